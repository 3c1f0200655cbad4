package com.llmcommittee.service;

import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.TokenDeltaEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Rebuilds each backend's text from its events. One slot per backend, frozen on the terminal
 * event. Not thread-safe; feed it from the single thread draining a run.
 */
public final class ResponseAssembler {

    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final Function<String, Optional<Instant>> startedAt;
    private final Clock clock;

    public ResponseAssembler(
            List<String> backendIds,
            Function<String, Optional<Instant>> startedAt,
            BackendLabelResolver labelResolver,
            Clock clock
    ) {
        this.startedAt = startedAt;
        this.clock = clock;
        for (String backendId : backendIds) {
            slots.put(backendId, new Slot(backendId, labelResolver.labelFor(backendId)));
        }
    }

    public static ResponseAssembler forRun(CommitteeRun run, BackendLabelResolver labelResolver, Clock clock) {
        return new ResponseAssembler(run.backendIds(), run::startedAt, labelResolver, clock);
    }

    public void accept(TokenDeltaEvent event) {
        Slot slot = slots.get(event.backendId());
        if (slot == null || slot.frozen) {
            return;
        }
        slot.content.append(event.textFragment());
        if (!event.isFinal()) {
            return;
        }
        slot.errorMessage = event.errorMessage();
        slot.latencyMs = startedAt.apply(event.backendId())
                .map(start -> Math.max(0L, Duration.between(start, clock.instant()).toMillis()))
                .orElse(null);
        slot.frozen = true;
    }

    public boolean isComplete() {
        return slots.values().stream().allMatch(slot -> slot.frozen);
    }

    public List<AssembledResponse> responses() {
        return slots.values().stream().map(Slot::snapshot).toList();
    }

    public List<AssembledResponse> usableResponses() {
        return responses().stream().filter(AssembledResponse::isUsable).toList();
    }

    public Optional<AssembledResponse> response(String backendId) {
        return Optional.ofNullable(slots.get(backendId)).map(Slot::snapshot);
    }

    private static final class Slot {
        private final String backendId;
        private final String label;
        private final StringBuilder content = new StringBuilder();
        private String errorMessage;
        private Long latencyMs;
        private boolean frozen;

        private Slot(String backendId, String label) {
            this.backendId = backendId;
            this.label = label;
        }

        private AssembledResponse snapshot() {
            return new AssembledResponse(backendId, label, content.toString(), errorMessage, latencyMs);
        }
    }
}
