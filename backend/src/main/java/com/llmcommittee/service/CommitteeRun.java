package com.llmcommittee.service;

import com.llmcommittee.model.TokenDeltaEvent;
import com.llmcommittee.provider.BackendClient;
import com.llmcommittee.provider.CancellationToken;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Handle on one fan-out dispatch. Branches publish into a shared channel from their own threads;
 * a single consumer drains it until every backend has delivered its terminal event.
 */
public final class CommitteeRun {

    private final List<String> backendIds;
    private final CancellationToken cancellation;
    private final BlockingQueue<TokenDeltaEvent> channel = new LinkedBlockingQueue<>();
    private final Map<String, Instant> startedAt = new ConcurrentHashMap<>();
    private final Set<String> pending;

    CommitteeRun(List<String> backendIds, CancellationToken cancellation) {
        this.backendIds = List.copyOf(backendIds);
        this.cancellation = cancellation;
        this.pending = Collections.synchronizedSet(new LinkedHashSet<>(this.backendIds));
        cancellation.onCancel(this::publishCancelledTerminals);
    }

    public List<String> backendIds() {
        return backendIds;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public Optional<Instant> startedAt(String backendId) {
        return Optional.ofNullable(startedAt.get(backendId));
    }

    public Map<String, Instant> startedAt() {
        Map<String, Instant> snapshot = new LinkedHashMap<>();
        for (String backendId : backendIds) {
            Instant instant = startedAt.get(backendId);
            if (instant != null) {
                snapshot.put(backendId, instant);
            }
        }
        return snapshot;
    }

    /**
     * Delivers events in arrival order until every backend has terminated. Events for unknown
     * backends and events after a backend's terminal event are dropped.
     */
    public void drain(Consumer<TokenDeltaEvent> consumer) throws InterruptedException {
        while (!pending.isEmpty()) {
            TokenDeltaEvent event = channel.take();
            if (!pending.contains(event.backendId())) {
                continue;
            }
            if (event.isFinal()) {
                pending.remove(event.backendId());
            }
            consumer.accept(event);
        }
    }

    public boolean isComplete() {
        return pending.isEmpty();
    }

    /**
     * Cancels every open backend call. Each branch that has not terminated yet terminates with a
     * cancellation error, so draining still ends.
     */
    public void cancel() {
        cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    void markStarted(String backendId, Instant instant) {
        startedAt.putIfAbsent(backendId, instant);
    }

    void publish(TokenDeltaEvent event) {
        channel.add(event);
    }

    private void publishCancelledTerminals() {
        for (String backendId : backendIds) {
            channel.add(TokenDeltaEvent.failed(backendId, BackendClient.CANCELLED_MESSAGE));
        }
    }
}
