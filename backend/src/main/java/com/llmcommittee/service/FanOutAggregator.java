package com.llmcommittee.service;

import com.llmcommittee.model.ChatMessage;
import com.llmcommittee.model.TokenDeltaEvent;
import com.llmcommittee.provider.BackendClient;
import com.llmcommittee.provider.CancellationToken;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Dispatches one prompt to several backends at once and multiplexes their streams into a
 * {@link CommitteeRun}. Every backend yields exactly one terminal event, whatever happens to it.
 */
@Service
@RequiredArgsConstructor
public class FanOutAggregator {

    private static final Logger log = LoggerFactory.getLogger(FanOutAggregator.class);

    static final String MISSING_TERMINAL_MESSAGE = "Backend stream ended without completing";

    private final BackendClient backendClient;
    private final ExecutorService committeeDispatchExecutor;
    private final Clock committeeClock;

    public CommitteeRun run(String prompt, List<String> backendIds) {
        return run(prompt, backendIds, new CancellationToken());
    }

    public CommitteeRun run(String prompt, List<String> backendIds, CancellationToken cancellation) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required");
        }
        if (backendIds == null || backendIds.isEmpty()) {
            throw new IllegalArgumentException("At least one backend id is required");
        }
        Set<String> distinct = new HashSet<>();
        for (String backendId : backendIds) {
            if (backendId == null || backendId.isBlank() || !distinct.add(backendId)) {
                throw new IllegalArgumentException("Backend ids must be non-blank and unique");
            }
        }

        CommitteeRun run = new CommitteeRun(backendIds, cancellation);
        List<ChatMessage> messages = List.of(ChatMessage.user(prompt));
        for (String backendId : run.backendIds()) {
            try {
                committeeDispatchExecutor.execute(() -> dispatch(run, backendId, messages));
            } catch (RejectedExecutionException ex) {
                log.error("Dispatch executor rejected backend {}", backendId, ex);
                run.publish(TokenDeltaEvent.failed(backendId, "Dispatch rejected"));
            }
        }
        log.debug("Started committee run for {} backends", run.backendIds().size());
        return run;
    }

    private void dispatch(CommitteeRun run, String backendId, List<ChatMessage> messages) {
        run.markStarted(backendId, committeeClock.instant());
        BranchSink sink = new BranchSink(run, backendId);
        try {
            backendClient.stream(backendId, messages, run.cancellation(), sink);
        } catch (RuntimeException ex) {
            log.warn("Backend {} failed unexpectedly", backendId, ex);
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            sink.accept(TokenDeltaEvent.failed(backendId, message));
        } finally {
            if (!sink.terminated) {
                log.warn("Backend {} returned without a terminal event", backendId);
                sink.accept(TokenDeltaEvent.failed(backendId, MISSING_TERMINAL_MESSAGE));
            }
        }
    }

    /**
     * Tags events with the branch's backend id and stops forwarding after the first terminal event.
     * Used by one branch thread only.
     */
    private static final class BranchSink implements Consumer<TokenDeltaEvent> {

        private final CommitteeRun run;
        private final String backendId;
        private boolean terminated;

        private BranchSink(CommitteeRun run, String backendId) {
            this.run = run;
            this.backendId = backendId;
        }

        @Override
        public void accept(TokenDeltaEvent event) {
            if (terminated || event == null) {
                return;
            }
            if (event.isFinal()) {
                terminated = true;
            }
            run.publish(new TokenDeltaEvent(backendId, event.textFragment(), event.isFinal(), event.errorMessage()));
        }
    }
}
