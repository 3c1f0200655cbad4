package com.llmcommittee.service;

import com.llmcommittee.config.CommitteeJudgeProperties;
import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.ChatMessage;
import com.llmcommittee.model.ConsensusResult;
import com.llmcommittee.model.JudgeVote;
import com.llmcommittee.model.JudgingMode;
import com.llmcommittee.model.JudgingRequest;
import com.llmcommittee.model.Verdict;
import com.llmcommittee.provider.BackendClient;
import com.llmcommittee.provider.BackendCompletion;
import com.llmcommittee.provider.CancellationToken;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one judging request: resolves judges for the mode, dispatches every judge concurrently,
 * parses each verdict and aggregates the accepted ones.
 */
@Service
@RequiredArgsConstructor
public class JudgingEngine {

    private static final Logger log = LoggerFactory.getLogger(JudgingEngine.class);

    static final String TOO_FEW_RESPONSES_MESSAGE = "Fewer than 2 models responded successfully.";
    static final String DEFAULT_CONTRIBUTION = "No distinct contribution was attributed to this response.";
    private static final int MIN_USABLE_RESPONSES = 2;

    private final BackendClient backendClient;
    private final ExecutorService committeeDispatchExecutor;
    private final VerdictParser verdictParser;
    private final VerdictAggregator verdictAggregator;
    private final BackendLabelResolver backendLabelResolver;
    private final CommitteeJudgeProperties committeeJudgeProperties;

    public Verdict judge(JudgingRequest request) {
        return judge(request, new CancellationToken());
    }

    public Verdict judge(JudgingRequest request, CancellationToken cancellation) {
        List<AssembledResponse> usable = usableResponses(request.responses());
        if (request.prompt() == null || request.prompt().isBlank()) {
            throw JudgingFailureException.preconditionFailed("Prompt is required", usable);
        }
        if (usable.size() < MIN_USABLE_RESPONSES) {
            throw JudgingFailureException.preconditionFailed(TOO_FEW_RESPONSES_MESSAGE, usable);
        }

        List<JudgeAssignment> assignments = resolveAssignments(request, usable);
        log.info(
                "Judging {} responses in {} mode with {} judge(s)",
                usable.size(),
                request.mode().wireValue(),
                assignments.size()
        );

        List<BackendCompletion> completions = dispatch(assignments, cancellation, usable);
        if (request.mode() == JudgingMode.CONSENSUS) {
            return synthesize(completions.get(0), usable);
        }

        List<JudgeVote> votes = new ArrayList<>();
        for (int i = 0; i < assignments.size(); i++) {
            JudgeAssignment assignment = assignments.get(i);
            BackendCompletion completion = completions.get(i);
            if (!completion.isSuccess()) {
                log.warn("Judge {} failed: {}", assignment.judgeId(), completion.errorMessage());
                continue;
            }
            VerdictParser.ParsedVerdict parsed = verdictParser.parse(completion.content(), assignment.evaluated());
            if (parsed.fallback()) {
                log.warn("Judge {} returned an unusable verdict; excluding it", assignment.judgeId());
                continue;
            }
            votes.add(new JudgeVote(
                    assignment.judgeId(),
                    backendLabelResolver.labelFor(assignment.judgeId()),
                    parsed.winnerBackendId(),
                    parsed.reasoning(),
                    parsed.scores()
            ));
        }

        if (votes.isEmpty()) {
            throw JudgingFailureException.allJudgesFailed("No judge returned a usable verdict", usable);
        }
        return verdictAggregator.aggregate(request.mode(), votes, usable);
    }

    private List<JudgeAssignment> resolveAssignments(JudgingRequest request, List<AssembledResponse> usable) {
        List<String> requestedJudges = distinctIds(request.judgeBackendIds());
        String prompt = request.prompt();

        return switch (request.mode()) {
            case SINGLE -> {
                String judgeId = firstOrDefault(requestedJudges, committeeJudgeProperties.getDefaultJudge());
                if (judgeId == null) {
                    throw JudgingFailureException.preconditionFailed("No judge configured", usable);
                }
                yield List.of(verdictAssignment(judgeId, prompt, usable, request));
            }
            case COMMITTEE -> usable.stream()
                    .map(judge -> verdictAssignment(
                            judge.backendId(),
                            prompt,
                            usable.stream()
                                    .filter(response -> !response.backendId().equals(judge.backendId()))
                                    .toList(),
                            request
                    ))
                    .toList();
            case EXECUTIVE -> {
                if (requestedJudges.isEmpty()) {
                    throw JudgingFailureException.preconditionFailed(
                            "Executive mode requires at least one judge",
                            usable
                    );
                }
                yield requestedJudges.stream()
                        .map(judgeId -> verdictAssignment(judgeId, prompt, usable, request))
                        .toList();
            }
            case CONSENSUS -> {
                String synthesizerId = firstOrDefault(requestedJudges, committeeJudgeProperties.getDefaultSynthesizer());
                if (synthesizerId == null) {
                    throw JudgingFailureException.preconditionFailed("No synthesizer configured", usable);
                }
                yield List.of(new JudgeAssignment(
                        synthesizerId,
                        usable,
                        JudgePromptBuilder.buildConsensusPrompt(prompt, usable, request.criteria())
                ));
            }
        };
    }

    private static JudgeAssignment verdictAssignment(
            String judgeId,
            String prompt,
            List<AssembledResponse> evaluated,
            JudgingRequest request
    ) {
        return new JudgeAssignment(
                judgeId,
                evaluated,
                JudgePromptBuilder.buildVerdictPrompt(prompt, evaluated, request.criteria())
        );
    }

    /**
     * Starts every judge call, then waits for all of them. Results keep the assignment order.
     */
    private List<BackendCompletion> dispatch(
            List<JudgeAssignment> assignments,
            CancellationToken cancellation,
            List<AssembledResponse> usable
    ) {
        Duration timeout = Duration.ofSeconds(committeeJudgeProperties.getTimeoutSeconds());
        List<Future<BackendCompletion>> futures = new ArrayList<>();
        List<BackendCompletion> completions = new ArrayList<>();

        for (JudgeAssignment assignment : assignments) {
            try {
                futures.add(committeeDispatchExecutor.submit(() -> backendClient.complete(
                        assignment.judgeId(),
                        List.of(ChatMessage.user(assignment.prompt())),
                        timeout,
                        cancellation
                )));
            } catch (RejectedExecutionException ex) {
                log.error("Dispatch executor rejected judge {}", assignment.judgeId(), ex);
                futures.add(null);
            }
        }

        long graceNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, committeeJudgeProperties.getBarrierGraceMillis()));
        long deadline = System.nanoTime() + timeout.toNanos() + graceNanos;
        for (int i = 0; i < assignments.size(); i++) {
            String judgeId = assignments.get(i).judgeId();
            Future<BackendCompletion> future = futures.get(i);
            if (future == null) {
                completions.add(BackendCompletion.failure(judgeId, "Dispatch rejected", 0));
                continue;
            }
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                completions.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                cancellation.cancel();
                futures.stream().filter(Objects::nonNull).forEach(pending -> pending.cancel(true));
                throw JudgingFailureException.cancelled(usable);
            } catch (TimeoutException ex) {
                future.cancel(true);
                log.warn("Judge {} timed out", judgeId);
                completions.add(BackendCompletion.failure(judgeId, "Judge timed out", timeout.toMillis()));
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                log.warn("Judge {} failed unexpectedly", judgeId, cause);
                completions.add(BackendCompletion.failure(judgeId, cause.getMessage(), 0));
            }
        }

        if (cancellation.isCancelled()) {
            throw JudgingFailureException.cancelled(usable);
        }
        return completions;
    }

    private Verdict synthesize(BackendCompletion completion, List<AssembledResponse> usable) {
        if (!completion.isSuccess()) {
            log.warn("Consensus synthesizer {} failed: {}", completion.backendId(), completion.errorMessage());
            throw JudgingFailureException.allJudgesFailed(
                    "Consensus synthesizer failed: " + completion.errorMessage(),
                    usable
            );
        }

        VerdictParser.ParsedConsensus parsed = verdictParser.parseConsensus(completion.content(), usable);
        if (parsed.fallback()) {
            log.warn("Consensus synthesizer {} returned unstructured output; using raw text", completion.backendId());
        }

        Map<String, ConsensusResult.Attribution> attributed = new LinkedHashMap<>();
        parsed.attributions().forEach(attribution -> attributed.putIfAbsent(attribution.backendId(), attribution));
        List<ConsensusResult.Attribution> attributions = new ArrayList<>();
        for (AssembledResponse response : usable) {
            ConsensusResult.Attribution attribution = attributed.get(response.backendId());
            String contribution = attribution == null || attribution.contribution() == null
                    || attribution.contribution().isBlank()
                    ? DEFAULT_CONTRIBUTION
                    : attribution.contribution().trim();
            attributions.add(new ConsensusResult.Attribution(response.backendId(), response.label(), contribution));
        }

        ConsensusResult consensus = new ConsensusResult(parsed.synthesizedText(), attributions, parsed.keyPoints());
        return new Verdict(
                null,
                null,
                "Synthesized a consensus answer from " + usable.size() + " responses.",
                parsed.scores(),
                JudgingMode.CONSENSUS,
                null,
                null,
                consensus
        );
    }

    private static List<AssembledResponse> usableResponses(List<AssembledResponse> responses) {
        Set<String> seen = new LinkedHashSet<>();
        List<AssembledResponse> usable = new ArrayList<>();
        for (AssembledResponse response : responses) {
            if (response.isUsable() && seen.add(response.backendId())) {
                usable.add(response);
            }
        }
        return usable;
    }

    private static List<String> distinctIds(List<String> ids) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String id : ids) {
            if (!id.isBlank()) {
                distinct.add(id.trim());
            }
        }
        return new ArrayList<>(distinct);
    }

    private static String firstOrDefault(List<String> ids, String defaultId) {
        if (!ids.isEmpty()) {
            return ids.get(0);
        }
        return defaultId == null || defaultId.isBlank() ? null : defaultId.trim();
    }

    private record JudgeAssignment(
            String judgeId,
            List<AssembledResponse> evaluated,
            String prompt
    ) {
    }
}
