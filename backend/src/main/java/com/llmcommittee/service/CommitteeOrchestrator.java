package com.llmcommittee.service;

import com.llmcommittee.config.CommitteeRuntimeProperties;
import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.CommitteeEvaluation;
import com.llmcommittee.model.Criteria;
import com.llmcommittee.model.JudgingMode;
import com.llmcommittee.model.JudgingRequest;
import com.llmcommittee.model.Verdict;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for committee runs: validates the committee, starts the fan-out and, for
 * synchronous evaluation, assembles the responses and judges them.
 */
@Service
@RequiredArgsConstructor
public class CommitteeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CommitteeOrchestrator.class);

    static final String COMMITTEE_REQUIRED_MESSAGE = "Prompt and at least 2 models required";

    private final FanOutAggregator fanOutAggregator;
    private final JudgingEngine judgingEngine;
    private final BackendLabelResolver backendLabelResolver;
    private final CommitteeRuntimeProperties committeeRuntimeProperties;
    private final Clock committeeClock;

    public CommitteeRun startStream(String prompt, List<String> backendIds) {
        List<String> committee = validateCommittee(prompt, backendIds);
        log.info("Streaming prompt to committee of {} backends", committee.size());
        return fanOutAggregator.run(prompt, committee);
    }

    public CommitteeEvaluation evaluate(
            String prompt,
            List<String> backendIds,
            JudgingMode mode,
            List<String> judgeBackendIds,
            Criteria criteria
    ) {
        List<String> committee = validateCommittee(prompt, backendIds);
        CommitteeRun run = fanOutAggregator.run(prompt, committee);
        ResponseAssembler assembler = ResponseAssembler.forRun(run, backendLabelResolver, committeeClock);
        try {
            run.drain(assembler::accept);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            run.cancel();
            throw JudgingFailureException.cancelled(assembler.responses());
        }

        List<AssembledResponse> responses = assembler.responses();
        log.info(
                "Committee run finished with {} of {} usable responses",
                assembler.usableResponses().size(),
                responses.size()
        );

        try {
            Verdict verdict = judgingEngine.judge(
                    new JudgingRequest(prompt, responses, mode, judgeBackendIds, criteria),
                    run.cancellation()
            );
            return new CommitteeEvaluation(responses, verdict);
        } catch (JudgingFailureException ex) {
            throw ex.withResponses(responses);
        }
    }

    List<String> validateCommittee(String prompt, List<String> backendIds) {
        if (prompt == null || prompt.isBlank() || backendIds == null) {
            throw new IllegalArgumentException(COMMITTEE_REQUIRED_MESSAGE);
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String backendId : backendIds) {
            if (backendId != null && !backendId.isBlank()) {
                distinct.add(backendId.trim());
            }
        }

        CommitteeRuntimeProperties.Dispatch dispatch = committeeRuntimeProperties.getDispatch();
        if (distinct.size() < dispatch.getMinCommitteeSize()) {
            throw new IllegalArgumentException(COMMITTEE_REQUIRED_MESSAGE);
        }
        if (distinct.size() > dispatch.getMaxCommitteeSize()) {
            throw new IllegalArgumentException(
                    "At most " + dispatch.getMaxCommitteeSize() + " models per committee"
            );
        }
        return new ArrayList<>(distinct);
    }
}
