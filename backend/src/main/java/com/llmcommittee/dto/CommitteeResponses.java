package com.llmcommittee.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.Verdict;

import java.util.List;

public final class CommitteeResponses {

    private CommitteeResponses() {
    }

    /**
     * One server-sent event of the committee stream.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StreamChunk(
            String backendId,
            String content,
            boolean done,
            String error
    ) {
    }

    public record EvaluationResponse(
            List<AssembledResponse> responses,
            Verdict verdict
    ) {
    }

    public record HealthResponse(
            String service,
            String providerMode,
            String defaultJudge,
            String defaultSynthesizer
    ) {
    }
}
