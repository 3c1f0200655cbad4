package com.llmcommittee.model;

import java.util.List;

public record CommitteeEvaluation(
        List<AssembledResponse> responses,
        Verdict verdict
) {
    public CommitteeEvaluation {
        responses = responses == null ? List.of() : List.copyOf(responses);
    }
}
