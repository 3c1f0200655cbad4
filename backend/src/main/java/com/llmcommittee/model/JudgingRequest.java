package com.llmcommittee.model;

import java.util.List;
import java.util.Objects;

/**
 * Input of one judging run. {@code judgeBackendIds} may be empty for modes with a configured default.
 */
public record JudgingRequest(
        String prompt,
        List<AssembledResponse> responses,
        JudgingMode mode,
        List<String> judgeBackendIds,
        Criteria criteria
) {
    public JudgingRequest {
        responses = withoutNulls(responses);
        mode = mode == null ? JudgingMode.SINGLE : mode;
        judgeBackendIds = withoutNulls(judgeBackendIds);
    }

    private static <T> List<T> withoutNulls(List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }
}
