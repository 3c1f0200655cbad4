package com.llmcommittee.service;

import com.llmcommittee.model.AssembledResponse;
import lombok.Getter;

import java.util.List;

/**
 * Raised when judging cannot produce a verdict. Carries the responses that were available so
 * callers can still show them.
 */
@Getter
public class JudgingFailureException extends RuntimeException {

    private final JudgingFailureType type;
    private final List<AssembledResponse> responses;

    public JudgingFailureException(JudgingFailureType type, String message, List<AssembledResponse> responses) {
        super(message);
        this.type = type;
        this.responses = responses == null ? List.of() : List.copyOf(responses);
    }

    public static JudgingFailureException preconditionFailed(String detail, List<AssembledResponse> responses) {
        return new JudgingFailureException(JudgingFailureType.PRECONDITION_FAILED, detail, responses);
    }

    public static JudgingFailureException allJudgesFailed(String detail, List<AssembledResponse> responses) {
        return new JudgingFailureException(JudgingFailureType.ALL_JUDGES_FAILED, detail, responses);
    }

    public static JudgingFailureException cancelled(List<AssembledResponse> responses) {
        return new JudgingFailureException(JudgingFailureType.CANCELLED, "Judging was cancelled", responses);
    }

    public JudgingFailureException withResponses(List<AssembledResponse> allResponses) {
        JudgingFailureException copy = new JudgingFailureException(type, getMessage(), allResponses);
        copy.initCause(this);
        return copy;
    }
}
