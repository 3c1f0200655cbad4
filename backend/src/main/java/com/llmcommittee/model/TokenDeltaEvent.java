package com.llmcommittee.model;

import java.util.Objects;

/**
 * One decoded output fragment from a backend, or the single terminal event of its stream.
 * A terminal event with a non-null {@code errorMessage} signals failure.
 */
public record TokenDeltaEvent(
        String backendId,
        String textFragment,
        boolean isFinal,
        String errorMessage
) {
    public TokenDeltaEvent {
        Objects.requireNonNull(backendId, "backendId is required");
        textFragment = textFragment == null ? "" : textFragment;
        if (errorMessage != null && !isFinal) {
            throw new IllegalArgumentException("Only terminal events may carry an error");
        }
    }

    public static TokenDeltaEvent fragment(String backendId, String textFragment) {
        return new TokenDeltaEvent(backendId, textFragment, false, null);
    }

    public static TokenDeltaEvent completed(String backendId) {
        return new TokenDeltaEvent(backendId, "", true, null);
    }

    public static TokenDeltaEvent failed(String backendId, String errorMessage) {
        String message = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        return new TokenDeltaEvent(backendId, "", true, message);
    }

    public boolean isFailure() {
        return errorMessage != null;
    }
}
