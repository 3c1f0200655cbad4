package com.llmcommittee.provider;

/**
 * Result of one non-streaming backend call. Failures are carried as {@code errorMessage}.
 */
public record BackendCompletion(
        String backendId,
        String content,
        String errorMessage,
        long latencyMs
) {
    public static BackendCompletion success(String backendId, String content, long latencyMs) {
        return new BackendCompletion(backendId, content, null, latencyMs);
    }

    public static BackendCompletion failure(String backendId, String errorMessage, long latencyMs) {
        String message = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        return new BackendCompletion(backendId, null, message, latencyMs);
    }

    public boolean isSuccess() {
        return errorMessage == null;
    }
}
