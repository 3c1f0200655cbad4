package com.llmcommittee.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Final text of one backend for one request. A non-null {@code errorMessage} means
 * {@code content} must not be trusted, even when partially populated.
 */
public record AssembledResponse(
        String backendId,
        String label,
        String content,
        String errorMessage,
        Long latencyMs
) {
    public AssembledResponse {
        Objects.requireNonNull(backendId, "backendId is required");
        label = label == null || label.isBlank() ? backendId : label;
        content = content == null ? "" : content;
    }

    public static AssembledResponse success(String backendId, String label, String content) {
        return new AssembledResponse(backendId, label, content, null, null);
    }

    @JsonIgnore
    public boolean isUsable() {
        return errorMessage == null && !content.isBlank();
    }
}
