package com.llmcommittee.service;

/**
 * Raised when a backend cannot produce a usable rubric.
 */
public class CriteriaGenerationException extends RuntimeException {

    public CriteriaGenerationException(String message) {
        super(message);
    }
}
