package com.llmcommittee.service;

/**
 * Maps backend ids to display labels.
 */
public interface BackendLabelResolver {

    /**
     * Returns the configured label, or the id itself when none is configured.
     */
    String labelFor(String backendId);
}
