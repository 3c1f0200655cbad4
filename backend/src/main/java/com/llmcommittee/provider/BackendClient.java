package com.llmcommittee.provider;

import com.llmcommittee.model.ChatMessage;
import com.llmcommittee.model.TokenDeltaEvent;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Provider abstraction for model backend calls. Implementations report every failure as data.
 */
public interface BackendClient {

    String CANCELLED_MESSAGE = "Dispatch cancelled";

    /**
     * Streams one completion, blocking until it ends. Emits zero or more fragment events followed
     * by exactly one terminal event; never throws for transport or backend failures.
     */
    void stream(
            String backendId,
            List<ChatMessage> messages,
            CancellationToken cancellation,
            Consumer<TokenDeltaEvent> sink
    );

    /**
     * Performs one request/response completion expected to return a JSON object.
     */
    BackendCompletion complete(
            String backendId,
            List<ChatMessage> messages,
            Duration timeout,
            CancellationToken cancellation
    );
}
