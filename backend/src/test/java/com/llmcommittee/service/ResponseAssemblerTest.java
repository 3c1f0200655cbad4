package com.llmcommittee.service;

import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.TokenDeltaEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseAssemblerTest {

    private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");

    private final Clock clock = Clock.fixed(STARTED.plusMillis(1250), ZoneOffset.UTC);
    private final BackendLabelResolver labels = backendId -> Map.of("a", "Model A").getOrDefault(backendId, backendId);

    @Test
    void rebuildsTextAndFreezesOnTerminalEvent() {
        ResponseAssembler assembler = new ResponseAssembler(
                List.of("a", "b"),
                backendId -> Optional.of(STARTED),
                labels,
                clock
        );

        assembler.accept(TokenDeltaEvent.fragment("a", "Hello, "));
        assembler.accept(TokenDeltaEvent.fragment("b", "Partial"));
        assembler.accept(TokenDeltaEvent.fragment("a", "world"));
        assembler.accept(TokenDeltaEvent.completed("a"));
        assembler.accept(TokenDeltaEvent.fragment("a", " ignored"));
        assertFalse(assembler.isComplete());

        assembler.accept(TokenDeltaEvent.failed("b", "API error: 502 - bad gateway"));
        assertTrue(assembler.isComplete());

        AssembledResponse a = assembler.response("a").orElseThrow();
        assertEquals("Model A", a.label());
        assertEquals("Hello, world", a.content());
        assertNull(a.errorMessage());
        assertEquals(1250L, a.latencyMs());

        AssembledResponse b = assembler.response("b").orElseThrow();
        assertEquals("b", b.label());
        assertEquals("API error: 502 - bad gateway", b.errorMessage());
        assertFalse(b.isUsable());

        assertEquals(List.of("a"), assembler.usableResponses().stream().map(AssembledResponse::backendId).toList());
    }

    @Test
    void ignoresEventsForUnknownBackends() {
        ResponseAssembler assembler = new ResponseAssembler(
                List.of("a"),
                backendId -> Optional.empty(),
                labels,
                clock
        );

        assembler.accept(TokenDeltaEvent.fragment("z", "stray"));
        assembler.accept(TokenDeltaEvent.completed("a"));

        assertEquals(1, assembler.responses().size());
        assertNull(assembler.response("a").orElseThrow().latencyMs());
        assertFalse(assembler.response("a").orElseThrow().isUsable());
    }
}
