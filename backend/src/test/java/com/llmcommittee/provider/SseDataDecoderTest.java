package com.llmcommittee.provider;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SseDataDecoderTest {

    @Test
    void decodesDataLinesAndIgnoresOtherFields() {
        SseDataDecoder decoder = new SseDataDecoder();

        List<String> payloads = decoder.feed(": keep-alive\nevent: message\ndata: {\"a\":1}\n\ndata:[DONE]\n");

        assertEquals(List.of("{\"a\":1}", "[DONE]"), payloads);
    }

    @Test
    void holdsPartialLinesAcrossChunks() {
        SseDataDecoder decoder = new SseDataDecoder();
        List<String> payloads = new ArrayList<>();

        payloads.addAll(decoder.feed("da"));
        payloads.addAll(decoder.feed("ta: {\"choices\":[{\"delta\":"));
        assertTrue(payloads.isEmpty());

        payloads.addAll(decoder.feed("{\"content\":\"Hi\"}}]}\r\ndata: [DO"));
        payloads.addAll(decoder.feed("NE]\n"));

        assertEquals(List.of("{\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}", "[DONE]"), payloads);
    }

    @Test
    void finishFlushesUnterminatedLine() {
        SseDataDecoder decoder = new SseDataDecoder();

        assertTrue(decoder.feed("data: tail").isEmpty());
        assertEquals(List.of("tail"), decoder.finish());
        assertTrue(decoder.finish().isEmpty());
    }

    @Test
    void skipsEmptyPayloads() {
        SseDataDecoder decoder = new SseDataDecoder();

        char[] chunk = "data:\ndata:   \ndata: x\n".toCharArray();

        assertEquals(List.of("x"), decoder.feed(chunk, 0, chunk.length));
    }
}
