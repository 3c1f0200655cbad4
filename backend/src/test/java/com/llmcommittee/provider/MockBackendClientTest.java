package com.llmcommittee.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.ChatMessage;
import com.llmcommittee.model.TokenDeltaEvent;
import com.llmcommittee.service.JudgePromptBuilder;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MockBackendClientTest {

    private final MockBackendClient mockBackendClient = new MockBackendClient();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void streamIsDeterministicAndEndsWithSingleTerminal() {
        List<TokenDeltaEvent> first = streamOf("openai/gpt-4o", "Explain caching");
        List<TokenDeltaEvent> second = streamOf("openai/gpt-4o", "Explain caching");

        assertEquals(first, second);
        assertTrue(first.size() > 2);
        assertEquals(1, first.stream().filter(TokenDeltaEvent::isFinal).count());
        assertTrue(first.get(first.size() - 1).isFinal());
        String text = first.stream().map(TokenDeltaEvent::textFragment).collect(Collectors.joining());
        assertTrue(text.startsWith("[openai/gpt-4o] "));
    }

    @Test
    void failingIdsProduceOnlyAnErrorTerminal() {
        List<TokenDeltaEvent> events = streamOf("mock/fail-fast", "Explain caching");

        assertEquals(1, events.size());
        assertTrue(events.get(0).isFailure());
    }

    @Test
    void cancelledStreamStopsWithCancellationError() {
        CancellationToken token = new CancellationToken();
        List<TokenDeltaEvent> events = new ArrayList<>();

        mockBackendClient.stream("openai/gpt-4o", List.of(ChatMessage.user("p")), token, event -> {
            events.add(event);
            token.cancel();
        });

        assertEquals(2, events.size());
        assertEquals(BackendClient.CANCELLED_MESSAGE, events.get(1).errorMessage());
    }

    @Test
    void completeReturnsVerdictJsonForListedResponses() throws Exception {
        List<AssembledResponse> responses = List.of(
                AssembledResponse.success("a/one", "One", "Short answer."),
                AssembledResponse.success("b/two", "Two (beta)", "A much longer answer with several more words in it.")
        );
        String prompt = JudgePromptBuilder.buildVerdictPrompt("Question?", responses, null);

        BackendCompletion completion = mockBackendClient.complete(
                "judge/x",
                List.of(ChatMessage.user(prompt)),
                Duration.ofSeconds(1),
                new CancellationToken()
        );

        assertTrue(completion.isSuccess());
        JsonNode verdict = objectMapper.readTree(completion.content());
        String winner = verdict.get("winnerBackendId").asText();
        assertTrue(winner.equals("a/one") || winner.equals("b/two"));
        assertEquals(2, verdict.get("scores").size());
        assertEquals("a/one", verdict.get("scores").get(0).get("backendId").asText());
        assertEquals("b/two", verdict.get("scores").get(1).get("backendId").asText());
        int score = verdict.get("scores").get(1).get("score").asInt();
        assertTrue(score >= 60 && score <= 99);
    }

    @Test
    void completeReturnsConsensusJsonForSynthesisPrompt() throws Exception {
        List<AssembledResponse> responses = List.of(
                AssembledResponse.success("a/one", "One", "First."),
                AssembledResponse.success("b/two", "Two", "Second.")
        );
        String prompt = JudgePromptBuilder.buildConsensusPrompt("Question?", responses, null);

        BackendCompletion completion = mockBackendClient.complete(
                "synth/x",
                List.of(ChatMessage.user(prompt)),
                Duration.ofSeconds(1),
                new CancellationToken()
        );

        JsonNode consensus = objectMapper.readTree(completion.content());
        assertTrue(consensus.get("synthesizedResponse").asText().startsWith("Merged answer from 2 responses."));
        assertEquals(2, consensus.get("attributions").size());
        assertFalse(consensus.has("winnerBackendId"));
    }

    private List<TokenDeltaEvent> streamOf(String backendId, String prompt) {
        List<TokenDeltaEvent> events = new ArrayList<>();
        mockBackendClient.stream(backendId, List.of(ChatMessage.user(prompt)), new CancellationToken(), events::add);
        return events;
    }
}
