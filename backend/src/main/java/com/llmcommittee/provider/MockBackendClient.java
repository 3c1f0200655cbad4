package com.llmcommittee.provider;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmcommittee.model.ChatMessage;
import com.llmcommittee.model.TokenDeltaEvent;
import com.llmcommittee.service.CriteriaGenerationService;
import com.llmcommittee.service.JudgePromptBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Matcher;

/**
 * Deterministic mock backend used for reproducible local runs and tests. Backend ids starting
 * with {@value #FAILING_ID_PREFIX} always fail.
 */
@Component
@ConditionalOnProperty(prefix = "committee", name = "mock-provider", havingValue = "true", matchIfMissing = true)
public class MockBackendClient implements BackendClient {

    public static final String FAILING_ID_PREFIX = "mock/fail";
    static final String FAILURE_MESSAGE = "Mock backend failure";

    private static final List<String> ANSWER_SENTENCES = List.of(
            "The short answer depends on the constraints stated in the question.",
            "Start with the simplest approach that satisfies every requirement.",
            "Measure before optimizing, because intuition about hot paths is often wrong.",
            "Edge cases such as empty input and very large input deserve explicit handling.",
            "A worked example makes the trade-offs concrete.",
            "In summary, prefer clarity first and refine once the behavior is verified."
    );

    private static final List<String> CRITERION_NAMES = List.of(
            "Accuracy", "Relevance", "Depth", "Clarity", "Practicality", "Originality"
    );

    @Override
    public void stream(
            String backendId,
            List<ChatMessage> messages,
            CancellationToken cancellation,
            Consumer<TokenDeltaEvent> sink
    ) {
        if (backendId.startsWith(FAILING_ID_PREFIX)) {
            sink.accept(TokenDeltaEvent.failed(backendId, FAILURE_MESSAGE));
            return;
        }

        String[] words = answerFor(backendId, lastContent(messages)).split(" ");
        for (int i = 0; i < words.length; i++) {
            if (cancellation.isCancelled()) {
                sink.accept(TokenDeltaEvent.failed(backendId, CANCELLED_MESSAGE));
                return;
            }
            String fragment = i < words.length - 1 ? words[i] + " " : words[i];
            sink.accept(TokenDeltaEvent.fragment(backendId, fragment));
        }
        sink.accept(TokenDeltaEvent.completed(backendId));
    }

    @Override
    public BackendCompletion complete(
            String backendId,
            List<ChatMessage> messages,
            Duration timeout,
            CancellationToken cancellation
    ) {
        if (cancellation.isCancelled()) {
            return BackendCompletion.failure(backendId, CANCELLED_MESSAGE, 0);
        }
        if (backendId.startsWith(FAILING_ID_PREFIX)) {
            return BackendCompletion.failure(backendId, FAILURE_MESSAGE, 0);
        }

        String prompt = lastContent(messages);
        ObjectNode result;
        if (prompt.contains(JudgePromptBuilder.SYNTHESIS_FORMAT_HEADING)) {
            result = consensusFor(backendId, prompt);
        } else if (prompt.contains(JudgePromptBuilder.VERDICT_FORMAT_HEADING)) {
            result = verdictFor(backendId, prompt);
        } else if (prompt.contains(CriteriaGenerationService.PROMPT_HEADING)) {
            result = rubricFor(backendId, prompt);
        } else {
            result = JsonNodeFactory.instance.objectNode();
            result.put("answer", answerFor(backendId, prompt));
        }
        return BackendCompletion.success(backendId, result.toString(), 0);
    }

    private static String answerFor(String backendId, String prompt) {
        int first = stableIndex(seed(backendId, prompt, "answer.first"), ANSWER_SENTENCES.size());
        int count = 2 + stableIndex(seed(backendId, prompt, "answer.count"), 3);
        StringBuilder answer = new StringBuilder("[" + backendId + "]");
        for (int i = 0; i < count; i++) {
            answer.append(' ').append(ANSWER_SENTENCES.get((first + i) % ANSWER_SENTENCES.size()));
        }
        return answer.toString();
    }

    private static ObjectNode verdictFor(String judgeId, String prompt) {
        List<ListedResponse> listed = listedResponses(prompt);
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        ArrayNode scores = root.putArray("scores");

        ListedResponse winner = null;
        int winnerScore = -1;
        for (ListedResponse response : listed) {
            int score = 60
                    + Math.min(30, response.wordCount() / 10)
                    + stableIndex(seed(judgeId, prompt, response.backendId()), 10);
            ObjectNode entry = scores.addObject();
            entry.put("backendId", response.backendId());
            entry.put("score", score);
            entry.putArray("strengths").add("Addresses the prompt in " + response.wordCount() + " words");
            entry.putArray("weaknesses");
            if (score > winnerScore) {
                winner = response;
                winnerScore = score;
            }
        }

        if (winner != null) {
            root.put("winnerBackendId", winner.backendId());
            root.put("winnerLabel", winner.label());
        }
        root.put(
                "reasoning",
                "Mock judge scored responses deterministically by length and seed (winner_score="
                        + winnerScore
                        + ", responses="
                        + listed.size()
                        + ")."
        );
        return root;
    }

    private static ObjectNode consensusFor(String synthesizerId, String prompt) {
        List<ListedResponse> listed = listedResponses(prompt);
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put(
                "synthesizedResponse",
                "Merged answer from " + listed.size() + " responses. "
                        + ANSWER_SENTENCES.get(stableIndex(seed(synthesizerId, prompt, "synthesis"), ANSWER_SENTENCES.size()))
        );

        ArrayNode attributions = root.putArray("attributions");
        ArrayNode scores = root.putArray("scores");
        for (ListedResponse response : listed) {
            attributions.addObject()
                    .put("backendId", response.backendId())
                    .put("contribution", "Contributed " + response.wordCount() + " words of supporting detail");
            scores.addObject()
                    .put("backendId", response.backendId())
                    .put("score", 40 + stableIndex(seed(synthesizerId, prompt, response.backendId()), 50));
        }

        ObjectNode keyPoint = root.putArray("keyPoints").addObject();
        keyPoint.put("point", "Prefer the simplest approach that satisfies every requirement");
        ArrayNode sources = keyPoint.putArray("sourceBackendIds");
        listed.forEach(response -> sources.add(response.backendId()));
        return root;
    }

    private static ObjectNode rubricFor(String backendId, String prompt) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("name", "Custom Criteria");
        root.put("description", "Generated criteria tailored to the requested focus");
        ArrayNode criteria = root.putArray("criteria");
        int first = stableIndex(seed(backendId, prompt, "rubric.first"), CRITERION_NAMES.size());
        for (int i = 0; i < 3; i++) {
            String name = CRITERION_NAMES.get((first + i) % CRITERION_NAMES.size());
            criteria.addObject()
                    .put("name", name)
                    .put("weight", 2 + stableIndex(seed(backendId, prompt, "rubric." + name), 4))
                    .put("description", "How well the response demonstrates " + name.toLowerCase());
        }
        return root;
    }

    private static List<ListedResponse> listedResponses(String prompt) {
        List<ListedResponse> listed = new ArrayList<>();
        Matcher matcher = JudgePromptBuilder.RESPONSE_HEADING.matcher(prompt);
        List<int[]> bounds = new ArrayList<>();
        List<String[]> headings = new ArrayList<>();
        while (matcher.find()) {
            bounds.add(new int[]{matcher.start(), matcher.end()});
            headings.add(new String[]{matcher.group(2), matcher.group(3)});
        }
        for (int i = 0; i < bounds.size(); i++) {
            int bodyStart = bounds.get(i)[1];
            int bodyEnd = i + 1 < bounds.size() ? bounds.get(i + 1)[0] : sectionEnd(prompt, bodyStart);
            String body = prompt.substring(bodyStart, bodyEnd);
            listed.add(new ListedResponse(headings.get(i)[1], headings.get(i)[0], wordCount(body)));
        }
        return listed;
    }

    private static int sectionEnd(String prompt, int from) {
        int next = prompt.indexOf("\n## ", from);
        return next < 0 ? prompt.length() : next;
    }

    private static int wordCount(String text) {
        String normalized = text == null ? "" : text.replace("---", " ").trim();
        if (normalized.isEmpty()) {
            return 0;
        }
        return normalized.split("\\s+").length;
    }

    private static String lastContent(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return "";
        }
        String content = messages.get(messages.size() - 1).content();
        return content == null ? "" : content;
    }

    private static String seed(String backendId, String prompt, String suffix) {
        return backendId + "|" + prompt.length() + "|" + prompt.hashCode() + "|" + suffix;
    }

    private static int stableIndex(String seed, int bound) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(seed.getBytes(StandardCharsets.UTF_8));
            int raw = ByteBuffer.wrap(hash).getInt();
            return Math.floorMod(raw, bound);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest algorithm is required", ex);
        }
    }

    private record ListedResponse(String backendId, String label, int wordCount) {
    }
}
