package com.llmcommittee.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.ConsensusResult;
import com.llmcommittee.model.ScoreEntry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns free-form judge and synthesizer output into validated structures. Never throws for bad
 * model output; unusable text yields a deterministic fallback flagged as such.
 */
@Component
@RequiredArgsConstructor
public class VerdictParser {

    private static final Logger log = LoggerFactory.getLogger(VerdictParser.class);

    public static final String FALLBACK_REASONING = "Unable to parse judge response. Defaulting to first response.";
    public static final String FALLBACK_SYNTHESIS = "Unable to parse synthesizer response.";

    private static final String FIELD_WINNER_ID = "winnerBackendId";
    private static final String FIELD_WINNER_ID_ALIAS = "winnerModelId";
    private static final String FIELD_WINNER_LABEL = "winnerLabel";
    private static final String FIELD_WINNER_LABEL_ALIAS = "winnerModelName";
    private static final String FIELD_REASONING = "reasoning";
    private static final String FIELD_SCORES = "scores";
    private static final String FIELD_BACKEND_ID = "backendId";
    private static final String FIELD_BACKEND_ID_ALIAS = "modelId";
    private static final String FIELD_SCORE = "score";
    private static final String FIELD_STRENGTHS = "strengths";
    private static final String FIELD_WEAKNESSES = "weaknesses";
    private static final String FIELD_SYNTHESIZED = "synthesizedResponse";
    private static final String FIELD_ATTRIBUTIONS = "attributions";
    private static final String FIELD_CONTRIBUTION = "contribution";
    private static final String FIELD_KEY_POINTS = "keyPoints";
    private static final String FIELD_POINT = "point";
    private static final String FIELD_SOURCE_IDS = "sourceBackendIds";
    private static final String FIELD_SOURCE_IDS_ALIAS = "sourceModelIds";

    private final ObjectMapper objectMapper;

    public ParsedVerdict parse(String rawText, List<AssembledResponse> evaluated) {
        if (evaluated == null || evaluated.isEmpty()) {
            throw new IllegalArgumentException("At least one evaluated response is required");
        }
        Map<String, String> labels = labelsById(evaluated);

        for (String candidate : JsonPayloadExtractor.candidates(rawText)) {
            JsonNode root = readTree(candidate);
            if (root == null) {
                continue;
            }
            try {
                return readVerdict(root, labels);
            } catch (IllegalArgumentException ex) {
                log.debug("Rejected judge verdict candidate: {}", ex.getMessage());
            }
        }
        return fallbackVerdict(evaluated);
    }

    public ParsedConsensus parseConsensus(String rawText, List<AssembledResponse> evaluated) {
        if (evaluated == null || evaluated.isEmpty()) {
            throw new IllegalArgumentException("At least one evaluated response is required");
        }
        Map<String, String> labels = labelsById(evaluated);

        for (String candidate : JsonPayloadExtractor.candidates(rawText)) {
            JsonNode root = readTree(candidate);
            if (root == null) {
                continue;
            }
            try {
                return readConsensus(root, labels);
            } catch (IllegalArgumentException ex) {
                log.debug("Rejected consensus candidate: {}", ex.getMessage());
            }
        }

        String synthesized = rawText == null || rawText.isBlank() ? FALLBACK_SYNTHESIS : rawText.trim();
        return new ParsedConsensus(synthesized, List.of(), List.of(), List.of(), true);
    }

    private JsonNode readTree(String candidate) {
        try {
            return objectMapper.readTree(candidate);
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private static ParsedVerdict readVerdict(JsonNode root, Map<String, String> labels) {
        if (!root.isObject()) {
            throw new IllegalArgumentException("Verdict JSON must be an object");
        }

        JsonNode winnerNode = firstPresent(root, FIELD_WINNER_ID, FIELD_WINNER_ID_ALIAS);
        if (winnerNode == null || !winnerNode.isTextual()) {
            throw new IllegalArgumentException("Verdict missing textual field '" + FIELD_WINNER_ID + "'");
        }
        String winnerId = winnerNode.textValue().trim();
        if (!labels.containsKey(winnerId)) {
            throw new IllegalArgumentException("Verdict winner '" + winnerId + "' is not an evaluated backend");
        }

        JsonNode reasoningNode = root.get(FIELD_REASONING);
        if (reasoningNode == null || !reasoningNode.isTextual() || reasoningNode.textValue().isBlank()) {
            throw new IllegalArgumentException("Verdict missing textual field '" + FIELD_REASONING + "'");
        }

        JsonNode scoresNode = root.get(FIELD_SCORES);
        if (scoresNode == null || !scoresNode.isArray()) {
            throw new IllegalArgumentException("Verdict missing array field '" + FIELD_SCORES + "'");
        }
        List<ScoreEntry> scores = new ArrayList<>();
        Set<String> scored = new LinkedHashSet<>();
        for (JsonNode entryNode : scoresNode) {
            ScoreEntry entry = readScoreEntry(entryNode);
            if (!labels.containsKey(entry.backendId())) {
                throw new IllegalArgumentException("Score refers to unknown backend '" + entry.backendId() + "'");
            }
            if (!scored.add(entry.backendId())) {
                throw new IllegalArgumentException("Backend '" + entry.backendId() + "' scored more than once");
            }
            scores.add(entry);
        }

        JsonNode labelNode = firstPresent(root, FIELD_WINNER_LABEL, FIELD_WINNER_LABEL_ALIAS);
        String winnerLabel = labelNode != null && labelNode.isTextual() && !labelNode.textValue().isBlank()
                ? labelNode.textValue().trim()
                : labels.get(winnerId);

        return new ParsedVerdict(winnerId, winnerLabel, reasoningNode.textValue().trim(), scores, false);
    }

    private static ParsedConsensus readConsensus(JsonNode root, Map<String, String> labels) {
        if (!root.isObject()) {
            throw new IllegalArgumentException("Consensus JSON must be an object");
        }

        JsonNode synthesizedNode = root.get(FIELD_SYNTHESIZED);
        if (synthesizedNode == null || !synthesizedNode.isTextual() || synthesizedNode.textValue().isBlank()) {
            throw new IllegalArgumentException("Consensus missing textual field '" + FIELD_SYNTHESIZED + "'");
        }

        List<ConsensusResult.Attribution> attributions = new ArrayList<>();
        Set<String> attributed = new LinkedHashSet<>();
        for (JsonNode attributionNode : optionalArray(root, FIELD_ATTRIBUTIONS)) {
            if (!attributionNode.isObject()) {
                throw new IllegalArgumentException("Attribution entries must be objects");
            }
            String backendId = requireBackendId(attributionNode);
            if (!labels.containsKey(backendId) || !attributed.add(backendId)) {
                continue;
            }
            attributions.add(new ConsensusResult.Attribution(
                    backendId,
                    labels.get(backendId),
                    optionalText(attributionNode, FIELD_CONTRIBUTION)
            ));
        }

        List<ConsensusResult.KeyPoint> keyPoints = new ArrayList<>();
        for (JsonNode keyPointNode : optionalArray(root, FIELD_KEY_POINTS)) {
            if (!keyPointNode.isObject()) {
                throw new IllegalArgumentException("Key point entries must be objects");
            }
            String point = optionalText(keyPointNode, FIELD_POINT);
            if (point == null || point.isBlank()) {
                throw new IllegalArgumentException("Key point missing textual field '" + FIELD_POINT + "'");
            }
            JsonNode sourcesNode = firstPresent(keyPointNode, FIELD_SOURCE_IDS, FIELD_SOURCE_IDS_ALIAS);
            List<String> sources = sourcesNode == null || sourcesNode.isNull()
                    ? List.of()
                    : readStringArray(sourcesNode, FIELD_SOURCE_IDS);
            keyPoints.add(new ConsensusResult.KeyPoint(
                    point.trim(),
                    sources.stream().filter(labels::containsKey).distinct().toList()
            ));
        }

        List<ScoreEntry> scores = new ArrayList<>();
        Set<String> scored = new LinkedHashSet<>();
        for (JsonNode entryNode : optionalArray(root, FIELD_SCORES)) {
            ScoreEntry entry = readScoreEntry(entryNode);
            if (labels.containsKey(entry.backendId()) && scored.add(entry.backendId())) {
                scores.add(entry);
            }
        }

        return new ParsedConsensus(synthesizedNode.textValue().trim(), attributions, keyPoints, scores, false);
    }

    private static ScoreEntry readScoreEntry(JsonNode entryNode) {
        if (entryNode == null || !entryNode.isObject()) {
            throw new IllegalArgumentException("Score entries must be objects");
        }
        String backendId = requireBackendId(entryNode);

        JsonNode scoreNode = entryNode.get(FIELD_SCORE);
        if (scoreNode == null || !scoreNode.isNumber()) {
            throw new IllegalArgumentException("Score entry for '" + backendId + "' missing numeric field 'score'");
        }
        long score = Math.round(scoreNode.doubleValue());
        if (score < ScoreEntry.MIN_SCORE || score > ScoreEntry.MAX_SCORE) {
            throw new IllegalArgumentException(
                    "Score for '" + backendId + "' must be between "
                            + ScoreEntry.MIN_SCORE
                            + " and "
                            + ScoreEntry.MAX_SCORE
            );
        }

        return new ScoreEntry(
                backendId,
                (int) score,
                optionalStringArray(entryNode, FIELD_STRENGTHS),
                optionalStringArray(entryNode, FIELD_WEAKNESSES)
        );
    }

    private static String requireBackendId(JsonNode node) {
        JsonNode idNode = firstPresent(node, FIELD_BACKEND_ID, FIELD_BACKEND_ID_ALIAS);
        if (idNode == null || !idNode.isTextual() || idNode.textValue().isBlank()) {
            throw new IllegalArgumentException("Entry missing textual field '" + FIELD_BACKEND_ID + "'");
        }
        return idNode.textValue().trim();
    }

    private static List<String> optionalStringArray(JsonNode node, String fieldName) {
        JsonNode arrayNode = node.get(fieldName);
        if (arrayNode == null || arrayNode.isNull()) {
            return List.of();
        }
        return readStringArray(arrayNode, fieldName);
    }

    private static List<String> readStringArray(JsonNode arrayNode, String fieldName) {
        if (!arrayNode.isArray()) {
            throw new IllegalArgumentException("Field '" + fieldName + "' must be an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode valueNode : arrayNode) {
            if (!valueNode.isTextual()) {
                throw new IllegalArgumentException("Field '" + fieldName + "' must contain only strings");
            }
            if (!valueNode.textValue().isBlank()) {
                values.add(valueNode.textValue().trim());
            }
        }
        return values;
    }

    private static Iterable<JsonNode> optionalArray(JsonNode root, String fieldName) {
        JsonNode arrayNode = root.get(fieldName);
        if (arrayNode == null || arrayNode.isNull()) {
            return List.of();
        }
        if (!arrayNode.isArray()) {
            throw new IllegalArgumentException("Field '" + fieldName + "' must be an array");
        }
        return arrayNode;
    }

    private static String optionalText(JsonNode node, String fieldName) {
        JsonNode fieldNode = node.get(fieldName);
        if (fieldNode == null || fieldNode.isNull()) {
            return null;
        }
        if (!fieldNode.isTextual()) {
            throw new IllegalArgumentException("Field '" + fieldName + "' must be textual");
        }
        return fieldNode.textValue();
    }

    private static JsonNode firstPresent(JsonNode node, String fieldName, String aliasFieldName) {
        JsonNode value = node.get(fieldName);
        return value != null && !value.isNull() ? value : node.get(aliasFieldName);
    }

    private static Map<String, String> labelsById(List<AssembledResponse> evaluated) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (AssembledResponse response : evaluated) {
            labels.putIfAbsent(response.backendId(), response.label());
        }
        return labels;
    }

    private static ParsedVerdict fallbackVerdict(List<AssembledResponse> evaluated) {
        AssembledResponse first = evaluated.get(0);
        List<ScoreEntry> neutralScores = labelsById(evaluated).keySet().stream()
                .map(ScoreEntry::neutral)
                .toList();
        return new ParsedVerdict(first.backendId(), first.label(), FALLBACK_REASONING, neutralScores, true);
    }

    /**
     * One judge's verdict. {@code fallback} is set when the judge output could not be used.
     */
    public record ParsedVerdict(
            String winnerBackendId,
            String winnerLabel,
            String reasoning,
            List<ScoreEntry> scores,
            boolean fallback
    ) {
        public ParsedVerdict {
            scores = scores == null ? List.of() : List.copyOf(scores);
        }
    }

    public record ParsedConsensus(
            String synthesizedText,
            List<ConsensusResult.Attribution> attributions,
            List<ConsensusResult.KeyPoint> keyPoints,
            List<ScoreEntry> scores,
            boolean fallback
    ) {
        public ParsedConsensus {
            attributions = attributions == null ? List.of() : List.copyOf(attributions);
            keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
            scores = scores == null ? List.of() : List.copyOf(scores);
        }
    }
}
