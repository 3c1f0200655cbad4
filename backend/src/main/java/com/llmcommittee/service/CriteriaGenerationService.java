package com.llmcommittee.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmcommittee.config.CommitteeJudgeProperties;
import com.llmcommittee.model.ChatMessage;
import com.llmcommittee.model.Criteria;
import com.llmcommittee.model.CriteriaPresets;
import com.llmcommittee.provider.BackendClient;
import com.llmcommittee.provider.BackendCompletion;
import com.llmcommittee.provider.CancellationToken;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Asks a backend to design a judging rubric from a free-text description and sanitizes the result.
 */
@Service
@RequiredArgsConstructor
public class CriteriaGenerationService {

    private static final Logger log = LoggerFactory.getLogger(CriteriaGenerationService.class);

    public static final String PROMPT_HEADING =
            "You are an expert at designing evaluation criteria for comparing AI model responses.";
    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    static final String DEFAULT_NAME = "AI-Generated Criteria";
    static final String DEFAULT_DESCRIPTION = "AI-generated evaluation criteria";

    private final BackendClient backendClient;
    private final ObjectMapper objectMapper;
    private final CommitteeJudgeProperties committeeJudgeProperties;

    public Criteria generate(String description, String backendId) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description is required");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException(
                    "Description must be " + MAX_DESCRIPTION_LENGTH + " characters or fewer"
            );
        }
        if (backendId == null || backendId.isBlank()) {
            throw new IllegalArgumentException("Backend id is required");
        }

        BackendCompletion completion = backendClient.complete(
                backendId.trim(),
                List.of(ChatMessage.user(buildPrompt(description))),
                Duration.ofSeconds(committeeJudgeProperties.getTimeoutSeconds()),
                new CancellationToken()
        );
        if (!completion.isSuccess()) {
            log.warn("Criteria generation by backend {} failed: {}", backendId, completion.errorMessage());
            throw new CriteriaGenerationException(completion.errorMessage());
        }

        JsonNode root = readFirstObject(completion.content());
        if (root == null) {
            throw new CriteriaGenerationException("Failed to parse model response");
        }
        return toCriteria(root);
    }

    static String buildPrompt(String description) {
        return PROMPT_HEADING + "\n\n"
                + "The user wants to evaluate AI responses with the following focus:\n"
                + "\"" + description + "\"\n\n"
                + "Analyze this description and generate a set of 3-7 evaluation criteria. Each criterion should have:\n"
                + "- A short, clear name (e.g., \"Accuracy\", \"Code Quality\")\n"
                + "- A weight from 1-5 indicating importance (5 = most important)\n"
                + "- A brief description of what to evaluate\n\n"
                + "Also provide a short name and description for this criteria set as a whole.\n\n"
                + "Return your response as a JSON object with this exact structure:\n"
                + "{\n"
                + "  \"name\": \"Short name for this criteria set\",\n"
                + "  \"description\": \"One-sentence description of what this criteria set evaluates\",\n"
                + "  \"criteria\": [\n"
                + "    {\n"
                + "      \"name\": \"Criterion Name\",\n"
                + "      \"weight\": 4,\n"
                + "      \"description\": \"What this criterion evaluates\"\n"
                + "    }\n"
                + "  ]\n"
                + "}\n\n"
                + "Guidelines:\n"
                + "- Generate criteria that specifically address what the user described\n"
                + "- Assign higher weights to criteria that are most relevant to the user's description\n"
                + "- Keep criterion names concise (1-3 words)\n"
                + "- Keep criterion descriptions under 100 characters\n"
                + "- Ensure criteria are distinct and don't overlap significantly";
    }

    private JsonNode readFirstObject(String content) {
        for (String candidate : JsonPayloadExtractor.candidates(content)) {
            try {
                JsonNode node = objectMapper.readTree(candidate);
                if (node != null && node.isObject()) {
                    return node;
                }
            } catch (JsonProcessingException ex) {
                log.debug("Rejected criteria candidate: {}", ex.getOriginalMessage());
            }
        }
        return null;
    }

    private static Criteria toCriteria(JsonNode root) {
        JsonNode nameNode = root.get("name");
        JsonNode descriptionNode = root.get("description");
        JsonNode criteriaNode = root.get("criteria");
        if (nameNode == null || !nameNode.isTextual()
                || descriptionNode == null || !descriptionNode.isTextual()
                || criteriaNode == null || !criteriaNode.isArray() || criteriaNode.isEmpty()) {
            throw new CriteriaGenerationException("Invalid criteria structure from model");
        }

        List<Criteria.Item> items = new ArrayList<>();
        for (JsonNode itemNode : criteriaNode) {
            JsonNode itemName = itemNode.get("name");
            JsonNode itemWeight = itemNode.get("weight");
            JsonNode itemDescription = itemNode.get("description");
            if (itemName == null || !itemName.isTextual() || itemName.textValue().isBlank()
                    || itemWeight == null || !itemWeight.isNumber()
                    || itemDescription == null || !itemDescription.isTextual()) {
                continue;
            }
            long rounded = Math.round(itemWeight.doubleValue());
            int weight = (int) Math.max(Criteria.MIN_WEIGHT, Math.min(Criteria.MAX_WEIGHT, rounded));
            items.add(new Criteria.Item(itemName.textValue().trim(), weight, itemDescription.textValue().trim()));
        }
        if (items.isEmpty()) {
            throw new CriteriaGenerationException("No valid criteria generated");
        }

        String name = nameNode.textValue().trim();
        String description = descriptionNode.textValue().trim();
        return new Criteria(
                CriteriaPresets.CUSTOM_CRITERIA_ID,
                name.isEmpty() ? DEFAULT_NAME : name,
                description.isEmpty() ? DEFAULT_DESCRIPTION : description,
                items
        );
    }
}
