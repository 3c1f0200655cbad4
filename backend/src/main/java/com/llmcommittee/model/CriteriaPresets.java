package com.llmcommittee.model;

import java.util.List;
import java.util.Optional;

/**
 * Built-in judging rubrics.
 */
public final class CriteriaPresets {

    public static final String DEFAULT_CRITERIA_ID = "general";
    public static final String CUSTOM_CRITERIA_ID = "custom";

    public static final List<Criteria> PRESETS = List.of(
            new Criteria("general", "General Purpose", "Balanced evaluation for most prompts", List.of(
                    item("Accuracy", 5, "Correctness and factual accuracy of the response"),
                    item("Completeness", 4, "Thoroughness in addressing all aspects of the prompt"),
                    item("Clarity", 4, "Clear, well-organized, and easy to understand"),
                    item("Relevance", 5, "Directly addresses the prompt without tangents"),
                    item("Helpfulness", 4, "Practical and actionable for the user")
            )),
            new Criteria("code", "Code Quality", "Evaluates programming and technical responses", List.of(
                    item("Correctness", 5, "Code works correctly and handles edge cases"),
                    item("Best Practices", 4, "Follows language idioms and coding standards"),
                    item("Readability", 4, "Clean, well-structured, properly named"),
                    item("Efficiency", 3, "Appropriate time/space complexity"),
                    item("Explanation", 4, "Clear explanation of the approach and code"),
                    item("Error Handling", 3, "Handles errors and edge cases appropriately")
            )),
            new Criteria("creative", "Creative Writing", "Evaluates stories, poetry, and creative content", List.of(
                    item("Creativity", 5, "Original ideas, unique perspectives, imaginative"),
                    item("Engagement", 5, "Captivating, holds attention, emotionally resonant"),
                    item("Style", 4, "Distinctive voice, appropriate tone, literary quality"),
                    item("Structure", 3, "Well-paced, coherent narrative or logical flow"),
                    item("Language", 4, "Rich vocabulary, vivid imagery, polished prose")
            )),
            new Criteria("factual", "Factual Accuracy", "Prioritizes correctness for research and factual queries", List.of(
                    item("Accuracy", 5, "Factually correct, verifiable information"),
                    item("Sources", 4, "References authoritative sources when appropriate"),
                    item("Nuance", 4, "Acknowledges complexity, avoids oversimplification"),
                    item("Objectivity", 4, "Balanced, presents multiple perspectives if relevant"),
                    item("Completeness", 3, "Covers key aspects without unnecessary detail")
            )),
            new Criteria("concise", "Concise & Direct", "Rewards brevity and directness", List.of(
                    item("Brevity", 5, "Gets to the point quickly, no unnecessary words"),
                    item("Directness", 5, "Answers the question immediately and clearly"),
                    item("Accuracy", 4, "Correct despite being brief"),
                    item("Completeness", 3, "Covers essentials without over-explaining")
            )),
            new Criteria("educational", "Educational", "Evaluates explanations and teaching quality", List.of(
                    item("Clarity", 5, "Easy to understand, appropriate for audience"),
                    item("Accuracy", 5, "Factually correct information"),
                    item("Examples", 4, "Uses helpful examples and analogies"),
                    item("Structure", 4, "Logical progression, builds understanding"),
                    item("Depth", 3, "Appropriate level of detail")
            )),
            new Criteria("persuasive", "Persuasive", "Evaluates arguments and persuasive writing", List.of(
                    item("Argument Strength", 5, "Logical, well-reasoned arguments"),
                    item("Evidence", 4, "Supports claims with evidence or examples"),
                    item("Rhetoric", 4, "Effective persuasive techniques"),
                    item("Counterarguments", 3, "Addresses potential objections"),
                    item("Conclusion", 4, "Strong, memorable conclusion")
            ))
    );

    private CriteriaPresets() {
    }

    public static Optional<Criteria> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return PRESETS.stream()
                .filter(criteria -> criteria.id().equals(id.trim()))
                .findFirst();
    }

    public static Criteria defaultCriteria() {
        return findById(DEFAULT_CRITERIA_ID)
                .orElseThrow(() -> new IllegalStateException("Default criteria preset is missing"));
    }

    private static Criteria.Item item(String name, int weight, String description) {
        return new Criteria.Item(name, weight, description);
    }
}
