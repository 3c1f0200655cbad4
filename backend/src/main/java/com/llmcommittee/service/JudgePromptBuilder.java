package com.llmcommittee.service;

import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.Criteria;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds judge and synthesizer prompts. Every part is a pure function of its inputs.
 */
public final class JudgePromptBuilder {

    /**
     * Matches one response heading produced by {@link #formatResponses(List)}; groups are the
     * 1-based position, the label and the backend id.
     */
    public static final Pattern RESPONSE_HEADING =
            Pattern.compile("^### Response (\\d+): (.*) \\((.+)\\)$", Pattern.MULTILINE);

    public static final String VERDICT_FORMAT_HEADING = "## Verdict Format";
    public static final String SYNTHESIS_FORMAT_HEADING = "## Synthesis Format";

    private static final String RESPONSE_SEPARATOR = "\n---\n";

    private JudgePromptBuilder() {
    }

    public static String formatResponses(List<AssembledResponse> responses) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < responses.size(); i++) {
            AssembledResponse response = responses.get(i);
            if (i > 0) {
                builder.append(RESPONSE_SEPARATOR);
            }
            builder.append("\n### Response ")
                    .append(i + 1)
                    .append(": ")
                    .append(response.label())
                    .append(" (")
                    .append(response.backendId())
                    .append(")\n")
                    .append(response.content())
                    .append('\n');
        }
        return builder.toString();
    }

    public static String verdictInstruction() {
        return VERDICT_FORMAT_HEADING + "\n"
                + "Respond with a single JSON object and nothing else, using this exact structure:\n"
                + "{\n"
                + "  \"winnerBackendId\": \"the backend id of the best response\",\n"
                + "  \"winnerLabel\": \"the display name of the winner\",\n"
                + "  \"reasoning\": \"A 2-3 sentence explanation of why this response won, referencing "
                + "specific strengths and comparing to other responses\",\n"
                + "  \"scores\": [\n"
                + "    {\n"
                + "      \"backendId\": \"backend id\",\n"
                + "      \"score\": 85,\n"
                + "      \"strengths\": [\"strength 1\", \"strength 2\"],\n"
                + "      \"weaknesses\": [\"weakness 1\"]\n"
                + "    }\n"
                + "  ]\n"
                + "}\n\n"
                + "Score every response from 0 to 100. Use only backend ids that appear in the response "
                + "headings. Be specific in your reasoning and reference actual content from the responses.";
    }

    public static String consensusInstruction() {
        return SYNTHESIS_FORMAT_HEADING + "\n"
                + "Do not pick a winner. Merge the strongest, correct parts of every response into one "
                + "answer to the original prompt, and record which response contributed what.\n"
                + "Respond with a single JSON object and nothing else, using this exact structure:\n"
                + "{\n"
                + "  \"synthesizedResponse\": \"the merged answer\",\n"
                + "  \"attributions\": [\n"
                + "    { \"backendId\": \"backend id\", \"contribution\": \"what this response contributed\" }\n"
                + "  ],\n"
                + "  \"keyPoints\": [\n"
                + "    { \"point\": \"a key point of the merged answer\", \"sourceBackendIds\": [\"backend id\"] }\n"
                + "  ],\n"
                + "  \"scores\": [\n"
                + "    { \"backendId\": \"backend id\", \"score\": 70 }\n"
                + "  ]\n"
                + "}\n\n"
                + "Scores are optional and describe how much each response contributed, from 0 to 100.";
    }

    public static String buildVerdictPrompt(
            String prompt,
            List<AssembledResponse> responses,
            Criteria criteria
    ) {
        return "You are an expert judge evaluating AI model responses. Your task is to analyze the "
                + "following responses to a user prompt and determine which is best.\n\n"
                + "## Original User Prompt\n"
                + prompt + "\n\n"
                + "## Responses to Evaluate\n"
                + formatResponses(responses) + "\n"
                + "## Evaluation Criteria\n"
                + "Weigh each criterion by its importance:\n"
                + CriteriaFormatter.format(criteria) + "\n\n"
                + verdictInstruction();
    }

    public static String buildConsensusPrompt(
            String prompt,
            List<AssembledResponse> responses,
            Criteria criteria
    ) {
        return "You are an expert editor combining several AI model responses into the best "
                + "possible single answer.\n\n"
                + "## Original User Prompt\n"
                + prompt + "\n\n"
                + "## Responses to Combine\n"
                + formatResponses(responses) + "\n"
                + "## Quality Criteria\n"
                + "Favor content that best satisfies these criteria:\n"
                + CriteriaFormatter.format(criteria) + "\n\n"
                + consensusInstruction();
    }
}
