package com.llmcommittee.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists the substrings of model output that may hold a JSON object, most likely first:
 * the whole trimmed text, the contents of fenced code blocks, then the outermost brace span.
 */
final class JsonPayloadExtractor {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private JsonPayloadExtractor() {
    }

    static List<String> candidates(String rawText) {
        List<String> candidates = new ArrayList<>();
        if (rawText == null) {
            return candidates;
        }
        String trimmed = rawText.trim();
        if (trimmed.isEmpty()) {
            return candidates;
        }
        candidates.add(trimmed);

        Matcher matcher = FENCED_BLOCK.matcher(trimmed);
        while (matcher.find()) {
            addDistinct(candidates, matcher.group(1).trim());
        }

        int open = trimmed.indexOf('{');
        int close = trimmed.lastIndexOf('}');
        if (open >= 0 && close > open) {
            addDistinct(candidates, trimmed.substring(open, close + 1));
        }
        return candidates;
    }

    private static void addDistinct(List<String> candidates, String candidate) {
        if (!candidate.isEmpty() && !candidates.contains(candidate)) {
            candidates.add(candidate);
        }
    }
}
