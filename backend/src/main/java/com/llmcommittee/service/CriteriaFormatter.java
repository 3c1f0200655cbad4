package com.llmcommittee.service;

import com.llmcommittee.model.Criteria;
import com.llmcommittee.model.CriteriaPresets;

import java.util.stream.Collectors;

/**
 * Renders a rubric as the bullet list embedded in judge prompts.
 */
public final class CriteriaFormatter {

    private CriteriaFormatter() {
    }

    public static String format(Criteria criteria) {
        Criteria effective = criteria == null || criteria.items().isEmpty()
                ? CriteriaPresets.defaultCriteria()
                : criteria;
        return effective.items().stream()
                .map(item -> "- **" + item.name() + "** (importance: " + item.weight() + "/" + Criteria.MAX_WEIGHT
                        + "): " + item.description())
                .collect(Collectors.joining("\n"));
    }
}
