package com.llmcommittee.service;

import com.llmcommittee.model.Criteria;
import com.llmcommittee.model.CriteriaPresets;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CriteriaFormatterTest {

    @Test
    void formatsOneLinePerItem() {
        Criteria criteria = new Criteria("custom", "Custom", "d", List.of(
                new Criteria.Item("Accuracy", 5, "Correct facts"),
                new Criteria.Item("Tone", 2, "Friendly")
        ));

        assertEquals(
                "- **Accuracy** (importance: 5/5): Correct facts\n- **Tone** (importance: 2/5): Friendly",
                CriteriaFormatter.format(criteria)
        );
    }

    @Test
    void missingRubricUsesGeneralPreset() {
        String formatted = CriteriaFormatter.format(null);

        assertEquals(CriteriaFormatter.format(CriteriaPresets.defaultCriteria()), formatted);
        assertTrue(formatted.startsWith("- **Accuracy** (importance: 5/5): Correctness and factual accuracy"));
        assertEquals(5, formatted.split("\n").length);
    }

    @Test
    void presetsAreAvailableById() {
        assertEquals(7, CriteriaPresets.PRESETS.size());
        assertEquals("Code Quality", CriteriaPresets.findById("code").orElseThrow().label());
        assertTrue(CriteriaPresets.findById("unknown").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new Criteria.Item("Bad", 6, "too heavy"));
    }
}
