package com.llmcommittee.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Evaluation strategy applied to a set of committee responses.
 */
public enum JudgingMode {
    SINGLE("single"),
    COMMITTEE("committee"),
    EXECUTIVE("executive"),
    CONSENSUS("consensus");

    private final String wireValue;

    JudgingMode(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isMultiJudge() {
        return this == COMMITTEE || this == EXECUTIVE;
    }

    @JsonCreator
    public static JudgingMode fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Judging mode is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        // "judge" is the name older clients send for single-judge mode.
        if ("judge".equals(normalized)) {
            return SINGLE;
        }
        for (JudgingMode mode : values()) {
            if (mode.wireValue.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown judging mode: " + value);
    }
}
