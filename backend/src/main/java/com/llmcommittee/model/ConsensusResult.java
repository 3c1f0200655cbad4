package com.llmcommittee.model;

import java.util.List;

/**
 * Merged answer produced in consensus mode, with per-backend attribution.
 */
public record ConsensusResult(
        String synthesizedText,
        List<Attribution> attributions,
        List<KeyPoint> keyPoints
) {
    public ConsensusResult {
        attributions = attributions == null ? List.of() : List.copyOf(attributions);
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
    }

    public record Attribution(
            String backendId,
            String label,
            String contribution
    ) {
    }

    public record KeyPoint(
            String point,
            List<String> sourceBackendIds
    ) {
        public KeyPoint {
            sourceBackendIds = sourceBackendIds == null ? List.of() : List.copyOf(sourceBackendIds);
        }
    }
}
