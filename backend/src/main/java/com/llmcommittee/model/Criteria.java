package com.llmcommittee.model;

import java.util.List;
import java.util.Objects;

/**
 * Weighted rubric handed to judges. Immutable once built.
 */
public record Criteria(
        String id,
        String label,
        String description,
        List<Item> items
) {
    public static final int MIN_WEIGHT = 1;
    public static final int MAX_WEIGHT = 5;

    public Criteria {
        Objects.requireNonNull(id, "id is required");
        items = items == null ? List.of() : List.copyOf(items);
    }

    public record Item(
            String name,
            int weight,
            String description
    ) {
        public Item {
            if (weight < MIN_WEIGHT || weight > MAX_WEIGHT) {
                throw new IllegalArgumentException(
                        "weight must be between " + MIN_WEIGHT + " and " + MAX_WEIGHT
                );
            }
        }
    }
}
