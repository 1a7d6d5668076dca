package com.architecture.memory.mergeflow.dto.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Risk level of a PR as supplied by the analysis pipeline.
 * {@code rank} orders merge preference, {@code weight} feeds the impact score.
 */
public enum RiskLevel {
    LOW(0, 0),
    MEDIUM(1, 2),
    HIGH(2, 5),
    CRITICAL(3, 8);

    private final int rank;
    private final int weight;

    RiskLevel(int rank, int weight) {
        this.rank = rank;
        this.weight = weight;
    }

    public int getRank() {
        return rank;
    }

    public int getWeight() {
        return weight;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isHighOrAbove() {
        return this == HIGH || this == CRITICAL;
    }

    /**
     * Unknown or missing levels count as medium.
     */
    public static RiskLevel fromString(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
