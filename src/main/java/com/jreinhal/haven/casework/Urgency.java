package com.jreinhal.haven.casework;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

public enum Urgency {
    LOW("BASSE", 30),
    MEDIUM("MOYENNE", 14),
    HIGH("HAUTE", 7),
    CRITICAL("CRITIQUE", 3);

    private final String frenchLabel;
    private final int expectedHandlingDays;

    Urgency(String frenchLabel, int expectedHandlingDays) {
        this.frenchLabel = frenchLabel;
        this.expectedHandlingDays = expectedHandlingDays;
    }

    /** Days a report of this urgency may stay open before it counts as delayed. */
    public int getExpectedHandlingDays() {
        return this.expectedHandlingDays;
    }

    public boolean isUrgent() {
        return this == HIGH || this == CRITICAL;
    }

    /**
     * Accepts the English constant or the French field label (e.g. {@code CRITIQUE}).
     */
    @JsonCreator
    public static Urgency fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Urgency urgency : values()) {
            if (urgency.name().equals(normalized) || urgency.frenchLabel.equals(normalized)) {
                return urgency;
            }
        }
        throw new IllegalArgumentException("Unknown urgency: " + value);
    }
}
