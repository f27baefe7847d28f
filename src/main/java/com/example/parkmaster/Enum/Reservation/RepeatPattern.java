package com.example.parkmaster.Enum.Reservation;

import java.util.Optional;

public enum RepeatPattern {
    NONE("none", 0),
    DAILY("daily", 1),
    WEEKLY("weekly", 7);

    private final String value;
    private final int stepDays;

    RepeatPattern(String value, int stepDays) {
        this.value = value;
        this.stepDays = stepDays;
    }

    public String getValue() {
        return value;
    }

    public int getStepDays() {
        return stepDays;
    }

    /**
     * Lenient lookup used by the schedule expander. Unknown values are not an
     * error there, so this returns empty instead of throwing.
     */
    public static Optional<RepeatPattern> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmedValue = value.trim();
        for (RepeatPattern pattern : RepeatPattern.values()) {
            if (pattern.name().equalsIgnoreCase(trimmedValue) || pattern.getValue().equalsIgnoreCase(trimmedValue)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
}
