package com.prakash.focusplanner.model;

import java.util.OptionalInt;

/**
 * Bucket a commitment lives in for its period.
 */
public enum Section {
    PRIMARY,   // Focus targets, capped per timeframe
    OVERFLOW;  // Everything else, unlimited

    /**
     * Built-in occupancy cap for this section at the given timeframe.
     * Empty means unlimited. Configuration may override these.
     */
    public OptionalInt maxTasks(Timeframe timeframe) {
        if (this == OVERFLOW) {
            return OptionalInt.empty();
        }
        return switch (timeframe) {
            case DAILY -> OptionalInt.of(3);
            case YEARLY -> OptionalInt.of(10);
            default -> OptionalInt.of(5);
        };
    }

    public String displayName() {
        return this == PRIMARY ? "Focus" : "Extra";
    }
}
