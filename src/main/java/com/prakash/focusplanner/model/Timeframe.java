package com.prakash.focusplanner.model;

import java.util.List;

/**
 * Period granularity a task can be committed to.
 * Declaration order is the containment order: DAILY &lt; WEEKLY &lt; MONTHLY &lt; YEARLY.
 */
public enum Timeframe {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY;

    /**
     * The next lower timeframe, or null for DAILY.
     */
    public Timeframe childTimeframe() {
        return switch (this) {
            case YEARLY -> MONTHLY;
            case MONTHLY -> WEEKLY;
            case WEEKLY -> DAILY;
            case DAILY -> null;
        };
    }

    /**
     * Every timeframe a commitment at this level may be broken down into, highest first.
     * Not limited to the immediate child: weekly goes straight to daily, yearly may skip to weekly.
     * Yearly never goes straight to daily (a year has too many day slots to pick from).
     */
    public List<Timeframe> breakdownTargets() {
        return switch (this) {
            case YEARLY -> List.of(MONTHLY, WEEKLY);
            case MONTHLY -> List.of(WEEKLY, DAILY);
            case WEEKLY -> List.of(DAILY);
            case DAILY -> List.of();
        };
    }

    public boolean canBreakDownTo(Timeframe target) {
        return target != null && breakdownTargets().contains(target);
    }

    public boolean isHigherThan(Timeframe other) {
        return compareTo(other) > 0;
    }

    // lower = more urgent
    public int urgencyIndex() {
        return ordinal();
    }

    public String nextPeriodLabel() {
        return switch (this) {
            case DAILY -> "Tomorrow";
            case WEEKLY -> "Next Week";
            case MONTHLY -> "Next Month";
            case YEARLY -> "Next Year";
        };
    }
}
