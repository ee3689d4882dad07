package com.prakash.focusplanner.service;

import java.time.LocalDate;

/**
 * Half-open date range [start, endExclusive).
 */
public record PeriodBounds(LocalDate start, LocalDate endExclusive) {

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && date.isBefore(endExclusive);
    }

    public boolean overlaps(PeriodBounds other) {
        return start.isBefore(other.endExclusive) && other.start.isBefore(endExclusive);
    }
}
