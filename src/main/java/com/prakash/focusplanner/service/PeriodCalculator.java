package com.prakash.focusplanner.service;

import com.prakash.focusplanner.model.Timeframe;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Period boundary arithmetic for timeframes.
 * <p>
 * Days are calendar days, weeks start on Sunday, months and years are calendar months and years.
 * All inputs are reduced to a {@link LocalDate}, so the time of day never affects a result.
 */
@Component
public class PeriodCalculator {

    public static final DayOfWeek FIRST_DAY_OF_WEEK = DayOfWeek.SUNDAY;

    public PeriodBounds periodBounds(Timeframe timeframe, LocalDate date) {
        LocalDate start = periodStart(timeframe, date);
        return new PeriodBounds(start, advance(timeframe, start));
    }

    public PeriodBounds periodBounds(Timeframe timeframe, LocalDateTime dateTime) {
        return periodBounds(timeframe, dateTime.toLocalDate());
    }

    public LocalDate periodStart(Timeframe timeframe, LocalDate date) {
        return switch (timeframe) {
            case DAILY -> date;
            case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(FIRST_DAY_OF_WEEK));
            case MONTHLY -> date.withDayOfMonth(1);
            case YEARLY -> date.withDayOfYear(1);
        };
    }

    /**
     * True if both dates fall inside the same period of the given timeframe.
     */
    public boolean samePeriod(LocalDate date, Timeframe timeframe, LocalDate referenceDate) {
        return periodStart(timeframe, date).equals(periodStart(timeframe, referenceDate));
    }

    public boolean samePeriod(LocalDateTime date, Timeframe timeframe, LocalDateTime referenceDate) {
        return samePeriod(date.toLocalDate(), timeframe, referenceDate.toLocalDate());
    }

    /**
     * Start of the period right after the one containing {@code date}.
     */
    public LocalDate nextPeriodAnchor(Timeframe timeframe, LocalDate date) {
        return advance(timeframe, periodStart(timeframe, date));
    }

    /**
     * Start of every {@code target} period that overlaps the {@code source} period containing {@code date},
     * in chronological order. A week overlapping the start of a month is included even though it starts
     * in the previous month.
     */
    public List<LocalDate> subPeriodStarts(Timeframe source, LocalDate date, Timeframe target) {
        PeriodBounds bounds = periodBounds(source, date);
        List<LocalDate> starts = new ArrayList<>();
        LocalDate cursor = periodStart(target, bounds.start());
        while (cursor.isBefore(bounds.endExclusive())) {
            starts.add(cursor);
            cursor = advance(target, cursor);
        }
        return starts;
    }

    private LocalDate advance(Timeframe timeframe, LocalDate start) {
        return switch (timeframe) {
            case DAILY -> start.plusDays(1);
            case WEEKLY -> start.plusWeeks(1);
            case MONTHLY -> start.plusMonths(1);
            case YEARLY -> start.plusYears(1);
        };
    }
}
