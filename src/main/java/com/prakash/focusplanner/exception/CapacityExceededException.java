package com.prakash.focusplanner.exception;

import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.Timeframe;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.CONFLICT) // Destination section is full for the period
public class CapacityExceededException extends RuntimeException {

    private final Section section;
    private final Timeframe timeframe;
    private final int limit;
    private final int currentCount;

    public CapacityExceededException(Section section, Timeframe timeframe, int limit, int currentCount) {
        super(section.displayName() + " section is full (" + limit + " max for " + timeframe.name().toLowerCase() + ")");
        this.section = section;
        this.timeframe = timeframe;
        this.limit = limit;
        this.currentCount = currentCount;
    }

    public Section getSection() {
        return section;
    }

    public Timeframe getTimeframe() {
        return timeframe;
    }

    public int getLimit() {
        return limit;
    }

    public int getCurrentCount() {
        return currentCount;
    }
}
