package com.prakash.focusplanner.service;

import com.prakash.focusplanner.config.FocusProperties;
import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.Timeframe;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Maximum occupancy of a section for one period. Configured caps win over the section's built-in ones.
 */
@Component
public class CapacityPolicy {

    private final FocusProperties properties;

    @Autowired
    public CapacityPolicy(FocusProperties properties) {
        this.properties = properties;
    }

    public OptionalInt maxFor(Section section, Timeframe timeframe) {
        Map<Timeframe, Integer> configured = section == Section.PRIMARY
                ? properties.getCapacity().getPrimary()
                : properties.getCapacity().getOverflow();
        Integer override = configured == null ? null : configured.get(timeframe);
        if (override != null) {
            return OptionalInt.of(override);
        }
        return section.maxTasks(timeframe);
    }
}
