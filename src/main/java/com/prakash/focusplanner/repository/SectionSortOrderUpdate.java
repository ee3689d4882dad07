package com.prakash.focusplanner.repository;

import com.prakash.focusplanner.model.Section;

public record SectionSortOrderUpdate(String id, int sortOrder, Section section) {
}
