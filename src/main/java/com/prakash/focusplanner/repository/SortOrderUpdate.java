package com.prakash.focusplanner.repository;

public record SortOrderUpdate(String id, int sortOrder) {
}
