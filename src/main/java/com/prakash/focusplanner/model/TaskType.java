package com.prakash.focusplanner.model;

public enum TaskType {
    TASK,     // Plain work item
    PROJECT,  // Container of tasks
    LIST      // Checklist-like container of items
}
