package com.prakash.focusplanner.service;

import com.prakash.focusplanner.model.Task;

/**
 * Decides whether a subtask counts toward auto-completing its parent.
 */
@FunctionalInterface
public interface AutoCompleteRule {

    AutoCompleteRule EVERY_SUBTASK = subtask -> true;

    boolean counts(Task subtask);
}
