package com.prakash.focusplanner.service;

import com.prakash.focusplanner.exception.ValidationException;

import java.util.Optional;

/**
 * Accessor for the signed-in user. Passed explicitly to every component that stamps ownership.
 */
@FunctionalInterface
public interface CurrentUser {

    Optional<String> currentUserId();

    default String requireUserId() {
        return currentUserId().orElseThrow(() -> new ValidationException("No authenticated user"));
    }
}
