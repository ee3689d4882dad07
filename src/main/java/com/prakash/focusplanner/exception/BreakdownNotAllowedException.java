package com.prakash.focusplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when a breakdown targets a timeframe or slot that is not a sub-period of the source commitment.
 * Normal UI flows only offer valid targets, so seeing this usually means the caller's state is stale or wrong.
 */
@ResponseStatus(value = HttpStatus.UNPROCESSABLE_ENTITY)
public class BreakdownNotAllowedException extends RuntimeException {

    public BreakdownNotAllowedException(String message) {
        super(message);
    }
}
