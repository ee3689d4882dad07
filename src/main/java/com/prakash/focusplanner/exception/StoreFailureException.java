package com.prakash.focusplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A round trip to the task or commitment store failed. Never retried automatically.
 */
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class StoreFailureException extends RuntimeException {

    public StoreFailureException(String message) {
        super(message);
    }

    public StoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
