package com.prakash.focusplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST) // Rejected before any store call
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
