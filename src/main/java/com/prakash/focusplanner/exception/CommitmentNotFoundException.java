package com.prakash.focusplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class CommitmentNotFoundException extends RuntimeException {

    public CommitmentNotFoundException(String message) {
        super(message);
    }
}
