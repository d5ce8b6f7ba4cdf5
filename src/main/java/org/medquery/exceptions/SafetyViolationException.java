package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

public class SafetyViolationException extends MedQueryException {

    public SafetyViolationException(String message) {
        super(HttpStatus.BAD_REQUEST, "SAFETY_VIOLATION", message);
    }

    public SafetyViolationException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, "SAFETY_VIOLATION", message, cause);
    }
}
