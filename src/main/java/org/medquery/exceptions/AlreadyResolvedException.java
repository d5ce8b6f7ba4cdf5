package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

public class AlreadyResolvedException extends MedQueryException {

    public AlreadyResolvedException(String message) {
        super(HttpStatus.CONFLICT, "ALREADY_RESOLVED", message);
    }

    public AlreadyResolvedException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, "ALREADY_RESOLVED", message, cause);
    }
}
