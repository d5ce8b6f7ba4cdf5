package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

public class RequestNotFoundException extends MedQueryException {

    public RequestNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "NOT_FOUND", message);
    }

    public RequestNotFoundException(String message, Throwable cause) {
        super(HttpStatus.NOT_FOUND, "NOT_FOUND", message, cause);
    }
}
