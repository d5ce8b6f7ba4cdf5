package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

public class UnknownEntityException extends MedQueryException {

    public UnknownEntityException(String message) {
        super(HttpStatus.BAD_REQUEST, "UNKNOWN_ENTITY", message);
    }

    public UnknownEntityException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, "UNKNOWN_ENTITY", message, cause);
    }
}
