package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends MedQueryException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, "FORBIDDEN", message);
    }

    public ForbiddenException(String message, Throwable cause) {
        super(HttpStatus.FORBIDDEN, "FORBIDDEN", message, cause);
    }
}
