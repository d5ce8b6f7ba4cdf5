package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

public class GenerationFailureException extends MedQueryException {

    public GenerationFailureException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "GENERATION_FAILURE", message);
    }

    public GenerationFailureException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "GENERATION_FAILURE", message, cause);
    }
}
