package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

public class IntegrationFailureException extends MedQueryException {

    public IntegrationFailureException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "INTEGRATION_FAILURE", message);
    }

    public IntegrationFailureException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "INTEGRATION_FAILURE", message, cause);
    }
}
