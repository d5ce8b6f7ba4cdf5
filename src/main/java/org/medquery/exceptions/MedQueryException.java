package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Base type for every failure the query and ingestion pipelines report to a caller.
 * Each subclass fixes the HTTP status and the error code written to the response body.
 */
public abstract class MedQueryException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected MedQueryException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected MedQueryException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
