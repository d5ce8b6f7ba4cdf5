package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

public class ExecutionFailureException extends MedQueryException {

    private final String statement;

    public ExecutionFailureException(String statement, String reason, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "EXECUTION_FAILURE", "Statement execution failed: " + reason, cause);
        this.statement = statement;
    }

    public String getStatement() {
        return statement;
    }
}
