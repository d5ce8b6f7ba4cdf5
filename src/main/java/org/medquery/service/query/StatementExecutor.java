package org.medquery.service.query;

import org.medquery.exceptions.ExecutionFailureException;

/**
 * Runs a read statement against the clinical store inside one transaction.
 */
public interface StatementExecutor {

    /**
     * @param maxRows rows beyond this cap are dropped and the result is marked truncated
     * @throws ExecutionFailureException when the store rejects the statement
     */
    QueryResult execute(String statement, int maxRows);
}
