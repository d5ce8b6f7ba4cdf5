package org.medquery.service.query;

import lombok.extern.slf4j.Slf4j;
import org.medquery.configuration.MedQueryProperties;
import org.medquery.exceptions.ExecutionFailureException;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class JdbcStatementExecutor implements StatementExecutor {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int timeoutSeconds;

    public JdbcStatementExecutor(JdbcTemplate jdbcTemplate,
                                 PlatformTransactionManager transactionManager,
                                 MedQueryProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.timeoutSeconds = (int) Math.max(1, properties.getQuery().getStatementTimeout().toSeconds());
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setReadOnly(true);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public QueryResult execute(String statement, int maxRows) {
        try {
            return transactionTemplate.execute(status -> {
                List<Map<String, Object>> rows = jdbcTemplate.query(connection -> {
                    PreparedStatement prepared = connection.prepareStatement(statement);
                    // one extra row tells us whether the cap cut anything off
                    prepared.setMaxRows(maxRows + 1);
                    prepared.setQueryTimeout(timeoutSeconds);
                    return prepared;
                }, new ColumnMapRowMapper());
                boolean truncated = rows.size() > maxRows;
                List<Map<String, Object>> bounded = truncated ? new ArrayList<>(rows.subList(0, maxRows)) : rows;
                return new QueryResult(bounded, truncated);
            });
        } catch (QueryTimeoutException exception) {
            log.error("Statement cancelled after {} s", timeoutSeconds);
            throw new ExecutionFailureException(statement, "statement exceeded the " + timeoutSeconds + " s timeout", exception);
        } catch (DataAccessException exception) {
            Throwable cause = NestedExceptionUtils.getMostSpecificCause(exception);
            log.error("Statement rejected by the store: {}", cause.getMessage());
            throw new ExecutionFailureException(statement, cause.getMessage(), exception);
        }
    }
}
