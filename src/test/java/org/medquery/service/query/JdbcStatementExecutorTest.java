package org.medquery.service.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.medquery.configuration.MedQueryProperties;
import org.medquery.exceptions.ExecutionFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JdbcStatementExecutorTest {

    private static final String STATEMENT = "SELECT subject_id FROM patients";

    private JdbcTemplate jdbcTemplate;
    private JdbcStatementExecutor executor;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        MedQueryProperties properties = new MedQueryProperties();
        properties.getQuery().setStatementTimeout(Duration.ofSeconds(12));
        executor = new JdbcStatementExecutor(jdbcTemplate, mock(PlatformTransactionManager.class), properties);
    }

    @Test
    @SuppressWarnings("unchecked")
    void everyStatementCarriesRowCapAndTimeout() throws Exception {
        Connection connection = mock(Connection.class);
        PreparedStatement prepared = mock(PreparedStatement.class);
        when(connection.prepareStatement(STATEMENT)).thenReturn(prepared);
        when(jdbcTemplate.query(any(PreparedStatementCreator.class), any(RowMapper.class))).thenAnswer(invocation -> {
            PreparedStatementCreator creator = invocation.getArgument(0);
            creator.createPreparedStatement(connection);
            return List.of(Map.of("subject_id", 1), Map.of("subject_id", 2), Map.of("subject_id", 3));
        });

        QueryResult result = executor.execute(STATEMENT, 2);

        verify(prepared).setMaxRows(3);
        verify(prepared).setQueryTimeout(12);
        assertEquals(2, result.rowCount());
        assertTrue(result.truncated());
    }

    @Test
    @SuppressWarnings("unchecked")
    void cancelledStatementIsExecutionFailure() {
        when(jdbcTemplate.query(any(PreparedStatementCreator.class), any(RowMapper.class)))
                .thenThrow(new QueryTimeoutException("canceling statement due to statement timeout"));

        ExecutionFailureException exception = assertThrows(ExecutionFailureException.class,
                () -> executor.execute(STATEMENT, 2));

        assertTrue(exception.getMessage().contains("12 s timeout"));
        assertEquals(STATEMENT, exception.getStatement());
    }
}
