package org.medquery.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.medquery.exceptions.IntegrationFailureException;
import org.medquery.schema.ClinicalRecord;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Inserts records with plain JDBC. Table and column names come from the schema registry, never
 * from caller input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcClinicalRecordWriter implements ClinicalRecordWriter {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public int insert(List<ClinicalRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        int written = 0;
        for (Map.Entry<InsertShape, List<ClinicalRecord>> entry : groupByShape(records).entrySet()) {
            written += insertRows(entry.getKey(), entry.getValue());
        }
        return written;
    }

    private Map<InsertShape, List<ClinicalRecord>> groupByShape(List<ClinicalRecord> records) {
        Map<InsertShape, List<ClinicalRecord>> grouped = new LinkedHashMap<>();
        for (ClinicalRecord record : records) {
            InsertShape shape = new InsertShape(record.entity().tableName(), record.columns());
            grouped.computeIfAbsent(shape, key -> new ArrayList<>()).add(record);
        }
        return grouped;
    }

    private int insertRows(InsertShape shape, List<ClinicalRecord> rows) {
        if (shape.columns().isEmpty()) {
            throw new IntegrationFailureException("Record for " + shape.table() + " has no columns");
        }
        String columnList = String.join(", ", shape.columns());
        String placeholders = shape.columns().stream().map(c -> "?").collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + shape.table() + " (" + columnList + ") VALUES (" + placeholders + ")";
        try {
            jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    Map<String, Object> values = rows.get(i).values();
                    for (int columnIndex = 0; columnIndex < shape.columns().size(); columnIndex++) {
                        ps.setObject(columnIndex + 1, values.get(shape.columns().get(columnIndex)));
                    }
                }

                @Override
                public int getBatchSize() {
                    return rows.size();
                }
            });
        } catch (DataAccessException exception) {
            String reason = NestedExceptionUtils.getMostSpecificCause(exception).getMessage();
            log.error("Insert into {} failed: {}", shape.table(), reason);
            throw new IntegrationFailureException("Database insertion error for " + shape.table() + ": " + reason, exception);
        }
        log.info("Wrote {} rows to {}", rows.size(), shape.table());
        return rows.size();
    }

    private record InsertShape(String table, List<String> columns) {
    }
}
