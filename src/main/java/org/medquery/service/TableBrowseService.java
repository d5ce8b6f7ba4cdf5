package org.medquery.service;

import lombok.extern.slf4j.Slf4j;
import org.medquery.configuration.MedQueryProperties;
import org.medquery.exceptions.ExecutionFailureException;
import org.medquery.models.dto.TablePageDTO;
import org.medquery.schema.ClinicalEntity;
import org.medquery.schema.SchemaRegistry;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Paged read of a clinical table. The table name is resolved through the schema registry, so only
 * registered tables can appear in the generated SQL.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class TableBrowseService {

    private final JdbcTemplate jdbcTemplate;
    private final SchemaRegistry schemaRegistry;
    private final int maxRows;

    public TableBrowseService(JdbcTemplate jdbcTemplate, SchemaRegistry schemaRegistry, MedQueryProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.schemaRegistry = schemaRegistry;
        this.maxRows = properties.getQuery().getMaxRows();
    }

    public List<String> tableNames() {
        return Arrays.stream(ClinicalEntity.values())
                .map(ClinicalEntity::tableName)
                .toList();
    }

    /**
     * @param page  1-based page number
     * @param limit rows per page, capped at the configured maximum row count
     */
    public TablePageDTO browse(String tableName, int page, int limit) {
        ClinicalEntity entity = schemaRegistry.entityFor(tableName);
        if (page < 1) {
            throw new IllegalArgumentException("page must be 1 or greater");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be 1 or greater");
        }
        int pageSize = Math.min(limit, maxRows);
        long offset = (long) (page - 1) * pageSize;

        String table = entity.tableName();
        String orderBy = String.join(", ", entity.schema().requiredFieldNames());
        String sql = "SELECT * FROM " + table + " ORDER BY " + orderBy + " LIMIT ? OFFSET ?";
        try {
            List<Map<String, Object>> rows = jdbcTemplate.query(sql, new ColumnMapRowMapper(), pageSize, offset);
            Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
            log.debug("Browsed {} page {} ({} rows)", table, page, rows.size());
            return new TablePageDTO(table, rows, total == null ? 0 : total, page, pageSize, columns(entity, rows));
        } catch (DataAccessException exception) {
            String reason = NestedExceptionUtils.getMostSpecificCause(exception).getMessage();
            log.error("Browsing {} failed: {}", table, reason);
            throw new ExecutionFailureException(sql, reason, exception);
        }
    }

    private List<String> columns(ClinicalEntity entity, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return new ArrayList<>(entity.schema().fieldNames());
        }
        return rows.get(0).keySet().stream()
                .map(column -> column.toLowerCase(Locale.ROOT))
                .toList();
    }
}
