package org.medquery.service.ingestion;

import lombok.RequiredArgsConstructor;
import org.medquery.models.enums.FieldType;
import org.medquery.schema.ClinicalEntity;
import org.medquery.schema.FieldDefinition;
import org.medquery.schema.SchemaDefinition;
import org.medquery.schema.SchemaRegistry;
import org.medquery.schema.TemporalNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates incoming rows against the target table and normalizes their values. Unknown columns
 * are checked across the whole batch before any row-level check.
 */
@Component
@RequiredArgsConstructor
public class PayloadNormalizer {

    private final SchemaRegistry schemaRegistry;

    public NormalizedPayload normalize(String entityName, List<Map<String, Object>> rows) {
        ClinicalEntity entity = schemaRegistry.entityFor(entityName);
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("No records to ingest for " + entity.tableName());
        }

        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        schemaRegistry.validateFields(entity.tableName(), columns);

        SchemaDefinition definition = entity.schema();
        List<Map<String, Object>> normalized = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            row.forEach((field, value) -> values.put(field, normalizeValue(definition, field, value)));
            schemaRegistry.validateRequired(entity.tableName(), values);
            normalized.add(values);
        }
        return new NormalizedPayload(entity, normalized);
    }

    private Object normalizeValue(SchemaDefinition definition, String field, Object value) {
        if (value == null || (value instanceof String text && text.isBlank())) {
            return null;
        }
        FieldType type = definition.field(field).map(FieldDefinition::type).orElse(FieldType.TEXT);
        if (type == FieldType.TIMESTAMP) {
            return TemporalNormalizer.normalize(value);
        }
        return value;
    }
}
