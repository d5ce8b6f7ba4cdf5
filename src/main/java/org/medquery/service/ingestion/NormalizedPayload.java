package org.medquery.service.ingestion;

import org.medquery.schema.ClinicalEntity;
import org.medquery.schema.ClinicalRecord;
import org.medquery.schema.TemporalValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows that passed column validation for one entity, with temporal fields normalized.
 */
public record NormalizedPayload(ClinicalEntity entity, List<Map<String, Object>> rows) {

    public List<ClinicalRecord> toRecords() {
        return rows.stream().map(entity::newRecord).toList();
    }

    /** Plain form of the rows, suitable for JSON serialization and later replay. */
    public List<Map<String, Object>> replayRows() {
        return rows.stream().map(NormalizedPayload::replayRow).toList();
    }

    private static Map<String, Object> replayRow(Map<String, Object> row) {
        Map<String, Object> plain = new LinkedHashMap<>();
        row.forEach((field, value) -> plain.put(field,
                value instanceof TemporalValue temporal ? temporal.replayValue() : value));
        return plain;
    }
}
