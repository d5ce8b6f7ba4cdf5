package org.medquery.models.dto;

import org.medquery.models.entity.QueryRecord;

import java.time.Instant;

public record QueryHistoryItemDTO(
        Long id,
        String userId,
        String question,
        String generatedSql,
        String answerText,
        Long executionTimeMs,
        Integer rowCount,
        Instant timestamp
) {

    public static QueryHistoryItemDTO from(QueryRecord record) {
        return new QueryHistoryItemDTO(
                record.getId(),
                record.getSubject(),
                record.getQuestion(),
                record.getStatement(),
                record.getNarration(),
                record.getExecutionTimeMs(),
                record.getRowCount(),
                record.getTimestamp()
        );
    }
}
