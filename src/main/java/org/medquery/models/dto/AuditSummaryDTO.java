package org.medquery.models.dto;

import java.util.List;

public record AuditSummaryDTO(
        long totalQueries,
        double avgLatencyMs,
        long totalRecordsRetrieved,
        List<QuestionCount> topQuestions
) {

    public record QuestionCount(String question, long count) {
    }
}
