package org.medquery.models.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.medquery.models.enums.QueryStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(
        String id,
        String question,
        String narration,
        String statement,
        Instant timestamp,
        QueryStatus status,
        long executionTimeMs,
        int rowCount,
        List<Map<String, Object>> rows,
        boolean truncated,
        boolean narrationFailed,
        boolean auditRecorded
) {

    public static QueryResponse pendingReview(String question, String statement) {
        return new QueryResponse(null, question, null, statement, Instant.now(), QueryStatus.PENDING_REVIEW,
                0, 0, null, false, false, false);
    }
}
