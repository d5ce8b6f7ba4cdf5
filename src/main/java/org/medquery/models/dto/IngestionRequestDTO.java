package org.medquery.models.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.medquery.models.enums.PayloadKind;
import org.medquery.models.enums.RequestStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionRequestDTO(
        Long id,
        String tableName,
        PayloadKind payloadKind,
        String fileName,
        Integer rowCount,
        RequestStatus status,
        String requestedBy,
        Instant createdAt,
        Instant resolvedAt,
        List<Map<String, Object>> rows
) {
}
