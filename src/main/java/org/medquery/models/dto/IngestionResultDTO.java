package org.medquery.models.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionResultDTO(
        String status,
        String table,
        int rowsProcessed,
        String filename,
        String message
) {
}
