package org.medquery.models.dto;

import java.util.List;
import java.util.Map;

public record TablePageDTO(
        String table,
        List<Map<String, Object>> data,
        long totalRows,
        int page,
        int limit,
        List<String> columns
) {
}
