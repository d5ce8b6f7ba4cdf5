package org.medquery.service.query;

import java.util.List;
import java.util.Map;

public record QueryResult(List<Map<String, Object>> rows, boolean truncated) {

    public int rowCount() {
        return rows.size();
    }
}
