package org.medquery.models.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.Map;

public record SingleRecordRequest(
        @JsonAlias({"table_name", "tableName"}) String targetEntity,
        @JsonAlias({"data"}) Map<String, Object> fields
) {
}
