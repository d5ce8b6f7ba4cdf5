package org.medquery.models.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

public record QueryRequest(
        String question,
        @JsonAlias({"model"}) String modelHint,
        @JsonAlias({"sql_only", "sqlOnly"}) boolean planOnly,
        @JsonAlias({"edited_sql", "editedSql"}) String editedStatement
) {
}
