package org.medquery.models.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueryStatus {
    PENDING_REVIEW("pending_review"),
    SUCCESS("success");

    private final String wireValue;

    QueryStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
