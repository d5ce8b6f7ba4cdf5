package org.medquery.models.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RequestStatus {
    PENDING,
    APPROVED,
    REJECTED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
