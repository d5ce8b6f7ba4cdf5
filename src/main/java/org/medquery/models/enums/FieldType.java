package org.medquery.models.enums;

public enum FieldType {
    INTEGER,
    DECIMAL,
    BOOLEAN,
    TEXT,
    TIMESTAMP
}
