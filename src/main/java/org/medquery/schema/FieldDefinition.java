package org.medquery.schema;

import org.medquery.models.enums.FieldType;

public record FieldDefinition(String name, FieldType type, boolean required) {

    public static FieldDefinition required(String name, FieldType type) {
        return new FieldDefinition(name, type, true);
    }

    public static FieldDefinition optional(String name, FieldType type) {
        return new FieldDefinition(name, type, false);
    }
}
