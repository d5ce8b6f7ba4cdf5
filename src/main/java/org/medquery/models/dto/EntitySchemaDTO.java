package org.medquery.models.dto;

import org.medquery.schema.SchemaDefinition;

import java.util.List;
import java.util.Locale;

public record EntitySchemaDTO(String name, List<ColumnDTO> columns) {

    public record ColumnDTO(String name, String type, boolean required) {
    }

    public static EntitySchemaDTO from(SchemaDefinition definition) {
        List<ColumnDTO> columns = definition.fields().stream()
                .map(field -> new ColumnDTO(field.name(), field.type().name().toLowerCase(Locale.ROOT), field.required()))
                .toList();
        return new EntitySchemaDTO(definition.entityName(), columns);
    }
}
