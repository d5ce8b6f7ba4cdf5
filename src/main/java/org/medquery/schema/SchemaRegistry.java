package org.medquery.schema;

import org.medquery.exceptions.MissingRequiredFieldsException;
import org.medquery.exceptions.UnknownEntityException;
import org.medquery.exceptions.UnknownFieldsException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only lookup over the clinical table definitions.
 */
@Component
public class SchemaRegistry {

    public ClinicalEntity entityFor(String entityName) {
        return ClinicalEntity.fromTableName(entityName)
                .orElseThrow(() -> new UnknownEntityException("Invalid table name: " + entityName));
    }

    public SchemaDefinition definitionFor(String entityName) {
        return entityFor(entityName).schema();
    }

    /**
     * Rejects any field the table does not define. Missing optional fields are fine.
     */
    public void validateFields(String entityName, Collection<String> fieldNames) {
        SchemaDefinition definition = definitionFor(entityName);
        Set<String> unknown = definition.unknownFields(fieldNames);
        if (!unknown.isEmpty()) {
            throw new UnknownFieldsException(entityName, unknown);
        }
    }

    /**
     * A required field counts as missing when it is absent or null.
     */
    public void validateRequired(String entityName, Map<String, Object> values) {
        SchemaDefinition definition = definitionFor(entityName);
        Set<String> missing = new LinkedHashSet<>();
        for (String required : definition.requiredFieldNames()) {
            if (values.get(required) == null) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldsException(entityName, missing);
        }
    }

    public List<SchemaDefinition> definitions() {
        return Arrays.stream(ClinicalEntity.values())
                .map(ClinicalEntity::schema)
                .toList();
    }

    public String describe() {
        return definitions().stream()
                .map(SchemaDefinition::describe)
                .collect(Collectors.joining("\n"));
    }
}
