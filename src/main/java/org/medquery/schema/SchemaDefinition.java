package org.medquery.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural definition of one clinical table. Field order is the declaration order.
 */
public final class SchemaDefinition {

    private final String entityName;
    private final Map<String, FieldDefinition> fields;

    public SchemaDefinition(String entityName, List<FieldDefinition> fields) {
        this.entityName = entityName;
        Map<String, FieldDefinition> ordered = new LinkedHashMap<>();
        for (FieldDefinition field : fields) {
            ordered.put(field.name(), field);
        }
        this.fields = Collections.unmodifiableMap(ordered);
    }

    public String entityName() {
        return entityName;
    }

    public List<FieldDefinition> fields() {
        return List.copyOf(fields.values());
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Optional<FieldDefinition> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Set<String> requiredFieldNames() {
        return fields.values().stream()
                .filter(FieldDefinition::required)
                .map(FieldDefinition::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> unknownFields(Collection<String> candidates) {
        Set<String> unknown = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (!fields.containsKey(candidate)) {
                unknown.add(candidate);
            }
        }
        return unknown;
    }

    public String describe() {
        String columns = fields.values().stream()
                .map(field -> field.name() + " " + field.type().name().toLowerCase(Locale.ROOT)
                        + (field.required() ? " required" : ""))
                .collect(Collectors.joining(", "));
        return entityName + "(" + columns + ")";
    }
}
