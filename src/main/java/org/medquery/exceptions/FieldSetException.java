package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Validation failure that names a set of offending fields. The names are kept sorted so that
 * responses are stable for the same input.
 */
public abstract class FieldSetException extends MedQueryException {

    private final List<String> fields;

    protected FieldSetException(String code, String label, String entity, Collection<String> fields) {
        this(code, label, entity, List.copyOf(new TreeSet<>(fields)));
    }

    private FieldSetException(String code, String label, String entity, List<String> sorted) {
        super(HttpStatus.BAD_REQUEST, code, label + " for " + entity + ": " + String.join(", ", sorted));
        this.fields = sorted;
    }

    public List<String> getFields() {
        return fields;
    }
}
