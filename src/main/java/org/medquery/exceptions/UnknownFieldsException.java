package org.medquery.exceptions;

import java.util.Collection;

public class UnknownFieldsException extends FieldSetException {

    public UnknownFieldsException(String entity, Collection<String> fields) {
        super("UNKNOWN_FIELDS", "Unknown columns", entity, fields);
    }
}
