package org.medquery.exceptions;

import java.util.Collection;

public class MissingRequiredFieldsException extends FieldSetException {

    public MissingRequiredFieldsException(String entity, Collection<String> fields) {
        super("MISSING_REQUIRED_FIELDS", "Missing required columns", entity, fields);
    }
}
