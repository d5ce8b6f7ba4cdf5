package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

public class InvalidFieldValueException extends MedQueryException {

    private final String field;

    public InvalidFieldValueException(String field, Object value, String expectedType) {
        super(HttpStatus.BAD_REQUEST, "INVALID_FIELD_VALUE",
                "Value '" + value + "' of field " + field + " is not a valid " + expectedType);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
