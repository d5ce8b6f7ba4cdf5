package org.medquery.schema;

import org.medquery.exceptions.InvalidFieldValueException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Set;

final class FieldCoercion {

    private static final Set<String> TRUE_LITERALS = Set.of("true", "t", "1", "yes", "y");
    private static final Set<String> FALSE_LITERALS = Set.of("false", "f", "0", "no", "n");

    private FieldCoercion() {
    }

    static Object coerce(FieldDefinition field, Object value) {
        if (value == null) {
            return null;
        }
        return switch (field.type()) {
            case INTEGER -> toLong(field, value);
            case DECIMAL -> toDecimal(field, value);
            case BOOLEAN -> toBoolean(field, value);
            case TEXT -> value.toString();
            case TIMESTAMP -> toTimestamp(value);
        };
    }

    private static Long toLong(FieldDefinition field, Object value) {
        try {
            if (value instanceof Number number) {
                return new BigDecimal(number.toString()).longValueExact();
            }
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException | ArithmeticException exception) {
            throw new InvalidFieldValueException(field.name(), value, "integer");
        }
    }

    private static BigDecimal toDecimal(FieldDefinition field, Object value) {
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException exception) {
            throw new InvalidFieldValueException(field.name(), value, "decimal");
        }
    }

    private static Boolean toBoolean(FieldDefinition field, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String literal = value.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_LITERALS.contains(literal)) {
            return Boolean.TRUE;
        }
        if (FALSE_LITERALS.contains(literal)) {
            return Boolean.FALSE;
        }
        throw new InvalidFieldValueException(field.name(), value, "boolean");
    }

    // Unparsed temporal values go to the store as their raw text.
    private static Object toTimestamp(Object value) {
        if (value instanceof TemporalValue temporal) {
            return temporal.storageValue();
        }
        if (value instanceof LocalDateTime) {
            return value;
        }
        return value.toString();
    }
}
