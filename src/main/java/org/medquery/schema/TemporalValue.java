package org.medquery.schema;

import java.time.LocalDateTime;

/**
 * Outcome of normalizing a temporal field: either a parsed timestamp or the raw input kept as-is.
 */
public sealed interface TemporalValue permits TemporalValue.Parsed, TemporalValue.Unparsed {

    Object storageValue();

    /** Text form used when the payload is serialized for later replay. */
    String replayValue();

    record Parsed(LocalDateTime value) implements TemporalValue {
        @Override
        public Object storageValue() {
            return value;
        }

        @Override
        public String replayValue() {
            return value.toString();
        }
    }

    record Unparsed(String raw) implements TemporalValue {
        @Override
        public Object storageValue() {
            return raw;
        }

        @Override
        public String replayValue() {
            return raw;
        }
    }
}
