package org.medquery.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A domain record ready to be written to its table. Column order follows the table definition.
 */
public record ClinicalRecord(ClinicalEntity entity, Map<String, Object> values) {

    public ClinicalRecord {
        values = Collections.unmodifiableMap(values);
    }

    public List<String> columns() {
        return new ArrayList<>(values.keySet());
    }
}
