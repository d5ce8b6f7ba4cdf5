package org.medquery.service.ingestion;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Turns an uploaded batch file into field/value rows.
 */
public interface RecordExtractor {

    boolean supports(String filename);

    List<Map<String, Object>> extract(InputStream content) throws IOException;
}
