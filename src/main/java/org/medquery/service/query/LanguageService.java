package org.medquery.service.query;

import java.util.List;
import java.util.Map;

/**
 * External text generation used to draft statements and narrate results.
 * Implementations throw {@link LanguageServiceException} on any failure, including timeouts.
 */
public interface LanguageService {

    String draftStatement(String question, String schemaDescription, String model);

    String narrate(String question, String statement, List<Map<String, Object>> sampleRows, int totalRows, String model);
}
