package org.medquery.service.ingestion;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a JSON array of flat objects.
 */
@Component
@RequiredArgsConstructor
public class JsonRecordExtractor implements RecordExtractor {

    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Override
    public boolean supports(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".json");
    }

    @Override
    public List<Map<String, Object>> extract(InputStream content) throws IOException {
        return objectMapper.readValue(content, ROWS);
    }
}
