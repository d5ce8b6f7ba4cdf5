package org.medquery.service.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonRecordExtractorTest {

    private final JsonRecordExtractor extractor = new JsonRecordExtractor(new ObjectMapper());

    @Test
    void readsArrayOfObjects() throws IOException {
        String json = "[{\"subject_id\": 10001, \"gender\": \"F\"}, {\"subject_id\": 10002}]";

        List<Map<String, Object>> rows = extractor.extract(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals(2, rows.size());
        assertEquals(10001, rows.get(0).get("subject_id"));
        assertTrue(extractor.supports("patients.json"));
    }

    @Test
    void singleObjectIsNotABatch() {
        String json = "{\"subject_id\": 10001}";

        assertThrows(IOException.class,
                () -> extractor.extract(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    }
}
