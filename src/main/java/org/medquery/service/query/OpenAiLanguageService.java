package org.medquery.service.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.medquery.configuration.MedQueryProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link LanguageService} backed by an OpenAI-compatible chat completions endpoint.
 */
@Slf4j
@Service
public class OpenAiLanguageService implements LanguageService {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:sql)?\\s*(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private static final String DRAFT_INSTRUCTIONS = """
            You translate clinical questions into a single read-only SQL statement.
            Use only the tables and columns listed below. Answer with the SQL statement only,
            without explanation. Never modify data. Always include LIMIT 100 unless the query
            is an aggregate returning one row.

            Tables:
            %s
            """;

    private static final String NARRATION_INSTRUCTIONS = """
            You explain query results to clinical staff in two or three plain sentences.
            Do not invent numbers that are not in the rows provided.
            """;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final MedQueryProperties properties;

    public OpenAiLanguageService(@Qualifier("languageServiceRestClient") RestClient restClient,
                                 ObjectMapper objectMapper,
                                 MedQueryProperties properties) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String draftStatement(String question, String schemaDescription, String model) {
        String content = complete(model, DRAFT_INSTRUCTIONS.formatted(schemaDescription), question);
        return stripCodeFence(content);
    }

    @Override
    public String narrate(String question, String statement, List<Map<String, Object>> sampleRows, int totalRows, String model) {
        String rows;
        try {
            rows = objectMapper.writeValueAsString(sampleRows);
        } catch (JsonProcessingException exception) {
            throw new LanguageServiceException("Unable to serialize result sample", exception);
        }
        String prompt = "Question: " + question
                + "\nSQL: " + statement
                + "\nTotal rows: " + totalRows
                + "\nSample rows: " + rows;
        return complete(model, NARRATION_INSTRUCTIONS, prompt).trim();
    }

    private String complete(String model, String system, String user) {
        String resolvedModel = StringUtils.hasText(model) ? model : properties.getLanguage().getDefaultModel();
        Map<String, Object> body = Map.of(
                "model", resolvedModel,
                "temperature", 0,
                "messages", List.of(
                        Map.of("role", "system", "content", system),
                        Map.of("role", "user", "content", user)
                )
        );

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException exception) {
            throw new LanguageServiceException("Language service call failed: " + exception.getMessage(), exception);
        }

        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual() || !StringUtils.hasText(content.asText())) {
            throw new LanguageServiceException("Language service returned no content");
        }
        log.debug("Language service answered using model {}", resolvedModel);
        return content.asText();
    }

    static String stripCodeFence(String content) {
        Matcher matcher = CODE_FENCE.matcher(content);
        String statement = matcher.find() ? matcher.group(1) : content;
        return statement.trim();
    }
}
