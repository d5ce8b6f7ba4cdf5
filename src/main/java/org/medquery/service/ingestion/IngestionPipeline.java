package org.medquery.service.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.medquery.exceptions.AlreadyResolvedException;
import org.medquery.exceptions.IntegrationFailureException;
import org.medquery.exceptions.RequestNotFoundException;
import org.medquery.exceptions.UnsupportedFileFormatException;
import org.medquery.models.dto.IngestionRequestDTO;
import org.medquery.models.dto.IngestionResultDTO;
import org.medquery.models.entity.IngestionRequest;
import org.medquery.models.enums.PayloadKind;
import org.medquery.models.enums.RequestStatus;
import org.medquery.models.enums.TransitionOutcome;
import org.medquery.schema.ClinicalRecord;
import org.medquery.security.Principal;
import org.medquery.service.AuditHistoryStore;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Write path. Direct ingestion integrates records immediately; request ingestion quarantines the
 * normalized payload until a reviewer approves or rejects it.
 */
@Slf4j
@Service
public class IngestionPipeline {

    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {
    };

    private final PayloadNormalizer payloadNormalizer;
    private final ClinicalRecordWriter recordWriter;
    private final AuditHistoryStore auditHistoryStore;
    private final List<RecordExtractor> extractors;
    private final ObjectMapper objectMapper;

    public IngestionPipeline(PayloadNormalizer payloadNormalizer,
                             ClinicalRecordWriter recordWriter,
                             AuditHistoryStore auditHistoryStore,
                             List<RecordExtractor> extractors,
                             ObjectMapper objectMapper) {
        this.payloadNormalizer = payloadNormalizer;
        this.recordWriter = recordWriter;
        this.auditHistoryStore = auditHistoryStore;
        this.extractors = extractors;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public IngestionResultDTO ingestDirect(Principal principal, String entityName, Map<String, Object> fields) {
        NormalizedPayload payload = payloadNormalizer.normalize(entityName, List.of(requireFields(fields)));
        int written = recordWriter.insert(payload.toRecords());
        log.info("{} integrated a record into {}", principal.subject(), payload.entity().tableName());
        return new IngestionResultDTO("success", payload.entity().tableName(), written, null, "Record inserted successfully");
    }

    @Transactional
    public IngestionResultDTO ingestDirectBatch(Principal principal, String entityName, String filename, InputStream content) {
        NormalizedPayload payload = payloadNormalizer.normalize(entityName, extract(filename, content));
        int written = recordWriter.insert(payload.toRecords());
        log.info("{} integrated {} rows from {} into {}", principal.subject(), written, filename, payload.entity().tableName());
        return new IngestionResultDTO("success", payload.entity().tableName(), written, filename, null);
    }

    public IngestionRequestDTO requestSingle(Principal principal, String entityName, Map<String, Object> fields) {
        NormalizedPayload payload = payloadNormalizer.normalize(entityName, List.of(requireFields(fields)));
        return quarantine(principal, payload, PayloadKind.SINGLE, null);
    }

    public IngestionRequestDTO requestBatch(Principal principal, String entityName, String filename, InputStream content) {
        NormalizedPayload payload = payloadNormalizer.normalize(entityName, extract(filename, content));
        return quarantine(principal, payload, PayloadKind.BATCH, filename);
    }

    /**
     * Replays a pending request against the current schema and integrates it. The status change
     * and the inserted records commit together, so a failed insert leaves the request pending and
     * a concurrent second approval finds it already resolved.
     */
    @Transactional
    public IngestionRequestDTO approve(Long requestId, Principal reviewer) {
        IngestionRequest request = requirePending(requestId);

        NormalizedPayload payload = payloadNormalizer.normalize(request.getTableName(), deserialize(request));
        List<ClinicalRecord> records = payload.toRecords();

        resolve(requestId, RequestStatus.APPROVED);
        int written = recordWriter.insert(records);

        log.info("{} approved request {} integrating {} rows into {}", reviewer.subject(), requestId, written,
                payload.entity().tableName());
        return toDto(reloaded(requestId), false);
    }

    @Transactional
    public IngestionRequestDTO reject(Long requestId, Principal reviewer) {
        resolve(requestId, RequestStatus.REJECTED);
        log.info("{} rejected request {}", reviewer.subject(), requestId);
        return toDto(reloaded(requestId), false);
    }

    public List<IngestionRequestDTO> listPending() {
        return auditHistoryStore.listPending().stream()
                .map(request -> toDto(request, true))
                .toList();
    }

    // Values are type-checked on submission as well as on approval.
    private IngestionRequestDTO quarantine(Principal principal, NormalizedPayload payload, PayloadKind kind, String filename) {
        payload.toRecords();

        IngestionRequest request = new IngestionRequest();
        request.setRequestedBy(principal.subject());
        request.setRequesterRole(principal.role());
        request.setTableName(payload.entity().tableName());
        request.setPayloadKind(kind);
        request.setFileName(filename);
        request.setRowCount(payload.rows().size());
        request.setPayload(serialize(payload));

        IngestionRequest saved;
        try {
            saved = auditHistoryStore.createRequest(request);
        } catch (DataAccessException exception) {
            log.error("Failed to store ingestion request for {}", payload.entity().tableName(), exception);
            throw new IntegrationFailureException("Could not store ingestion request", exception);
        }
        log.info("{} submitted request {} for {} ({} rows)", principal.subject(), saved.getId(),
                saved.getTableName(), saved.getRowCount());
        return toDto(saved, false);
    }

    private IngestionRequest requirePending(Long requestId) {
        IngestionRequest request = auditHistoryStore.findRequest(requestId)
                .orElseThrow(() -> new RequestNotFoundException("Request not found: " + requestId));
        if (request.getStatus() != RequestStatus.PENDING) {
            throw new AlreadyResolvedException("Request " + requestId + " is already " + request.getStatus().wireValue());
        }
        return request;
    }

    private void resolve(Long requestId, RequestStatus status) {
        TransitionOutcome outcome = auditHistoryStore.transition(requestId, status);
        switch (outcome) {
            case OK -> {
            }
            case NOT_FOUND -> throw new RequestNotFoundException("Request not found: " + requestId);
            case ALREADY_RESOLVED -> throw new AlreadyResolvedException("Request " + requestId + " is already resolved");
        }
    }

    private IngestionRequest reloaded(Long requestId) {
        return auditHistoryStore.findRequest(requestId)
                .orElseThrow(() -> new RequestNotFoundException("Request not found: " + requestId));
    }

    private List<Map<String, Object>> extract(String filename, InputStream content) {
        RecordExtractor extractor = extractors.stream()
                .filter(candidate -> candidate.supports(filename))
                .findFirst()
                .orElseThrow(() -> new UnsupportedFileFormatException("Unsupported file format: " + filename));
        try {
            return extractor.extract(content);
        } catch (IOException | IllegalArgumentException | IllegalStateException exception) {
            throw new UnsupportedFileFormatException("Error reading file: " + exception.getMessage(), exception);
        }
    }

    private Map<String, Object> requireFields(Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Record data is required");
        }
        return fields;
    }

    private String serialize(NormalizedPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload.replayRows());
        } catch (JsonProcessingException exception) {
            throw new IllegalArgumentException("Record data cannot be serialized: " + exception.getOriginalMessage(), exception);
        }
    }

    private List<Map<String, Object>> deserialize(IngestionRequest request) {
        try {
            return objectMapper.readValue(request.getPayload(), ROWS);
        } catch (JsonProcessingException exception) {
            throw new IntegrationFailureException("Stored payload of request " + request.getId() + " is unreadable", exception);
        }
    }

    private IngestionRequestDTO toDto(IngestionRequest request, boolean includeRows) {
        List<Map<String, Object>> rows = includeRows ? deserialize(request) : null;
        return new IngestionRequestDTO(
                request.getId(),
                request.getTableName(),
                request.getPayloadKind(),
                request.getFileName(),
                request.getRowCount(),
                request.getStatus(),
                request.getRequestedBy(),
                request.getCreatedAt(),
                request.getResolvedAt(),
                rows
        );
    }
}
