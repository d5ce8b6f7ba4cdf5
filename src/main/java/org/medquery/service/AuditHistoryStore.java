package org.medquery.service;

import org.medquery.models.entity.IngestionRequest;
import org.medquery.models.entity.QueryRecord;
import org.medquery.models.enums.RequestStatus;
import org.medquery.models.enums.TransitionOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Query history (append-only) and the ingestion request table.
 */
public interface AuditHistoryStore {

    QueryRecord append(QueryRecord record);

    /** Newest first. */
    List<QueryRecord> list(int limit);

    IngestionRequest createRequest(IngestionRequest request);

    Optional<IngestionRequest> findRequest(Long id);

    /**
     * Moves a pending request to {@code newStatus}. At most one caller can move a given request
     * out of pending.
     */
    TransitionOutcome transition(Long id, RequestStatus newStatus);

    List<IngestionRequest> listPending();
}
