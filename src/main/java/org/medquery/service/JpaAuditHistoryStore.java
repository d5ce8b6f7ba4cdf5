package org.medquery.service;

import lombok.RequiredArgsConstructor;
import org.medquery.models.entity.IngestionRequest;
import org.medquery.models.entity.QueryRecord;
import org.medquery.models.enums.RequestStatus;
import org.medquery.models.enums.TransitionOutcome;
import org.medquery.repository.IngestionRequestRepository;
import org.medquery.repository.QueryRecordRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaAuditHistoryStore implements AuditHistoryStore {

    private final QueryRecordRepository queryRecordRepository;
    private final IngestionRequestRepository ingestionRequestRepository;

    @Override
    public QueryRecord append(QueryRecord record) {
        if (record.getId() != null) {
            throw new IllegalArgumentException("Query records are append-only");
        }
        if (record.getTimestamp() == null) {
            record.setTimestamp(Instant.now());
        }
        return queryRecordRepository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueryRecord> list(int limit) {
        return queryRecordRepository.findAllByOrderByTimestampDescIdDesc(PageRequest.of(0, Math.max(limit, 1)));
    }

    @Override
    public IngestionRequest createRequest(IngestionRequest request) {
        request.setStatus(RequestStatus.PENDING);
        if (request.getCreatedAt() == null) {
            request.setCreatedAt(Instant.now());
        }
        return ingestionRequestRepository.save(request);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<IngestionRequest> findRequest(Long id) {
        return ingestionRequestRepository.findById(id);
    }

    @Override
    @Transactional
    public TransitionOutcome transition(Long id, RequestStatus newStatus) {
        if (newStatus == RequestStatus.PENDING) {
            throw new IllegalArgumentException("A request cannot transition back to pending");
        }
        int updated = ingestionRequestRepository.compareAndSetStatus(id, RequestStatus.PENDING, newStatus, Instant.now());
        if (updated == 1) {
            return TransitionOutcome.OK;
        }
        return ingestionRequestRepository.existsById(id) ? TransitionOutcome.ALREADY_RESOLVED : TransitionOutcome.NOT_FOUND;
    }

    @Override
    @Transactional(readOnly = true)
    public List<IngestionRequest> listPending() {
        return ingestionRequestRepository.findByStatusOrderByCreatedAtAsc(RequestStatus.PENDING);
    }
}
