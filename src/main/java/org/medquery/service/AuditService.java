package org.medquery.service;

import lombok.RequiredArgsConstructor;
import org.medquery.models.dto.AuditSummaryDTO;
import org.medquery.models.dto.QueryHistoryItemDTO;
import org.medquery.repository.QueryRecordRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AuditService {

    private static final int TOP_QUESTIONS = 5;

    private final AuditHistoryStore auditHistoryStore;
    private final QueryRecordRepository queryRecordRepository;

    public List<QueryHistoryItemDTO> recentQueries(int limit) {
        return auditHistoryStore.list(limit).stream()
                .map(QueryHistoryItemDTO::from)
                .toList();
    }

    public AuditSummaryDTO summary() {
        long total = queryRecordRepository.count();
        Double average = queryRecordRepository.averageExecutionTimeMs();
        Long rows = queryRecordRepository.totalRowsRetrieved();
        List<AuditSummaryDTO.QuestionCount> top = queryRecordRepository.topQuestions(PageRequest.of(0, TOP_QUESTIONS))
                .stream()
                .map(row -> new AuditSummaryDTO.QuestionCount((String) row[0], ((Number) row[1]).longValue()))
                .toList();
        double roundedAverage = average == null ? 0.0 : Math.round(average * 100.0) / 100.0;
        return new AuditSummaryDTO(total, roundedAverage, rows == null ? 0 : rows, top);
    }
}
