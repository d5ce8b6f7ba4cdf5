package org.medquery.service.query;

import lombok.extern.slf4j.Slf4j;
import org.medquery.configuration.MedQueryProperties;
import org.medquery.exceptions.GenerationFailureException;
import org.medquery.models.dto.QueryRequest;
import org.medquery.models.dto.QueryResponse;
import org.medquery.models.entity.QueryRecord;
import org.medquery.models.enums.QueryStatus;
import org.medquery.schema.SchemaRegistry;
import org.medquery.security.Principal;
import org.medquery.service.AuditHistoryStore;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Read path: draft, review split, safety check, execute, narrate, audit. Stages run strictly in
 * that order and a failed stage stops the ones after it, except narration and audit which only
 * degrade the response.
 */
@Slf4j
@Service
public class QueryPipeline {

    static final String LOCAL_ID_PREFIX = "local-";

    private final LanguageService languageService;
    private final StatementExecutor statementExecutor;
    private final StatementSafetyCheck safetyCheck;
    private final AuditHistoryStore auditHistoryStore;
    private final SchemaRegistry schemaRegistry;
    private final MedQueryProperties.Query limits;

    public QueryPipeline(LanguageService languageService,
                         StatementExecutor statementExecutor,
                         StatementSafetyCheck safetyCheck,
                         AuditHistoryStore auditHistoryStore,
                         SchemaRegistry schemaRegistry,
                         MedQueryProperties properties) {
        this.languageService = languageService;
        this.statementExecutor = statementExecutor;
        this.safetyCheck = safetyCheck;
        this.auditHistoryStore = auditHistoryStore;
        this.schemaRegistry = schemaRegistry;
        this.limits = properties.getQuery();
    }

    public QueryResponse run(Principal principal, QueryRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Query request body is required");
        }
        boolean callerSupplied = StringUtils.hasText(request.editedStatement());
        if (!callerSupplied && !StringUtils.hasText(request.question())) {
            throw new IllegalArgumentException("A question or an edited statement is required");
        }

        StatementDraft draft = draft(request, callerSupplied);

        if (request.planOnly() && !callerSupplied) {
            log.info("Returning drafted statement for review to {}", principal.subject());
            return QueryResponse.pendingReview(request.question(), draft.statementText());
        }

        String statement = safetyCheck.check(draft.statementText());

        long started = System.nanoTime();
        QueryResult result = statementExecutor.execute(statement, limits.getMaxRows());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        log.info("Executed {} statement in {} ms returning {} rows", draft.origin(), elapsedMs, result.rowCount());

        Narration narration = narrate(request, statement, result);

        QueryRecord record = new QueryRecord();
        record.setSubject(principal.subject());
        record.setRole(principal.role());
        record.setQuestion(request.question());
        record.setStatement(statement);
        record.setNarration(narration.text());
        record.setExecutionTimeMs(elapsedMs);
        record.setRowCount(result.rowCount());
        record.setTimestamp(Instant.now());
        AuditOutcome audit = audit(record);

        return new QueryResponse(
                audit.id(),
                request.question(),
                narration.text(),
                statement,
                record.getTimestamp(),
                QueryStatus.SUCCESS,
                elapsedMs,
                result.rowCount(),
                result.rows(),
                result.truncated(),
                narration.failed(),
                audit.recorded()
        );
    }

    private StatementDraft draft(QueryRequest request, boolean callerSupplied) {
        if (callerSupplied) {
            return new StatementDraft(request.question(), request.editedStatement(), StatementDraft.Origin.CALLER_SUPPLIED);
        }
        try {
            String text = languageService.draftStatement(request.question(), schemaRegistry.describe(), request.modelHint());
            log.info("Drafted statement for question");
            return new StatementDraft(request.question(), text, StatementDraft.Origin.GENERATED);
        } catch (LanguageServiceException exception) {
            log.error("Statement drafting failed: {}", exception.getMessage());
            throw new GenerationFailureException("Could not draft a statement: " + exception.getMessage(), exception);
        }
    }

    private Narration narrate(QueryRequest request, String statement, QueryResult result) {
        List<Map<String, Object>> sample = result.rows().subList(0, Math.min(result.rowCount(), limits.getNarrationSampleRows()));
        String question = StringUtils.hasText(request.question()) ? request.question() : statement;
        try {
            String text = languageService.narrate(question, statement, sample, result.rowCount(), request.modelHint());
            return new Narration(text, false);
        } catch (LanguageServiceException exception) {
            log.warn("Narration failed, returning rows without explanation: {}", exception.getMessage());
            return new Narration("", true);
        }
    }

    // Audit is written in its own transaction and never turns a successful query into an error.
    private AuditOutcome audit(QueryRecord record) {
        try {
            QueryRecord saved = auditHistoryStore.append(record);
            return new AuditOutcome(String.valueOf(saved.getId()), true);
        } catch (RuntimeException exception) {
            String localId = LOCAL_ID_PREFIX + UUID.randomUUID();
            log.error("Failed to persist query record, responding with {}", localId, exception);
            return new AuditOutcome(localId, false);
        }
    }

    private record Narration(String text, boolean failed) {
    }

    private record AuditOutcome(String id, boolean recorded) {
    }
}
