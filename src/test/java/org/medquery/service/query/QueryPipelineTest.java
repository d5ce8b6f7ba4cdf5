package org.medquery.service.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.medquery.configuration.MedQueryProperties;
import org.medquery.exceptions.ExecutionFailureException;
import org.medquery.exceptions.GenerationFailureException;
import org.medquery.exceptions.SafetyViolationException;
import org.medquery.models.dto.QueryRequest;
import org.medquery.models.dto.QueryResponse;
import org.medquery.models.entity.QueryRecord;
import org.medquery.models.enums.QueryStatus;
import org.medquery.models.enums.Role;
import org.medquery.schema.SchemaRegistry;
import org.medquery.security.Principal;
import org.medquery.support.FakeLanguageService;
import org.medquery.support.InMemoryAuditHistoryStore;
import org.medquery.support.RecordingStatementExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryPipelineTest {

    private static final Principal DOCTOR = new Principal("doctor", Role.DOCTOR);
    private static final String FEMALE_COUNT = "SELECT COUNT(*) AS count FROM patients WHERE gender = 'F'";

    private FakeLanguageService languageService;
    private RecordingStatementExecutor executor;
    private InMemoryAuditHistoryStore store;
    private MedQueryProperties properties;

    @BeforeEach
    void setUp() {
        languageService = new FakeLanguageService();
        executor = new RecordingStatementExecutor();
        store = new InMemoryAuditHistoryStore();
        properties = new MedQueryProperties();
    }

    private QueryPipeline pipeline() {
        return new QueryPipeline(languageService, executor, new StatementSafetyCheck(), store, new SchemaRegistry(), properties);
    }

    @Test
    void answersQuestionAndRecordsIt() {
        languageService.drafting(FEMALE_COUNT).narrating("There are 4 female patients.");
        executor.returning(List.of(Map.of("count", 4)));

        QueryResponse response = pipeline().run(DOCTOR, new QueryRequest("How many female patients?", null, false, null));

        assertEquals(QueryStatus.SUCCESS, response.status());
        assertEquals(FEMALE_COUNT, response.statement());
        assertEquals("There are 4 female patients.", response.narration());
        assertEquals(1, response.rowCount());
        assertEquals(List.of(Map.of("count", 4)), response.rows());
        assertTrue(response.auditRecorded());
        assertFalse(response.narrationFailed());

        assertEquals(1, store.queries().size());
        QueryRecord record = store.queries().get(0);
        assertEquals(String.valueOf(record.getId()), response.id());
        assertEquals("doctor", record.getSubject());
        assertEquals(Role.DOCTOR, record.getRole());
        assertEquals("How many female patients?", record.getQuestion());
        assertEquals(FEMALE_COUNT, record.getStatement());
        assertEquals(1, record.getRowCount());
    }

    @Test
    void destructiveDraftIsNeverExecutedOrRecorded() {
        languageService.drafting("DELETE FROM patients");

        assertThrows(SafetyViolationException.class,
                () -> pipeline().run(DOCTOR, new QueryRequest("Remove all patients", null, false, null)));

        assertTrue(executor.executed().isEmpty());
        assertTrue(store.queries().isEmpty());
    }

    @Test
    void editedDeleteIsRejectedEvenInPlanOnlyMode() {
        assertThrows(SafetyViolationException.class,
                () -> pipeline().run(DOCTOR, new QueryRequest(null, null, false, "DELETE FROM patients")));
        assertThrows(SafetyViolationException.class,
                () -> pipeline().run(DOCTOR, new QueryRequest(null, null, true, "DELETE FROM patients")));

        assertEquals(0, languageService.draftCalls());
        assertTrue(executor.executed().isEmpty());
        assertTrue(store.queries().isEmpty());
    }

    @Test
    void callerEditedStatementIsCheckedToo() {
        assertThrows(SafetyViolationException.class,
                () -> pipeline().run(DOCTOR, new QueryRequest("q", null, false, "SELECT 1; DROP TABLE patients")));

        assertEquals(0, languageService.draftCalls());
        assertTrue(executor.executed().isEmpty());
    }

    @Test
    void planOnlyReturnsDraftWithoutExecuting() {
        languageService.drafting(FEMALE_COUNT);

        QueryResponse response = pipeline().run(DOCTOR, new QueryRequest("How many female patients?", null, true, null));

        assertEquals(QueryStatus.PENDING_REVIEW, response.status());
        assertEquals(FEMALE_COUNT, response.statement());
        assertNull(response.id());
        assertNull(response.rows());
        assertTrue(executor.executed().isEmpty());
        assertTrue(store.queries().isEmpty());
    }

    @Test
    void editedStatementSkipsDraftingAndRuns() {
        executor.returning(List.of(Map.of("count", 4)));

        QueryResponse response = pipeline().run(DOCTOR,
                new QueryRequest("How many female patients?", null, true, FEMALE_COUNT + ";"));

        assertEquals(QueryStatus.SUCCESS, response.status());
        assertEquals(0, languageService.draftCalls());
        assertEquals(List.of(FEMALE_COUNT), executor.executed());
    }

    @Test
    void narrationFailureStillReturnsRows() {
        languageService.drafting(FEMALE_COUNT).failingNarration();
        executor.returning(List.of(Map.of("count", 4)));

        QueryResponse response = pipeline().run(DOCTOR, new QueryRequest("How many female patients?", null, false, null));

        assertEquals(QueryStatus.SUCCESS, response.status());
        assertTrue(response.narrationFailed());
        assertEquals("", response.narration());
        assertEquals(1, response.rowCount());
        assertEquals(1, store.queries().size());
    }

    @Test
    void auditFailureYieldsLocalId() {
        store.failingAppends();
        languageService.drafting(FEMALE_COUNT);
        executor.returning(List.of(Map.of("count", 4)));

        QueryResponse response = pipeline().run(DOCTOR, new QueryRequest("How many female patients?", null, false, null));

        assertEquals(QueryStatus.SUCCESS, response.status());
        assertFalse(response.auditRecorded());
        assertTrue(response.id().startsWith(QueryPipeline.LOCAL_ID_PREFIX));
    }

    @Test
    void draftingFailureIsGenerationFailure() {
        languageService.failingDraft();

        assertThrows(GenerationFailureException.class,
                () -> pipeline().run(DOCTOR, new QueryRequest("How many female patients?", null, false, null)));
        assertTrue(executor.executed().isEmpty());
    }

    @Test
    void executionFailurePropagatesWithoutRecord() {
        languageService.drafting("SELECT * FROM missing_table");
        executor.failingWith(new ExecutionFailureException("SELECT * FROM missing_table", "relation does not exist", null));

        assertThrows(ExecutionFailureException.class,
                () -> pipeline().run(DOCTOR, new QueryRequest("Show the missing table", null, false, null)));
        assertTrue(store.queries().isEmpty());
    }

    @Test
    void rowsAreCappedAndNarrationSampleIsLimited() {
        properties.getQuery().setMaxRows(5);
        properties.getQuery().setNarrationSampleRows(2);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            rows.add(Map.of("subject_id", i));
        }
        languageService.drafting("SELECT subject_id FROM patients");
        executor.returning(rows);

        QueryResponse response = pipeline().run(DOCTOR, new QueryRequest("List patients", null, false, null));

        assertEquals(List.of(5), executor.caps());
        assertEquals(5, response.rowCount());
        assertTrue(response.truncated());
        assertEquals(2, languageService.narratedSamples().get(0).size());
    }

    @Test
    void blankRequestIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> pipeline().run(DOCTOR, new QueryRequest("  ", null, false, null)));
        assertThrows(IllegalArgumentException.class, () -> pipeline().run(DOCTOR, null));
    }
}
