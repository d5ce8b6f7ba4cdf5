package org.medquery.service.query;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.medquery.exceptions.SafetyViolationException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StatementSafetyCheckTest {

    private final StatementSafetyCheck safetyCheck = new StatementSafetyCheck();

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT COUNT(*) FROM patients WHERE gender = 'F'",
            "  select * from admissions limit 10",
            "WITH recent AS (SELECT * FROM admissions) SELECT * FROM recent",
            "EXPLAIN SELECT * FROM labevents",
            "show tables",
            "describe patients"
    })
    void readOnlyStatementsPass(String statement) {
        assertDoesNotThrow(() -> safetyCheck.check(statement));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "DELETE FROM patients",
            "drop table admissions",
            "UPDATE patients SET gender = 'M'",
            "INSERT INTO patients (subject_id) VALUES (1)",
            "TRUNCATE labevents",
            "select_all_rows",
            "(SELECT 1)"
    })
    void otherLeadingKeywordsAreRejected(String statement) {
        assertThrows(SafetyViolationException.class, () -> safetyCheck.check(statement));
    }

    @Test
    void emptyStatementIsRejected() {
        assertThrows(SafetyViolationException.class, () -> safetyCheck.check("   "));
        assertThrows(SafetyViolationException.class, () -> safetyCheck.check(null));
    }

    @Test
    void chainedStatementsAreRejected() {
        assertThrows(SafetyViolationException.class,
                () -> safetyCheck.check("SELECT 1; DROP TABLE patients"));
    }

    @Test
    void singleTrailingSemicolonIsStripped() {
        assertEquals("SELECT * FROM patients", safetyCheck.check(" SELECT * FROM patients; "));
    }

    @Test
    void semicolonInsideLiteralIsRejected() {
        assertThrows(SafetyViolationException.class,
                () -> safetyCheck.check("SELECT * FROM prescriptions WHERE drug = 'a;b'"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT 1 -- '\n; COMMIT; DELETE FROM patients; SELECT '1'",
            "SELECT $$'$$; COMMIT; DELETE FROM patients; SELECT $$'$$",
            "SELECT E'\\''; COMMIT; DELETE FROM patients; SELECT '1'",
            "SELECT 1 /* ; */",
            "SELECT 1;;"
    })
    void separatorsHiddenBehindQuotingTricksAreRejected(String statement) {
        assertThrows(SafetyViolationException.class, () -> safetyCheck.check(statement));
    }

    @Test
    void leadingKeywordIsLowercased() {
        assertEquals("select", StatementSafetyCheck.leadingKeyword("SELECT\n*"));
        assertEquals("(select", StatementSafetyCheck.leadingKeyword("(SELECT 1)"));
    }
}
