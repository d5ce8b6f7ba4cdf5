package org.medquery.service.query;

/**
 * An unexecuted statement. Treated as untrusted whatever its origin.
 */
public record StatementDraft(String question, String statementText, Origin origin) {

    public enum Origin {
        GENERATED,
        CALLER_SUPPLIED
    }
}
