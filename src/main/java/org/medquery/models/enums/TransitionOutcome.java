package org.medquery.models.enums;

public enum TransitionOutcome {
    OK,
    NOT_FOUND,
    ALREADY_RESOLVED
}
