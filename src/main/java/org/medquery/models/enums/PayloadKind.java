package org.medquery.models.enums;

public enum PayloadKind {
    SINGLE,
    BATCH
}
