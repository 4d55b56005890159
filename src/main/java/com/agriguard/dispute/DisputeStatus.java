package com.agriguard.dispute;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Dispute lifecycle. ACTIVE is the only state that accepts votes; EXPIRED and
 * PROCESSED are terminal.
 */
public enum DisputeStatus {
    ACTIVE(0),
    APPROVED(1),
    REJECTED(2),
    EXPIRED(3),
    PROCESSED(4);

    private final int code;

    DisputeStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isResolved() {
        return this == APPROVED || this == REJECTED;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
