package com.agriguard.error;

/**
 * Machine-readable reason codes, each bound to exactly one {@link ErrorKind}.
 */
public enum ErrorCode {
    INVALID_INPUT(ErrorKind.VALIDATION),

    NOT_ADMIN(ErrorKind.AUTHORIZATION),
    NOT_ORACLE(ErrorKind.AUTHORIZATION),
    NOT_OWNER(ErrorKind.AUTHORIZATION),
    NOT_A_JUROR(ErrorKind.AUTHORIZATION),
    NOT_ASSIGNED(ErrorKind.AUTHORIZATION),
    INSURANCE_NOT_LINKED(ErrorKind.AUTHORIZATION),

    POLICY_NOT_FOUND(ErrorKind.STATE),
    ALREADY_SETTLED(ErrorKind.STATE),
    NOT_SETTLED(ErrorKind.STATE),
    NOT_STARTED(ErrorKind.STATE),
    COVERAGE_EXPIRED(ErrorKind.STATE),
    DISPUTE_WINDOW_CLOSED(ErrorKind.STATE),
    DISPUTE_LINK_MISSING(ErrorKind.STATE),
    ALREADY_REGISTERED(ErrorKind.STATE),
    NOT_READY(ErrorKind.STATE),
    DISPUTE_NOT_FOUND(ErrorKind.STATE),
    VOTING_EXPIRED(ErrorKind.STATE),
    ALREADY_RESOLVED(ErrorKind.STATE),
    NOT_RESOLVED(ErrorKind.STATE),
    ALREADY_VOTED(ErrorKind.STATE),
    TOO_SOON(ErrorKind.STATE),
    SETTLEMENT_NOT_FOUND(ErrorKind.STATE),

    INSUFFICIENT_FUNDS(ErrorKind.RESOURCE);

    private final ErrorKind kind;

    ErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isNotFound() {
        return this == POLICY_NOT_FOUND || this == DISPUTE_NOT_FOUND || this == SETTLEMENT_NOT_FOUND;
    }
}
