package com.agriguard.policy;

/**
 * Result of {@link PolicyEngine#validatePolicyTiming(long)}. The numeric codes
 * match the ones reported to the oracle collaborator.
 */
public enum PolicyTiming {
    NOT_FOUND(0),
    ACTIVE(1),
    SETTLED(2),
    NOT_STARTED(3),
    EXPIRED(4);

    private final int code;

    PolicyTiming(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
