package com.agriguard.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Which side of the threshold triggers a payout.
 */
public enum PolicyDirection {
    TRIGGER_BELOW_THRESHOLD("trigger_below_threshold", 1),
    TRIGGER_ABOVE_THRESHOLD("trigger_above_threshold", 0);

    private final String value;
    private final int code;

    PolicyDirection(String value, int code) {
        this.value = value;
        this.code = code;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Numeric form used by the oracle collaborator: 1 below, 0 above. */
    public int getCode() {
        return code;
    }

    @JsonCreator
    public static PolicyDirection fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || String.valueOf(v.code).equals(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown policy direction: " + raw));
    }
}
