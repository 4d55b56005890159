package com.agriguard.dispute;

public enum JurorEligibility {
    NOT_REGISTERED(0),
    WAITING_PERIOD(1),
    LOW_REPUTATION(2),
    ELIGIBLE(3);

    private final int code;

    JurorEligibility(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
