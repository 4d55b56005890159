package com.agriguard.policy;

public enum SettlementStatus {
    UNSETTLED,
    SETTLED
}
