package com.agriguard.ledger;

/**
 * Monotonic round counter supplied by the execution substrate. It is the only
 * notion of time the engines use; wall-clock time never enters a decision.
 */
public interface LogicalClock {

    long currentRound();
}
