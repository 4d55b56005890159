package com.agriguard.ledger;

import com.agriguard.error.ValidationException;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Logical clock advanced explicitly, either by the hosting substrate or by tests.
 * The round never moves backwards.
 */
public class ManualLogicalClock implements LogicalClock {

    private final AtomicLong round;

    public ManualLogicalClock(long initialRound) {
        if (initialRound < 0) {
            throw new ValidationException("initial round must be >= 0");
        }
        this.round = new AtomicLong(initialRound);
    }

    @Override
    public long currentRound() {
        return round.get();
    }

    public long advance(long rounds) {
        if (rounds < 0) {
            throw new ValidationException("rounds must be >= 0");
        }
        return round.addAndGet(rounds);
    }

    public long advanceTo(long target) {
        return round.updateAndGet(current -> {
            if (target < current) {
                throw new ValidationException("clock cannot move back from " + current + " to " + target);
            }
            return target;
        });
    }
}
