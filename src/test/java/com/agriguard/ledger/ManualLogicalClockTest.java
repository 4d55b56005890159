package com.agriguard.ledger;

import com.agriguard.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ManualLogicalClockTest {

    @Test
    void advancesForwardOnly() {
        ManualLogicalClock clock = new ManualLogicalClock(100);

        assertEquals(110, clock.advance(10));
        assertEquals(200, clock.advanceTo(200));
        assertEquals(200, clock.advanceTo(200));

        assertThrows(ValidationException.class, () -> clock.advanceTo(199));
        assertThrows(ValidationException.class, () -> clock.advance(-1));
        assertEquals(200, clock.currentRound());
    }

    @Test
    void negativeStartIsRejected() {
        assertThrows(ValidationException.class, () -> new ManualLogicalClock(-1));
    }
}
