package com.agriguard.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every engine operation behind one global write lock.
 *
 * Operations run to completion while holding the lock, so no caller ever observes
 * a partially applied effect. Engines check all preconditions before their first
 * write, which makes a thrown exception equivalent to an abort. The lock is
 * re-entrant: a nested sub-operation (dispute resolution settling a policy) runs
 * inside the outer one.
 */
public class LedgerExecutor {

    private static final Logger log = LoggerFactory.getLogger(LedgerExecutor.class);

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T execute(String operation, Supplier<T> body) {
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                log.debug("Nested operation {} (depth={})", operation, lock.getHoldCount());
            }
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    public boolean isInsideOperation() {
        return lock.isHeldByCurrentThread();
    }
}
