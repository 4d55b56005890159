package com.agriguard.ledger;

import com.agriguard.error.ErrorCode;
import com.agriguard.error.ResourceException;
import com.agriguard.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryTreasury implements Treasury {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTreasury.class);

    private final AtomicLong balance;
    private final ConcurrentHashMap<String, Long> payouts = new ConcurrentHashMap<>();

    public InMemoryTreasury(long initialBalance) {
        if (initialBalance < 0) {
            throw new ValidationException("initial balance must be >= 0");
        }
        this.balance = new AtomicLong(initialBalance);
    }

    @Override
    public long balance() {
        return balance.get();
    }

    @Override
    public void ensureCanAccept(long amount) {
        if (amount <= 0) {
            throw new ValidationException("deposit must be positive");
        }
        if (amount > Long.MAX_VALUE - balance.get()) {
            throw new ValidationException("treasury balance " + balance.get() + " cannot accept " + amount + " more");
        }
    }

    @Override
    public void deposit(String from, long amount) {
        ensureCanAccept(amount);
        long after = balance.addAndGet(amount);
        log.debug("Deposit of {} from {} (balance={})", amount, from, after);
    }

    @Override
    public void ensureCanPay(long amount) {
        if (amount > balance.get()) {
            throw new ResourceException(ErrorCode.INSUFFICIENT_FUNDS,
                "treasury balance " + balance.get() + " cannot cover payout " + amount);
        }
    }

    @Override
    public void pay(String to, long amount) {
        if (amount <= 0) {
            return;
        }
        ensureCanPay(amount);
        balance.addAndGet(-amount);
        payouts.merge(to, amount, Long::sum);
        log.info("Paid {} to {} (balance={})", amount, to, balance.get());
    }

    @Override
    public long paidTo(String address) {
        return payouts.getOrDefault(address, 0L);
    }
}
