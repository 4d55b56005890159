package com.agriguard.ledger;

/**
 * Funds held by the insurance pool: premiums flow in, payouts flow out.
 */
public interface Treasury {

    long balance();

    /**
     * Fails with {@link com.agriguard.error.ValidationException} when the balance
     * could not hold {@code amount} more; nothing moves in that case.
     */
    void ensureCanAccept(long amount);

    void deposit(String from, long amount);

    /**
     * Fails with {@link com.agriguard.error.ResourceException} when the pool cannot
     * cover {@code amount}; nothing moves in that case.
     */
    void ensureCanPay(long amount);

    void pay(String to, long amount);

    /** Total paid out to {@code address} so far. */
    long paidTo(String address);
}
