package com.agriguard.policy;

import com.agriguard.error.ValidationException;

/**
 * Premium quote from coverage and risk inputs.
 *
 * <pre>
 * base        = cap / 100
 * risk        = 100 + riskScore / 2        (riskScore 0..100)
 * uncertainty = 100 + uncertainty          (0..50 percent)
 * duration    = 100 + durationDays / 2     (1..365 days)
 * fee         = max(MIN_FEE, base * risk * uncertainty * duration / 100^3)
 * </pre>
 */
public class FeeCalculator {

    public static final long MIN_FEE = 1000L;

    private static final long SCALE = 100L * 100L * 100L;

    public long calculateFee(long cap, long riskScore, long uncertainty, long durationDays) {
        if (cap <= 0) {
            throw new ValidationException("cap must be positive");
        }
        if (riskScore < 0 || riskScore > 100) {
            throw new ValidationException("risk_score must be in [0, 100]");
        }
        if (uncertainty < 0 || uncertainty > 50) {
            throw new ValidationException("uncertainty must be in [0, 50]");
        }
        if (durationDays < 1 || durationDays > 365) {
            throw new ValidationException("duration_days must be in [1, 365]");
        }

        long base = cap / 100;
        long riskMultiplier = 100 + riskScore / 2;
        long uncertaintyMultiplier = 100 + uncertainty;
        long durationMultiplier = 100 + durationDays / 2;

        long fee;
        try {
            fee = Math.multiplyExact(
                Math.multiplyExact(Math.multiplyExact(base, riskMultiplier), uncertaintyMultiplier),
                durationMultiplier) / SCALE;
        } catch (ArithmeticException ex) {
            throw new ValidationException("cap is too large to quote");
        }
        return Math.max(fee, MIN_FEE);
    }
}
