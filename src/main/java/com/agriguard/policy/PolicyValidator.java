package com.agriguard.policy;

import com.agriguard.config.AgriGuardProperties;
import com.agriguard.error.ValidationException;

/**
 * Checks requested policy terms against the coverage rules. Every failure is a
 * {@link ValidationException} raised before anything is stored.
 */
public class PolicyValidator {

    private final AgriGuardProperties.Insurance settings;

    public PolicyValidator(AgriGuardProperties.Insurance settings) {
        this.settings = settings;
    }

    public void validate(PolicyParams params, String caller, long currentRound) {
        requireNonNull(params, "policy parameters are required");
        requireString(caller, "caller is required");
        requireString(params.zipCode(), "zip_code is required");
        requireNonNull(params.direction(), "direction is required");

        if (params.t0() >= params.t1()) {
            throw new ValidationException("t0 must be before t1");
        }
        if (params.cap() <= 0) {
            throw new ValidationException("cap must be positive");
        }
        if (params.fee() <= 0) {
            throw new ValidationException("fee must be positive");
        }
        if (params.threshold() < 0) {
            throw new ValidationException("threshold must be >= 0");
        }
        if (params.slope() < 0) {
            throw new ValidationException("slope must be >= 0");
        }

        if (params.t0() < currentRound + settings.minLeadRounds()) {
            throw new ValidationException("t0 must be at least " + settings.minLeadRounds()
                + " rounds after the current round " + currentRound);
        }
        if (params.t1() - params.t0() <= settings.minDurationRounds()) {
            throw new ValidationException("coverage window must exceed "
                + settings.minDurationRounds() + " rounds");
        }
    }

    private void requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message);
        }
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ValidationException(message);
        }
    }
}
