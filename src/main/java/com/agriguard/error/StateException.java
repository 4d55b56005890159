package com.agriguard.error;

/**
 * Thrown when stored state forbids the operation: unknown record, already settled,
 * already voted, too early, too late.
 */
public class StateException extends AgriGuardException {

    public StateException(ErrorCode code, String message) {
        super(ErrorKind.STATE, code, message);
    }
}
