package com.agriguard.error;

/**
 * Thrown when the treasury cannot cover a payout.
 */
public class ResourceException extends AgriGuardException {

    public ResourceException(ErrorCode code, String message) {
        super(ErrorKind.RESOURCE, code, message);
    }
}
