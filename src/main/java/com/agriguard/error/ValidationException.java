package com.agriguard.error;

/**
 * Thrown when an operation receives malformed or out-of-range input.
 */
public class ValidationException extends AgriGuardException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, ErrorCode.INVALID_INPUT, message);
    }
}
