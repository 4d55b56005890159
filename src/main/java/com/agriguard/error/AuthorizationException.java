package com.agriguard.error;

/**
 * Thrown when the caller is not allowed to perform a privileged action.
 */
public class AuthorizationException extends AgriGuardException {

    public AuthorizationException(ErrorCode code, String message) {
        super(ErrorKind.AUTHORIZATION, code, message);
    }
}
