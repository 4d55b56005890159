package com.agriguard.error;

import java.util.Objects;

/**
 * Base of the error taxonomy. Every rejected operation throws a subclass before
 * touching any stored state, so catching one means nothing was written.
 */
public abstract class AgriGuardException extends RuntimeException {

    private final ErrorCode code;

    protected AgriGuardException(ErrorKind expectedKind, ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
        if (code.kind() != expectedKind) {
            throw new IllegalArgumentException(code + " is not a " + expectedKind + " error");
        }
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorKind getKind() {
        return code.kind();
    }
}
