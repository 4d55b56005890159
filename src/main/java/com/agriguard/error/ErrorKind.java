package com.agriguard.error;

/**
 * Coarse classification of every rejected operation. Callers branch on the kind;
 * the {@link ErrorCode} carries the precise reason.
 */
public enum ErrorKind {
    VALIDATION,
    AUTHORIZATION,
    STATE,
    RESOURCE
}
