package com.olympiadregistration.domain.exception;

/**
 * Classification of registration failures.
 *
 * <p>Every kind except {@link #RACE_CONDITION} aborts the single operation
 * with no mutation. A race condition aborts only the remaining rows of a
 * bulk import. {@link #NOT_FOUND} is reported when a record addressed by id
 * does not exist.
 */
public enum ErrorKind {
    REQUIRED_FIELD_MISSING,
    FORMAT_INVALID,
    UNIQUENESS_VIOLATION,
    STATE_CONFLICT,
    REFERENCE_INVALID,
    PERMISSION_DENIED,
    RACE_CONDITION,
    NOT_FOUND
}
