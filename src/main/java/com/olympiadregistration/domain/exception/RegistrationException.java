package com.olympiadregistration.domain.exception;

import lombok.Getter;

/**
 * Base class for all rule violations reported to the caller.
 *
 * <p>The message is the human-readable text shown to the user and is
 * surfaced verbatim.
 */
@Getter
public abstract class RegistrationException extends RuntimeException {

    private final ErrorKind kind;

    protected RegistrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RegistrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
