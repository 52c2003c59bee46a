package com.olympiadregistration.domain.exception;

/**
 * A code, name, role or roster number collides with an existing record.
 */
public class UniquenessViolationException extends RegistrationException {

    public UniquenessViolationException(String message) {
        super(ErrorKind.UNIQUENESS_VIOLATION, message);
    }
}
