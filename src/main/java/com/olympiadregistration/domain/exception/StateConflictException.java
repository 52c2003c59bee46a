package com.olympiadregistration.domain.exception;

/**
 * The operation is not permitted in the current event or consent state.
 */
public class StateConflictException extends RegistrationException {

    public StateConflictException(String message) {
        super(ErrorKind.STATE_CONFLICT, message);
    }
}
