package com.olympiadregistration.domain.exception;

/**
 * A bulk import row failed at commit time because a concurrent actor changed
 * the store after the batch was validated. Rows committed before it stay
 * committed.
 */
public class RaceConditionException extends RegistrationException {

    public RaceConditionException(String message, Throwable cause) {
        super(ErrorKind.RACE_CONDITION, message, cause);
    }
}
