package com.olympiadregistration.domain.exception;

/**
 * A country, location, role or other reference name is not recognised.
 */
public class ReferenceInvalidException extends RegistrationException {

    public ReferenceInvalidException(String message) {
        super(ErrorKind.REFERENCE_INVALID, message);
    }
}
