package com.olympiadregistration.domain.exception;

/**
 * A mandatory field was omitted.
 */
public class RequiredFieldMissingException extends RegistrationException {

    public RequiredFieldMissingException(String message) {
        super(ErrorKind.REQUIRED_FIELD_MISSING, message);
    }
}
