package com.olympiadregistration.domain.exception;

/**
 * A value is present but malformed or out of range.
 */
public class FormatInvalidException extends RegistrationException {

    public FormatInvalidException(String message) {
        super(ErrorKind.FORMAT_INVALID, message);
    }

    public FormatInvalidException(String message, Throwable cause) {
        super(ErrorKind.FORMAT_INVALID, message, cause);
    }
}
