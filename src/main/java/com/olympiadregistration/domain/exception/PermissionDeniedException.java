package com.olympiadregistration.domain.exception;

/**
 * The actor lacks the capability for this mutation or file.
 */
public class PermissionDeniedException extends RegistrationException {

    public PermissionDeniedException(String message) {
        super(ErrorKind.PERMISSION_DENIED, message);
    }
}
