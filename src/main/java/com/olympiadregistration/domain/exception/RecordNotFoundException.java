package com.olympiadregistration.domain.exception;

/**
 * A record addressed by id does not exist.
 */
public class RecordNotFoundException extends RegistrationException {

    public RecordNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
