package com.olympiadregistration.domain.exception;

import lombok.Getter;

/**
 * Failure of one row of a bulk import, reported as {@code row N: message}.
 *
 * <p>Row numbers are 1-based with the header row counted as row 0.
 */
@Getter
public class BulkImportException extends RegistrationException {

    private final int row;

    private final int committedRows;

    public BulkImportException(int row, RegistrationException cause, int committedRows) {
        super(cause.getKind(), "row " + row + ": " + cause.getMessage(), cause);
        this.row = row;
        this.committedRows = committedRows;
    }

    public BulkImportException(int row, RegistrationException cause) {
        this(row, cause, 0);
    }
}
