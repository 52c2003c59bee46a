package com.olympiadregistration.domain.visibility;

/**
 * Who may be served a stored file.
 */
public enum FileVisibility {

    /** Anyone. */
    PUBLIC,

    /** Administrators and the owner's delegate or self-registrant, for badges only. */
    BADGE_ONLY,

    /** Administrators and the owner's delegate or self-registrant. */
    PRIVATE,

    /** No longer the current file for its slot: administrators only. */
    SUPERSEDED
}
