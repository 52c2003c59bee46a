package com.olympiadregistration.infrastructure.security;

/**
 * Kind of account behind a request.
 */
public enum ActorRole {

    /** Event administrator: may change anything. */
    ADMIN,

    /** Delegate registering one country's participants. */
    REGISTER,

    /** Self-registration account bound to one person. */
    SELFREG,

    /** Scoring account. */
    SCORE,

    /** Not logged in. */
    ANONYMOUS
}
