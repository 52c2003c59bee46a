package com.olympiadregistration.infrastructure.security;

import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.EventStatus;
import com.olympiadregistration.domain.model.Person;

/**
 * Central access-control gate run before every mutation reaches an auditor.
 *
 * <p>Every method returns normally when the actor may proceed and otherwise
 * throws {@link com.olympiadregistration.domain.exception.PermissionDeniedException},
 * or {@link com.olympiadregistration.domain.exception.StateConflictException}
 * when the event state closes the operation to this actor.
 */
public interface RegistrationAccessKernel {

    /**
     * Full country create, edit and retirement.
     */
    void authorizeCountryAdministration(ActorContext actor, String operation);

    /**
     * Preregistration edit of one country.
     */
    void authorizePreregistration(ActorContext actor, Country country);

    /**
     * Create a person in {@code country}; a null country (unknown code) is
     * never the actor's own.
     */
    void authorizePersonCreation(ActorContext actor, Country country, EventStatus status);

    /**
     * Edit {@code person}, possibly moving it to {@code targetCountry}.
     */
    void authorizePersonEdit(ActorContext actor, Person person, Country targetCountry, EventStatus status);

    void authorizePersonRetirement(ActorContext actor);

    /**
     * Enter scores for contestants of {@code country}, which is null when the
     * requested code names no country.
     */
    void authorizeScoreEntry(ActorContext actor, Country country, EventStatus status);

    void authorizeMedalBoundaries(ActorContext actor);

    void authorizeEventAdministration(ActorContext actor);

    /**
     * Bulk import of countries (administrators only) or people
     * (administrators and delegates, each row then gated as a creation).
     */
    void authorizeBulkImport(ActorContext actor, boolean countries);
}
