package com.olympiadregistration.infrastructure.security;

import com.olympiadregistration.domain.exception.PermissionDeniedException;
import com.olympiadregistration.domain.exception.StateConflictException;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.EventStatus;
import com.olympiadregistration.domain.model.MedalBoundaries;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.support.RegistrationTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.olympiadregistration.support.RegistrationTestContext.admin;
import static com.olympiadregistration.support.RegistrationTestContext.delegate;
import static com.olympiadregistration.support.RegistrationTestContext.scorer;
import static com.olympiadregistration.support.RegistrationTestContext.selfRegistrant;
import static org.junit.jupiter.api.Assertions.*;

class DefaultRegistrationAccessKernelTest {

    private static final EventStatus OPEN = new EventStatus(true, true, false, MedalBoundaries.unset());
    private static final EventStatus CLOSED = new EventStatus(false, false, false, MedalBoundaries.unset());
    private static final EventStatus SELF_SCORING = new EventStatus(false, false, true, MedalBoundaries.unset());

    private final DefaultRegistrationAccessKernel kernel = new DefaultRegistrationAccessKernel();

    private Country abc;
    private Country xyz;
    private Person leader;

    @BeforeEach
    void setUp() {
        RegistrationTestContext ctx = new RegistrationTestContext();
        abc = ctx.registerCountry("ABC", "Absurdia");
        xyz = ctx.registerCountry("XYZ", "Xylophonia");
        leader = ctx.registerPerson(abc, "Leader", "Ada");
    }

    @Test
    void countries_administered_by_administrators_only() {
        assertDoesNotThrow(() -> kernel.authorizeCountryAdministration(admin(), "create"));

        PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
            () -> kernel.authorizeCountryAdministration(delegate(abc), "create"));
        assertEquals("Only administrators may create countries", e.getMessage());
    }

    @Test
    void delegate_preregisters_own_country_only() {
        assertDoesNotThrow(() -> kernel.authorizePreregistration(delegate(abc), abc));
        assertThrows(PermissionDeniedException.class, () -> kernel.authorizePreregistration(delegate(abc), xyz));
        assertThrows(PermissionDeniedException.class, () -> kernel.authorizePreregistration(scorer(), abc));
    }

    @Test
    void delegate_registers_people_of_own_country_while_open() {
        assertDoesNotThrow(() -> kernel.authorizePersonCreation(delegate(abc), abc, OPEN));

        PermissionDeniedException wrongCountry = assertThrows(PermissionDeniedException.class,
            () -> kernel.authorizePersonCreation(delegate(abc), xyz, OPEN));
        assertEquals("Person must be from your country", wrongCountry.getMessage());

        StateConflictException closed = assertThrows(StateConflictException.class,
            () -> kernel.authorizePersonCreation(delegate(abc), abc, CLOSED));
        assertEquals(DefaultRegistrationAccessKernel.REGISTRATION_DISABLED, closed.getMessage());

        assertDoesNotThrow(() -> kernel.authorizePersonCreation(admin(), xyz, CLOSED));
    }

    @Test
    void self_registrant_edits_own_record_without_moving_it() {
        ActorContext self = selfRegistrant(leader);

        assertDoesNotThrow(() -> kernel.authorizePersonEdit(self, leader, abc, OPEN));

        PermissionDeniedException move = assertThrows(PermissionDeniedException.class,
            () -> kernel.authorizePersonEdit(self, leader, xyz, OPEN));
        assertEquals("You may not change your country", move.getMessage());

        ActorContext someoneElse = ActorContext.builder()
            .principal("other")
            .role(ActorRole.SELFREG)
            .personId(leader.getId() + 1)
            .build();
        assertThrows(PermissionDeniedException.class, () -> kernel.authorizePersonEdit(someoneElse, leader, abc, OPEN));
    }

    @Test
    void delegate_cannot_move_person_to_another_country() {
        assertThrows(PermissionDeniedException.class,
            () -> kernel.authorizePersonEdit(delegate(abc), leader, xyz, OPEN));
        assertDoesNotThrow(() -> kernel.authorizePersonEdit(admin(), leader, xyz, CLOSED));
    }

    @Test
    void scores_entered_by_scorers_or_self_scoring_delegates() {
        assertDoesNotThrow(() -> kernel.authorizeScoreEntry(scorer(), abc, CLOSED));
        assertThrows(PermissionDeniedException.class, () -> kernel.authorizeScoreEntry(delegate(abc), abc, CLOSED));
        assertDoesNotThrow(() -> kernel.authorizeScoreEntry(delegate(abc), abc, SELF_SCORING));
        assertThrows(PermissionDeniedException.class,
            () -> kernel.authorizeScoreEntry(delegate(abc), xyz, SELF_SCORING));
        assertThrows(PermissionDeniedException.class,
            () -> kernel.authorizeScoreEntry(delegate(abc), null, SELF_SCORING));
        assertDoesNotThrow(() -> kernel.authorizeScoreEntry(scorer(), null, CLOSED));
        assertThrows(PermissionDeniedException.class, () -> kernel.authorizeMedalBoundaries(delegate(abc)));
    }

    @Test
    void delegates_may_bulk_import_people_but_not_countries() {
        assertDoesNotThrow(() -> kernel.authorizeBulkImport(delegate(abc), false));
        assertThrows(PermissionDeniedException.class, () -> kernel.authorizeBulkImport(delegate(abc), true));
        assertThrows(PermissionDeniedException.class, () -> kernel.authorizeBulkImport(ActorContext.anonymous(), false));
    }
}
