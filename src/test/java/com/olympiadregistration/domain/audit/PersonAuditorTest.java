package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.exception.FormatInvalidException;
import com.olympiadregistration.domain.exception.PermissionDeniedException;
import com.olympiadregistration.domain.exception.ReferenceInvalidException;
import com.olympiadregistration.domain.exception.RequiredFieldMissingException;
import com.olympiadregistration.domain.exception.UniquenessViolationException;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.domain.model.PersonFields;
import com.olympiadregistration.domain.model.PhotoConsent;
import com.olympiadregistration.domain.model.FileUpload;
import com.olympiadregistration.support.RegistrationTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static com.olympiadregistration.support.RegistrationTestContext.personSubmission;
import static org.junit.jupiter.api.Assertions.*;

class PersonAuditorTest {

    private RegistrationTestContext ctx;
    private PersonAuditor auditor;
    private Country country;

    @BeforeEach
    void setUp() {
        ctx = new RegistrationTestContext();
        auditor = ctx.getPersonAuditor();
        country = ctx.registerCountry("ABC", "Absurdia");
    }

    private PersonFields audit(PersonSubmission submission, Person previous, boolean byAdministrator) {
        return auditor.audit(submission, previous, byAdministrator, ctx.eventContext(), ctx.getRegistrationView());
    }

    @Test
    void valid_contestant_gets_default_room_type() {
        PersonFields fields = audit(personSubmission("ABC", "Contestant 1", "Ada").build(), null, false);

        assertSame(country, fields.getCountry());
        assertEquals(LocalDate.of(2000, 1, 15), fields.getDateOfBirth());
        assertEquals("Shared room", fields.getRoomType());
        assertFalse(fields.isIncomplete());
    }

    @Test
    void unknown_country_is_a_reference_error() {
        ReferenceInvalidException e = assertThrows(ReferenceInvalidException.class,
            () -> audit(personSubmission("XYZ", "Leader", "Ada").build(), null, false));
        assertEquals("Invalid country", e.getMessage());
    }

    @Test
    void missing_given_name_message_depends_on_form() {
        RequiredFieldMissingException fromForm = assertThrows(RequiredFieldMissingException.class,
            () -> audit(personSubmission("ABC", "Leader", "").build(), null, false));
        assertEquals("No given name specified", fromForm.getMessage());

        RequiredFieldMissingException fromApi = assertThrows(RequiredFieldMissingException.class,
            () -> audit(personSubmission("ABC", "Leader", null).omissionAcknowledged(false).build(), null, false));
        assertEquals("Required person property given_name not supplied", fromApi.getMessage());
    }

    @Test
    void administrator_may_leave_incomplete_registration_without_required_fields() {
        PersonSubmission sparse = PersonSubmission.builder()
            .countryCode("ABC")
            .primaryRole("Leader")
            .incomplete(true)
            .build();

        PersonFields fields = audit(sparse, null, true);
        assertTrue(fields.isIncomplete());
        assertNull(fields.getGivenName());

        assertThrows(PermissionDeniedException.class, () -> audit(sparse, null, false));
    }

    @Test
    void incomplete_registration_still_checks_formats() {
        PersonSubmission sparse = PersonSubmission.builder()
            .countryCode("ABC")
            .primaryRole("Leader")
            .incomplete(true)
            .tshirt("Huge")
            .build();

        ReferenceInvalidException e = assertThrows(ReferenceInvalidException.class, () -> audit(sparse, null, true));
        assertEquals("Invalid T-shirt size Huge", e.getMessage());
    }

    @Test
    void unique_role_per_country() {
        ctx.registerPerson(country, "Leader", "First");

        UniquenessViolationException e = assertThrows(UniquenessViolationException.class,
            () -> audit(personSubmission("ABC", "Leader", "Second").build(), null, false));
        assertEquals("A person with this role already exists", e.getMessage());

        assertDoesNotThrow(() -> audit(personSubmission("ABC", "Observer with Leader", "Third").build(), null,
            false));
    }

    @Test
    void staff_and_participant_roles_do_not_mix() {
        FormatInvalidException staffRole = assertThrows(FormatInvalidException.class,
            () -> audit(personSubmission("ABC", "Coordinator", "Ada").build(), null, true));
        assertEquals("Invalid role for participant", staffRole.getMessage());

        FormatInvalidException participantRole = assertThrows(FormatInvalidException.class,
            () -> audit(personSubmission(RegistrationTestContext.STAFF_CODE, "Leader", "Ada").build(), null, true));
        assertEquals("Staff must have administrative roles", participantRole.getMessage());

        PersonFields staff = audit(personSubmission(RegistrationTestContext.STAFF_CODE, "Guide", "Gus")
            .otherRoles(List.of("Webmaster"))
            .guideFor(List.of("ABC"))
            .phoneNumber("+44 1234")
            .build(), null, true);
        assertEquals(1, staff.getGuideFor().size());
        assertEquals("+44 1234", staff.getPhoneNumber());
    }

    @Test
    void phone_numbers_only_for_staff() {
        FormatInvalidException e = assertThrows(FormatInvalidException.class,
            () -> audit(personSubmission("ABC", "Leader", "Ada").phoneNumber("123").build(), null, true));
        assertEquals("Phone numbers may only be entered for staff", e.getMessage());
    }

    @Test
    void contestant_date_of_birth_bounds() {
        FormatInvalidException old = assertThrows(FormatInvalidException.class,
            () -> audit(personSubmission("ABC", "Contestant 1", "Ada").dobYear("1995").dobMonth("4").dobDay("1")
                .build(), null, false));
        assertEquals("Contestant too old", old.getMessage());

        FormatInvalidException young = assertThrows(FormatInvalidException.class,
            () -> audit(personSubmission("ABC", "Contestant 1", "Ada").dobYear("2014").dobMonth("1").dobDay("1")
                .build(), null, false));
        assertEquals("Contestant implausibly young", young.getMessage());

        assertDoesNotThrow(() -> audit(personSubmission("ABC", "Leader", "Ada").dobYear("1960").build(), null,
            false));
    }

    @Test
    void languages_checked_against_configured_list() {
        assertThrows(ReferenceInvalidException.class,
            () -> audit(personSubmission("ABC", "Leader", "Ada").languages(List.of("Klingon")).build(), null, false));
        assertThrows(FormatInvalidException.class,
            () -> audit(personSubmission("ABC", "Leader", "Ada").languages(List.of("English", "English")).build(),
                null, false));
        assertThrows(FormatInvalidException.class,
            () -> audit(personSubmission("ABC", "Leader", "Ada")
                .languages(List.of("English", "French", "German")).build(), null, false));

        RequiredFieldMissingException none = assertThrows(RequiredFieldMissingException.class,
            () -> audit(personSubmission("ABC", "Leader", "Ada").languages(List.of()).build(), null, false));
        assertEquals("No first language specified", none.getMessage());
    }

    @Test
    void contestant_date_of_birth_required_even_when_optional_for_others() {
        RegistrationTestContext optional = new RegistrationTestContext(
            RegistrationTestContext.defaultRules().toBuilder().requireDateOfBirth(false).build());
        optional.registerCountry("ABC", "Absurdia");
        PersonAuditor optionalAuditor = optional.getPersonAuditor();

        PersonFields leader = optionalAuditor.audit(personSubmission("ABC", "Leader", "Ada")
                .dobYear(null).dobMonth(null).dobDay(null).build(),
            null, false, optional.eventContext(), optional.getRegistrationView());
        assertNull(leader.getDateOfBirth());

        RequiredFieldMissingException e = assertThrows(RequiredFieldMissingException.class,
            () -> optionalAuditor.audit(personSubmission("ABC", "Contestant 1", "Ada")
                    .dobYear(null).dobMonth(null).dobDay(null).build(),
                null, false, optional.eventContext(), optional.getRegistrationView()));
        assertEquals("No date of birth specified", e.getMessage());
    }

    @Test
    void contestant_gender_limited_to_configured_values() {
        RoleCapabilityTable restricted = RoleCapabilityTable.builder()
            .contestantsPerTeam(2)
            .contestantGender("Female")
            .contestantGender("Other")
            .contestantRoomType("Shared room")
            .nonContestantRoomType("Shared room")
            .defaultContestantRoomType("Shared room")
            .defaultNonContestantRoomType("Shared room")
            .build();
        RegistrationTestContext limited = new RegistrationTestContext(RegistrationTestContext.defaultRules(),
            restricted);
        limited.registerCountry("ABC", "Absurdia");
        PersonAuditor limitedAuditor = limited.getPersonAuditor();

        FormatInvalidException e = assertThrows(FormatInvalidException.class,
            () -> limitedAuditor.audit(personSubmission("ABC", "Contestant 1", "Ada").gender("Male").build(),
                null, false, limited.eventContext(), limited.getRegistrationView()));
        assertEquals("Contestant gender must be Female or Other", e.getMessage());

        assertEquals("Other", limitedAuditor.audit(personSubmission("ABC", "Contestant 1", "Ada").gender("Other")
            .build(), null, false, limited.eventContext(), limited.getRegistrationView()).getGender());
        assertEquals("Male", limitedAuditor.audit(personSubmission("ABC", "Leader", "Lea").gender("Male")
            .build(), null, false, limited.eventContext(), limited.getRegistrationView()).getGender());
    }

    @Test
    void or_list_joins_the_last_value_with_or() {
        assertEquals("Female", PersonAuditor.orList(List.of("Female")));
        assertEquals("Female or Other", PersonAuditor.orList(List.of("Female", "Other")));
        assertEquals("Female, Male or Other", PersonAuditor.orList(List.of("Female", "Male", "Other")));
    }

    @Test
    void minute_only_edit_keeps_the_stored_hour() {
        Person person = ctx.getPersonService().create(RegistrationTestContext.admin(),
            personSubmission("ABC", "Leader", "Ada")
                .arrivalDate("2015-04-01").arrivalHour("10").arrivalMinute("30").build());

        PersonFields edited = audit(PersonSubmission.builder().arrivalMinute("45").build(), person, false);
        assertEquals(LocalTime.of(10, 45), edited.getArrival().getTime());

        PersonFields hourOnly = audit(PersonSubmission.builder().arrivalHour("12").build(), person, false);
        assertEquals(LocalTime.of(12, 30), hourOnly.getArrival().getTime());

        PersonFields cleared = audit(PersonSubmission.builder().arrivalHour("").build(), person, false);
        assertNull(cleared.getArrival().getTime());
    }

    @Test
    void travel_time_dropped_without_date_and_dates_ordered() {
        PersonFields noDate = audit(personSubmission("ABC", "Leader", "Ada")
            .arrivalHour("10").arrivalFlight("XM123").build(), null, false);
        assertNull(noDate.getArrival().getTime());
        assertNull(noDate.getArrival().getFlight());

        PersonFields withDate = audit(personSubmission("ABC", "Leader", "Ada")
            .arrivalDate("2015-04-01").arrivalHour("10").arrivalMinute("30").build(), null, false);
        assertEquals(LocalTime.of(10, 30), withDate.getArrival().getTime());

        FormatInvalidException order = assertThrows(FormatInvalidException.class,
            () -> audit(personSubmission("ABC", "Leader", "Ada")
                .arrivalDate("2015-04-02").departureDate("2015-04-01").build(), null, false));
        assertEquals("Arrival date after departure date", order.getMessage());

        FormatInvalidException early = assertThrows(FormatInvalidException.class,
            () -> audit(personSubmission("ABC", "Leader", "Ada").arrivalDate("2015-03-30").build(), null, false));
        assertEquals("Arrival date too early", early.getMessage());
    }

    @Test
    void room_types_limited_by_role_for_delegates_only() {
        FormatInvalidException e = assertThrows(FormatInvalidException.class,
            () -> audit(personSubmission("ABC", "Contestant 1", "Ada").roomType("Single room").build(), null, false));
        assertEquals("Room type Single room not permitted for this role", e.getMessage());

        PersonFields byAdmin = audit(personSubmission("ABC", "Contestant 1", "Ada").roomType("Single room").build(),
            null, true);
        assertEquals("Single room", byAdmin.getRoomType());

        assertThrows(ReferenceInvalidException.class,
            () -> audit(personSubmission("ABC", "Contestant 1", "Ada").roomType("Tent").build(), null, true));
    }

    @Test
    void clearing_a_required_field_keeps_the_stored_value() {
        Person person = ctx.registerPerson(country, "Leader", "Ada");

        PersonFields fields = audit(PersonSubmission.builder().givenName("").familyName("Lovelace").build(),
            person, false);

        assertEquals("Ada", fields.getGivenName());
        assertEquals("Lovelace", fields.getFamilyName());
        assertSame(country, fields.getCountry());
    }

    @Test
    void editing_own_record_keeps_unique_role() {
        Person person = ctx.registerPerson(country, "Leader", "Ada");

        assertDoesNotThrow(() -> audit(PersonSubmission.builder().primaryRole("Leader").build(), person, false));
    }

    @Test
    void consent_collected_when_enabled() {
        RegistrationTestContext consent = new RegistrationTestContext(
            RegistrationTestContext.defaultRules().toBuilder().consentUi(true).build());
        consent.registerCountry("ABC", "Absurdia");
        PersonAuditor consentAuditor = consent.getPersonAuditor();

        RequiredFieldMissingException missing = assertThrows(RequiredFieldMissingException.class,
            () -> consentAuditor.audit(personSubmission("ABC", "Leader", "Ada").build(), null, false,
                consent.eventContext(), consent.getRegistrationView()));
        assertEquals("No choice of consent for event photos specified", missing.getMessage());

        PersonFields fields = consentAuditor.audit(personSubmission("ABC", "Leader", "Ada")
                .eventPhotosConsent(true)
                .dietConsent(false)
                .diet("Vegetarian")
                .photo(new FileUpload("me.jpg", RegistrationTestContext.JPEG))
                .photoConsent("badge")
                .build(), null, false, consent.eventContext(), consent.getRegistrationView());
        assertEquals(PersonAuditor.DIET_UNKNOWN, fields.getDiet());
        assertEquals(PhotoConsent.BADGE_ONLY, fields.getPhotoConsent());
    }
}
