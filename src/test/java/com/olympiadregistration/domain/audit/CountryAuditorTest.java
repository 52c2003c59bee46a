package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.exception.FormatInvalidException;
import com.olympiadregistration.domain.exception.PermissionDeniedException;
import com.olympiadregistration.domain.exception.RequiredFieldMissingException;
import com.olympiadregistration.domain.exception.StateConflictException;
import com.olympiadregistration.domain.exception.UniquenessViolationException;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.CountryFields;
import com.olympiadregistration.domain.model.ExpectedNumbers;
import com.olympiadregistration.domain.model.FileFormat;
import com.olympiadregistration.domain.model.FileUpload;
import com.olympiadregistration.support.RegistrationTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.olympiadregistration.support.RegistrationTestContext.GENERIC_URL_BASE;
import static com.olympiadregistration.support.RegistrationTestContext.PNG;
import static org.junit.jupiter.api.Assertions.*;

class CountryAuditorTest {

    private RegistrationTestContext ctx;
    private CountryAuditor auditor;

    @BeforeEach
    void setUp() {
        ctx = new RegistrationTestContext();
        auditor = ctx.getCountryAuditor();
    }

    private CountryFields audit(CountrySubmission submission, Country previous) {
        return auditor.audit(submission, previous, ctx.eventContext(), ctx.getRegistrationView());
    }

    private static CountrySubmission.CountrySubmissionBuilder submission(String code, String name) {
        return CountrySubmission.builder().code(code).name(name).omissionAcknowledged(true);
    }

    @Test
    void new_country_gets_default_expected_numbers() {
        CountryFields fields = audit(submission("ABC", "Absurdia")
            .contactEmails("one@example.org\ntwo@example.org")
            .build(), null);

        assertEquals("ABC", fields.getCode());
        assertFalse(fields.isStaff());
        assertTrue(fields.isParticipantsOk());
        assertEquals(ExpectedNumbers.defaultsFor(2), fields.getExpected());
        assertEquals(List.of("one@example.org", "two@example.org"), fields.getContactEmails());
        assertFalse(fields.isNumbersConfirmed());
    }

    @Test
    void code_must_be_capital_letters() {
        FormatInvalidException e = assertThrows(FormatInvalidException.class,
            () -> audit(submission("Abc", "Absurdia").build(), null));
        assertEquals("Country codes must be all capital letters", e.getMessage());
    }

    @Test
    void missing_code_message_depends_on_form() {
        RequiredFieldMissingException fromForm = assertThrows(RequiredFieldMissingException.class,
            () -> audit(submission(" ", "Absurdia").build(), null));
        assertEquals("No country code specified", fromForm.getMessage());

        RequiredFieldMissingException fromApi = assertThrows(RequiredFieldMissingException.class,
            () -> audit(submission(null, "Absurdia").omissionAcknowledged(false).build(), null));
        assertEquals("Required country property code not supplied", fromApi.getMessage());
    }

    @Test
    void code_and_name_unique_among_active_countries() {
        Country existing = ctx.registerCountry("ABC", "Absurdia");

        UniquenessViolationException code = assertThrows(UniquenessViolationException.class,
            () -> audit(submission("ABC", "Other").build(), null));
        assertEquals("A country with code ABC already exists", code.getMessage());

        UniquenessViolationException name = assertThrows(UniquenessViolationException.class,
            () -> audit(submission("XYZ", "Absurdia").build(), null));
        assertEquals("A country with name Absurdia already exists", name.getMessage());

        assertDoesNotThrow(() -> audit(submission("ABC", "Absurdia").build(), existing));

        ctx.getCountryService().retire(RegistrationTestContext.admin(), existing.getId());
        assertDoesNotThrow(() -> audit(submission("ABC", "Absurdia").build(), null));
    }

    @Test
    void staff_flag_cannot_change_on_edit() {
        Country existing = ctx.registerCountry("ABC", "Absurdia");

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> audit(CountrySubmission.builder().staff(true).build(), existing));
        assertEquals("Cannot change whether a country is normal", e.getMessage());
    }

    @Test
    void staff_country_carries_no_expected_numbers() {
        FormatInvalidException e = assertThrows(FormatInvalidException.class,
            () -> audit(submission("STF", "More Staff").staff(true).expectedLeaders("1").build(), null));
        assertEquals("Expected numbers may only be set for normal countries", e.getMessage());
    }

    @Test
    void expected_contestants_bounded_by_team_size() {
        assertThrows(FormatInvalidException.class,
            () -> audit(submission("ABC", "Absurdia").expectedContestants("3").build(), null));
        CountryFields fields = audit(submission("ABC", "Absurdia").expectedContestants("1").build(), null);
        assertEquals(1, fields.getExpected().getContestants());
    }

    @Test
    void generic_url_must_match_expected_form() {
        FormatInvalidException e = assertThrows(FormatInvalidException.class,
            () -> audit(submission("ABC", "Absurdia").genericUrl("https://elsewhere.org/1/").build(), null));
        assertEquals("example.org URLs for previous participation must be in the form "
            + GENERIC_URL_BASE + "countries/countryN/", e.getMessage());

        CountryFields fields = audit(submission("ABC", "Absurdia")
            .genericUrl(GENERIC_URL_BASE + "countries/country7/").build(), null);
        assertEquals(GENERIC_URL_BASE + "countries/country7/", fields.getGenericUrl());
    }

    @Test
    void leader_email_only_for_virtual_events() {
        FormatInvalidException e = assertThrows(FormatInvalidException.class,
            () -> audit(submission("ABC", "Absurdia").leaderEmail("leader@example.org").build(), null));
        assertEquals("Leader email may only be specified for virtual events", e.getMessage());

        RegistrationTestContext virtual = new RegistrationTestContext(
            RegistrationTestContext.defaultRules().toBuilder().virtualEvent(true).build());
        CountryFields fields = virtual.getCountryAuditor().audit(
            submission("ABC", "Absurdia").leaderEmail("leader@example.org").build(), null,
            virtual.eventContext(), virtual.getRegistrationView());
        assertEquals("leader@example.org", fields.getLeaderEmail());
    }

    @Test
    void flag_format_is_sniffed_from_content() {
        FormatInvalidException wrongFormat = assertThrows(FormatInvalidException.class,
            () -> audit(submission("ABC", "Absurdia")
                .flag(new FileUpload("flag.png", RegistrationTestContext.PDF)).build(), null));
        assertEquals("Flags must be in PNG format", wrongFormat.getMessage());

        FormatInvalidException wrongName = assertThrows(FormatInvalidException.class,
            () -> audit(submission("ABC", "Absurdia").flag(new FileUpload("flag.jpg", PNG)).build(), null));
        assertEquals("Filename extension for flag must match contents (png)", wrongName.getMessage());

        CountryFields fields = audit(submission("ABC", "Absurdia").flag(new FileUpload("Flag.PNG", PNG)).build(),
            null);
        assertEquals(FileFormat.PNG, fields.getFlag().format());
    }

    @Test
    void preregistration_confirms_numbers_once_even_without_changes() {
        Country country = ctx.registerCountry("ABC", "Absurdia");
        CountrySubmission unchanged = CountrySubmission.builder().expectedLeaders("1").build();

        Optional<CountryFields> first = auditor.auditPreregistration(unchanged, country, ctx.eventContext());
        assertTrue(first.isPresent());
        assertTrue(first.get().isNumbersConfirmed());

        country.applyPreregistration(first.get());
        assertTrue(auditor.auditPreregistration(unchanged, country, ctx.eventContext()).isEmpty());
    }

    @Test
    void preregistration_rejects_changes_once_disabled() {
        Country country = ctx.registerCountry("ABC", "Absurdia");
        ctx.getEventService().updateFlags(RegistrationTestContext.admin(), null, false, null);

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> auditor.auditPreregistration(CountrySubmission.builder().expectedDeputies("0").build(),
                country, ctx.eventContext()));
        assertTrue(e.getMessage().startsWith("Preregistration is now disabled"));

        assertTrue(auditor.auditPreregistration(CountrySubmission.builder().expectedDeputies("1").build(),
            country, ctx.eventContext()).isEmpty());
    }

    @Test
    void preregistration_may_not_touch_other_fields() {
        Country country = ctx.registerCountry("ABC", "Absurdia");

        assertThrows(PermissionDeniedException.class,
            () -> auditor.auditPreregistration(CountrySubmission.builder().name("Renamed").build(),
                country, ctx.eventContext()));
    }
}
