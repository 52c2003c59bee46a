package com.olympiadregistration.application;

import com.olympiadregistration.domain.audit.CountrySubmission;
import com.olympiadregistration.domain.exception.PermissionDeniedException;
import com.olympiadregistration.domain.exception.RecordNotFoundException;
import com.olympiadregistration.domain.exception.StateConflictException;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.FileUpload;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.domain.model.RegistrationFile;
import com.olympiadregistration.support.RecordingNotificationService.Notification;
import com.olympiadregistration.support.RegistrationTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.olympiadregistration.support.RegistrationTestContext.PNG;
import static com.olympiadregistration.support.RegistrationTestContext.admin;
import static com.olympiadregistration.support.RegistrationTestContext.delegate;
import static com.olympiadregistration.support.RegistrationTestContext.personSubmission;
import static org.junit.jupiter.api.Assertions.*;

class CountryRegistrationServiceTest {

    private RegistrationTestContext ctx;
    private CountryRegistrationService service;

    @BeforeEach
    void setUp() {
        ctx = new RegistrationTestContext();
        service = ctx.getCountryService();
    }

    @Test
    void create_stores_country_and_records_notification() {
        Country country = service.create(admin(), CountrySubmission.builder()
            .code("ABC")
            .name("Absurdia")
            .flag(new FileUpload("abc.png", PNG))
            .omissionAcknowledged(true)
            .build());

        assertNotNull(country.getId());
        assertNotNull(country.getFlag());
        assertEquals(country.getId(), country.getFlag().getOwnerId());
        assertEquals(List.of("ABC", RegistrationTestContext.STAFF_CODE),
            service.list().stream().map(Country::getCode).toList());

        List<Notification> recorded = ctx.getNotifications().byCategory("country");
        assertEquals(1, recorded.size());
        assertEquals("created", recorded.get(0).action());
        assertEquals(String.valueOf(country.getId()), recorded.get(0).resourceId());
        assertEquals("admin", recorded.get(0).principal());
        assertEquals(1.0, ctx.getMeterRegistry().counter("registration.records",
            "category", "country", "action", "created").count());
    }

    @Test
    void new_flag_supersedes_the_old_one() {
        Country country = ctx.registerCountry("ABC", "Absurdia");
        service.update(admin(), country.getId(), CountrySubmission.builder()
            .flag(new FileUpload("first.png", PNG)).build());
        RegistrationFile first = country.getFlag();

        service.update(admin(), country.getId(), CountrySubmission.builder()
            .flag(new FileUpload("second.png", PNG)).build());

        assertNotEquals(first.getId(), country.getFlag().getId());
        FileDownloadService downloads = ctx.getDownloadService();
        assertThrows(PermissionDeniedException.class,
            () -> downloads.download(delegate(country), first.getId()));
        assertEquals("flag" + first.getId() + ".png", downloads.download(admin(), first.getId()).filename());
        assertEquals("image/png", downloads.download(delegate(country), country.getFlag().getId()).contentType());
    }

    @Test
    void retiring_country_retires_its_people_and_guides_stop_guiding() {
        Country country = ctx.registerCountry("ABC", "Absurdia");
        Person leader = ctx.registerPerson(country, "Leader", "Ada");
        Person guide = ctx.getPersonService().create(admin(),
            personSubmission(RegistrationTestContext.STAFF_CODE, "Guide", "Gus").guideFor(List.of("ABC")).build());

        service.retire(admin(), country.getId());

        assertTrue(service.get(country.getId()).isRetired());
        assertTrue(leader.isRetired());
        assertTrue(guide.getGuideFor().isEmpty());
        assertFalse(guide.isRetired());
        assertEquals(List.of(RegistrationTestContext.STAFF_CODE),
            service.list().stream().map(Country::getCode).toList());

        StateConflictException e = assertThrows(StateConflictException.class,
            () -> service.update(admin(), country.getId(), CountrySubmission.builder().name("Again").build()));
        assertEquals("Country ABC has been retired", e.getMessage());
    }

    @Test
    void staff_country_cannot_be_retired() {
        StateConflictException e = assertThrows(StateConflictException.class,
            () -> service.retire(admin(), ctx.staffCountry().getId()));
        assertEquals("The special staff country cannot be retired", e.getMessage());
    }

    @Test
    void delegate_preregisters_expected_numbers() {
        Country country = ctx.registerCountry("ABC", "Absurdia");
        int before = ctx.getNotifications().notifications().size();

        service.preregister(delegate(country), country.getId(), CountrySubmission.builder()
            .expectedContestants("1")
            .expectedSingleRooms("2")
            .build());

        assertEquals(1, country.getExpected().getContestants());
        assertEquals(2, country.getExpected().getSingleRooms());
        assertTrue(country.isNumbersConfirmed());
        assertEquals(before + 1, ctx.getNotifications().notifications().size());

        service.preregister(delegate(country), country.getId(), CountrySubmission.builder()
            .expectedContestants("1")
            .build());
        assertEquals(before + 1, ctx.getNotifications().notifications().size());
    }

    @Test
    void delegate_cannot_create_countries() {
        Country country = ctx.registerCountry("ABC", "Absurdia");

        assertThrows(PermissionDeniedException.class, () -> service.create(delegate(country),
            CountrySubmission.builder().code("XYZ").name("Xylophonia").build()));
        assertThrows(RecordNotFoundException.class, () -> service.get(999L));
    }
}
