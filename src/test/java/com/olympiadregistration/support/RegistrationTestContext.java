package com.olympiadregistration.support;

import com.olympiadregistration.application.CountryRegistrationService;
import com.olympiadregistration.application.EventAdministrationService;
import com.olympiadregistration.application.EventContextFactory;
import com.olympiadregistration.application.FileDownloadService;
import com.olympiadregistration.application.PersonRegistrationService;
import com.olympiadregistration.application.ScoringService;
import com.olympiadregistration.application.bulk.BulkImportService;
import com.olympiadregistration.application.bulk.CountryImportSchema;
import com.olympiadregistration.application.bulk.PersonImportSchema;
import com.olympiadregistration.application.export.RegistrationExportService;
import com.olympiadregistration.config.PerformanceConfiguration.RegistrationMetrics;
import com.olympiadregistration.domain.audit.CountryAuditor;
import com.olympiadregistration.domain.audit.CountrySubmission;
import com.olympiadregistration.domain.audit.EventContext;
import com.olympiadregistration.domain.audit.EventRules;
import com.olympiadregistration.domain.audit.PersonAuditor;
import com.olympiadregistration.domain.audit.PersonSubmission;
import com.olympiadregistration.domain.audit.RoleCapabilityTable;
import com.olympiadregistration.domain.audit.RosterLookup;
import com.olympiadregistration.domain.audit.StoreRegistrationView;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.CountryFields;
import com.olympiadregistration.domain.model.EventState;
import com.olympiadregistration.domain.model.ExpectedNumbers;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.domain.visibility.FileVisibilityResolver;
import com.olympiadregistration.infrastructure.csv.CsvSpreadsheetCodec;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.infrastructure.security.ActorRole;
import com.olympiadregistration.infrastructure.security.DefaultRegistrationAccessKernel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Every application service wired by hand over in-memory repositories, for
 * tests that exercise the services without Spring or a database.
 */
@Getter
public class RegistrationTestContext {

    public static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n', 0, 0, 0, 13};
    public static final byte[] JPEG = {(byte) 0xff, (byte) 0xd8, (byte) 0xff, (byte) 0xe0, 0, 16};
    public static final byte[] PDF = "%PDF-1.4\n%%EOF\n".getBytes(StandardCharsets.US_ASCII);

    public static final String GENERIC_URL_BASE = "https://www.example.org/";
    public static final String STAFF_CODE = "ZZA";

    private final EventRules rules;
    private final RoleCapabilityTable roles;

    private final InMemoryCountryRepository countryRepository = new InMemoryCountryRepository();
    private final InMemoryPersonRepository personRepository = new InMemoryPersonRepository();
    private final InMemoryRegistrationFileRepository fileRepository = new InMemoryRegistrationFileRepository();
    private final InMemoryEventStateRepository eventStateRepository = new InMemoryEventStateRepository();
    private final RecordingNotificationService notifications = new RecordingNotificationService();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private final CountryAuditor countryAuditor = new CountryAuditor();
    private final PersonAuditor personAuditor = new PersonAuditor();
    private final DefaultRegistrationAccessKernel accessKernel = new DefaultRegistrationAccessKernel();
    private final StoreRegistrationView registrationView;
    private final FileVisibilityResolver visibilityResolver;
    private final EventContextFactory eventContextFactory;

    private final CountryRegistrationService countryService;
    private final PersonRegistrationService personService;
    private final ScoringService scoringService;
    private final EventAdministrationService eventService;
    private final FileDownloadService downloadService;
    private final BulkImportService bulkImportService;
    private final RegistrationExportService exportService;

    public RegistrationTestContext() {
        this(defaultRules());
    }

    public RegistrationTestContext(EventRules rules) {
        this(rules, defaultRoles(rules.getContestantsPerTeam()));
    }

    public RegistrationTestContext(EventRules rules, RoleCapabilityTable roles) {
        this.rules = rules;
        this.roles = roles;
        this.registrationView = new StoreRegistrationView(countryRepository, personRepository);
        this.visibilityResolver = new FileVisibilityResolver(rules.isConsentUi());
        this.eventContextFactory = new EventContextFactory(rules, roles, RosterLookup.NONE, eventStateRepository);

        RegistrationMetrics metrics = new RegistrationMetrics(meterRegistry);
        this.countryService = new CountryRegistrationService(countryRepository, personRepository, fileRepository,
            countryAuditor, registrationView, accessKernel, eventContextFactory, notifications, metrics);
        this.personService = new PersonRegistrationService(personRepository, countryRepository, fileRepository,
            personAuditor, registrationView, accessKernel, eventContextFactory, notifications, metrics);
        this.scoringService = new ScoringService(countryRepository, personRepository, eventStateRepository,
            roles, rules, accessKernel, notifications, metrics);
        this.eventService = new EventAdministrationService(eventStateRepository, accessKernel, notifications);
        this.downloadService = new FileDownloadService(fileRepository, countryRepository, personRepository,
            visibilityResolver, metrics);
        CsvSpreadsheetCodec codec = new CsvSpreadsheetCodec();
        this.bulkImportService = new BulkImportService(codec, new CountryImportSchema(rules),
            new PersonImportSchema(rules), countryAuditor, personAuditor, registrationView, accessKernel,
            eventContextFactory, countryService, personService, metrics);
        this.exportService = new RegistrationExportService(countryRepository, personRepository,
            eventStateRepository, roles, rules, visibilityResolver, scoringService, codec);

        countryRepository.save(Country.create(CountryFields.builder()
            .code(STAFF_CODE)
            .name(rules.staffCountryName())
            .staff(true)
            .participantsOk(true)
            .expected(ExpectedNumbers.none())
            .build()));
    }

    public static EventRules defaultRules() {
        return EventRules.builder()
            .shortName("XMO")
            .year(2015)
            .numProblems(3)
            .marksPerProblem(List.of(7, 7, 7))
            .contestantsPerTeam(2)
            .honourableMentions(true)
            .requireDateOfBirth(true)
            .languages(Set.of("English", "French", "German"))
            .roomTypes(Set.of("Shared room", "Single room"))
            .maxLanguages(2)
            .earliestContestantDateOfBirth(LocalDate.of(1995, 4, 2))
            .sanityDateOfBirth(LocalDate.of(2014, 1, 1))
            .earliestPlausibleDateOfBirth(LocalDate.of(1902, 1, 1))
            .ageDay(LocalDate.of(2015, 4, 1))
            .earliestArrivalDate(LocalDate.of(2015, 3, 31))
            .latestArrivalDate(LocalDate.of(2015, 4, 2))
            .earliestDepartureDate(LocalDate.of(2015, 4, 1))
            .latestDepartureDate(LocalDate.of(2015, 4, 3))
            .genericUrlBase(GENERIC_URL_BASE)
            .genericUrlDescription("example.org URL")
            .genericUrlDescriptionPlural("example.org URLs")
            .build();
    }

    public static RoleCapabilityTable defaultRoles(int contestantsPerTeam) {
        return RoleCapabilityTable.builder()
            .contestantsPerTeam(contestantsPerTeam)
            .extraAdminRoles(List.of("Webmaster"))
            .contestantRoomTypes(List.of("Shared room"))
            .nonContestantRoomTypes(List.of("Shared room", "Single room"))
            .defaultContestantRoomType("Shared room")
            .defaultNonContestantRoomType("Shared room")
            .build();
    }

    public EventContext eventContext() {
        return eventContextFactory.current();
    }

    public Country staffCountry() {
        return countryRepository.findStaffCountry().orElseThrow();
    }

    // Actors

    public static ActorContext admin() {
        return actor("admin", ActorRole.ADMIN, null, null);
    }

    public static ActorContext delegate(Country country) {
        return actor("delegate-" + country.getCode(), ActorRole.REGISTER, country.getId(), null);
    }

    public static ActorContext selfRegistrant(Person person) {
        return actor("self-" + person.getId(), ActorRole.SELFREG, person.getCountry().getId(), person.getId());
    }

    public static ActorContext scorer() {
        return actor("scorer", ActorRole.SCORE, null, null);
    }

    public static ActorContext actor(String principal, ActorRole role, Long countryId, Long personId) {
        return ActorContext.builder()
            .requestId(UUID.randomUUID())
            .principal(principal)
            .role(role)
            .countryId(countryId)
            .personId(personId)
            .requestedAt(Instant.now())
            .build();
    }

    // Registration shortcuts

    public Country registerCountry(String code, String name) {
        return countryService.create(admin(), CountrySubmission.builder()
            .code(code)
            .name(name)
            .contactEmails(code.toLowerCase() + "@example.org")
            .omissionAcknowledged(true)
            .build());
    }

    /**
     * A submission that passes every required-field check for a participant.
     */
    public static PersonSubmission.PersonSubmissionBuilder personSubmission(String countryCode, String role,
                                                                           String givenName) {
        return PersonSubmission.builder()
            .countryCode(countryCode)
            .primaryRole(role)
            .givenName(givenName)
            .familyName("Example")
            .gender("Female")
            .dobYear("2000")
            .dobMonth("1")
            .dobDay("15")
            .languages(List.of("English"))
            .tshirt("M")
            .omissionAcknowledged(true);
    }

    public Person registerPerson(Country country, String role, String givenName) {
        return personService.create(admin(), personSubmission(country.getCode(), role, givenName).build());
    }

    public Person registerContestant(Country country, int number) {
        return registerPerson(country, RoleCapabilityTable.CONTESTANT_PREFIX + number,
            country.getCode() + " contestant " + number);
    }

    /**
     * Close registration so that scores may be entered.
     */
    public void closeRegistration() {
        EventState state = eventStateRepository.load();
        state.changeFlags(false, false, state.isSelfScoringEnabled());
        eventStateRepository.save(state);
    }
}
