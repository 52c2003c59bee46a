package com.olympiadregistration.application.export;

import com.olympiadregistration.application.ContestantResult;
import com.olympiadregistration.application.ScoringService;
import com.olympiadregistration.application.bulk.CountryImportSchema;
import com.olympiadregistration.application.bulk.PersonImportSchema;
import com.olympiadregistration.domain.audit.EventRules;
import com.olympiadregistration.domain.audit.FieldValidators;
import com.olympiadregistration.domain.audit.RoleCapabilityTable;
import com.olympiadregistration.domain.model.*;
import com.olympiadregistration.domain.repository.CountryRepository;
import com.olympiadregistration.domain.repository.EventStateRepository;
import com.olympiadregistration.domain.repository.PersonRepository;
import com.olympiadregistration.domain.visibility.FileOwnership;
import com.olympiadregistration.domain.visibility.FileVisibilityResolver;
import com.olympiadregistration.domain.visibility.Viewer;
import com.olympiadregistration.infrastructure.csv.CsvSpreadsheetCodec;
import com.olympiadregistration.infrastructure.security.ActorContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalTime;
import java.time.Period;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.olympiadregistration.application.bulk.CountryImportSchema.*;
import static com.olympiadregistration.application.bulk.PersonImportSchema.*;

/**
 * CSV exports of countries, people and scores, always rebuilt from the
 * current store state.
 *
 * <p>Administrators get the full column set. Everyone else gets the public
 * columns, and file URLs only for files they may view. Column names match
 * the bulk import columns, so an administrator's export can be imported
 * again unchanged.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class RegistrationExportService {

    public static final String FILE_URL_PREFIX = "/api/v1/files/";

    static final String NORMAL = "Normal";
    static final String FLAG_URL = "Flag URL";
    static final String COUNTRY_NAME = "Country Name";
    static final String CONTESTANT_CODE = "Contestant Code";
    static final String CONTESTANT_AGE = "Contestant Age";
    static final String TOTAL = "Total";
    static final String AWARD = "Award";
    static final String PHOTO_URL = "Photo URL";
    static final String CONSENT_FORM_URL = "Consent Form URL";
    static final String INCOMPLETE = "Incomplete";
    static final String NAME_COLUMN = "Name";

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    private final CountryRepository countryRepository;
    private final PersonRepository personRepository;
    private final EventStateRepository eventStateRepository;
    private final RoleCapabilityTable roles;
    private final EventRules rules;
    private final FileVisibilityResolver visibilityResolver;
    private final ScoringService scoringService;
    private final CsvSpreadsheetCodec codec;

    /**
     * {@code countries.csv}: active countries ordered by code.
     */
    public byte[] countriesCsv(ActorContext actor) {
        boolean admin = actor.isAdministrator();
        Viewer viewer = actor.toViewer();
        List<Country> countries = countryRepository.findAllActive();

        int extraContacts = countries.stream().mapToInt(c -> c.getContactExtra().size()).max().orElse(0);
        List<String> columns = new ArrayList<>(List.of(COUNTRY_NUMBER, CODE, CountryImportSchema.NAME,
            FLAG_URL, CountryImportSchema.GENERIC_NUMBER, NORMAL));
        if (admin) {
            for (int n = 1; n <= 1 + extraContacts; n++) {
                columns.add(CONTACT_EMAIL_PREFIX + n);
            }
            columns.addAll(List.of(EXPECTED_LEADERS, EXPECTED_DEPUTIES, EXPECTED_CONTESTANTS,
                EXPECTED_OBSERVERS_LEADER, EXPECTED_OBSERVERS_DEPUTY, EXPECTED_OBSERVERS_CONTESTANTS,
                EXPECTED_SINGLE_ROOMS));
            if (rules.isVirtualEvent()) {
                columns.addAll(List.of(LEADER_EMAIL, PHYSICAL_ADDRESS));
            }
        }

        List<Map<String, String>> rows = new ArrayList<>();
        for (Country country : countries) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put(COUNTRY_NUMBER, String.valueOf(country.getId()));
            row.put(CODE, country.getCode());
            row.put(CountryImportSchema.NAME, country.getName());
            row.put(FLAG_URL, fileUrl(country.getFlag(), file -> FileOwnership.ofCountry(country, file), viewer));
            row.put(CountryImportSchema.GENERIC_NUMBER, genericNumber(country.getGenericUrl(), "country"));
            row.put(NORMAL, yesNo(country.isNormal()));
            if (admin) {
                row.put(CONTACT_EMAIL_PREFIX + 1, String.join(",", country.getContactEmails()));
                List<String> extra = country.getContactExtra();
                for (int i = 0; i < extra.size(); i++) {
                    row.put(CONTACT_EMAIL_PREFIX + (i + 2), extra.get(i));
                }
                ExpectedNumbers expected = country.getExpected();
                if (country.isNormal() && expected != null) {
                    row.put(EXPECTED_LEADERS, text(expected.getLeaders()));
                    row.put(EXPECTED_DEPUTIES, text(expected.getDeputies()));
                    row.put(EXPECTED_CONTESTANTS, text(expected.getContestants()));
                    row.put(EXPECTED_OBSERVERS_LEADER, text(expected.getObserversWithLeader()));
                    row.put(EXPECTED_OBSERVERS_DEPUTY, text(expected.getObserversWithDeputy()));
                    row.put(EXPECTED_OBSERVERS_CONTESTANTS, text(expected.getObserversWithContestants()));
                    row.put(EXPECTED_SINGLE_ROOMS, text(expected.getSingleRooms()));
                }
                row.put(LEADER_EMAIL, country.getLeaderEmail());
                row.put(PHYSICAL_ADDRESS, country.getPhysicalAddress());
            }
            rows.add(row);
        }
        log.info("Countries exported: rows={}, admin={}", rows.size(), admin);
        return codec.write(columns, rows, ',');
    }

    /**
     * {@code people.csv}: active people ordered by country code, then by
     * primary role, then by id.
     */
    public byte[] peopleCsv(ActorContext actor) {
        boolean admin = actor.isAdministrator();
        Viewer viewer = actor.toViewer();
        MedalBoundaries boundaries = eventStateRepository.load().getMedalBoundaries();

        List<String> columns = new ArrayList<>(List.of(PERSON_NUMBER, COUNTRY_NAME, COUNTRY_CODE,
            PRIMARY_ROLE, OTHER_ROLES, GUIDE_FOR, CONTESTANT_CODE, GIVEN_NAME, FAMILY_NAME));
        columns.addAll(problemColumns());
        columns.addAll(List.of(TOTAL, AWARD, PHOTO_URL, PersonImportSchema.GENERIC_NUMBER));
        if (admin) {
            columns.addAll(List.of(CONTESTANT_AGE, GENDER, DATE_OF_BIRTH, LANGUAGES, DIET, TSHIRT,
                ARRIVAL_PLACE, ARRIVAL_DATE, ARRIVAL_TIME, ARRIVAL_FLIGHT,
                DEPARTURE_PLACE, DEPARTURE_DATE, DEPARTURE_TIME, DEPARTURE_FLIGHT,
                ROOM_TYPE, ROOM_SHARE_WITH, ROOM_NUMBER, PHONE_NUMBER,
                PASSPORT_GIVEN_NAME, PASSPORT_FAMILY_NAME, PASSPORT_NUMBER, NATIONALITY,
                EVENT_PHOTOS_CONSENT, PHOTO_CONSENT, DIET_CONSENT, CONSENT_FORM_URL, INCOMPLETE));
        }

        List<Person> people = personRepository.findAllActive().stream()
            .sorted(Comparator.comparing((Person p) -> p.getCountry().getCode())
                .thenComparing(p -> Objects.toString(p.getPrimaryRole(), ""))
                .thenComparing(Person::getId))
            .toList();

        List<Map<String, String>> rows = new ArrayList<>();
        for (Person person : people) {
            boolean contestant = roles.isContestant(person);
            Map<String, String> row = new LinkedHashMap<>();
            row.put(PERSON_NUMBER, String.valueOf(person.getId()));
            row.put(COUNTRY_NAME, person.getCountry().getName());
            row.put(COUNTRY_CODE, person.getCountry().getCode());
            row.put(PRIMARY_ROLE, person.getPrimaryRole());
            row.put(OTHER_ROLES, person.getOtherRoles().stream().sorted().collect(Collectors.joining(",")));
            row.put(GUIDE_FOR, person.getGuideFor().stream().map(Country::getCode).sorted()
                .collect(Collectors.joining(",")));
            row.put(CONTESTANT_CODE, roles.contestantCode(person).orElse(""));
            row.put(GIVEN_NAME, person.getGivenName());
            row.put(FAMILY_NAME, person.getFamilyName());
            for (int p = 1; p <= rules.getNumProblems(); p++) {
                row.put("P" + p, text(person.getScores().get(p)));
            }
            row.put(TOTAL, contestant ? String.valueOf(person.totalScore()) : "");
            row.put(AWARD, contestant && boundaries.isSet() ? awardLabel(person, boundaries) : "");
            row.put(PHOTO_URL, fileUrl(person.getPhoto(), file -> FileOwnership.ofPerson(person, file), viewer));
            row.put(PersonImportSchema.GENERIC_NUMBER, genericNumber(person.getGenericUrl(), "person"));
            if (admin) {
                putAdminColumns(row, person, contestant, viewer);
            }
            rows.add(row);
        }
        log.info("People exported: rows={}, admin={}", rows.size(), admin);
        return codec.write(columns, rows, ',');
    }

    /**
     * {@code scores.csv}: every active contestant's scores, total and award.
     */
    public byte[] scoresCsv() {
        List<String> columns = new ArrayList<>(List.of(COUNTRY_CODE, CONTESTANT_CODE, NAME_COLUMN));
        columns.addAll(problemColumns());
        columns.addAll(List.of(TOTAL, AWARD));

        List<Map<String, String>> rows = new ArrayList<>();
        for (ContestantResult result : scoringService.results()) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put(COUNTRY_CODE, result.countryCode());
            row.put(CONTESTANT_CODE, result.contestantCode());
            row.put(NAME_COLUMN, result.name());
            for (int p = 1; p <= result.scores().size(); p++) {
                row.put("P" + p, text(result.scores().get(p - 1)));
            }
            row.put(TOTAL, String.valueOf(result.total()));
            row.put(AWARD, result.award() == null ? "" : result.award().getLabel());
            rows.add(row);
        }
        log.info("Scores exported: rows={}", rows.size());
        return codec.write(columns, rows, ',');
    }

    private void putAdminColumns(Map<String, String> row, Person person, boolean contestant, Viewer viewer) {
        row.put(CONTESTANT_AGE, contestant && person.getDateOfBirth() != null && rules.getAgeDay() != null
            ? String.valueOf(Period.between(person.getDateOfBirth(), rules.getAgeDay()).getYears())
            : "");
        row.put(GENDER, person.getGender());
        row.put(DATE_OF_BIRTH, text(person.getDateOfBirth()));
        row.put(LANGUAGES, String.join(",", person.getLanguages()));
        row.put(DIET, person.getDiet());
        row.put(TSHIRT, person.getTshirt());
        putTravel(row, person.getArrival(), ARRIVAL_PLACE, ARRIVAL_DATE, ARRIVAL_TIME, ARRIVAL_FLIGHT);
        putTravel(row, person.getDeparture(), DEPARTURE_PLACE, DEPARTURE_DATE, DEPARTURE_TIME, DEPARTURE_FLIGHT);
        row.put(ROOM_TYPE, person.getRoomType());
        row.put(ROOM_SHARE_WITH, person.getRoomShareWith());
        row.put(ROOM_NUMBER, person.getRoomNumber());
        row.put(PHONE_NUMBER, person.getPhoneNumber());
        row.put(PASSPORT_GIVEN_NAME, person.getPassportGivenName());
        row.put(PASSPORT_FAMILY_NAME, person.getPassportFamilyName());
        row.put(PASSPORT_NUMBER, person.getPassportNumber());
        row.put(NATIONALITY, person.getNationality());
        row.put(EVENT_PHOTOS_CONSENT, person.getEventPhotosConsent() == null ? ""
            : yesNo(person.getEventPhotosConsent()));
        row.put(PHOTO_CONSENT, person.getPhotoConsent() == null ? "" : person.getPhotoConsent().getCode());
        row.put(DIET_CONSENT, person.getDietConsent() == null ? "" : yesNo(person.getDietConsent()));
        row.put(CONSENT_FORM_URL, fileUrl(person.getConsentForm(), file -> FileOwnership.ofPerson(person, file),
            viewer));
        row.put(INCOMPLETE, yesNo(person.isIncomplete()));
    }

    private static void putTravel(Map<String, String> row, TravelLeg leg, String place, String date, String time,
                                  String flight) {
        row.put(place, leg.getPlace());
        row.put(date, text(leg.getDate()));
        LocalTime t = leg.getTime();
        row.put(time, t == null ? "" : t.format(TIME));
        row.put(flight, leg.getFlight());
    }

    private List<String> problemColumns() {
        List<String> result = new ArrayList<>();
        for (int p = 1; p <= rules.getNumProblems(); p++) {
            result.add("P" + p);
        }
        return result;
    }

    private String awardLabel(Person person, MedalBoundaries boundaries) {
        return Award.derive(person.getScores(), boundaries, rules.getMarksPerProblem(),
            rules.isHonourableMentions()).getLabel();
    }

    private String genericNumber(String url, String kind) {
        return FieldValidators.genericUrlNumber(url, rules.getGenericUrlBase(), kind)
            .map(String::valueOf)
            .orElse("");
    }

    private String fileUrl(RegistrationFile file, Function<RegistrationFile, FileOwnership> ownership,
                           Viewer viewer) {
        if (file == null || !visibilityResolver.canView(file, ownership.apply(file), viewer)) {
            return "";
        }
        return FILE_URL_PREFIX + file.getId();
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }
}
