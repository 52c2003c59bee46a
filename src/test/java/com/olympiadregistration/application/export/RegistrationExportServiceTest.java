package com.olympiadregistration.application.export;

import com.olympiadregistration.application.bulk.BulkImportResult;
import com.olympiadregistration.domain.audit.CountrySubmission;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.FileUpload;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.infrastructure.csv.CsvSpreadsheetCodec;
import com.olympiadregistration.infrastructure.csv.Spreadsheet;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.support.RegistrationTestContext;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.olympiadregistration.support.RegistrationTestContext.JPEG;
import static com.olympiadregistration.support.RegistrationTestContext.PNG;
import static com.olympiadregistration.support.RegistrationTestContext.admin;
import static com.olympiadregistration.support.RegistrationTestContext.delegate;
import static com.olympiadregistration.support.RegistrationTestContext.personSubmission;
import static com.olympiadregistration.support.RegistrationTestContext.scorer;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class RegistrationExportServiceTest {

    private final CsvSpreadsheetCodec codec = new CsvSpreadsheetCodec();

    private Spreadsheet parse(byte[] csv) {
        assertEquals((byte) 0xef, csv[0]);
        return codec.read(csv, ',');
    }

    @Test
    void public_countries_export_hides_contact_details() {
        RegistrationTestContext ctx = new RegistrationTestContext();
        Country abc = ctx.getCountryService().create(admin(), CountrySubmission.builder()
            .code("ABC")
            .name("Absurdia")
            .contactEmails("abc@example.org")
            .flag(new FileUpload("abc.png", PNG))
            .genericUrl("https://www.example.org/countries/country42/")
            .build());
        ctx.registerCountry("XYZ", "Xylophonia");

        Spreadsheet anonymous = parse(ctx.getExportService().countriesCsv(ActorContext.anonymous()));

        assertEquals(List.of("Country Number", "Code", "Name", "Flag URL", "Generic Number", "Normal"),
            anonymous.header());
        assertEquals(List.of("ABC", "XYZ", RegistrationTestContext.STAFF_CODE),
            anonymous.rows().stream().map(row -> row.get("Code")).toList());
        Map<String, String> first = anonymous.rows().get(0);
        assertEquals(String.valueOf(abc.getId()), first.get("Country Number"));
        assertEquals("/api/v1/files/" + abc.getFlag().getId(), first.get("Flag URL"));
        assertEquals("42", first.get("Generic Number"));
        assertEquals("Yes", first.get("Normal"));
        assertEquals("No", anonymous.rows().get(2).get("Normal"));

        Spreadsheet full = parse(ctx.getExportService().countriesCsv(admin()));
        assertTrue(full.header().contains("Contact Email 1"));
        assertTrue(full.header().contains("Expected Contestants"));
        assertFalse(full.header().contains("Leader Email"));
        assertEquals("abc@example.org", full.rows().get(0).get("Contact Email 1"));
    }

    @Test
    void countries_export_reimports_into_fresh_event() {
        RegistrationTestContext source = new RegistrationTestContext();
        source.registerCountry("ABC", "Absurdia");
        source.registerCountry("XYZ", "Xylophonia");
        String exported = new String(source.getExportService().countriesCsv(admin()), UTF_8);
        String normalOnly = Arrays.stream(exported.split("\n"))
            .filter(line -> !line.contains("," + RegistrationTestContext.STAFF_CODE + ","))
            .collect(Collectors.joining("\n", "", "\n"));

        RegistrationTestContext target = new RegistrationTestContext();
        BulkImportResult result = target.getBulkImportService().importCountries(admin(),
            normalOnly.getBytes(UTF_8), ',', null, false);

        assertEquals(2, result.createdIds().size());
        Country abc = target.getCountryRepository().findActiveByCode("ABC").orElseThrow();
        assertEquals("Absurdia", abc.getName());
        assertEquals(List.of("abc@example.org"), abc.getContactEmails());
    }

    @Test
    void people_export_reimports_into_fresh_event() {
        RegistrationTestContext source = new RegistrationTestContext();
        Country abc = source.registerCountry("ABC", "Absurdia");
        source.registerPerson(abc, "Leader", "Ada");
        source.registerContestant(abc, 1);
        byte[] exported = source.getExportService().peopleCsv(admin());

        RegistrationTestContext target = new RegistrationTestContext();
        target.registerCountry("ABC", "Absurdia");
        BulkImportResult result = target.getBulkImportService().importPeople(admin(), exported, ',', null, false);

        assertEquals(2, result.createdIds().size());
        for (Person original : source.getPersonRepository().findAllActive()) {
            Person copy = target.getPersonRepository().findAllActive().stream()
                .filter(p -> p.getPrimaryRole().equals(original.getPrimaryRole()))
                .findFirst()
                .orElseThrow();
            assertEquals(original.getGivenName(), copy.getGivenName());
            assertEquals(original.getFamilyName(), copy.getFamilyName());
            assertEquals(original.getGender(), copy.getGender());
            assertEquals(original.getDateOfBirth(), copy.getDateOfBirth());
            assertEquals(original.getLanguages(), copy.getLanguages());
            assertEquals(original.getTshirt(), copy.getTshirt());
            assertEquals(original.getRoomType(), copy.getRoomType());
        }
    }

    @Test
    void people_export_filters_photo_and_admin_columns() {
        RegistrationTestContext ctx = new RegistrationTestContext(
            RegistrationTestContext.defaultRules().toBuilder().consentUi(true).build());
        Country abc = ctx.registerCountry("ABC", "Absurdia");
        Person leader = ctx.getPersonService().create(admin(), personSubmission("ABC", "Leader", "Ada")
            .eventPhotosConsent(true)
            .dietConsent(true)
            .photoConsent("no")
            .photo(new FileUpload("ada.jpg", JPEG))
            .build());

        Spreadsheet anonymous = parse(ctx.getExportService().peopleCsv(ActorContext.anonymous()));
        assertFalse(anonymous.header().contains("Date of Birth"));
        assertFalse(anonymous.header().contains("Incomplete"));
        Map<String, String> row = anonymous.rows().get(0);
        assertEquals("ABC", row.get("Country Code"));
        assertEquals("Ada", row.get("Given Name"));
        assertEquals("", row.get("Photo URL"));

        Map<String, String> own = parse(ctx.getExportService().peopleCsv(delegate(abc))).rows().get(0);
        assertEquals("/api/v1/files/" + leader.getPhoto().getId(), own.get("Photo URL"));

        Map<String, String> full = parse(ctx.getExportService().peopleCsv(admin())).rows().get(0);
        assertEquals("2000-01-15", full.get("Date of Birth"));
        assertEquals("no", full.get("Photo Consent"));
        assertEquals("No", full.get("Incomplete"));
        assertEquals("", full.get("Contestant Age"));
    }

    @Test
    void scores_export_carries_totals_and_awards() {
        RegistrationTestContext ctx = new RegistrationTestContext();
        Country abc = ctx.registerCountry("ABC", "Absurdia");
        ctx.registerContestant(abc, 1);
        ctx.registerContestant(abc, 2);
        ctx.closeRegistration();
        ctx.getScoringService().enterScores(scorer(), "ABC", 1, Map.of("ABC1", "7", "ABC2", "1"));
        ctx.getScoringService().enterScores(scorer(), "ABC", 2, Map.of("ABC1", "7", "ABC2", "1"));
        ctx.getScoringService().enterScores(scorer(), "ABC", 3, Map.of("ABC1", "7", "ABC2", "1"));
        ctx.getScoringService().setMedalBoundaries(admin(), "20", "14", "7");

        Spreadsheet scores = parse(ctx.getExportService().scoresCsv());

        assertEquals(List.of("Country Code", "Contestant Code", "Name", "P1", "P2", "P3", "Total", "Award"),
            scores.header());
        assertEquals("ABC1", scores.rows().get(0).get("Contestant Code"));
        assertEquals("21", scores.rows().get(0).get("Total"));
        assertEquals("Gold Medal", scores.rows().get(0).get("Award"));
        assertEquals("3", scores.rows().get(1).get("Total"));
        assertEquals("", scores.rows().get(1).get("Award"));

        Map<String, String> person = parse(ctx.getExportService().peopleCsv(admin())).rows().get(0);
        assertEquals("ABC1", person.get("Contestant Code"));
        assertEquals("7", person.get("P2"));
        assertEquals("Gold Medal", person.get("Award"));
        assertEquals("15", person.get("Contestant Age"));
    }
}
