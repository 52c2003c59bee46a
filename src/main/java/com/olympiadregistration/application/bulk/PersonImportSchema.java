package com.olympiadregistration.application.bulk;

import com.olympiadregistration.domain.audit.EventRules;
import com.olympiadregistration.domain.audit.FieldValidators;
import com.olympiadregistration.domain.audit.PersonSubmission;
import com.olympiadregistration.domain.exception.BulkImportException;
import com.olympiadregistration.domain.exception.FormatInvalidException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Columns of a person bulk import.
 *
 * <p>Dates are ISO ({@code 2000-01-31}), times are {@code HH:MM}, and the
 * consent columns take {@code Yes} or {@code No}. {@code Guide For} lists
 * country codes.
 */
@Component
@RequiredArgsConstructor
public class PersonImportSchema implements ImportSchema<PersonSubmission> {

    public static final String PERSON_NUMBER = "Person Number";
    public static final String GENERIC_NUMBER = "Generic Number";
    public static final String COUNTRY_CODE = "Country Code";
    public static final String PRIMARY_ROLE = "Primary Role";
    public static final String OTHER_ROLES = "Other Roles";
    public static final String GUIDE_FOR = "Guide For";
    public static final String GIVEN_NAME = "Given Name";
    public static final String FAMILY_NAME = "Family Name";
    public static final String PASSPORT_GIVEN_NAME = "Passport Given Name";
    public static final String PASSPORT_FAMILY_NAME = "Passport Family Name";
    public static final String GENDER = "Gender";
    public static final String DATE_OF_BIRTH = "Date of Birth";
    public static final String LANGUAGES = "Languages";
    public static final String DIET = "Allergies and Dietary Requirements";
    public static final String TSHIRT = "T-Shirt Size";
    public static final String ARRIVAL_PLACE = "Arrival Place";
    public static final String ARRIVAL_DATE = "Arrival Date";
    public static final String ARRIVAL_TIME = "Arrival Time";
    public static final String ARRIVAL_FLIGHT = "Arrival Flight";
    public static final String DEPARTURE_PLACE = "Departure Place";
    public static final String DEPARTURE_DATE = "Departure Date";
    public static final String DEPARTURE_TIME = "Departure Time";
    public static final String DEPARTURE_FLIGHT = "Departure Flight";
    public static final String ROOM_TYPE = "Room Type";
    public static final String ROOM_SHARE_WITH = "Share Room With";
    public static final String ROOM_NUMBER = "Room Number";
    public static final String PHONE_NUMBER = "Phone Number";
    public static final String PASSPORT_NUMBER = "Passport or Identity Card Number";
    public static final String NATIONALITY = "Nationality";
    public static final String EVENT_PHOTOS_CONSENT = "Event Photos Consent";
    public static final String PHOTO_CONSENT = "Photo Consent";
    public static final String DIET_CONSENT = "Allergies and Dietary Requirements Consent";
    public static final String PHOTO = "Photo";
    public static final String CONSENT_FORM = "Consent Form";

    private static final List<ColumnSpec> COLUMNS = List.of(
        ColumnSpec.unique(PERSON_NUMBER, false),
        ColumnSpec.optional(GENERIC_NUMBER),
        ColumnSpec.optional(COUNTRY_CODE),
        ColumnSpec.required(PRIMARY_ROLE),
        ColumnSpec.list(OTHER_ROLES),
        ColumnSpec.list(GUIDE_FOR),
        ColumnSpec.required(GIVEN_NAME),
        ColumnSpec.required(FAMILY_NAME),
        ColumnSpec.optional(PASSPORT_GIVEN_NAME),
        ColumnSpec.optional(PASSPORT_FAMILY_NAME),
        ColumnSpec.optional(GENDER),
        ColumnSpec.optional(DATE_OF_BIRTH),
        ColumnSpec.list(LANGUAGES),
        ColumnSpec.optional(DIET),
        ColumnSpec.optional(TSHIRT),
        ColumnSpec.optional(ARRIVAL_PLACE),
        ColumnSpec.optional(ARRIVAL_DATE),
        ColumnSpec.optional(ARRIVAL_TIME),
        ColumnSpec.optional(ARRIVAL_FLIGHT),
        ColumnSpec.optional(DEPARTURE_PLACE),
        ColumnSpec.optional(DEPARTURE_DATE),
        ColumnSpec.optional(DEPARTURE_TIME),
        ColumnSpec.optional(DEPARTURE_FLIGHT),
        ColumnSpec.optional(ROOM_TYPE),
        ColumnSpec.optional(ROOM_SHARE_WITH),
        ColumnSpec.optional(ROOM_NUMBER),
        ColumnSpec.optional(PHONE_NUMBER),
        ColumnSpec.optional(PASSPORT_NUMBER),
        ColumnSpec.optional(NATIONALITY),
        ColumnSpec.optional(EVENT_PHOTOS_CONSENT),
        ColumnSpec.optional(PHOTO_CONSENT),
        ColumnSpec.optional(DIET_CONSENT),
        ColumnSpec.optional(PHOTO),
        ColumnSpec.optional(CONSENT_FORM));

    private final EventRules rules;

    @Override
    public String kind() {
        return "people";
    }

    @Override
    public List<ColumnSpec> columns() {
        return COLUMNS;
    }

    @Override
    public PersonSubmission toSubmission(ImportRow row, AttachmentArchive attachments) {
        int n = row.number();
        LocalDate dateOfBirth = date(row, DATE_OF_BIRTH, "date of birth");
        String[] arrivalTime = time(row, ARRIVAL_TIME, "arrival time");
        String[] departureTime = time(row, DEPARTURE_TIME, "departure time");

        return PersonSubmission.builder()
            .countryCode(row.get(COUNTRY_CODE))
            .primaryRole(row.get(PRIMARY_ROLE))
            .otherRoles(row.list(OTHER_ROLES))
            .guideFor(row.list(GUIDE_FOR))
            .givenName(row.get(GIVEN_NAME))
            .familyName(row.get(FAMILY_NAME))
            .passportGivenName(row.get(PASSPORT_GIVEN_NAME))
            .passportFamilyName(row.get(PASSPORT_FAMILY_NAME))
            .gender(row.get(GENDER))
            .dobYear(dateOfBirth == null ? null : String.valueOf(dateOfBirth.getYear()))
            .dobMonth(dateOfBirth == null ? null : String.valueOf(dateOfBirth.getMonthValue()))
            .dobDay(dateOfBirth == null ? null : String.valueOf(dateOfBirth.getDayOfMonth()))
            .languages(row.list(LANGUAGES))
            .diet(row.get(DIET))
            .tshirt(row.get(TSHIRT))
            .arrivalPlace(row.get(ARRIVAL_PLACE))
            .arrivalDate(row.get(ARRIVAL_DATE))
            .arrivalHour(arrivalTime[0])
            .arrivalMinute(arrivalTime[1])
            .arrivalFlight(row.get(ARRIVAL_FLIGHT))
            .departurePlace(row.get(DEPARTURE_PLACE))
            .departureDate(row.get(DEPARTURE_DATE))
            .departureHour(departureTime[0])
            .departureMinute(departureTime[1])
            .departureFlight(row.get(DEPARTURE_FLIGHT))
            .roomType(row.get(ROOM_TYPE))
            .roomShareWith(row.get(ROOM_SHARE_WITH))
            .roomNumber(row.get(ROOM_NUMBER))
            .phoneNumber(row.get(PHONE_NUMBER))
            .passportNumber(row.get(PASSPORT_NUMBER))
            .nationality(row.get(NATIONALITY))
            .genericUrl(genericUrl(row))
            .eventPhotosConsent(yesNo(row, EVENT_PHOTOS_CONSENT))
            .photoConsent(row.get(PHOTO_CONSENT))
            .dietConsent(yesNo(row, DIET_CONSENT))
            .photo(attachments.get(row.get(PHOTO), n))
            .consentForm(attachments.get(row.get(CONSENT_FORM), n))
            .build();
    }

    private String genericUrl(ImportRow row) {
        String number = row.hasColumn(GENERIC_NUMBER) ? row.get(GENERIC_NUMBER) : row.get(PERSON_NUMBER);
        if (number == null) {
            return null;
        }
        return FieldValidators.genericUrlPrefix(rules.getGenericUrlBase(), "person") + number + "/";
    }

    private static LocalDate date(ImportRow row, String column, String description) {
        try {
            return FieldValidators.parseDate(row.get(column), description);
        } catch (FormatInvalidException e) {
            throw new BulkImportException(row.number(), e);
        }
    }

    /**
     * Split {@code HH:MM} into hour and minute; a value without a colon is
     * taken as the hour alone.
     */
    private static String[] time(ImportRow row, String column, String description) {
        String value = row.get(column);
        if (value == null) {
            return new String[] {null, null};
        }
        String[] parts = value.split(":", -1);
        if (parts.length > 2) {
            throw new BulkImportException(row.number(), new FormatInvalidException("Invalid " + description));
        }
        return new String[] {parts[0], parts.length == 2 ? parts[1] : null};
    }

    private static Boolean yesNo(ImportRow row, String column) {
        String value = row.get(column);
        if (value == null) {
            return null;
        }
        if (value.equalsIgnoreCase("yes")) {
            return Boolean.TRUE;
        }
        if (value.equalsIgnoreCase("no")) {
            return Boolean.FALSE;
        }
        throw new BulkImportException(row.number(), new FormatInvalidException("Invalid " + column));
    }
}
