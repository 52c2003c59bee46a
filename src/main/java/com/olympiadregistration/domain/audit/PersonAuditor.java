package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.exception.*;
import com.olympiadregistration.domain.model.*;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.*;
import java.util.function.Function;

import static com.olympiadregistration.domain.audit.FieldValidators.clean;

/**
 * Validates and normalizes one Person create or edit.
 *
 * <p>Required-field checks are skipped for registrations an administrator
 * marks incomplete; every format and range check still applies.
 */
@Slf4j
public class PersonAuditor {

    /**
     * Diet recorded when consent to store dietary information is withdrawn.
     */
    public static final String DIET_UNKNOWN = "Unknown";

    /**
     * Audit a create or edit.
     *
     * @param submission raw submitted values
     * @param previous the stored record, or null on create
     * @param byAdministrator whether the editor is an administrator
     * @param context event configuration and state
     * @param view store state the submission is checked against
     * @return the normalized field set to store
     */
    public PersonFields audit(PersonSubmission submission, Person previous, boolean byAdministrator,
                              EventContext context, RegistrationView view) {
        EventRules rules = context.rules();
        Required required = new Required(submission.isOmissionAcknowledged());

        boolean incomplete = incomplete(submission, previous, byAdministrator);
        boolean checkRequired = !incomplete;

        Country country = country(submission, previous, view, required);
        String primaryRole = required.value(pick(submission.getPrimaryRole(), previous, Person::getPrimaryRole),
            previous, Person::getPrimaryRole, "primary_role", "primary role");
        RoleCapability capability = context.roles().find(primaryRole)
            .orElseThrow(() -> new ReferenceInvalidException("Invalid role " + primaryRole));

        String givenName = checkRequired
            ? required.value(pick(submission.getGivenName(), previous, Person::getGivenName), previous,
                Person::getGivenName, "given_name", "given name")
            : optional(submission.getGivenName(), previous, Person::getGivenName);
        String familyName = checkRequired
            ? required.value(pick(submission.getFamilyName(), previous, Person::getFamilyName), previous,
                Person::getFamilyName, "family_name", "family name")
            : optional(submission.getFamilyName(), previous, Person::getFamilyName);
        String gender = checkRequired
            ? required.value(pick(submission.getGender(), previous, Person::getGender), previous,
                Person::getGender, "gender", "gender")
            : optional(submission.getGender(), previous, Person::getGender);
        String tshirt = checkRequired
            ? required.value(pick(submission.getTshirt(), previous, Person::getTshirt), previous,
                Person::getTshirt, "tshirt", "T-shirt size")
            : optional(submission.getTshirt(), previous, Person::getTshirt);

        Set<String> otherRoles = otherRoles(submission, previous, context.roles());
        checkRoles(country, capability, otherRoles, context.roles());
        if (!country.isStaff() && capability.isUniquePerCountry()
                && view.roleTaken(country, primaryRole, previous == null ? null : previous.getId())) {
            throw new UniquenessViolationException("A person with this role already exists");
        }
        Set<Country> guideFor = guideFor(submission, previous, capability, view);

        checkGender(gender, capability, rules);

        LocalDate dateOfBirth = dateOfBirth(submission, previous);
        if (dateOfBirth == null && checkRequired && (rules.isRequireDateOfBirth() || capability.isContestant())) {
            throw required.missing("date_of_birth", "date of birth");
        }
        checkDateOfBirth(dateOfBirth, capability, rules);

        List<String> languages = languages(submission, previous, rules);
        if (languages.isEmpty() && checkRequired) {
            throw required.missing("language_1", "first language");
        }
        if (tshirt != null && !rules.getTshirtSizes().isEmpty() && !rules.getTshirtSizes().contains(tshirt)) {
            throw new ReferenceInvalidException("Invalid T-shirt size " + tshirt);
        }

        String passportNumber = optional(submission.getPassportNumber(), previous, Person::getPassportNumber);
        if (passportNumber == null && checkRequired && rules.isRequirePassportNumber()) {
            throw required.missing("passport_number", "passport number");
        }
        String nationality = optional(submission.getNationality(), previous, Person::getNationality);
        if (nationality == null && checkRequired && rules.isRequireNationality()) {
            throw required.missing("nationality", "nationality");
        }

        TravelLeg arrival = travelLeg(submission.getArrivalPlace(), submission.getArrivalDate(),
            submission.getArrivalHour(), submission.getArrivalMinute(), submission.getArrivalFlight(),
            previous == null ? null : previous.getArrival(), "arrival", rules);
        TravelLeg departure = travelLeg(submission.getDeparturePlace(), submission.getDepartureDate(),
            submission.getDepartureHour(), submission.getDepartureMinute(), submission.getDepartureFlight(),
            previous == null ? null : previous.getDeparture(), "departure", rules);
        checkTravelDates(arrival, departure, rules);

        String roomType = roomType(submission, previous, capability, byAdministrator, rules);

        String phoneNumber = optional(submission.getPhoneNumber(), previous, Person::getPhoneNumber);
        if (phoneNumber != null && !capability.staffOnly()) {
            throw new FormatInvalidException("Phone numbers may only be entered for staff");
        }

        String genericUrl = submission.getGenericUrl() == null
            ? (previous == null ? null : previous.getGenericUrl())
            : clean(submission.getGenericUrl());
        if (genericUrl != null && submission.getGenericUrl() != null) {
            CountryAuditor.checkGenericUrl(genericUrl, "person", context);
        }

        VerifiedUpload photo = UploadVerifier.verify(submission.getPhoto(), FileKind.PHOTO);
        VerifiedUpload consentForm = UploadVerifier.verify(submission.getConsentForm(), FileKind.CONSENT_FORM);

        String diet = optional(submission.getDiet(), previous, Person::getDiet);
        Boolean eventPhotosConsent = null;
        PhotoConsent photoConsent = null;
        Boolean dietConsent = null;
        if (rules.isConsentUi()) {
            eventPhotosConsent = submission.getEventPhotosConsent() != null
                ? submission.getEventPhotosConsent()
                : previous == null ? null : previous.getEventPhotosConsent();
            if (eventPhotosConsent == null && checkRequired) {
                throw required.missing("event_photos_consent", "choice of consent for event photos");
            }
            dietConsent = submission.getDietConsent() != null
                ? submission.getDietConsent()
                : previous == null ? null : previous.getDietConsent();
            if (dietConsent == null && checkRequired) {
                throw required.missing("diet_consent",
                    "choice of consent for allergies and dietary requirements information");
            }
            photoConsent = photoConsent(submission, previous);
            boolean hasPhoto = photo != null || (previous != null && previous.getPhoto() != null);
            if (hasPhoto && photoConsent == null && checkRequired) {
                throw required.missing("photo_consent", "choice of consent for registration photo");
            }
            if (Boolean.FALSE.equals(dietConsent)) {
                diet = DIET_UNKNOWN;
            }
        }
        if (diet == null && checkRequired && rules.isRequireDiet()) {
            throw required.missing("diet", "dietary requirements");
        }

        log.debug("Person audit passed: country={}, role={}, create={}, incomplete={}",
            country.getCode(), primaryRole, previous == null, incomplete);

        return PersonFields.builder()
            .country(country)
            .primaryRole(primaryRole)
            .otherRoles(otherRoles)
            .guideFor(guideFor)
            .givenName(givenName)
            .familyName(familyName)
            .passportGivenName(optional(submission.getPassportGivenName(), previous,
                Person::getPassportGivenName))
            .passportFamilyName(optional(submission.getPassportFamilyName(), previous,
                Person::getPassportFamilyName))
            .gender(gender)
            .dateOfBirth(dateOfBirth)
            .languages(languages)
            .diet(diet)
            .tshirt(tshirt)
            .arrival(arrival)
            .departure(departure)
            .roomType(roomType)
            .roomShareWith(optional(submission.getRoomShareWith(), previous, Person::getRoomShareWith))
            .roomNumber(optional(submission.getRoomNumber(), previous, Person::getRoomNumber))
            .phoneNumber(phoneNumber)
            .passportNumber(passportNumber)
            .nationality(nationality)
            .genericUrl(genericUrl)
            .incomplete(incomplete)
            .eventPhotosConsent(eventPhotosConsent)
            .photoConsent(photoConsent)
            .dietConsent(dietConsent)
            .photo(photo)
            .consentForm(consentForm)
            .build();
    }

    private static boolean incomplete(PersonSubmission submission, Person previous, boolean byAdministrator) {
        if (!byAdministrator) {
            if (Boolean.TRUE.equals(submission.getIncomplete())) {
                throw new PermissionDeniedException("Only administrators may mark registrations incomplete");
            }
            return false;
        }
        if (submission.getIncomplete() != null) {
            return submission.getIncomplete();
        }
        return previous != null && previous.isIncomplete();
    }

    private static Country country(PersonSubmission submission, Person previous, RegistrationView view,
                                   Required required) {
        String code = clean(submission.getCountryCode());
        if (code == null && previous != null) {
            return view.countryByCode(previous.getCountry().getCode())
                .orElseThrow(() -> new ReferenceInvalidException("Invalid country"));
        }
        if (code == null) {
            throw required.missing("country", "country");
        }
        Country country = view.countryByCode(code)
            .orElseThrow(() -> new ReferenceInvalidException("Invalid country"));
        if (!country.isParticipantsOk()) {
            throw new ReferenceInvalidException("Invalid country");
        }
        return country;
    }

    private static Set<String> otherRoles(PersonSubmission submission, Person previous,
                                          RoleCapabilityTable roles) {
        if (submission.getOtherRoles() == null) {
            return previous == null ? Set.of() : previous.getOtherRoles();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String raw : submission.getOtherRoles()) {
            String role = clean(raw);
            if (role != null) {
                result.add(roles.require(role).name());
            }
        }
        return result;
    }

    private static void checkRoles(Country country, RoleCapability primary, Set<String> otherRoles,
                                   RoleCapabilityTable roles) {
        if (country.isStaff()) {
            if (!primary.staffOnly()) {
                throw new FormatInvalidException("Staff must have administrative roles");
            }
            for (String role : otherRoles) {
                if (!roles.require(role).staffOnly()) {
                    throw new FormatInvalidException("Staff must have administrative roles");
                }
            }
            return;
        }
        if (primary.staffOnly()) {
            throw new FormatInvalidException("Invalid role for participant");
        }
        for (String role : otherRoles) {
            if (!roles.require(role).secondaryOk()) {
                throw new FormatInvalidException("Non-staff may not have secondary roles");
            }
        }
    }

    private static Set<Country> guideFor(PersonSubmission submission, Person previous, RoleCapability capability,
                                         RegistrationView view) {
        Set<Country> result = new LinkedHashSet<>();
        if (submission.getGuideFor() == null) {
            if (previous != null) {
                result.addAll(previous.getGuideFor());
            }
        } else {
            for (String raw : submission.getGuideFor()) {
                String code = clean(raw);
                if (code == null) {
                    continue;
                }
                Country guided = view.countryByCode(code)
                    .orElseThrow(() -> new ReferenceInvalidException("Invalid country " + code));
                if (guided.isStaff() || !guided.isParticipantsOk()) {
                    throw new FormatInvalidException("May only guide normal countries");
                }
                result.add(guided);
            }
        }
        if (!result.isEmpty() && !capability.canGuide()) {
            throw new FormatInvalidException("People with this role may not guide countries");
        }
        return result;
    }

    private static void checkGender(String gender, RoleCapability capability, EventRules rules) {
        if (gender == null) {
            return;
        }
        if (!rules.getGenders().isEmpty() && !rules.getGenders().contains(gender)) {
            throw new ReferenceInvalidException("Invalid gender " + gender);
        }
        List<String> allowed = capability.allowedGenders();
        if (capability.isContestant() && !allowed.isEmpty() && !allowed.contains(gender)) {
            throw new FormatInvalidException("Contestant gender must be " + orList(allowed));
        }
    }

    static String orList(List<String> values) {
        if (values.size() == 1) {
            return values.get(0);
        }
        return String.join(", ", values.subList(0, values.size() - 1)) + " or " + values.get(values.size() - 1);
    }

    private static LocalDate dateOfBirth(PersonSubmission s, Person previous) {
        LocalDate stored = previous == null ? null : previous.getDateOfBirth();
        String year = s.getDobYear() != null ? s.getDobYear() : stored == null ? null : String.valueOf(stored.getYear());
        String month = s.getDobMonth() != null ? s.getDobMonth()
            : stored == null ? null : String.valueOf(stored.getMonthValue());
        String day = s.getDobDay() != null ? s.getDobDay()
            : stored == null ? null : String.valueOf(stored.getDayOfMonth());
        return FieldValidators.parseDateParts(year, month, day, "of birth");
    }

    private static void checkDateOfBirth(LocalDate dateOfBirth, RoleCapability capability, EventRules rules) {
        if (dateOfBirth == null) {
            return;
        }
        if (capability.isContestant()) {
            if (rules.getEarliestContestantDateOfBirth() != null
                    && dateOfBirth.isBefore(rules.getEarliestContestantDateOfBirth())) {
                throw new FormatInvalidException("Contestant too old");
            }
            if (rules.getSanityDateOfBirth() != null && !dateOfBirth.isBefore(rules.getSanityDateOfBirth())) {
                throw new FormatInvalidException("Contestant implausibly young");
            }
        }
        if (rules.getEarliestPlausibleDateOfBirth() != null
                && dateOfBirth.isBefore(rules.getEarliestPlausibleDateOfBirth())) {
            throw new FormatInvalidException("Participant implausibly old");
        }
        if (rules.getLatestPlausibleDateOfBirth() != null
                && dateOfBirth.isAfter(rules.getLatestPlausibleDateOfBirth())) {
            throw new FormatInvalidException("Participant implausibly young");
        }
    }

    private static List<String> languages(PersonSubmission submission, Person previous, EventRules rules) {
        if (submission.getLanguages() == null) {
            return previous == null ? List.of() : previous.getLanguages();
        }
        List<String> result = new ArrayList<>();
        for (String raw : submission.getLanguages()) {
            String language = clean(raw);
            if (language == null) {
                continue;
            }
            if (!rules.getLanguages().isEmpty() && !rules.getLanguages().contains(language)) {
                throw new ReferenceInvalidException("Invalid language " + language);
            }
            if (result.contains(language)) {
                throw new FormatInvalidException("Language " + language + " specified more than once");
            }
            result.add(language);
        }
        if (rules.getMaxLanguages() > 0 && result.size() > rules.getMaxLanguages()) {
            throw new FormatInvalidException("At most " + rules.getMaxLanguages() + " languages may be specified");
        }
        return result;
    }

    private static TravelLeg travelLeg(String place, String date, String hour, String minute, String flight,
                                       TravelLeg stored, String direction, EventRules rules) {
        String resolvedPlace = place != null ? clean(place) : stored == null ? null : stored.getPlace();
        if (resolvedPlace != null && !rules.getLocations().isEmpty()
                && !rules.getLocations().contains(resolvedPlace)) {
            throw new ReferenceInvalidException("Invalid " + direction + " place " + resolvedPlace);
        }
        LocalDate resolvedDate = date != null
            ? FieldValidators.parseDate(date, direction + " date")
            : stored == null ? null : stored.getDate();

        LocalTime resolvedTime;
        if (hour != null || minute != null) {
            LocalTime storedTime = stored == null ? null : stored.getTime();
            if (hour == null && storedTime != null) {
                hour = String.valueOf(storedTime.getHour());
            }
            if (minute == null && storedTime != null && !FieldValidators.isBlank(hour)) {
                minute = String.valueOf(storedTime.getMinute());
            }
            resolvedTime = FieldValidators.parseTime(hour, minute, direction);
        } else {
            resolvedTime = stored == null ? null : stored.getTime();
        }
        String resolvedFlight = flight != null ? clean(flight) : stored == null ? null : stored.getFlight();

        if (resolvedDate == null) {
            return new TravelLeg(resolvedPlace, null, null, null);
        }
        return new TravelLeg(resolvedPlace, resolvedDate, resolvedTime, resolvedFlight);
    }

    private static void checkTravelDates(TravelLeg arrival, TravelLeg departure, EventRules rules) {
        LocalDate arrivalDate = arrival.getDate();
        LocalDate departureDate = departure.getDate();
        if (arrivalDate != null) {
            if (rules.getEarliestArrivalDate() != null && arrivalDate.isBefore(rules.getEarliestArrivalDate())) {
                throw new FormatInvalidException("Arrival date too early");
            }
            if (rules.getLatestArrivalDate() != null && arrivalDate.isAfter(rules.getLatestArrivalDate())) {
                throw new FormatInvalidException("Arrival date too late");
            }
        }
        if (departureDate != null) {
            if (rules.getEarliestDepartureDate() != null
                    && departureDate.isBefore(rules.getEarliestDepartureDate())) {
                throw new FormatInvalidException("Departure date too early");
            }
            if (rules.getLatestDepartureDate() != null && departureDate.isAfter(rules.getLatestDepartureDate())) {
                throw new FormatInvalidException("Departure date too late");
            }
        }
        if (arrivalDate != null && departureDate != null) {
            if (arrivalDate.isAfter(departureDate)) {
                throw new FormatInvalidException("Arrival date after departure date");
            }
            if (arrivalDate.equals(departureDate) && arrival.getTime() != null && departure.getTime() != null
                    && arrival.getTime().isAfter(departure.getTime())) {
                throw new FormatInvalidException("Arrival time after departure time");
            }
        }
    }

    private static String roomType(PersonSubmission submission, Person previous, RoleCapability capability,
                                   boolean byAdministrator, EventRules rules) {
        String submitted = submission.getRoomType() == null ? null : clean(submission.getRoomType());
        if (submitted == null) {
            String stored = submission.getRoomType() == null && previous != null ? previous.getRoomType() : null;
            if (stored != null && (byAdministrator || capability.roomTypes().contains(stored))) {
                return stored;
            }
            return capability.defaultRoomType();
        }
        if (byAdministrator) {
            if (!rules.getRoomTypes().isEmpty() && !rules.getRoomTypes().contains(submitted)) {
                throw new ReferenceInvalidException("Invalid room type " + submitted);
            }
            return submitted;
        }
        if (!capability.roomTypes().contains(submitted)) {
            throw new FormatInvalidException("Room type " + submitted + " not permitted for this role");
        }
        return submitted;
    }

    private static PhotoConsent photoConsent(PersonSubmission submission, Person previous) {
        if (submission.getPhotoConsent() == null) {
            return previous == null ? null : previous.getPhotoConsent();
        }
        String code = clean(submission.getPhotoConsent());
        if (code == null) {
            return null;
        }
        return PhotoConsent.fromCode(code)
            .orElseThrow(() -> new ReferenceInvalidException("Invalid choice of consent for registration photo"));
    }

    private static String pick(String submitted, Person previous, Function<Person, String> getter) {
        if (submitted != null) {
            return submitted;
        }
        return previous == null ? null : getter.apply(previous);
    }

    private static String optional(String submitted, Person previous, Function<Person, String> getter) {
        if (submitted != null) {
            return clean(submitted);
        }
        return previous == null ? null : getter.apply(previous);
    }

    /**
     * Required-field lookup with the two message phrasings.
     */
    private static final class Required {

        private final boolean acknowledged;

        Required(boolean acknowledged) {
            this.acknowledged = acknowledged;
        }

        /**
         * Resolve a required value. Clearing a stored value restores it.
         */
        String value(String resolved, Person previous, Function<Person, String> getter,
                     String property, String description) {
            String value = clean(resolved);
            if (value == null && previous != null) {
                value = getter.apply(previous);
            }
            if (value == null) {
                throw missing(property, description);
            }
            return value;
        }

        RequiredFieldMissingException missing(String property, String description) {
            return acknowledged
                ? new RequiredFieldMissingException("No " + description + " specified")
                : new RequiredFieldMissingException("Required person property " + property + " not supplied");
        }
    }
}
