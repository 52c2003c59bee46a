package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.exception.*;
import com.olympiadregistration.domain.model.*;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static com.olympiadregistration.domain.audit.FieldValidators.clean;

/**
 * Validates and normalizes one Country create or edit.
 *
 * <p>Checks run in a fixed order and the first failure is thrown:
 * required fields, code shape, uniqueness, immutable flags, expected
 * numbers, emails, generic URL, flag upload, virtual-event contact details.
 */
@Slf4j
public class CountryAuditor {

    private static final Pattern CODE = Pattern.compile("[A-Z]+");

    /**
     * Audit a full create or edit.
     *
     * @param submission raw submitted values
     * @param previous the stored record, or null on create
     * @param context event configuration and state
     * @param view store state the submission is checked against
     * @return the normalized field set to store
     */
    public CountryFields audit(CountrySubmission submission, Country previous, EventContext context,
                               RegistrationView view) {
        Long previousId = previous == null ? null : previous.getId();

        String code = required(submission.getCode(), previous, Country::getCode,
            "code", "country code", submission.isOmissionAcknowledged());
        String name = required(submission.getName(), previous, Country::getName,
            "name", "country name", submission.isOmissionAcknowledged());

        if (!CODE.matcher(code).matches()) {
            throw new FormatInvalidException("Country codes must be all capital letters");
        }
        if (view.countryCodeTaken(code, previousId)) {
            throw new UniquenessViolationException("A country with code " + code + " already exists");
        }
        if (view.countryNameTaken(name, previousId)) {
            throw new UniquenessViolationException("A country with name " + name + " already exists");
        }

        boolean staff = immutableFlag(submission.getStaff(), previous, Country::isStaff, false,
            "Cannot change whether a country is normal");
        boolean participantsOk = immutableFlag(submission.getParticipantsOk(), previous,
            Country::isParticipantsOk, true, "Cannot change whether a country can have participants");

        ExpectedNumbers expected = expectedNumbers(submission, previous, staff, context.rules());

        List<String> contactEmails = submission.getContactEmails() != null
            ? FieldValidators.parseEmails(submission.getContactEmails(), "contact email address")
            : previous == null ? List.of() : previous.getContactEmails();
        List<String> contactExtra = submission.getContactExtra() != null
            ? FieldValidators.parseEmails(submission.getContactExtra(), "extra contact email address")
            : previous == null ? List.of() : previous.getContactExtra();

        String genericUrl = genericUrl(submission.getGenericUrl(), previous, context);
        VerifiedUpload flag = UploadVerifier.verify(submission.getFlag(), FileKind.FLAG);

        String leaderEmail = virtualOnly(submission.getLeaderEmail(), previous, Country::getLeaderEmail,
            context.rules(), "Leader email");
        if (leaderEmail != null) {
            leaderEmail = FieldValidators.parseEmail(leaderEmail, "leader email address");
        }
        String physicalAddress = virtualOnly(submission.getPhysicalAddress(), previous,
            Country::getPhysicalAddress, context.rules(), "Physical address");

        log.debug("Country audit passed: code={}, create={}", code, previous == null);

        return CountryFields.builder()
            .code(code)
            .name(name)
            .staff(staff)
            .participantsOk(participantsOk)
            .contactEmails(contactEmails)
            .contactExtra(contactExtra)
            .expected(expected)
            .numbersConfirmed(previous != null && previous.isNumbersConfirmed())
            .genericUrl(genericUrl)
            .leaderEmail(leaderEmail)
            .physicalAddress(physicalAddress)
            .flag(flag)
            .build();
    }

    /**
     * Audit a delegate's preregistration edit, which may change only the
     * expected numbers and the virtual-event contact details.
     *
     * @return the field set to store, or empty if the submission changes
     *         nothing and there is nothing to confirm
     * @throws StateConflictException if preregistration is disabled and the
     *         values differ from the stored ones
     */
    public Optional<CountryFields> auditPreregistration(CountrySubmission submission, Country previous,
                                                        EventContext context) {
        if (previous.isStaff()) {
            throw new StateConflictException("Preregistration is only for normal countries");
        }
        rejectIfChanged(submission.getCode(), previous.getCode(), "country code");
        rejectIfChanged(submission.getName(), previous.getName(), "country name");
        rejectIfChanged(submission.getGenericUrl(), previous.getGenericUrl(), "generic URL");
        if (submission.getFlag() != null || submission.getStaff() != null
                || submission.getParticipantsOk() != null || submission.getContactEmails() != null
                || submission.getContactExtra() != null) {
            throw new PermissionDeniedException("Only preregistration details may be changed");
        }

        boolean enabled = context.status().preregistrationEnabled();
        if (!differsFrom(submission, previous)) {
            if (enabled && !previous.isNumbersConfirmed()) {
                return Optional.of(preregistrationFields(submission, previous, context));
            }
            return Optional.empty();
        }
        if (!enabled) {
            throw new StateConflictException("Preregistration is now disabled, please contact"
                + " the event organisers to change expected numbers of registered participants");
        }
        return Optional.of(preregistrationFields(submission, previous, context));
    }

    private CountryFields preregistrationFields(CountrySubmission submission, Country previous,
                                                EventContext context) {
        ExpectedNumbers expected = expectedNumbers(submission, previous, false, context.rules());
        String leaderEmail = virtualOnly(submission.getLeaderEmail(), previous, Country::getLeaderEmail,
            context.rules(), "Leader email");
        if (leaderEmail != null) {
            leaderEmail = FieldValidators.parseEmail(leaderEmail, "leader email address");
        }
        String physicalAddress = virtualOnly(submission.getPhysicalAddress(), previous,
            Country::getPhysicalAddress, context.rules(), "Physical address");
        return CountryFields.builder()
            .code(previous.getCode())
            .name(previous.getName())
            .staff(false)
            .participantsOk(previous.isParticipantsOk())
            .contactEmails(previous.getContactEmails())
            .contactExtra(previous.getContactExtra())
            .expected(expected)
            .numbersConfirmed(true)
            .genericUrl(previous.getGenericUrl())
            .leaderEmail(leaderEmail)
            .physicalAddress(physicalAddress)
            .build();
    }

    /**
     * Compare submitted preregistration values with the stored ones as
     * text, so that a resubmission is a no-op even if it would not parse.
     */
    private static boolean differsFrom(CountrySubmission s, Country previous) {
        ExpectedNumbers e = previous.getExpected() == null ? ExpectedNumbers.none() : previous.getExpected();
        return changed(s.getExpectedLeaders(), e.getLeaders())
            || changed(s.getExpectedDeputies(), e.getDeputies())
            || changed(s.getExpectedContestants(), e.getContestants())
            || changed(s.getExpectedObserversWithLeader(), e.getObserversWithLeader())
            || changed(s.getExpectedObserversWithDeputy(), e.getObserversWithDeputy())
            || changed(s.getExpectedObserversWithContestants(), e.getObserversWithContestants())
            || changed(s.getExpectedSingleRooms(), e.getSingleRooms())
            || changed(s.getLeaderEmail(), previous.getLeaderEmail())
            || changed(s.getPhysicalAddress(), previous.getPhysicalAddress());
    }

    private static boolean changed(String submitted, Object stored) {
        return submitted != null && !Objects.equals(clean(submitted), stored == null ? null : stored.toString());
    }

    private static void rejectIfChanged(String submitted, String stored, String description) {
        if (changed(submitted, stored)) {
            throw new PermissionDeniedException("The " + description + " may not be changed in preregistration");
        }
    }

    private static String required(String submitted, Country previous, Function<Country, String> getter,
                                   String property, String description, boolean acknowledged) {
        String value = clean(submitted);
        if (value == null && previous != null) {
            value = getter.apply(previous);
        }
        if (value == null) {
            throw acknowledged
                ? new RequiredFieldMissingException("No " + description + " specified")
                : new RequiredFieldMissingException("Required country property " + property + " not supplied");
        }
        return value;
    }

    private static boolean immutableFlag(Boolean submitted, Country previous, Function<Country, Boolean> getter,
                                         boolean defaultValue, String message) {
        if (previous == null) {
            return submitted != null ? submitted : defaultValue;
        }
        boolean stored = getter.apply(previous);
        if (submitted != null && submitted != stored) {
            throw new StateConflictException(message);
        }
        return stored;
    }

    private static ExpectedNumbers expectedNumbers(CountrySubmission s, Country previous, boolean staff,
                                                   EventRules rules) {
        if (staff) {
            boolean anySupplied = Stream.of(s.getExpectedLeaders(), s.getExpectedDeputies(),
                    s.getExpectedContestants(), s.getExpectedObserversWithLeader(),
                    s.getExpectedObserversWithDeputy(), s.getExpectedObserversWithContestants(),
                    s.getExpectedSingleRooms())
                .anyMatch(v -> !FieldValidators.isBlank(v));
            if (anySupplied) {
                throw new FormatInvalidException("Expected numbers may only be set for normal countries");
            }
            return ExpectedNumbers.none();
        }
        ExpectedNumbers base = previous != null && previous.getExpected() != null
            && previous.getExpected().getLeaders() != null
            ? previous.getExpected()
            : ExpectedNumbers.defaultsFor(rules.getContestantsPerTeam());
        int max = EventRules.MAX_EXPECTED;
        return ExpectedNumbers.builder()
            .leaders(expected(s.getExpectedLeaders(), base.getLeaders(), "expected number of leaders", max))
            .deputies(expected(s.getExpectedDeputies(), base.getDeputies(),
                "expected number of deputies", max))
            .contestants(expected(s.getExpectedContestants(), base.getContestants(),
                "expected number of contestants", rules.getContestantsPerTeam()))
            .observersWithLeader(expected(s.getExpectedObserversWithLeader(), base.getObserversWithLeader(),
                "expected number of Observers with Leader", max))
            .observersWithDeputy(expected(s.getExpectedObserversWithDeputy(), base.getObserversWithDeputy(),
                "expected number of Observers with Deputy", max))
            .observersWithContestants(expected(s.getExpectedObserversWithContestants(),
                base.getObserversWithContestants(), "expected number of Observers with Contestants", max))
            .singleRooms(expected(s.getExpectedSingleRooms(), base.getSingleRooms(),
                "expected number of single room requests", max))
            .build();
    }

    private static Integer expected(String submitted, Integer stored, String description, int max) {
        if (submitted == null) {
            return stored;
        }
        Integer parsed = FieldValidators.parseSmallInt(submitted, description, max);
        if (parsed == null) {
            throw new FormatInvalidException("Invalid " + description);
        }
        return parsed;
    }

    private static String genericUrl(String submitted, Country previous, EventContext context) {
        if (submitted == null) {
            return previous == null ? null : previous.getGenericUrl();
        }
        String url = clean(submitted);
        if (url == null) {
            return null;
        }
        return checkGenericUrl(url, "country", context);
    }

    /**
     * Check a generic URL against its expected shape and, if a roster is
     * configured, against the roster.
     */
    static String checkGenericUrl(String url, String kind, EventContext context) {
        EventRules rules = context.rules();
        int number = FieldValidators.genericUrlNumber(url, rules.getGenericUrlBase(), kind)
            .orElseThrow(() -> new FormatInvalidException(rules.getGenericUrlDescriptionPlural()
                + " for previous participation must be in the form "
                + FieldValidators.genericUrlPrefix(rules.getGenericUrlBase(), kind) + "N/"));
        RosterLookup roster = context.roster();
        boolean known = "person".equals(kind) ? roster.hasPerson(number) : roster.hasCountry(number);
        if (roster.isConfigured() && !known) {
            throw new FormatInvalidException(rules.getGenericUrlDescription()
                + " for previous participation not valid");
        }
        return url;
    }

    private static String virtualOnly(String submitted, Country previous, Function<Country, String> getter,
                                      EventRules rules, String description) {
        String value = submitted != null ? clean(submitted) : previous == null ? null : getter.apply(previous);
        if (value != null && !rules.isVirtualEvent()) {
            throw new FormatInvalidException(description + " may only be specified for virtual events");
        }
        return value;
    }
}
