package com.olympiadregistration.application.bulk;

import com.olympiadregistration.domain.audit.CountrySubmission;
import com.olympiadregistration.domain.audit.EventRules;
import com.olympiadregistration.domain.audit.FieldValidators;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Columns of a country bulk import.
 *
 * <p>{@code Contact Email 1} holds the main contact addresses and
 * {@code Contact Email 2}, {@code Contact Email 3}, ... the extra ones;
 * numbering stops at the first missing column. The previous participation
 * URL comes from {@code Generic Number}, or from {@code Country Number}
 * when the file has no {@code Generic Number} column.
 */
@Component
@RequiredArgsConstructor
public class CountryImportSchema implements ImportSchema<CountrySubmission> {

    public static final String COUNTRY_NUMBER = "Country Number";
    public static final String GENERIC_NUMBER = "Generic Number";
    public static final String CODE = "Code";
    public static final String NAME = "Name";
    public static final String CONTACT_EMAIL_PREFIX = "Contact Email ";
    public static final String EXPECTED_LEADERS = "Expected Leaders";
    public static final String EXPECTED_DEPUTIES = "Expected Deputies";
    public static final String EXPECTED_CONTESTANTS = "Expected Contestants";
    public static final String EXPECTED_OBSERVERS_LEADER = "Expected Observers with Leader";
    public static final String EXPECTED_OBSERVERS_DEPUTY = "Expected Observers with Deputy";
    public static final String EXPECTED_OBSERVERS_CONTESTANTS = "Expected Observers with Contestants";
    public static final String EXPECTED_SINGLE_ROOMS = "Expected Single Rooms";
    public static final String LEADER_EMAIL = "Leader Email";
    public static final String PHYSICAL_ADDRESS = "Physical Address";
    public static final String FLAG = "Flag";

    private static final List<ColumnSpec> COLUMNS = List.of(
        ColumnSpec.unique(COUNTRY_NUMBER, false),
        ColumnSpec.optional(GENERIC_NUMBER),
        ColumnSpec.unique(CODE, true),
        ColumnSpec.required(NAME),
        ColumnSpec.optional(EXPECTED_LEADERS),
        ColumnSpec.optional(EXPECTED_DEPUTIES),
        ColumnSpec.optional(EXPECTED_CONTESTANTS),
        ColumnSpec.optional(EXPECTED_OBSERVERS_LEADER),
        ColumnSpec.optional(EXPECTED_OBSERVERS_DEPUTY),
        ColumnSpec.optional(EXPECTED_OBSERVERS_CONTESTANTS),
        ColumnSpec.optional(EXPECTED_SINGLE_ROOMS),
        ColumnSpec.optional(LEADER_EMAIL),
        ColumnSpec.optional(PHYSICAL_ADDRESS),
        ColumnSpec.optional(FLAG));

    private final EventRules rules;

    @Override
    public String kind() {
        return "countries";
    }

    @Override
    public List<ColumnSpec> columns() {
        return COLUMNS;
    }

    @Override
    public CountrySubmission toSubmission(ImportRow row, AttachmentArchive attachments) {
        List<String> contacts = contactEmails(row);
        return CountrySubmission.builder()
            .code(row.get(CODE))
            .name(row.get(NAME))
            .contactEmails(contacts.isEmpty() ? null : contacts.get(0))
            .contactExtra(contacts.size() > 1 ? String.join(",", contacts.subList(1, contacts.size())) : null)
            .expectedLeaders(row.get(EXPECTED_LEADERS))
            .expectedDeputies(row.get(EXPECTED_DEPUTIES))
            .expectedContestants(row.get(EXPECTED_CONTESTANTS))
            .expectedObserversWithLeader(row.get(EXPECTED_OBSERVERS_LEADER))
            .expectedObserversWithDeputy(row.get(EXPECTED_OBSERVERS_DEPUTY))
            .expectedObserversWithContestants(row.get(EXPECTED_OBSERVERS_CONTESTANTS))
            .expectedSingleRooms(row.get(EXPECTED_SINGLE_ROOMS))
            .genericUrl(genericUrl(row))
            .leaderEmail(row.get(LEADER_EMAIL))
            .physicalAddress(row.get(PHYSICAL_ADDRESS))
            .flag(attachments.get(row.get(FLAG), row.number()))
            .build();
    }

    private static List<String> contactEmails(ImportRow row) {
        List<String> result = new ArrayList<>();
        String first = row.get(CONTACT_EMAIL_PREFIX + 1);
        if (first == null) {
            return result;
        }
        result.add(first);
        for (int n = 2; row.has(CONTACT_EMAIL_PREFIX + n); n++) {
            result.add(row.get(CONTACT_EMAIL_PREFIX + n));
        }
        return result;
    }

    private String genericUrl(ImportRow row) {
        String number = row.hasColumn(GENERIC_NUMBER) ? row.get(GENERIC_NUMBER) : row.get(COUNTRY_NUMBER);
        if (number == null) {
            return null;
        }
        return FieldValidators.genericUrlPrefix(rules.getGenericUrlBase(), "country") + number + "/";
    }
}
