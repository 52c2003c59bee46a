package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.exception.FormatInvalidException;
import com.olympiadregistration.domain.exception.RequiredFieldMissingException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless parsers and checkers for individual field values.
 *
 * <p>Every parser treats null or blank input as "no value" and returns
 * null or an empty result; malformed input is a {@link FormatInvalidException}
 * naming the field.
 */
public final class FieldValidators {

    private static final Pattern SMALL_INT = Pattern.compile("0|[1-9][0-9]{0,8}");
    private static final Pattern HEX_COLOUR = Pattern.compile("[0-9A-Fa-f]{6}");
    private static final Pattern EMAIL = Pattern.compile(
        "[A-Za-z0-9.!#$%&'*+/=?^_`{|}~-]+@[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?"
            + "(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]*[A-Za-z0-9])?)+");
    private static final Pattern EMAIL_SEPARATOR = Pattern.compile("[,\\r\\n]+");
    private static final Pattern GENERIC_URL_NUMBER = Pattern.compile("([1-9][0-9]*)/");

    private FieldValidators() {
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Trim a value, mapping blank to null.
     */
    public static String clean(String value) {
        return isBlank(value) ? null : value.trim();
    }

    /**
     * Parse a non-negative integer written as plain digits without a leading
     * zero (other than {@code 0} itself).
     *
     * @param value raw value
     * @param description field description used in the error message
     * @param max inclusive maximum
     * @return parsed value, or null if blank
     */
    public static Integer parseSmallInt(String value, String description, int max) {
        if (isBlank(value)) {
            return null;
        }
        String trimmed = value.trim();
        if (!SMALL_INT.matcher(trimmed).matches()) {
            throw new FormatInvalidException("Invalid " + description);
        }
        int parsed = Integer.parseInt(trimmed);
        if (parsed > max) {
            throw new FormatInvalidException("Invalid " + description);
        }
        return parsed;
    }

    public static boolean isEmail(String value) {
        return value != null && EMAIL.matcher(value).matches();
    }

    /**
     * Split a field holding several addresses on commas and newlines and
     * check each one. Empty entries are dropped.
     *
     * @param value raw value
     * @param description field description used in the error message
     * @return the addresses in order
     */
    public static List<String> parseEmails(String value, String description) {
        List<String> result = new ArrayList<>();
        if (isBlank(value)) {
            return result;
        }
        for (String part : EMAIL_SEPARATOR.split(value)) {
            String address = part.trim();
            if (address.isEmpty()) {
                continue;
            }
            if (!isEmail(address)) {
                throw new FormatInvalidException("Invalid " + description);
            }
            result.add(address);
        }
        return result;
    }

    /**
     * Check a single address.
     *
     * @return the trimmed address, or null if blank
     */
    public static String parseEmail(String value, String description) {
        String cleaned = clean(value);
        if (cleaned != null && !isEmail(cleaned)) {
            throw new FormatInvalidException("Invalid " + description);
        }
        return cleaned;
    }

    public static boolean isHexColour(String value) {
        return value != null && HEX_COLOUR.matcher(value).matches();
    }

    /**
     * Parse an ISO date ({@code yyyy-mm-dd}).
     */
    public static LocalDate parseDate(String value, String description) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new FormatInvalidException("Invalid " + description);
        }
    }

    /**
     * Build a date from year, month and day parts, all of which must be
     * supplied if any is. A partly filled date fails naming the missing part
     * even for incomplete registrations.
     *
     * @param description prefix for the missing-part messages, e.g. "of birth"
     * @return the date, or null if all three parts are blank
     */
    public static LocalDate parseDateParts(String year, String month, String day, String description) {
        boolean anySet = !isBlank(year) || !isBlank(month) || !isBlank(day);
        if (!anySet) {
            return null;
        }
        if (isBlank(year)) {
            throw new RequiredFieldMissingException("No year " + description + " specified");
        }
        if (isBlank(month)) {
            throw new RequiredFieldMissingException("No month " + description + " specified");
        }
        if (isBlank(day)) {
            throw new RequiredFieldMissingException("No day " + description + " specified");
        }
        try {
            return LocalDate.of(
                parseSmallInt(year, "year " + description, 9999),
                parseSmallInt(month, "month " + description, 12),
                parseSmallInt(day, "day " + description, 31));
        } catch (DateTimeException e) {
            throw new FormatInvalidException("Invalid date " + description);
        }
    }

    /**
     * Build a time of day. A missing minute defaults to zero; a minute
     * without an hour is rejected.
     *
     * @return the time, or null if both parts are blank
     */
    public static LocalTime parseTime(String hour, String minute, String description) {
        if (isBlank(hour)) {
            if (!isBlank(minute)) {
                throw new FormatInvalidException("No hour of " + description + " specified");
            }
            return null;
        }
        int h = parseTwoDigits(hour, "hour of " + description, 23);
        int m = isBlank(minute) ? 0 : parseTwoDigits(minute, "minute of " + description, 59);
        return LocalTime.of(h, m);
    }

    /**
     * Match a URL of the form {@code <base><kind>s/<kind>N/} and return N.
     *
     * @param url candidate URL
     * @param base configured base URL, ending in a slash
     * @param kind {@code country} or {@code person}
     */
    public static Optional<Integer> genericUrlNumber(String url, String base, String kind) {
        String prefix = genericUrlPrefix(base, kind);
        if (url == null || !url.startsWith(prefix)) {
            return Optional.empty();
        }
        Matcher m = GENERIC_URL_NUMBER.matcher(url.substring(prefix.length()));
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static String genericUrlPrefix(String base, String kind) {
        String collection = "person".equals(kind) ? "people" : kind.replaceAll("y$", "ie") + "s";
        return base + collection + "/" + kind;
    }

    private static int parseTwoDigits(String value, String description, int max) {
        String trimmed = value.trim();
        if (!trimmed.matches("[0-9]{1,2}")) {
            throw new FormatInvalidException("Invalid " + description);
        }
        int parsed = Integer.parseInt(trimmed);
        if (parsed > max) {
            throw new FormatInvalidException("Invalid " + description);
        }
        return parsed;
    }
}
