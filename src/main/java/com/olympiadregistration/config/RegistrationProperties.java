package com.olympiadregistration.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static event configuration bound from the {@code registration} prefix.
 */
@ConfigurationProperties(prefix = "registration")
@Validated
@Getter
@Setter
public class RegistrationProperties {

    public enum EventType { IN_PERSON, VIRTUAL }

    @NotBlank
    private String shortName = "XMO";

    @Min(1900)
    private int year = 2015;

    @NotEmpty
    private List<Integer> marksPerProblem = new ArrayList<>(List.of(7, 7, 7, 7, 7, 7));

    @Min(1)
    private int contestantsPerTeam = 6;

    private EventType eventType = EventType.IN_PERSON;

    /**
     * Genders permitted for contestants; empty means unrestricted.
     */
    private List<String> contestantGenders = new ArrayList<>();

    private boolean requireDateOfBirth;
    private boolean requirePassportNumber;
    private boolean requireNationality;
    private boolean requireDiet;

    /**
     * Whether consent choices (event photos, registration photo, diet) are collected.
     */
    private boolean consentUi;

    private boolean honourableMentions = true;

    private int maxLanguages = 2;

    private LocalDate earliestDateOfBirth = LocalDate.of(1995, 4, 2);
    private LocalDate sanityDateOfBirth = LocalDate.of(2014, 1, 1);
    private LocalDate earliestPlausibleDateOfBirth = LocalDate.of(1902, 1, 1);
    private LocalDate latestPlausibleDateOfBirth;
    private LocalDate ageDay = LocalDate.of(2015, 4, 1);
    private LocalDate earliestArrivalDate = LocalDate.of(2015, 3, 31);
    private LocalDate latestArrivalDate = LocalDate.of(2015, 4, 2);
    private LocalDate earliestDepartureDate = LocalDate.of(2015, 4, 1);
    private LocalDate latestDepartureDate = LocalDate.of(2015, 4, 3);

    @NotBlank
    private String genericUrlBase = "https://www.example.org/";
    private String genericUrlDescription = "example.org URL";
    private String genericUrlDescriptionPlural = "example.org URLs";

    /**
     * Directory holding {@code countries.csv} and {@code people.csv} from
     * previous events; unset disables the roster cross-check.
     */
    private String rosterDirectory;

    private List<String> genders = new ArrayList<>(List.of("Female", "Male", "Other"));
    private List<String> languages = new ArrayList<>(List.of("English", "French", "German", "Russian", "Spanish"));
    private List<String> tshirtSizes = new ArrayList<>(List.of("S", "M", "L", "XL", "XXL", "XXXL"));
    private List<String> locations = new ArrayList<>();

    private Rooms rooms = new Rooms();

    /**
     * Staff roles that may also be held as secondary roles by participants.
     */
    private List<String> extraAdminRoles = new ArrayList<>();

    /**
     * Badge colour overrides keyed by role name.
     */
    private Map<String, Badge> badgeColours = new LinkedHashMap<>();

    private Staff staff = new Staff();

    /**
     * Login accounts. Passwords use Spring Security's encoded form, for
     * example {@code {bcrypt}...}.
     */
    private List<Account> accounts = new ArrayList<>();

    @Getter
    @Setter
    public static class Rooms {
        private List<String> types = new ArrayList<>(List.of("Shared room", "Single room"));
        private List<String> contestantTypes = new ArrayList<>(List.of("Shared room"));
        private List<String> nonContestantTypes = new ArrayList<>(List.of("Shared room", "Single room"));
        private String defaultContestant = "Shared room";
        private String defaultNonContestant = "Shared room";

        /**
         * Permitted room types keyed by role name.
         */
        private Map<String, List<String>> roleOverrides = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Badge {
        private String outer;
        private String inner;
        private String text = "000000";
    }

    @Getter
    @Setter
    public static class Staff {
        private String countryCode = "ZZA";
    }

    @Getter
    @Setter
    public static class Account {
        private String username;
        private String password;

        /**
         * One of {@code ADMIN}, {@code REGISTER}, {@code SELFREG}, {@code SCORE}.
         */
        private String role;

        /**
         * Country a {@code REGISTER} account registers for.
         */
        private Long countryId;

        /**
         * Person a {@code SELFREG} account is bound to.
         */
        private Long personId;
    }
}
