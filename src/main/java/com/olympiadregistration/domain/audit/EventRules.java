package com.olympiadregistration.domain.audit;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Static event configuration consulted by the auditors.
 */
@Value
@Builder(toBuilder = true)
public class EventRules {

    public static final int MAX_EXPECTED = 1000;

    String shortName;
    int year;
    int numProblems;
    List<Integer> marksPerProblem;
    int contestantsPerTeam;
    boolean virtualEvent;
    boolean consentUi;
    boolean honourableMentions;
    boolean requireDateOfBirth;
    boolean requirePassportNumber;
    boolean requireNationality;
    boolean requireDiet;
    @Builder.Default
    Set<String> genders = Set.of("Female", "Male", "Other");
    @Builder.Default
    Set<String> languages = Set.of();
    @Builder.Default
    Set<String> tshirtSizes = Set.of("S", "M", "L", "XL", "XXL", "XXXL");
    @Builder.Default
    Set<String> locations = Set.of();
    @Builder.Default
    Set<String> roomTypes = Set.of();
    int maxLanguages;
    LocalDate earliestContestantDateOfBirth;
    LocalDate sanityDateOfBirth;
    LocalDate earliestPlausibleDateOfBirth;
    LocalDate latestPlausibleDateOfBirth;
    LocalDate ageDay;
    LocalDate earliestArrivalDate;
    LocalDate latestArrivalDate;
    LocalDate earliestDepartureDate;
    LocalDate latestDepartureDate;
    String genericUrlBase;
    String genericUrlDescription;
    String genericUrlDescriptionPlural;

    /**
     * Sum of marks over all problems.
     */
    public int maxTotal() {
        return marksPerProblem.stream().mapToInt(Integer::intValue).sum();
    }

    public int marksFor(int problem) {
        return marksPerProblem.get(problem - 1);
    }

    public String staffCountryName() {
        return shortName + " " + year + " Staff";
    }
}
