package com.olympiadregistration.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Normalized field set for a Person, as accepted by the person auditor.
 * Null uploads keep the current files.
 */
@Value
@Builder(toBuilder = true)
public class PersonFields {

    Country country;
    String primaryRole;
    @Builder.Default
    Set<String> otherRoles = Set.of();
    @Builder.Default
    Set<Country> guideFor = Set.of();
    String givenName;
    String familyName;
    String passportGivenName;
    String passportFamilyName;
    String gender;
    LocalDate dateOfBirth;
    @Builder.Default
    List<String> languages = List.of();
    String diet;
    String tshirt;
    TravelLeg arrival;
    TravelLeg departure;
    String roomType;
    String roomShareWith;
    String roomNumber;
    String phoneNumber;
    String passportNumber;
    String nationality;
    String genericUrl;
    boolean incomplete;
    Boolean eventPhotosConsent;
    PhotoConsent photoConsent;
    Boolean dietConsent;
    VerifiedUpload photo;
    VerifiedUpload consentForm;
}
