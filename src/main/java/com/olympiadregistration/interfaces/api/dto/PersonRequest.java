package com.olympiadregistration.interfaces.api.dto;

import com.olympiadregistration.domain.audit.PersonSubmission;
import com.olympiadregistration.domain.model.FileUpload;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for registering or editing a person.
 *
 * Fields left null keep their stored value. Dates of birth are sent as
 * separate year, month and day values, travel times as hour and minute,
 * dates as ISO text. Other countries are referenced by code in
 * {@code guideFor}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonRequest {

    @Size(max = 16)
    private String countryCode;

    @Size(max = 64)
    private String primaryRole;

    private List<String> otherRoles;

    private List<String> guideFor;

    @Size(max = 255, message = "Given name must not exceed 255 characters")
    private String givenName;

    @Size(max = 255, message = "Family name must not exceed 255 characters")
    private String familyName;

    @Size(max = 255)
    private String passportGivenName;

    @Size(max = 255)
    private String passportFamilyName;

    private String gender;

    private String dobYear;
    private String dobMonth;
    private String dobDay;

    private List<String> languages;

    @Size(max = 2000)
    private String diet;

    private String tshirt;

    private String arrivalPlace;
    private String arrivalDate;
    private String arrivalHour;
    private String arrivalMinute;
    private String arrivalFlight;

    private String departurePlace;
    private String departureDate;
    private String departureHour;
    private String departureMinute;
    private String departureFlight;

    private String roomType;

    @Size(max = 255)
    private String roomShareWith;

    @Size(max = 64)
    private String roomNumber;

    @Size(max = 64)
    private String phoneNumber;

    @Size(max = 64)
    private String passportNumber;

    @Size(max = 255)
    private String nationality;

    @Size(max = 500)
    private String genericUrl;

    private Boolean incomplete;

    private Boolean eventPhotosConsent;

    private String photoConsent;

    private Boolean dietConsent;

    public PersonSubmission toSubmission(FileUpload photo, FileUpload consentForm) {
        return PersonSubmission.builder()
            .countryCode(countryCode)
            .primaryRole(primaryRole)
            .otherRoles(otherRoles)
            .guideFor(guideFor)
            .givenName(givenName)
            .familyName(familyName)
            .passportGivenName(passportGivenName)
            .passportFamilyName(passportFamilyName)
            .gender(gender)
            .dobYear(dobYear)
            .dobMonth(dobMonth)
            .dobDay(dobDay)
            .languages(languages)
            .diet(diet)
            .tshirt(tshirt)
            .arrivalPlace(arrivalPlace)
            .arrivalDate(arrivalDate)
            .arrivalHour(arrivalHour)
            .arrivalMinute(arrivalMinute)
            .arrivalFlight(arrivalFlight)
            .departurePlace(departurePlace)
            .departureDate(departureDate)
            .departureHour(departureHour)
            .departureMinute(departureMinute)
            .departureFlight(departureFlight)
            .roomType(roomType)
            .roomShareWith(roomShareWith)
            .roomNumber(roomNumber)
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
            .omissionAcknowledged(true)
            .build();
    }
}
