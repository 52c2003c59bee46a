package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.model.FileUpload;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw Person field values as submitted by a form or a bulk import row.
 *
 * <p>A null field was not submitted and keeps its previous value; an empty
 * string clears it. Countries are referenced by code and roles by name.
 */
@Value
@Builder(toBuilder = true)
public class PersonSubmission {

    String countryCode;
    String primaryRole;
    List<String> otherRoles;
    List<String> guideFor;
    String givenName;
    String familyName;
    String passportGivenName;
    String passportFamilyName;
    String gender;
    String dobYear;
    String dobMonth;
    String dobDay;
    List<String> languages;
    String diet;
    String tshirt;
    String arrivalPlace;
    String arrivalDate;
    String arrivalHour;
    String arrivalMinute;
    String arrivalFlight;
    String departurePlace;
    String departureDate;
    String departureHour;
    String departureMinute;
    String departureFlight;
    String roomType;
    String roomShareWith;
    String roomNumber;
    String phoneNumber;
    String passportNumber;
    String nationality;
    String genericUrl;
    Boolean incomplete;
    Boolean eventPhotosConsent;
    String photoConsent;
    Boolean dietConsent;
    FileUpload photo;
    FileUpload consentForm;

    /**
     * Whether the caller's form presented every required field, so that an
     * omission gets a friendly "No X specified" message.
     */
    boolean omissionAcknowledged;
}
