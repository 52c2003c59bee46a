package com.olympiadregistration.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Response DTO for person information. The private registration details
 * are present only for actors allowed to see them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PersonResponse {

    private Long id;
    private Long countryId;
    private String countryCode;
    private String primaryRole;
    private List<String> otherRoles;
    private List<String> guideFor;
    private String contestantCode;
    private String givenName;
    private String familyName;
    private String photoUrl;
    private String genericUrl;
    private Details details;
    private Instant createdAt;
    private Instant updatedAt;
    private Long version;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Details {
        private String passportGivenName;
        private String passportFamilyName;
        private String gender;
        private LocalDate dateOfBirth;
        private List<String> languages;
        private String diet;
        private String tshirt;
        private Travel arrival;
        private Travel departure;
        private String roomType;
        private String roomShareWith;
        private String roomNumber;
        private String phoneNumber;
        private String passportNumber;
        private String nationality;
        private boolean incomplete;
        private Boolean eventPhotosConsent;
        private String photoConsent;
        private Boolean dietConsent;
        private String consentFormUrl;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Travel {
        private String place;
        private LocalDate date;
        private LocalTime time;
        private String flight;
    }
}
