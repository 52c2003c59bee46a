package com.olympiadregistration.interfaces.api.dto;

import com.olympiadregistration.domain.audit.CountrySubmission;
import com.olympiadregistration.domain.model.FileUpload;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or editing a country.
 *
 * Fields left null keep their stored value; an empty string clears an
 * optional field. Numbers are sent as text and checked by the auditor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CountryRequest {

    @Size(max = 16, message = "Country code must not exceed 16 characters")
    private String code;

    @Size(max = 255, message = "Country name must not exceed 255 characters")
    private String name;

    private Boolean staff;

    private Boolean participantsOk;

    @Size(max = 2000, message = "Contact email addresses must not exceed 2000 characters")
    private String contactEmails;

    @Size(max = 2000, message = "Extra contact email addresses must not exceed 2000 characters")
    private String contactExtra;

    private String expectedLeaders;
    private String expectedDeputies;
    private String expectedContestants;
    private String expectedObserversWithLeader;
    private String expectedObserversWithDeputy;
    private String expectedObserversWithContestants;
    private String expectedSingleRooms;

    @Size(max = 500, message = "Generic URL must not exceed 500 characters")
    private String genericUrl;

    @Size(max = 255, message = "Leader email must not exceed 255 characters")
    private String leaderEmail;

    @Size(max = 2000, message = "Physical address must not exceed 2000 characters")
    private String physicalAddress;

    public CountrySubmission toSubmission(FileUpload flag) {
        return CountrySubmission.builder()
            .code(code)
            .name(name)
            .staff(staff)
            .participantsOk(participantsOk)
            .contactEmails(contactEmails)
            .contactExtra(contactExtra)
            .expectedLeaders(expectedLeaders)
            .expectedDeputies(expectedDeputies)
            .expectedContestants(expectedContestants)
            .expectedObserversWithLeader(expectedObserversWithLeader)
            .expectedObserversWithDeputy(expectedObserversWithDeputy)
            .expectedObserversWithContestants(expectedObserversWithContestants)
            .expectedSingleRooms(expectedSingleRooms)
            .genericUrl(genericUrl)
            .leaderEmail(leaderEmail)
            .physicalAddress(physicalAddress)
            .flag(flag)
            .omissionAcknowledged(true)
            .build();
    }
}
