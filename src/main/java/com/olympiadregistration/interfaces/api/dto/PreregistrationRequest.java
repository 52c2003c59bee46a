package com.olympiadregistration.interfaces.api.dto;

import com.olympiadregistration.domain.audit.CountrySubmission;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a delegate's preregistration of expected numbers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreregistrationRequest {

    private String expectedLeaders;
    private String expectedDeputies;
    private String expectedContestants;
    private String expectedObserversWithLeader;
    private String expectedObserversWithDeputy;
    private String expectedObserversWithContestants;
    private String expectedSingleRooms;

    @Size(max = 255, message = "Leader email must not exceed 255 characters")
    private String leaderEmail;

    @Size(max = 2000, message = "Physical address must not exceed 2000 characters")
    private String physicalAddress;

    public CountrySubmission toSubmission() {
        return CountrySubmission.builder()
            .expectedLeaders(expectedLeaders)
            .expectedDeputies(expectedDeputies)
            .expectedContestants(expectedContestants)
            .expectedObserversWithLeader(expectedObserversWithLeader)
            .expectedObserversWithDeputy(expectedObserversWithDeputy)
            .expectedObserversWithContestants(expectedObserversWithContestants)
            .expectedSingleRooms(expectedSingleRooms)
            .leaderEmail(leaderEmail)
            .physicalAddress(physicalAddress)
            .omissionAcknowledged(true)
            .build();
    }
}
