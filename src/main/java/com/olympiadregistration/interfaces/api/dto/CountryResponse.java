package com.olympiadregistration.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for country information. Contact details and expected
 * numbers are present only for administrators and the country's delegate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CountryResponse {

    private Long id;
    private String code;
    private String name;
    private boolean staff;
    private boolean participantsOk;
    private String flagUrl;
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
        private List<String> contactEmails;
        private List<String> contactExtra;
        private Integer expectedLeaders;
        private Integer expectedDeputies;
        private Integer expectedContestants;
        private Integer expectedObserversWithLeader;
        private Integer expectedObserversWithDeputy;
        private Integer expectedObserversWithContestants;
        private Integer expectedSingleRooms;
        private boolean numbersConfirmed;
        private String leaderEmail;
        private String physicalAddress;
    }
}
