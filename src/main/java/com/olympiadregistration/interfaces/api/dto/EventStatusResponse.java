package com.olympiadregistration.interfaces.api.dto;

import com.olympiadregistration.domain.model.EventStatus;
import com.olympiadregistration.domain.model.MedalBoundaries;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for the event flags and medal boundaries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventStatusResponse {

    private boolean registrationEnabled;
    private boolean preregistrationEnabled;
    private boolean selfScoringEnabled;
    private Integer goldBoundary;
    private Integer silverBoundary;
    private Integer bronzeBoundary;

    public static EventStatusResponse from(EventStatus status) {
        MedalBoundaries boundaries = status.medalBoundaries() == null
            ? MedalBoundaries.unset()
            : status.medalBoundaries();
        return EventStatusResponse.builder()
            .registrationEnabled(status.registrationEnabled())
            .preregistrationEnabled(status.preregistrationEnabled())
            .selfScoringEnabled(status.selfScoringEnabled())
            .goldBoundary(boundaries.getGold())
            .silverBoundary(boundaries.getSilver())
            .bronzeBoundary(boundaries.getBronze())
            .build();
    }
}
