package com.olympiadregistration.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event flags to change; null keeps the current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventFlagsRequest {

    private Boolean registrationEnabled;
    private Boolean preregistrationEnabled;
    private Boolean selfScoringEnabled;
}
