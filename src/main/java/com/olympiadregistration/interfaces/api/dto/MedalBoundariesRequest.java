package com.olympiadregistration.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Medal boundaries as text. A null value keeps the current boundary; empty
 * values for all three unset the boundaries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MedalBoundariesRequest {

    private String gold;
    private String silver;
    private String bronze;
}
