package com.olympiadregistration.interfaces.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Scores for one problem of one country, keyed by contestant code. An empty
 * value marks the score as not yet known.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoresRequest {

    @NotBlank(message = "Country code is required")
    private String countryCode;

    @NotNull(message = "Problem is required")
    @Min(value = 1, message = "Problem numbers start at 1")
    private Integer problem;

    @NotNull(message = "Scores are required")
    private Map<String, String> scores;
}
