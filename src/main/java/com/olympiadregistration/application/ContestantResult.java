package com.olympiadregistration.application;

import com.olympiadregistration.domain.model.Award;

import java.util.List;

/**
 * One contestant's row of the results table.
 *
 * @param personId contestant id
 * @param contestantCode code such as {@code ABC1}
 * @param countryCode the contestant's country
 * @param name given and family name
 * @param scores score per problem, problem 1 first; null for unset cells
 * @param total sum of set cells
 * @param award derived award, or null while medal boundaries are unset
 */
public record ContestantResult(Long personId, String contestantCode, String countryCode, String name,
                               List<Integer> scores, int total, Award award) {
}
