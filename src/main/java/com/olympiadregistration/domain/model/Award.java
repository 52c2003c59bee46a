package com.olympiadregistration.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Award derived from a contestant's scores once medal boundaries are set.
 */
public enum Award {

    GOLD("Gold Medal"),
    SILVER("Silver Medal"),
    BRONZE("Bronze Medal"),
    HONOURABLE_MENTION("Honourable Mention"),
    NONE("");

    private final String label;

    Award(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Derive the award for one contestant.
     *
     * @param scores score per problem number (unset cells absent)
     * @param boundaries current boundaries; must be set
     * @param marksPerProblem maximum mark for each problem, problem 1 first
     * @param honourableMentions whether full marks on one problem earn a mention
     */
    public static Award derive(Map<Integer, Integer> scores, MedalBoundaries boundaries,
                               List<Integer> marksPerProblem, boolean honourableMentions) {
        if (!boundaries.isSet()) {
            throw new IllegalStateException("Medal boundaries not set");
        }
        int total = scores.values().stream().mapToInt(Integer::intValue).sum();
        if (total >= boundaries.getGold()) {
            return GOLD;
        }
        if (total >= boundaries.getSilver()) {
            return SILVER;
        }
        if (total >= boundaries.getBronze()) {
            return BRONZE;
        }
        if (honourableMentions) {
            for (int p = 1; p <= marksPerProblem.size(); p++) {
                Integer score = scores.get(p);
                if (score != null && score.equals(marksPerProblem.get(p - 1))) {
                    return HONOURABLE_MENTION;
                }
            }
        }
        return NONE;
    }
}
