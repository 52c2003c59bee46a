package com.olympiadregistration.infrastructure.roster;

import java.util.Set;

/**
 * Country and person numbers known from previous events.
 */
public record RosterData(boolean configured, Set<Integer> countryNumbers, Set<Integer> personNumbers) {

    public static RosterData unconfigured() {
        return new RosterData(false, Set.of(), Set.of());
    }
}
