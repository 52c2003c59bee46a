package com.olympiadregistration.domain.model;

/**
 * Immutable snapshot of the mutable event flags and boundaries.
 */
public record EventStatus(boolean registrationEnabled, boolean preregistrationEnabled,
                          boolean selfScoringEnabled, MedalBoundaries medalBoundaries) {

    public boolean medalBoundariesSet() {
        return medalBoundaries != null && medalBoundaries.isSet();
    }
}
