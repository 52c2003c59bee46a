package com.olympiadregistration.domain.visibility;

/**
 * The identity requesting a file.
 *
 * @param administrator whether the viewer is an event administrator
 * @param countryId country a delegate account registers for, or null
 * @param personId person a self-registration account is bound to, or null
 */
public record Viewer(boolean administrator, Long countryId, Long personId) {

    public static Viewer anonymous() {
        return new Viewer(false, null, null);
    }
}
