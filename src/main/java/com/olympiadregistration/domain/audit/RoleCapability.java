package com.olympiadregistration.domain.audit;

import java.util.List;

/**
 * What a role permits, consulted by the auditors instead of branching on
 * role names.
 *
 * @param name role name as shown to users
 * @param staffOnly only held by people of the staff country
 * @param secondaryOk may be held as a secondary role
 * @param canGuide may guide normal countries
 * @param contestantNumber 1-based contestant number, or 0 for non-contestants
 * @param observer observer roles are not unique per country
 * @param allowedGenders permitted genders; empty means unrestricted
 * @param roomTypes permitted room types
 * @param defaultRoomType room type applied when none is given
 * @param badge badge colours
 */
public record RoleCapability(String name, boolean staffOnly, boolean secondaryOk, boolean canGuide,
                             int contestantNumber, boolean observer, List<String> allowedGenders,
                             List<String> roomTypes, String defaultRoomType, BadgePalette badge) {

    public boolean isContestant() {
        return contestantNumber > 0;
    }

    /**
     * Whether at most one non-retired person per normal country may hold
     * this as primary role.
     */
    public boolean isUniquePerCountry() {
        return !observer && !staffOnly;
    }
}
