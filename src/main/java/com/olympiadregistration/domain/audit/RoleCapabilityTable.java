package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.exception.ReferenceInvalidException;
import com.olympiadregistration.domain.model.Person;
import lombok.Builder;
import lombok.Singular;

import java.util.*;

/**
 * Static lookup from role name to {@link RoleCapability}.
 *
 * <p>The table is built once at start-up from the event configuration:
 * contestant roles are numbered up to the team size, the participant and
 * staff roles are fixed, and configured extra administrative roles are
 * added as staff roles that may also be held as secondary roles.
 */
public final class RoleCapabilityTable {

    public static final String LEADER = "Leader";
    public static final String DEPUTY_LEADER = "Deputy Leader";
    public static final String GUIDE = "Guide";
    public static final String CONTESTANT_PREFIX = "Contestant ";

    static final List<String> OBSERVER_ROLES = List.of(
        "Observer with Contestants", "Observer with Leader", "Observer with Deputy");

    static final List<String> STAFF_ROLES = List.of(
        "Staff", "Jury Chair", "Chief Coordinator", "Coordinator", "Chief Guide",
        "Deputy Chief Guide", GUIDE, "Treasurer", "IT", "Transport", "Entertainment",
        "Logistics", "Problem Selection Chair", "Problem Selection", "Chief Invigilator",
        "Invigilator");

    private static final BadgePalette CONTESTANT_BADGE = new BadgePalette("7ab558", "c9deb0", "000000");
    private static final BadgePalette LEADER_BADGE = new BadgePalette("d22027", "eb9984", "000000");
    private static final BadgePalette OBSERVER_BADGE = new BadgePalette("fbca15", "fde4a4", "000000");
    private static final BadgePalette GUIDE_BADGE = new BadgePalette("2a3e92", "9c95cc", "ffffff");
    private static final BadgePalette STAFF_BADGE = new BadgePalette("f78b11", "fccc8f", "000000");

    private final Map<String, RoleCapability> roles;

    private RoleCapabilityTable(Map<String, RoleCapability> roles) {
        this.roles = Collections.unmodifiableMap(roles);
    }

    /**
     * Build the table.
     *
     * @param contestantsPerTeam number of contestant roles
     * @param extraAdminRoles staff roles that may also be secondary roles
     * @param contestantGenders genders permitted for contestants (empty: any)
     * @param contestantRoomTypes room types for contestants
     * @param nonContestantRoomTypes room types for everyone else
     * @param defaultContestantRoomType default for contestants
     * @param defaultNonContestantRoomType default for everyone else
     * @param roomTypeOverrides per-role permitted room types
     * @param badgeOverrides per-role badge colours
     * @throws IllegalArgumentException if a badge colour is not a hex colour
     *         or a default room type is not permitted
     */
    @Builder
    private static RoleCapabilityTable create(int contestantsPerTeam,
                                              @Singular List<String> extraAdminRoles,
                                              @Singular List<String> contestantGenders,
                                              @Singular List<String> contestantRoomTypes,
                                              @Singular List<String> nonContestantRoomTypes,
                                              String defaultContestantRoomType,
                                              String defaultNonContestantRoomType,
                                              @Singular Map<String, List<String>> roomTypeOverrides,
                                              @Singular Map<String, BadgePalette> badgeOverrides) {
        Map<String, RoleCapability> table = new LinkedHashMap<>();
        for (int i = 1; i <= contestantsPerTeam; i++) {
            String name = CONTESTANT_PREFIX + i;
            table.put(name, new RoleCapability(name, false, false, false, i, false,
                List.copyOf(contestantGenders), contestantRoomTypes, defaultContestantRoomType,
                CONTESTANT_BADGE));
        }
        for (String name : List.of(LEADER, DEPUTY_LEADER)) {
            table.put(name, participant(name, false, LEADER_BADGE, nonContestantRoomTypes,
                defaultNonContestantRoomType));
        }
        for (String name : OBSERVER_ROLES) {
            table.put(name, participant(name, true, OBSERVER_BADGE, nonContestantRoomTypes,
                defaultNonContestantRoomType));
        }
        for (String name : STAFF_ROLES) {
            boolean guide = GUIDE.equals(name);
            table.put(name, new RoleCapability(name, true, false, guide, 0, false, List.of(),
                nonContestantRoomTypes, defaultNonContestantRoomType,
                guide ? GUIDE_BADGE : STAFF_BADGE));
        }
        for (String name : extraAdminRoles) {
            table.put(name, new RoleCapability(name, true, true, false, 0, false, List.of(),
                nonContestantRoomTypes, defaultNonContestantRoomType, STAFF_BADGE));
        }

        roomTypeOverrides.forEach((name, types) -> table.computeIfPresent(name, (n, cap) ->
            withRooms(cap, types)));
        badgeOverrides.forEach((name, palette) -> {
            requireHex(name, palette);
            table.computeIfPresent(name, (n, cap) -> withBadge(cap, palette));
        });

        for (RoleCapability cap : table.values()) {
            if (cap.defaultRoomType() != null && !cap.roomTypes().contains(cap.defaultRoomType())) {
                throw new IllegalArgumentException(
                    "Default room type for " + cap.name() + " is not a permitted room type");
            }
        }
        return new RoleCapabilityTable(table);
    }

    public Optional<RoleCapability> find(String name) {
        return Optional.ofNullable(name).map(roles::get);
    }

    /**
     * Look up a role by exact name.
     *
     * @throws ReferenceInvalidException if the role is unknown
     */
    public RoleCapability require(String name) {
        return find(name).orElseThrow(() -> new ReferenceInvalidException("Invalid role " + name));
    }

    public Collection<RoleCapability> all() {
        return roles.values();
    }

    /**
     * Contestant code such as {@code ABC1}: country code followed by the
     * contestant number. Empty for non-contestants.
     */
    public Optional<String> contestantCode(Person person) {
        return find(person.getPrimaryRole())
            .filter(RoleCapability::isContestant)
            .map(cap -> person.getCountry().getCode() + cap.contestantNumber());
    }

    public boolean isContestant(Person person) {
        return find(person.getPrimaryRole()).map(RoleCapability::isContestant).orElse(false);
    }

    public List<RoleCapability> contestantRoles() {
        return roles.values().stream().filter(RoleCapability::isContestant).toList();
    }

    private static RoleCapability participant(String name, boolean observer, BadgePalette badge,
                                              List<String> rooms, String defaultRoom) {
        return new RoleCapability(name, false, false, false, 0, observer, List.of(), rooms,
            defaultRoom, badge);
    }

    private static RoleCapability withRooms(RoleCapability cap, List<String> rooms) {
        String defaultRoom = rooms.contains(cap.defaultRoomType())
            ? cap.defaultRoomType()
            : rooms.isEmpty() ? null : rooms.get(0);
        return new RoleCapability(cap.name(), cap.staffOnly(), cap.secondaryOk(), cap.canGuide(),
            cap.contestantNumber(), cap.observer(), cap.allowedGenders(), List.copyOf(rooms),
            defaultRoom, cap.badge());
    }

    private static RoleCapability withBadge(RoleCapability cap, BadgePalette badge) {
        return new RoleCapability(cap.name(), cap.staffOnly(), cap.secondaryOk(), cap.canGuide(),
            cap.contestantNumber(), cap.observer(), cap.allowedGenders(), cap.roomTypes(),
            cap.defaultRoomType(), badge);
    }

    private static void requireHex(String role, BadgePalette palette) {
        for (String colour : List.of(palette.outer(), palette.inner(), palette.text())) {
            if (!FieldValidators.isHexColour(colour)) {
                throw new IllegalArgumentException("Invalid badge colour for " + role + ": " + colour);
            }
        }
    }
}
