package com.olympiadregistration.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Numbers of participants a normal country expects to register.
 * Staff countries carry no expected numbers (all fields null).
 */
@Embeddable
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor
public class ExpectedNumbers {

    @Column(name = "expected_leaders")
    private Integer leaders;

    @Column(name = "expected_deputies")
    private Integer deputies;

    @Column(name = "expected_contestants")
    private Integer contestants;

    @Column(name = "expected_observers_a")
    private Integer observersWithLeader;

    @Column(name = "expected_observers_b")
    private Integer observersWithDeputy;

    @Column(name = "expected_observers_c")
    private Integer observersWithContestants;

    @Column(name = "expected_single_rooms")
    private Integer singleRooms;

    public static ExpectedNumbers none() {
        return new ExpectedNumbers(null, null, null, null, null, null, null);
    }

    public static ExpectedNumbers defaultsFor(int contestantsPerTeam) {
        return new ExpectedNumbers(1, 1, contestantsPerTeam, 0, 0, 0, 0);
    }
}
