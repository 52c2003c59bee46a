package com.olympiadregistration.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One direction of travel (arrival or departure). Every field may be null;
 * a time or flight is only kept together with a date.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor
public class TravelLeg {

    @Column(name = "place")
    private String place;

    @Column(name = "travel_date")
    private LocalDate date;

    @Column(name = "travel_time")
    private LocalTime time;

    @Column(name = "flight")
    private String flight;

    public static TravelLeg empty() {
        return new TravelLeg(null, null, null, null);
    }
}
