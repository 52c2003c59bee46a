package com.olympiadregistration.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Process-wide event singleton. The three flags and the boundary triple are
 * versioned together so concurrent administrators cannot interleave edits.
 */
@Entity
@Table(name = "event_state")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class EventState {

    public static final long SINGLETON_ID = 1L;

    @Id
    @Column(name = "id")
    private Long id;

    @Column(name = "registration_enabled", nullable = false)
    private boolean registrationEnabled;

    @Column(name = "preregistration_enabled", nullable = false)
    private boolean preregistrationEnabled;

    @Column(name = "self_scoring_enabled", nullable = false)
    private boolean selfScoringEnabled;

    @Embedded
    private MedalBoundaries medalBoundaries;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    /**
     * Initial state: registration and preregistration open, boundaries unset.
     */
    public static EventState initial() {
        EventState state = new EventState();
        state.id = SINGLETON_ID;
        state.registrationEnabled = true;
        state.preregistrationEnabled = true;
        state.selfScoringEnabled = false;
        state.medalBoundaries = MedalBoundaries.unset();
        state.updatedAt = Instant.now();
        return state;
    }

    public void changeFlags(boolean registration, boolean preregistration, boolean selfScoring) {
        this.registrationEnabled = registration;
        this.preregistrationEnabled = preregistration;
        this.selfScoringEnabled = selfScoring;
        this.updatedAt = Instant.now();
    }

    public void changeMedalBoundaries(MedalBoundaries boundaries) {
        this.medalBoundaries = boundaries;
        this.updatedAt = Instant.now();
    }

    public MedalBoundaries getMedalBoundaries() {
        return medalBoundaries != null ? medalBoundaries : MedalBoundaries.unset();
    }

    public EventStatus snapshot() {
        return new EventStatus(registrationEnabled, preregistrationEnabled, selfScoringEnabled,
            getMedalBoundaries());
    }
}
