package com.olympiadregistration.domain.repository;

import com.olympiadregistration.domain.model.EventState;

import java.util.Optional;

/**
 * Access to the event singleton.
 */
public interface EventStateRepository {

    Optional<EventState> find();

    /**
     * Load the singleton.
     *
     * @throws IllegalStateException if the event has not been initialised
     */
    default EventState load() {
        return find().orElseThrow(() -> new IllegalStateException("Event state not initialised"));
    }

    EventState save(EventState state);
}
