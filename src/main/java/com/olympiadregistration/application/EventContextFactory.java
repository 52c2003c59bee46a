package com.olympiadregistration.application;

import com.olympiadregistration.domain.audit.EventContext;
import com.olympiadregistration.domain.audit.EventRules;
import com.olympiadregistration.domain.audit.RoleCapabilityTable;
import com.olympiadregistration.domain.audit.RosterLookup;
import com.olympiadregistration.domain.repository.EventStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the immutable context passed to every auditor call from the static
 * rules and the current event state.
 */
@Component
@RequiredArgsConstructor
public class EventContextFactory {

    private final EventRules rules;
    private final RoleCapabilityTable roles;
    private final RosterLookup roster;
    private final EventStateRepository eventStateRepository;

    public EventContext current() {
        return new EventContext(rules, eventStateRepository.load().snapshot(), roles, roster);
    }
}
