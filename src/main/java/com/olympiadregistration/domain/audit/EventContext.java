package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.model.EventStatus;

/**
 * Everything an auditor needs to know about the event: static rules, the
 * current flags and boundaries, the role table and the roster.
 * Built once per operation so an auditor never reads ambient state.
 */
public record EventContext(EventRules rules, EventStatus status, RoleCapabilityTable roles,
                           RosterLookup roster) {
}
