package com.olympiadregistration.infrastructure.audit;

import com.olympiadregistration.domain.model.DomainEvent;

import java.util.List;

/**
 * Records registration notifications in the outbox. Called inside the
 * mutating transaction, so a notification exists only if the change commits.
 */
public interface NotificationService {

    void record(String category, String action, String resourceId, String principal, String detail);

    default void recordAll(List<DomainEvent> events, String principal) {
        for (DomainEvent event : events) {
            record(event.category(), event.action(), String.valueOf(event.aggregateId()), principal,
                event.detail());
        }
    }
}
