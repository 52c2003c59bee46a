package com.olympiadregistration.domain.model;

import java.time.Instant;

/**
 * Something that happened to a registration record, published as a
 * notification once the change has been committed.
 *
 * @param category record category ({@code country}, {@code person}, {@code event})
 * @param action what happened
 * @param aggregateId id of the record, null until assigned by the store
 * @param detail short human-readable detail, free of personal data
 * @param occurredAt when the change was made
 */
public record DomainEvent(String category, String action, Long aggregateId, String detail,
                          Instant occurredAt) {

    public DomainEvent withAggregateId(Long id) {
        return new DomainEvent(category, action, id, detail, occurredAt);
    }
}
