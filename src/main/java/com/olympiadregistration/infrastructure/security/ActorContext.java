package com.olympiadregistration.infrastructure.security;

import com.olympiadregistration.domain.visibility.Viewer;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable identity of the actor behind one request.
 *
 * <p>Established from the Spring Security authentication and threaded
 * through every access-control decision.
 */
@Value
@Builder
public class ActorContext {
    UUID requestId;
    String principal;
    ActorRole role;
    Long countryId;
    Long personId;
    Instant requestedAt;

    public static ActorContext anonymous() {
        return ActorContext.builder()
            .requestId(UUID.randomUUID())
            .principal("anonymous")
            .role(ActorRole.ANONYMOUS)
            .requestedAt(Instant.now())
            .build();
    }

    public boolean isAdministrator() {
        return role == ActorRole.ADMIN;
    }

    /**
     * The identity used to decide file visibility. Self-registration
     * accounts see files of their own person only.
     */
    public Viewer toViewer() {
        return switch (role) {
            case ADMIN -> new Viewer(true, null, null);
            case REGISTER -> new Viewer(false, countryId, null);
            case SELFREG -> new Viewer(false, null, personId);
            default -> Viewer.anonymous();
        };
    }

    /**
     * Whether this actor may see the private registration details of a
     * person.
     */
    public boolean mayViewDetails(Long personCountryId, Long personId) {
        return switch (role) {
            case ADMIN -> true;
            case REGISTER -> countryId != null && countryId.equals(personCountryId);
            case SELFREG -> this.personId != null && this.personId.equals(personId);
            default -> false;
        };
    }
}
