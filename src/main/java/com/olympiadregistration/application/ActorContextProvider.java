package com.olympiadregistration.application;

import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.infrastructure.security.ActorRole;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Provider for the current actor from Spring Security.
 *
 * Authorities map as follows:
 * - {@code ROLE_ADMIN}, {@code ROLE_REGISTER}, {@code ROLE_SELFREG},
 *   {@code ROLE_SCORE} select the actor role (first match in that order)
 * - {@code COUNTRY_<id>} scopes a delegate to one country
 * - {@code PERSON_<id>} binds a self-registration account to one person
 */
@Component
public class ActorContextProvider {

    public ActorContext getCurrentActor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return ActorContext.anonymous();
        }

        return ActorContext.builder()
            .requestId(UUID.randomUUID())
            .principal(authentication.getName())
            .role(extractRole(authentication))
            .countryId(extractScope(authentication, "COUNTRY_"))
            .personId(extractScope(authentication, "PERSON_"))
            .requestedAt(Instant.now())
            .build();
    }

    private ActorRole extractRole(Authentication auth) {
        for (ActorRole role : new ActorRole[] {ActorRole.ADMIN, ActorRole.REGISTER, ActorRole.SELFREG,
                ActorRole.SCORE}) {
            String authority = "ROLE_" + role.name();
            if (auth.getAuthorities().stream().map(GrantedAuthority::getAuthority).anyMatch(authority::equals)) {
                return role;
            }
        }
        return ActorRole.ANONYMOUS;
    }

    private Long extractScope(Authentication auth, String prefix) {
        return auth.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .filter(a -> a.startsWith(prefix))
            .map(a -> a.substring(prefix.length()))
            .filter(id -> id.matches("[0-9]+"))
            .map(Long::valueOf)
            .findFirst()
            .orElse(null);
    }
}
