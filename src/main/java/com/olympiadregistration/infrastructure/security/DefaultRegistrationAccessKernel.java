package com.olympiadregistration.infrastructure.security;

import com.olympiadregistration.domain.exception.PermissionDeniedException;
import com.olympiadregistration.domain.exception.StateConflictException;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.EventStatus;
import com.olympiadregistration.domain.model.Person;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;

/**
 * Access-control gate for registration mutations.
 *
 * Rules:
 * - countries are created, edited and retired by administrators only
 * - delegates may make preregistration edits of their own country
 * - people are created and edited by administrators or the delegate of the
 *   person's country; the bound self-registration account may edit its own
 *   person without moving it to another country
 * - non-administrators cannot change people while registration is disabled
 * - scores are entered by administrators, scoring accounts, or (while
 *   self-scoring is enabled) the scored country's delegate
 *
 * Every decision is logged with the request id for the audit trail.
 */
@Service
@Slf4j
public class DefaultRegistrationAccessKernel implements RegistrationAccessKernel {

    static final String REGISTRATION_DISABLED = "Registration is now disabled, please contact"
        + " the event organisers to change details of registered participants";

    @Override
    public void authorizeCountryAdministration(ActorContext actor, String operation) {
        require(actor, actor.isAdministrator(), operation, "ADMIN_REQUIRED",
            "Only administrators may " + operation + " countries");
        granted(actor, operation);
    }

    @Override
    public void authorizePreregistration(ActorContext actor, Country country) {
        if (!actor.isAdministrator()) {
            require(actor, actor.getRole() == ActorRole.REGISTER && actor.getCountryId() != null
                    && Objects.equals(actor.getCountryId(), country.getId()),
                "PREREGISTER", "WRONG_COUNTRY", "You may only preregister your own country");
        }
        granted(actor, "PREREGISTER");
    }

    @Override
    public void authorizePersonCreation(ActorContext actor, Country country, EventStatus status) {
        if (!actor.isAdministrator()) {
            require(actor, actor.getRole() == ActorRole.REGISTER, "CREATE_PERSON", "NOT_REGISTERING",
                "You do not have permission to register people");
            require(actor, actor.getCountryId() != null && Objects.equals(actor.getCountryId(), idOf(country)),
                "CREATE_PERSON",
                "WRONG_COUNTRY", "Person must be from your country");
            requireRegistrationOpen(actor, status, "CREATE_PERSON");
        }
        granted(actor, "CREATE_PERSON");
    }

    @Override
    public void authorizePersonEdit(ActorContext actor, Person person, Country targetCountry,
                                    EventStatus status) {
        if (!actor.isAdministrator()) {
            switch (actor.getRole()) {
                case REGISTER -> {
                    require(actor, actor.getCountryId() != null
                            && Objects.equals(actor.getCountryId(), person.getCountry().getId())
                            && Objects.equals(actor.getCountryId(), idOf(targetCountry)),
                        "EDIT_PERSON", "WRONG_COUNTRY", "Person must be from your country");
                }
                case SELFREG -> {
                    require(actor, actor.getPersonId() != null && Objects.equals(actor.getPersonId(), person.getId()),
                        "EDIT_PERSON", "WRONG_PERSON", "You may only edit your own registration");
                    require(actor, Objects.equals(person.getCountry().getId(), idOf(targetCountry)),
                        "EDIT_PERSON", "COUNTRY_CHANGE", "You may not change your country");
                }
                default -> require(actor, false, "EDIT_PERSON", "NOT_REGISTERING",
                    "You do not have permission to edit people");
            }
            requireRegistrationOpen(actor, status, "EDIT_PERSON");
        }
        granted(actor, "EDIT_PERSON");
    }

    @Override
    public void authorizePersonRetirement(ActorContext actor) {
        require(actor, actor.isAdministrator(), "RETIRE_PERSON", "ADMIN_REQUIRED",
            "Only administrators may retire people");
        granted(actor, "RETIRE_PERSON");
    }

    @Override
    public void authorizeScoreEntry(ActorContext actor, Country country, EventStatus status) {
        boolean scorer = actor.isAdministrator() || actor.getRole() == ActorRole.SCORE;
        boolean selfScorer = actor.getRole() == ActorRole.REGISTER
            && status.selfScoringEnabled()
            && country != null
            && Objects.equals(actor.getCountryId(), country.getId());
        require(actor, scorer || selfScorer, "ENTER_SCORES", "NOT_SCORING",
            "You do not have permission to enter scores");
        granted(actor, "ENTER_SCORES");
    }

    @Override
    public void authorizeMedalBoundaries(ActorContext actor) {
        require(actor, actor.isAdministrator() || actor.getRole() == ActorRole.SCORE,
            "SET_MEDAL_BOUNDARIES", "NOT_SCORING", "You do not have permission to set medal boundaries");
        granted(actor, "SET_MEDAL_BOUNDARIES");
    }

    @Override
    public void authorizeEventAdministration(ActorContext actor) {
        require(actor, actor.isAdministrator(), "ADMINISTER_EVENT", "ADMIN_REQUIRED",
            "Only administrators may change event settings");
        granted(actor, "ADMINISTER_EVENT");
    }

    @Override
    public void authorizeBulkImport(ActorContext actor, boolean countries) {
        boolean allowed = actor.isAdministrator()
            || (!countries && actor.getRole() == ActorRole.REGISTER && actor.getCountryId() != null);
        require(actor, allowed, "BULK_IMPORT", "ADMIN_REQUIRED",
            "You do not have permission to import " + (countries ? "countries" : "people"));
        granted(actor, "BULK_IMPORT");
    }

    private static Long idOf(Country country) {
        return country == null ? null : country.getId();
    }

    private void requireRegistrationOpen(ActorContext actor, EventStatus status, String operation) {
        if (!status.registrationEnabled()) {
            log.warn("AUTHORIZATION DENIED [{}]: registration disabled - principal={}, operation={}",
                actor.getRequestId(), Encode.forJava(actor.getPrincipal()), operation);
            auditDenial(actor, operation, "REGISTRATION_DISABLED");
            throw new StateConflictException(REGISTRATION_DISABLED);
        }
    }

    private void require(ActorContext actor, boolean condition, String operation, String reason,
                         String message) {
        if (condition) {
            return;
        }
        log.warn("AUTHORIZATION DENIED [{}]: principal={}, role={}, operation={}, reason={}",
            actor.getRequestId(), Encode.forJava(actor.getPrincipal()), actor.getRole(), operation, reason);
        auditDenial(actor, operation, reason);
        throw new PermissionDeniedException(message);
    }

    private void granted(ActorContext actor, String operation) {
        log.info("AUTHORIZATION GRANTED [{}]: principal={}, role={}, operation={}",
            actor.getRequestId(), Encode.forJava(actor.getPrincipal()), actor.getRole(), operation);
    }

    private void auditDenial(ActorContext actor, String operation, String reason) {
        log.warn("AUDIT: Authorization denied - principal={}, operation={}, reason={}, requestId={}, timestamp={}",
            Encode.forJava(actor.getPrincipal()), operation, reason, actor.getRequestId(), Instant.now());
    }
}
