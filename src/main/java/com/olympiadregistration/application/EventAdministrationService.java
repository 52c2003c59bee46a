package com.olympiadregistration.application;

import com.olympiadregistration.domain.model.EventState;
import com.olympiadregistration.domain.model.EventStatus;
import com.olympiadregistration.domain.repository.EventStateRepository;
import com.olympiadregistration.infrastructure.audit.NotificationService;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.infrastructure.security.RegistrationAccessKernel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and toggles the event-wide registration flags.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class EventAdministrationService {

    private final EventStateRepository eventStateRepository;
    private final RegistrationAccessKernel accessKernel;
    private final NotificationService notificationService;

    @Transactional(readOnly = true)
    public EventStatus status() {
        return eventStateRepository.load().snapshot();
    }

    /**
     * Change the flags; a null argument keeps the current value.
     */
    public EventStatus updateFlags(ActorContext actor, Boolean registration, Boolean preregistration,
                                   Boolean selfScoring) {
        accessKernel.authorizeEventAdministration(actor);

        EventState state = eventStateRepository.load();
        state.changeFlags(
            registration != null ? registration : state.isRegistrationEnabled(),
            preregistration != null ? preregistration : state.isPreregistrationEnabled(),
            selfScoring != null ? selfScoring : state.isSelfScoringEnabled());
        state = eventStateRepository.save(state);

        EventStatus status = state.snapshot();
        notificationService.record("event", "flags updated", String.valueOf(EventState.SINGLETON_ID),
            actor.getPrincipal(), "registration=" + status.registrationEnabled()
                + ", preregistration=" + status.preregistrationEnabled()
                + ", selfScoring=" + status.selfScoringEnabled());
        log.info("Event flags updated: registration={}, preregistration={}, selfScoring={}",
            status.registrationEnabled(), status.preregistrationEnabled(), status.selfScoringEnabled());
        return status;
    }
}
