package com.olympiadregistration.infrastructure.persistence;

import com.olympiadregistration.domain.model.EventState;
import com.olympiadregistration.domain.repository.EventStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class EventStateRepositoryAdapter implements EventStateRepository {

    private final SpringDataEventStateRepository springDataRepository;

    @Override
    public Optional<EventState> find() {
        return springDataRepository.findById(EventState.SINGLETON_ID);
    }

    @Override
    public EventState save(EventState state) {
        EventState saved = springDataRepository.saveAndFlush(state);
        log.info("Event state persisted: version={}, registration={}, preregistration={}, boundaries={}",
            saved.getVersion(), saved.isRegistrationEnabled(), saved.isPreregistrationEnabled(),
            saved.getMedalBoundaries());
        return saved;
    }
}
