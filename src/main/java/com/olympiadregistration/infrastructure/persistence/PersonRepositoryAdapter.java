package com.olympiadregistration.infrastructure.persistence;

import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.domain.repository.PersonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Adapter implementing the domain PersonRepository using Spring Data JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PersonRepositoryAdapter implements PersonRepository {

    private final SpringDataPersonRepository springDataRepository;

    @Override
    public Optional<Person> findById(Long id) {
        return springDataRepository.findById(id);
    }

    @Override
    public List<Person> findActiveByCountry(Long countryId) {
        return springDataRepository.findByCountryIdAndRetiredFalseOrderByIdAsc(countryId);
    }

    @Override
    public boolean existsActiveWithRole(Long countryId, String role, Long excludeId) {
        return springDataRepository.existsActiveWithRole(countryId, role, excludeId);
    }

    @Override
    public List<Person> findActiveGuidesFor(Long countryId) {
        return springDataRepository.findActiveGuidesFor(countryId);
    }

    @Override
    public List<Person> findAllActive() {
        return springDataRepository.findByRetiredFalseOrderByIdAsc();
    }

    @Override
    public Person save(Person person) {
        Person saved = springDataRepository.saveAndFlush(person);
        log.info("Person persisted: id={}, version={}", saved.getId(), saved.getVersion());
        return saved;
    }
}
