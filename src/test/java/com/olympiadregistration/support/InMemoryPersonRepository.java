package com.olympiadregistration.support;

import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.domain.repository.PersonRepository;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Person store backed by a map, with ids assigned on first save.
 */
public class InMemoryPersonRepository implements PersonRepository {

    private final Map<Long, Person> people = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong(100);

    @Override
    public Optional<Person> findById(Long id) {
        return Optional.ofNullable(people.get(id));
    }

    @Override
    public List<Person> findActiveByCountry(Long countryId) {
        return people.values().stream()
            .filter(p -> !p.isRetired() && Objects.equals(p.getCountry().getId(), countryId))
            .toList();
    }

    @Override
    public boolean existsActiveWithRole(Long countryId, String role, Long excludeId) {
        return findActiveByCountry(countryId).stream()
            .anyMatch(p -> role.equals(p.getPrimaryRole()) && !Objects.equals(p.getId(), excludeId));
    }

    @Override
    public List<Person> findActiveGuidesFor(Long countryId) {
        return people.values().stream()
            .filter(p -> !p.isRetired())
            .filter(p -> p.getGuideFor().stream().anyMatch(c -> Objects.equals(c.getId(), countryId)))
            .toList();
    }

    @Override
    public List<Person> findAllActive() {
        return people.values().stream().filter(p -> !p.isRetired()).toList();
    }

    @Override
    public Person save(Person person) {
        if (person.getId() == null) {
            ReflectionTestUtils.setField(person, "id", sequence.incrementAndGet());
        }
        people.put(person.getId(), person);
        return person;
    }

    public int size() {
        return people.size();
    }
}
