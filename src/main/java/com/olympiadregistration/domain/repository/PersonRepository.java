package com.olympiadregistration.domain.repository;

import com.olympiadregistration.domain.model.Person;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the Person aggregate.
 */
public interface PersonRepository {

    Optional<Person> findById(Long id);

    /**
     * Non-retired people of one country.
     */
    List<Person> findActiveByCountry(Long countryId);

    /**
     * Whether a non-retired person other than {@code excludeId} already holds
     * {@code role} as primary role in this country.
     */
    boolean existsActiveWithRole(Long countryId, String role, Long excludeId);

    /**
     * Non-retired people whose guide list contains this country.
     */
    List<Person> findActiveGuidesFor(Long countryId);

    List<Person> findAllActive();

    Person save(Person person);
}
