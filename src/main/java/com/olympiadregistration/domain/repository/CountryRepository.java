package com.olympiadregistration.domain.repository;

import com.olympiadregistration.domain.model.Country;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the Country aggregate.
 *
 * <p>Uniqueness of code and name is a rule over non-retired countries only,
 * so implementations answer the existence queries with retired rows excluded.
 */
public interface CountryRepository {

    Optional<Country> findById(Long id);

    /**
     * Find the non-retired country with this code.
     */
    Optional<Country> findActiveByCode(String code);

    /**
     * Find the non-retired country with this name.
     */
    Optional<Country> findActiveByName(String name);

    /**
     * Whether a non-retired country other than {@code excludeId} has this code.
     *
     * @param code exact code
     * @param excludeId id of the record being edited, or null on create
     */
    boolean existsActiveCode(String code, Long excludeId);

    /**
     * Whether a non-retired country other than {@code excludeId} has this name.
     */
    boolean existsActiveName(String name, Long excludeId);

    /**
     * All non-retired countries, ordered by code.
     */
    List<Country> findAllActive();

    Optional<Country> findStaffCountry();

    Country save(Country country);
}
