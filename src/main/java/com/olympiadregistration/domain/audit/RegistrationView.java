package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.model.Country;

import java.util.Optional;

/**
 * The auditors' read-only view of the store. Bulk import layers the rows
 * already accepted in the current batch on top of the committed state.
 */
public interface RegistrationView {

    /**
     * Find a non-retired country by exact code.
     */
    Optional<Country> countryByCode(String code);

    /**
     * Whether a non-retired country other than {@code excludeId} uses this code.
     */
    boolean countryCodeTaken(String code, Long excludeId);

    /**
     * Whether a non-retired country other than {@code excludeId} uses this name.
     */
    boolean countryNameTaken(String name, Long excludeId);

    /**
     * Whether a non-retired person other than {@code excludePersonId} holds
     * this primary role in the country.
     */
    boolean roleTaken(Country country, String role, Long excludePersonId);
}
