package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.repository.CountryRepository;
import com.olympiadregistration.domain.repository.PersonRepository;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * View of the committed store state, read through the repository ports.
 */
@RequiredArgsConstructor
public class StoreRegistrationView implements RegistrationView {

    private final CountryRepository countryRepository;
    private final PersonRepository personRepository;

    @Override
    public Optional<Country> countryByCode(String code) {
        return countryRepository.findActiveByCode(code);
    }

    @Override
    public boolean countryCodeTaken(String code, Long excludeId) {
        return countryRepository.existsActiveCode(code, excludeId);
    }

    @Override
    public boolean countryNameTaken(String name, Long excludeId) {
        return countryRepository.existsActiveName(name, excludeId);
    }

    @Override
    public boolean roleTaken(Country country, String role, Long excludePersonId) {
        return country.getId() != null
            && personRepository.existsActiveWithRole(country.getId(), role, excludePersonId);
    }
}
