package com.olympiadregistration.infrastructure.persistence;

import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.repository.CountryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Adapter implementing the domain CountryRepository using Spring Data JPA.
 *
 * Transactions are owned by the application services so that each
 * single-record operation (and each bulk import row) commits as one unit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CountryRepositoryAdapter implements CountryRepository {

    private final SpringDataCountryRepository springDataRepository;

    @Override
    public Optional<Country> findById(Long id) {
        return springDataRepository.findById(id);
    }

    @Override
    public Optional<Country> findActiveByCode(String code) {
        return springDataRepository.findFirstByCodeAndRetiredFalse(code);
    }

    @Override
    public Optional<Country> findActiveByName(String name) {
        return springDataRepository.findFirstByNameAndRetiredFalse(name);
    }

    @Override
    public boolean existsActiveCode(String code, Long excludeId) {
        return springDataRepository.existsActiveCode(code, excludeId);
    }

    @Override
    public boolean existsActiveName(String name, Long excludeId) {
        return springDataRepository.existsActiveName(name, excludeId);
    }

    @Override
    public List<Country> findAllActive() {
        return springDataRepository.findByRetiredFalseOrderByCodeAsc();
    }

    @Override
    public Optional<Country> findStaffCountry() {
        return springDataRepository.findFirstByStaffTrue();
    }

    @Override
    public Country save(Country country) {
        Country saved = springDataRepository.saveAndFlush(country);
        log.info("Country persisted: id={}, version={}", saved.getId(), saved.getVersion());
        return saved;
    }
}
