package com.olympiadregistration.support;

import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.repository.CountryRepository;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Country store backed by a map, with ids assigned on first save.
 */
public class InMemoryCountryRepository implements CountryRepository {

    private final Map<Long, Country> countries = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<Country> findById(Long id) {
        return Optional.ofNullable(countries.get(id));
    }

    @Override
    public Optional<Country> findActiveByCode(String code) {
        return countries.values().stream()
            .filter(c -> !c.isRetired() && c.getCode().equals(code))
            .findFirst();
    }

    @Override
    public Optional<Country> findActiveByName(String name) {
        return countries.values().stream()
            .filter(c -> !c.isRetired() && c.getName().equals(name))
            .findFirst();
    }

    @Override
    public boolean existsActiveCode(String code, Long excludeId) {
        return findActiveByCode(code).filter(c -> !Objects.equals(c.getId(), excludeId)).isPresent();
    }

    @Override
    public boolean existsActiveName(String name, Long excludeId) {
        return findActiveByName(name).filter(c -> !Objects.equals(c.getId(), excludeId)).isPresent();
    }

    @Override
    public List<Country> findAllActive() {
        return countries.values().stream()
            .filter(c -> !c.isRetired())
            .sorted(Comparator.comparing(Country::getCode))
            .toList();
    }

    @Override
    public Optional<Country> findStaffCountry() {
        return countries.values().stream().filter(Country::isStaff).findFirst();
    }

    @Override
    public Country save(Country country) {
        if (country.getId() == null) {
            ReflectionTestUtils.setField(country, "id", sequence.incrementAndGet());
        }
        countries.put(country.getId(), country);
        return country;
    }

    public int size() {
        return countries.size();
    }
}
