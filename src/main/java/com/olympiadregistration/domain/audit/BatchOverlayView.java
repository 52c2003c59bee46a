package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.CountryFields;
import com.olympiadregistration.domain.model.PersonFields;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * View of the store plus the rows accepted so far in one bulk import, so
 * that later rows are audited as if earlier rows were already committed.
 */
public class BatchOverlayView implements RegistrationView {

    private final RegistrationView base;
    private final Set<String> codes = new HashSet<>();
    private final Set<String> names = new HashSet<>();
    private final Set<String> roles = new HashSet<>();

    public BatchOverlayView(RegistrationView base) {
        this.base = base;
    }

    public void accept(CountryFields fields) {
        codes.add(fields.getCode());
        names.add(fields.getName());
    }

    public void accept(PersonFields fields) {
        roles.add(roleKey(fields.getCountry(), fields.getPrimaryRole()));
    }

    @Override
    public Optional<Country> countryByCode(String code) {
        return base.countryByCode(code);
    }

    @Override
    public boolean countryCodeTaken(String code, Long excludeId) {
        return codes.contains(code) || base.countryCodeTaken(code, excludeId);
    }

    @Override
    public boolean countryNameTaken(String name, Long excludeId) {
        return names.contains(name) || base.countryNameTaken(name, excludeId);
    }

    @Override
    public boolean roleTaken(Country country, String role, Long excludePersonId) {
        return roles.contains(roleKey(country, role)) || base.roleTaken(country, role, excludePersonId);
    }

    private static String roleKey(Country country, String role) {
        return country.getCode() + "\u0000" + role;
    }
}
