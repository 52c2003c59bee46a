package com.olympiadregistration.infrastructure.roster;

import com.olympiadregistration.domain.audit.RosterLookup;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@link RosterLookup} over the cached roster.
 */
@Component
@RequiredArgsConstructor
public class CachedRosterLookup implements RosterLookup {

    private final RosterLoader loader;

    @Override
    public boolean isConfigured() {
        return loader.load().configured();
    }

    @Override
    public boolean hasCountry(int number) {
        return loader.load().countryNumbers().contains(number);
    }

    @Override
    public boolean hasPerson(int number) {
        return loader.load().personNumbers().contains(number);
    }
}
