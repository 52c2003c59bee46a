package com.olympiadregistration.domain.audit;

/**
 * Static index of country and person numbers from previous occurrences of
 * the event, used to cross-check generic URLs.
 */
public interface RosterLookup {

    /**
     * Whether a roster is configured at all; without one, any well-formed
     * generic URL is accepted.
     */
    boolean isConfigured();

    boolean hasCountry(int number);

    boolean hasPerson(int number);

    RosterLookup NONE = new RosterLookup() {
        @Override
        public boolean isConfigured() {
            return false;
        }

        @Override
        public boolean hasCountry(int number) {
            return true;
        }

        @Override
        public boolean hasPerson(int number) {
            return true;
        }
    };
}
