package com.olympiadregistration.domain.visibility;

import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.domain.model.PhotoConsent;
import com.olympiadregistration.domain.model.RegistrationFile;

import java.util.Objects;

/**
 * Current state of the record owning a file, as needed to decide its
 * visibility.
 *
 * @param countryId owning country (for person files, the person's country)
 * @param personId owning person, or null for flags
 * @param current whether the owner's slot still points at this file
 * @param ownerRetired whether the owner or its country is retired
 * @param photoConsent the owner's photo consent, for photos
 */
public record FileOwnership(Long countryId, Long personId, boolean current, boolean ownerRetired,
                            PhotoConsent photoConsent) {

    public static FileOwnership ofCountry(Country country, RegistrationFile file) {
        return new FileOwnership(country.getId(), null, sameFile(country.getFlag(), file),
            country.isRetired(), null);
    }

    public static FileOwnership ofPerson(Person person, RegistrationFile file) {
        RegistrationFile slot = switch (file.getKind()) {
            case PHOTO -> person.getPhoto();
            case CONSENT_FORM -> person.getConsentForm();
            case FLAG -> null;
        };
        return new FileOwnership(person.getCountry().getId(), person.getId(), sameFile(slot, file),
            person.isRetired() || person.getCountry().isRetired(), person.getPhotoConsent());
    }

    /**
     * Ownership of a file whose owner no longer exists.
     */
    public static FileOwnership orphaned() {
        return new FileOwnership(null, null, false, true, null);
    }

    private static boolean sameFile(RegistrationFile slot, RegistrationFile file) {
        return slot != null && Objects.equals(slot.getId(), file.getId());
    }
}
