package com.olympiadregistration.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * How a participant's photo may be used.
 */
public enum PhotoConsent {

    NOT_GIVEN("no"),
    BADGE_ONLY("badge"),
    WEBSITE_AND_BADGE("yes");

    private final String code;

    PhotoConsent(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<PhotoConsent> fromCode(String code) {
        return Arrays.stream(values())
            .filter(c -> c.code.equalsIgnoreCase(code) || c.name().equalsIgnoreCase(code))
            .findFirst();
    }
}
