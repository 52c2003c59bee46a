package com.olympiadregistration.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Normalized field set for a Country, as accepted by the country auditor.
 * A null {@link #flag} keeps the current flag.
 */
@Value
@Builder(toBuilder = true)
public class CountryFields {

    String code;
    String name;
    boolean staff;
    boolean participantsOk;
    @Singular
    List<String> contactEmails;
    @Singular("contactExtra")
    List<String> contactExtra;
    ExpectedNumbers expected;
    boolean numbersConfirmed;
    String genericUrl;
    String leaderEmail;
    String physicalAddress;
    VerifiedUpload flag;
}
