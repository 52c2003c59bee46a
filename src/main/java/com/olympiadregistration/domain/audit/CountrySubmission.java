package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.model.FileUpload;
import lombok.Builder;
import lombok.Value;

/**
 * Raw Country field values as submitted by a form or a bulk import row.
 *
 * <p>A null field was not submitted and keeps its previous value; an empty
 * string clears it.
 */
@Value
@Builder(toBuilder = true)
public class CountrySubmission {

    String code;
    String name;
    Boolean staff;
    Boolean participantsOk;
    String contactEmails;
    String contactExtra;
    String expectedLeaders;
    String expectedDeputies;
    String expectedContestants;
    String expectedObserversWithLeader;
    String expectedObserversWithDeputy;
    String expectedObserversWithContestants;
    String expectedSingleRooms;
    String genericUrl;
    String leaderEmail;
    String physicalAddress;
    FileUpload flag;

    /**
     * Whether the caller's form presented every required field, so that an
     * omission gets a friendly "No X specified" message.
     */
    boolean omissionAcknowledged;
}
