package com.olympiadregistration.interfaces.api;

import com.olympiadregistration.application.export.RegistrationExportService;
import com.olympiadregistration.domain.audit.RoleCapabilityTable;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.ExpectedNumbers;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.domain.model.RegistrationFile;
import com.olympiadregistration.domain.model.TravelLeg;
import com.olympiadregistration.domain.visibility.FileOwnership;
import com.olympiadregistration.domain.visibility.FileVisibilityResolver;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.infrastructure.security.ActorRole;
import com.olympiadregistration.interfaces.api.dto.CountryResponse;
import com.olympiadregistration.interfaces.api.dto.PersonResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Maps domain records to response DTOs for one actor, leaving out what the
 * actor may not see.
 */
@Component
@RequiredArgsConstructor
public class RegistrationResponseAssembler {

    private final FileVisibilityResolver visibilityResolver;
    private final RoleCapabilityTable roles;

    public CountryResponse toResponse(Country country, ActorContext actor) {
        boolean details = actor.isAdministrator()
            || (actor.getRole() == ActorRole.REGISTER && Objects.equals(actor.getCountryId(), country.getId()));
        RegistrationFile flag = country.getFlag();
        return CountryResponse.builder()
            .id(country.getId())
            .code(country.getCode())
            .name(country.getName())
            .staff(country.isStaff())
            .participantsOk(country.isParticipantsOk())
            .flagUrl(flag != null
                && visibilityResolver.canView(flag, FileOwnership.ofCountry(country, flag), actor.toViewer())
                ? fileUrl(flag) : null)
            .genericUrl(country.getGenericUrl())
            .details(details ? countryDetails(country) : null)
            .createdAt(country.getCreatedAt())
            .updatedAt(country.getUpdatedAt())
            .version(country.getVersion())
            .build();
    }

    public PersonResponse toResponse(Person person, ActorContext actor) {
        boolean details = actor.mayViewDetails(person.getCountry().getId(), person.getId());
        return PersonResponse.builder()
            .id(person.getId())
            .countryId(person.getCountry().getId())
            .countryCode(person.getCountry().getCode())
            .primaryRole(person.getPrimaryRole())
            .otherRoles(person.getOtherRoles().stream().sorted().toList())
            .guideFor(person.getGuideFor().stream().map(Country::getCode).sorted().toList())
            .contestantCode(roles.contestantCode(person).orElse(null))
            .givenName(person.getGivenName())
            .familyName(person.getFamilyName())
            .photoUrl(visibleUrl(person, person.getPhoto(), actor))
            .genericUrl(person.getGenericUrl())
            .details(details ? personDetails(person, actor) : null)
            .createdAt(person.getCreatedAt())
            .updatedAt(person.getUpdatedAt())
            .version(person.getVersion())
            .build();
    }

    private static CountryResponse.Details countryDetails(Country country) {
        ExpectedNumbers expected = country.getExpected() == null ? ExpectedNumbers.none() : country.getExpected();
        return CountryResponse.Details.builder()
            .contactEmails(country.getContactEmails())
            .contactExtra(country.getContactExtra())
            .expectedLeaders(expected.getLeaders())
            .expectedDeputies(expected.getDeputies())
            .expectedContestants(expected.getContestants())
            .expectedObserversWithLeader(expected.getObserversWithLeader())
            .expectedObserversWithDeputy(expected.getObserversWithDeputy())
            .expectedObserversWithContestants(expected.getObserversWithContestants())
            .expectedSingleRooms(expected.getSingleRooms())
            .numbersConfirmed(country.isNumbersConfirmed())
            .leaderEmail(country.getLeaderEmail())
            .physicalAddress(country.getPhysicalAddress())
            .build();
    }

    private PersonResponse.Details personDetails(Person person, ActorContext actor) {
        return PersonResponse.Details.builder()
            .passportGivenName(person.getPassportGivenName())
            .passportFamilyName(person.getPassportFamilyName())
            .gender(person.getGender())
            .dateOfBirth(person.getDateOfBirth())
            .languages(person.getLanguages())
            .diet(person.getDiet())
            .tshirt(person.getTshirt())
            .arrival(travel(person.getArrival()))
            .departure(travel(person.getDeparture()))
            .roomType(person.getRoomType())
            .roomShareWith(person.getRoomShareWith())
            .roomNumber(person.getRoomNumber())
            .phoneNumber(person.getPhoneNumber())
            .passportNumber(person.getPassportNumber())
            .nationality(person.getNationality())
            .incomplete(person.isIncomplete())
            .eventPhotosConsent(person.getEventPhotosConsent())
            .photoConsent(person.getPhotoConsent() == null ? null : person.getPhotoConsent().getCode())
            .dietConsent(person.getDietConsent())
            .consentFormUrl(visibleUrl(person, person.getConsentForm(), actor))
            .build();
    }

    private static PersonResponse.Travel travel(TravelLeg leg) {
        return PersonResponse.Travel.builder()
            .place(leg.getPlace())
            .date(leg.getDate())
            .time(leg.getTime())
            .flight(leg.getFlight())
            .build();
    }

    private String visibleUrl(Person person, RegistrationFile file, ActorContext actor) {
        if (file == null || !visibilityResolver.canView(file, FileOwnership.ofPerson(person, file),
                actor.toViewer())) {
            return null;
        }
        return fileUrl(file);
    }

    private static String fileUrl(RegistrationFile file) {
        return RegistrationExportService.FILE_URL_PREFIX + file.getId();
    }
}
