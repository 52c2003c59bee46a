package com.olympiadregistration.config;

import com.olympiadregistration.domain.audit.*;
import com.olympiadregistration.domain.repository.CountryRepository;
import com.olympiadregistration.domain.repository.PersonRepository;
import com.olympiadregistration.domain.visibility.FileVisibilityResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Wires the framework-free domain components (auditors, role table,
 * visibility resolver) from the event configuration.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(RegistrationProperties.class)
@Slf4j
public class RegistrationConfiguration {

    @Bean
    public EventRules eventRules(RegistrationProperties properties) {
        EventRules rules = EventRules.builder()
            .shortName(properties.getShortName())
            .year(properties.getYear())
            .numProblems(properties.getMarksPerProblem().size())
            .marksPerProblem(List.copyOf(properties.getMarksPerProblem()))
            .contestantsPerTeam(properties.getContestantsPerTeam())
            .virtualEvent(properties.getEventType() == RegistrationProperties.EventType.VIRTUAL)
            .consentUi(properties.isConsentUi())
            .honourableMentions(properties.isHonourableMentions())
            .requireDateOfBirth(properties.isRequireDateOfBirth())
            .requirePassportNumber(properties.isRequirePassportNumber())
            .requireNationality(properties.isRequireNationality())
            .requireDiet(properties.isRequireDiet())
            .genders(new LinkedHashSet<>(properties.getGenders()))
            .languages(new LinkedHashSet<>(properties.getLanguages()))
            .tshirtSizes(new LinkedHashSet<>(properties.getTshirtSizes()))
            .locations(new LinkedHashSet<>(properties.getLocations()))
            .roomTypes(new LinkedHashSet<>(properties.getRooms().getTypes()))
            .maxLanguages(properties.getMaxLanguages())
            .earliestContestantDateOfBirth(properties.getEarliestDateOfBirth())
            .sanityDateOfBirth(properties.getSanityDateOfBirth())
            .earliestPlausibleDateOfBirth(properties.getEarliestPlausibleDateOfBirth())
            .latestPlausibleDateOfBirth(properties.getLatestPlausibleDateOfBirth())
            .ageDay(properties.getAgeDay())
            .earliestArrivalDate(properties.getEarliestArrivalDate())
            .latestArrivalDate(properties.getLatestArrivalDate())
            .earliestDepartureDate(properties.getEarliestDepartureDate())
            .latestDepartureDate(properties.getLatestDepartureDate())
            .genericUrlBase(properties.getGenericUrlBase())
            .genericUrlDescription(properties.getGenericUrlDescription())
            .genericUrlDescriptionPlural(properties.getGenericUrlDescriptionPlural())
            .build();
        log.info("Event rules loaded: event={} {}, problems={}, contestantsPerTeam={}, virtual={}",
            rules.getShortName(), rules.getYear(), rules.getNumProblems(), rules.getContestantsPerTeam(),
            rules.isVirtualEvent());
        return rules;
    }

    @Bean
    public RoleCapabilityTable roleCapabilityTable(RegistrationProperties properties) {
        RegistrationProperties.Rooms rooms = properties.getRooms();
        RoleCapabilityTable.RoleCapabilityTableBuilder builder = RoleCapabilityTable.builder()
            .contestantsPerTeam(properties.getContestantsPerTeam())
            .extraAdminRoles(properties.getExtraAdminRoles())
            .contestantGenders(properties.getContestantGenders())
            .contestantRoomTypes(rooms.getContestantTypes())
            .nonContestantRoomTypes(rooms.getNonContestantTypes())
            .defaultContestantRoomType(rooms.getDefaultContestant())
            .defaultNonContestantRoomType(rooms.getDefaultNonContestant())
            .roomTypeOverrides(rooms.getRoleOverrides());
        properties.getBadgeColours().forEach((role, badge) ->
            builder.badgeOverride(role, new BadgePalette(badge.getOuter(), badge.getInner(), badge.getText())));
        RoleCapabilityTable table = builder.build();
        log.info("Role capability table built: {} roles", table.all().size());
        return table;
    }

    @Bean
    public CountryAuditor countryAuditor() {
        return new CountryAuditor();
    }

    @Bean
    public PersonAuditor personAuditor() {
        return new PersonAuditor();
    }

    @Bean
    public StoreRegistrationView storeRegistrationView(CountryRepository countryRepository,
                                                       PersonRepository personRepository) {
        return new StoreRegistrationView(countryRepository, personRepository);
    }

    @Bean
    public FileVisibilityResolver fileVisibilityResolver(RegistrationProperties properties) {
        return new FileVisibilityResolver(properties.isConsentUi());
    }
}
