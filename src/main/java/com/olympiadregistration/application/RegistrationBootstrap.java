package com.olympiadregistration.application;

import com.olympiadregistration.config.RegistrationProperties;
import com.olympiadregistration.domain.audit.EventRules;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.CountryFields;
import com.olympiadregistration.domain.model.EventState;
import com.olympiadregistration.domain.model.ExpectedNumbers;
import com.olympiadregistration.domain.repository.CountryRepository;
import com.olympiadregistration.domain.repository.EventStateRepository;
import com.olympiadregistration.infrastructure.audit.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the event singleton and the staff country on first start.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistrationBootstrap implements ApplicationRunner {

    static final String SYSTEM_PRINCIPAL = "system";

    private final EventStateRepository eventStateRepository;
    private final CountryRepository countryRepository;
    private final NotificationService notificationService;
    private final EventRules rules;
    private final RegistrationProperties properties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (eventStateRepository.find().isEmpty()) {
            eventStateRepository.save(EventState.initial());
            log.info("Event state initialised");
        }
        if (countryRepository.findStaffCountry().isEmpty()) {
            Country staff = countryRepository.save(Country.create(CountryFields.builder()
                .code(properties.getStaff().getCountryCode())
                .name(rules.staffCountryName())
                .staff(true)
                .participantsOk(true)
                .expected(ExpectedNumbers.none())
                .build()));
            notificationService.recordAll(staff.collectDomainEvents(), SYSTEM_PRINCIPAL);
            log.info("Staff country created: id={}", staff.getId());
        }
    }
}
