package com.olympiadregistration.application;

import com.olympiadregistration.config.PerformanceConfiguration.RegistrationMetrics;
import com.olympiadregistration.domain.audit.CountryAuditor;
import com.olympiadregistration.domain.audit.CountrySubmission;
import com.olympiadregistration.domain.audit.EventContext;
import com.olympiadregistration.domain.audit.RegistrationView;
import com.olympiadregistration.domain.exception.RecordNotFoundException;
import com.olympiadregistration.domain.exception.StateConflictException;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.CountryFields;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.domain.model.RegistrationFile;
import com.olympiadregistration.domain.repository.CountryRepository;
import com.olympiadregistration.domain.repository.PersonRepository;
import com.olympiadregistration.domain.repository.RegistrationFileRepository;
import com.olympiadregistration.infrastructure.audit.NotificationService;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.infrastructure.security.RegistrationAccessKernel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Application service for Country create, edit, preregistration and
 * retirement.
 *
 * Every mutation runs gate, audit, store and notification in one
 * transaction.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class CountryRegistrationService {

    private final CountryRepository countryRepository;
    private final PersonRepository personRepository;
    private final RegistrationFileRepository fileRepository;
    private final CountryAuditor countryAuditor;
    private final RegistrationView registrationView;
    private final RegistrationAccessKernel accessKernel;
    private final EventContextFactory eventContextFactory;
    private final NotificationService notificationService;
    private final RegistrationMetrics metrics;

    /**
     * Create a country.
     */
    public Country create(ActorContext actor, CountrySubmission submission) {
        accessKernel.authorizeCountryAdministration(actor, "create");

        EventContext context = eventContextFactory.current();
        CountryFields fields = countryAuditor.audit(submission, null, context, registrationView);

        Country country = countryRepository.save(Country.create(fields));
        storeFlag(country, fields);

        notificationService.recordAll(country.collectDomainEvents(), actor.getPrincipal());
        metrics.recordRegistration("country", "created");
        log.info("Country created: id={}, code={}", country.getId(), country.getCode());
        return country;
    }

    /**
     * Full edit of a country by an administrator.
     */
    public Country update(ActorContext actor, Long id, CountrySubmission submission) {
        accessKernel.authorizeCountryAdministration(actor, "edit");

        Country country = loadActive(id);
        EventContext context = eventContextFactory.current();
        CountryFields fields = countryAuditor.audit(submission, country, context, registrationView);

        country.apply(fields);
        country = countryRepository.save(country);
        storeFlag(country, fields);

        notificationService.recordAll(country.collectDomainEvents(), actor.getPrincipal());
        metrics.recordRegistration("country", "updated");
        log.info("Country updated: id={}", id);
        return country;
    }

    /**
     * Preregistration edit: expected numbers and, for virtual events, the
     * leader email and physical address. An unchanged resubmission stores
     * nothing.
     */
    public Country preregister(ActorContext actor, Long id, CountrySubmission submission) {
        Country country = loadActive(id);
        accessKernel.authorizePreregistration(actor, country);

        EventContext context = eventContextFactory.current();
        Optional<CountryFields> fields = countryAuditor.auditPreregistration(submission, country, context);
        if (fields.isEmpty()) {
            log.info("Preregistration unchanged: id={}", id);
            return country;
        }

        country.applyPreregistration(fields.get());
        country = countryRepository.save(country);

        notificationService.recordAll(country.collectDomainEvents(), actor.getPrincipal());
        metrics.recordRegistration("country", "preregistration updated");
        log.info("Preregistration updated: id={}", id);
        return country;
    }

    /**
     * Retire a country together with its people, and remove it from every
     * guide's list of guided countries.
     */
    public void retire(ActorContext actor, Long id) {
        accessKernel.authorizeCountryAdministration(actor, "retire");

        Country country = loadActive(id);
        country.retire();

        for (Person person : personRepository.findActiveByCountry(id)) {
            person.retire();
            personRepository.save(person);
            notificationService.recordAll(person.collectDomainEvents(), actor.getPrincipal());
        }
        for (Person guide : personRepository.findActiveGuidesFor(id)) {
            if (guide.stopGuiding(country)) {
                personRepository.save(guide);
            }
        }

        countryRepository.save(country);
        notificationService.recordAll(country.collectDomainEvents(), actor.getPrincipal());
        metrics.recordRegistration("country", "retired");
        log.info("Country retired: id={}", id);
    }

    @Transactional(readOnly = true)
    public Country get(Long id) {
        return countryRepository.findById(id)
            .orElseThrow(() -> new RecordNotFoundException("Country not found: " + id));
    }

    @Transactional(readOnly = true)
    public List<Country> list() {
        return countryRepository.findAllActive();
    }

    private Country loadActive(Long id) {
        Country country = get(id);
        if (country.isRetired()) {
            throw new StateConflictException("Country " + country.getCode() + " has been retired");
        }
        return country;
    }

    private void storeFlag(Country country, CountryFields fields) {
        if (fields.getFlag() == null) {
            return;
        }
        RegistrationFile file = fileRepository.save(RegistrationFile.of(fields.getFlag(), country.getId()));
        country.replaceFlag(file);
        countryRepository.save(country);
        log.info("Flag stored: country={}, file={}", country.getId(), file.getId());
    }
}
