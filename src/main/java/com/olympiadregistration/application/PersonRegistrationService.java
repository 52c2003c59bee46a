package com.olympiadregistration.application;

import com.olympiadregistration.config.PerformanceConfiguration.RegistrationMetrics;
import com.olympiadregistration.domain.audit.EventContext;
import com.olympiadregistration.domain.audit.FieldValidators;
import com.olympiadregistration.domain.audit.PersonAuditor;
import com.olympiadregistration.domain.audit.PersonSubmission;
import com.olympiadregistration.domain.audit.RegistrationView;
import com.olympiadregistration.domain.exception.RecordNotFoundException;
import com.olympiadregistration.domain.exception.StateConflictException;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.domain.model.PersonFields;
import com.olympiadregistration.domain.model.RegistrationFile;
import com.olympiadregistration.domain.repository.CountryRepository;
import com.olympiadregistration.domain.repository.PersonRepository;
import com.olympiadregistration.domain.repository.RegistrationFileRepository;
import com.olympiadregistration.infrastructure.audit.NotificationService;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.infrastructure.security.ActorRole;
import com.olympiadregistration.infrastructure.security.RegistrationAccessKernel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Application service for Person registration.
 *
 * Orchestrates gate, audit, store, file storage and notification for each
 * create, edit and retirement.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class PersonRegistrationService {

    private final PersonRepository personRepository;
    private final CountryRepository countryRepository;
    private final RegistrationFileRepository fileRepository;
    private final PersonAuditor personAuditor;
    private final RegistrationView registrationView;
    private final RegistrationAccessKernel accessKernel;
    private final EventContextFactory eventContextFactory;
    private final NotificationService notificationService;
    private final RegistrationMetrics metrics;

    /**
     * Register a person. A delegate who names no country registers for
     * their own.
     */
    public Person create(ActorContext actor, PersonSubmission submission) {
        submission = forActor(actor, submission);

        EventContext context = eventContextFactory.current();
        Country country = countryByCode(submission.getCountryCode());
        accessKernel.authorizePersonCreation(actor, country, context.status());

        PersonFields fields = personAuditor.audit(submission, null, actor.isAdministrator(), context,
            registrationView);

        Person person = personRepository.save(Person.create(fields));
        storeFiles(person, fields);

        notificationService.recordAll(person.collectDomainEvents(), actor.getPrincipal());
        metrics.recordRegistration("person", "registered");
        log.info("Person registered: id={}, country={}", person.getId(), person.getCountry().getId());
        return person;
    }

    /**
     * Edit a person.
     */
    public Person update(ActorContext actor, Long id, PersonSubmission submission) {
        Person person = loadActive(id);

        EventContext context = eventContextFactory.current();
        String code = FieldValidators.clean(submission.getCountryCode());
        Country target = code == null ? person.getCountry() : countryByCode(code);
        accessKernel.authorizePersonEdit(actor, person, target, context.status());

        PersonFields fields = personAuditor.audit(submission, person, actor.isAdministrator(), context,
            registrationView);

        person.apply(fields);
        person = personRepository.save(person);
        storeFiles(person, fields);

        notificationService.recordAll(person.collectDomainEvents(), actor.getPrincipal());
        metrics.recordRegistration("person", "updated");
        log.info("Person updated: id={}", id);
        return person;
    }

    public void retire(ActorContext actor, Long id) {
        accessKernel.authorizePersonRetirement(actor);

        Person person = loadActive(id);
        person.retire();
        personRepository.save(person);

        notificationService.recordAll(person.collectDomainEvents(), actor.getPrincipal());
        metrics.recordRegistration("person", "retired");
        log.info("Person retired: id={}", id);
    }

    @Transactional(readOnly = true)
    public Person get(Long id) {
        return personRepository.findById(id)
            .orElseThrow(() -> new RecordNotFoundException("Person not found: " + id));
    }

    @Transactional(readOnly = true)
    public List<Person> list() {
        return personRepository.findAllActive();
    }

    private Person loadActive(Long id) {
        Person person = get(id);
        if (person.isRetired()) {
            throw new StateConflictException("Person " + id + " has been retired");
        }
        return person;
    }

    private Country countryByCode(String code) {
        String cleaned = FieldValidators.clean(code);
        return cleaned == null ? null : countryRepository.findActiveByCode(cleaned).orElse(null);
    }

    /**
     * Fill in the delegate's own country when a delegate names none.
     */
    public PersonSubmission forActor(ActorContext actor, PersonSubmission submission) {
        if (actor.getRole() != ActorRole.REGISTER || actor.getCountryId() == null
                || !FieldValidators.isBlank(submission.getCountryCode())) {
            return submission;
        }
        return countryRepository.findById(actor.getCountryId())
            .map(own -> submission.toBuilder().countryCode(own.getCode()).build())
            .orElse(submission);
    }

    private void storeFiles(Person person, PersonFields fields) {
        if (fields.getPhoto() != null) {
            RegistrationFile photo = fileRepository.save(RegistrationFile.of(fields.getPhoto(), person.getId()));
            person.replacePhoto(photo);
            log.info("Photo stored: person={}, file={}", person.getId(), photo.getId());
        }
        if (fields.getConsentForm() != null) {
            RegistrationFile form = fileRepository.save(
                RegistrationFile.of(fields.getConsentForm(), person.getId()));
            person.replaceConsentForm(form);
            log.info("Consent form stored: person={}, file={}", person.getId(), form.getId());
        }
        if (fields.getPhoto() != null || fields.getConsentForm() != null) {
            personRepository.save(person);
        }
    }
}
