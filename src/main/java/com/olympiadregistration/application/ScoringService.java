package com.olympiadregistration.application;

import com.olympiadregistration.config.PerformanceConfiguration.RegistrationMetrics;
import com.olympiadregistration.domain.audit.EventRules;
import com.olympiadregistration.domain.audit.FieldValidators;
import com.olympiadregistration.domain.audit.RoleCapabilityTable;
import com.olympiadregistration.domain.exception.FormatInvalidException;
import com.olympiadregistration.domain.exception.RecordNotFoundException;
import com.olympiadregistration.domain.exception.ReferenceInvalidException;
import com.olympiadregistration.domain.exception.RequiredFieldMissingException;
import com.olympiadregistration.domain.exception.StateConflictException;
import com.olympiadregistration.domain.model.Award;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.EventState;
import com.olympiadregistration.domain.model.EventStatus;
import com.olympiadregistration.domain.model.MedalBoundaries;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.domain.repository.CountryRepository;
import com.olympiadregistration.domain.repository.EventStateRepository;
import com.olympiadregistration.domain.repository.PersonRepository;
import com.olympiadregistration.infrastructure.audit.NotificationService;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.infrastructure.security.RegistrationAccessKernel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Score entry and medal boundaries.
 *
 * <p>Scores may change only while registration is disabled and the medal
 * boundaries are unset. Setting the boundaries freezes every score until
 * all three are unset together.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ScoringService {

    private final CountryRepository countryRepository;
    private final PersonRepository personRepository;
    private final EventStateRepository eventStateRepository;
    private final RoleCapabilityTable roles;
    private final EventRules rules;
    private final RegistrationAccessKernel accessKernel;
    private final NotificationService notificationService;
    private final RegistrationMetrics metrics;

    /**
     * Enter one problem's scores for every contestant of a country.
     *
     * @param countryCode code of the scored country
     * @param problem 1-based problem number
     * @param submitted value per contestant code; a blank value clears the cell
     * @return number of cells changed
     */
    public int enterScores(ActorContext actor, String countryCode, int problem, Map<String, String> submitted) {
        Optional<Country> found = countryRepository.findActiveByCode(Objects.toString(countryCode, "").trim());
        EventStatus status = eventStateRepository.load().snapshot();
        accessKernel.authorizeScoreEntry(actor, found.orElse(null), status);
        Country country = found
            .orElseThrow(() -> new ReferenceInvalidException("Country or problem invalid or not specified"));

        if (problem < 1 || problem > rules.getNumProblems()) {
            throw new ReferenceInvalidException("Country or problem invalid or not specified");
        }

        Map<String, Person> contestants = contestantsByCode(country);
        for (String code : submitted.keySet()) {
            if (!contestants.containsKey(code)) {
                throw new ReferenceInvalidException("Invalid contestant " + code);
            }
        }

        Map<Person, Integer> values = new LinkedHashMap<>();
        for (Map.Entry<String, Person> entry : contestants.entrySet()) {
            String code = entry.getKey();
            if (!submitted.containsKey(code)) {
                throw new RequiredFieldMissingException("No score specified for " + code);
            }
            values.put(entry.getValue(), FieldValidators.parseSmallInt(submitted.get(code),
                "score specified for " + code, rules.marksFor(problem)));
        }

        boolean anyChange = values.entrySet().stream()
            .anyMatch(e -> !Objects.equals(e.getKey().getScores().get(problem), e.getValue()));
        if (!anyChange) {
            log.info("Scores unchanged: country={}, problem={}", country.getId(), problem);
            return 0;
        }
        requireScoresOpen(status);

        int changed = 0;
        List<String> results = new ArrayList<>();
        for (Map.Entry<Person, Integer> entry : values.entrySet()) {
            Person person = entry.getKey();
            if (person.recordScore(problem, entry.getValue())) {
                personRepository.save(person);
                changed++;
            }
            results.add(roles.contestantCode(person).orElseThrow() + " = "
                + (entry.getValue() == null ? "?" : entry.getValue()));
        }

        String title = country.getCode() + " P" + problem;
        notificationService.record("scores", "entered", String.valueOf(country.getId()), actor.getPrincipal(),
            title + ": " + String.join(", ", results));
        metrics.recordScoresEntered(changed);
        log.info("Scores entered: country={}, problem={}, cells={}", country.getId(), problem, changed);
        return changed;
    }

    /**
     * Enter a single score cell, leaving the other contestants of the
     * country unchanged.
     */
    public int enterScore(ActorContext actor, Long personId, int problem, String value) {
        Optional<Person> found = personRepository.findById(personId).filter(p -> !p.isRetired());
        accessKernel.authorizeScoreEntry(actor, found.map(Person::getCountry).orElse(null),
            eventStateRepository.load().snapshot());
        Person person = found.orElseThrow(() -> new RecordNotFoundException("Person not found: " + personId));
        String code = roles.contestantCode(person)
            .orElseThrow(() -> new ReferenceInvalidException("Scores may only be entered for contestants"));

        Map<String, String> submitted = new LinkedHashMap<>();
        for (Map.Entry<String, Person> entry : contestantsByCode(person.getCountry()).entrySet()) {
            Integer current = entry.getValue().getScores().get(problem);
            submitted.put(entry.getKey(), current == null ? "" : current.toString());
        }
        submitted.put(code, value);
        return enterScores(actor, person.getCountry().getCode(), problem, submitted);
    }

    /**
     * Set, edit or unset the medal boundaries. A null argument leaves that
     * boundary as it is and a blank one unsets it. The first set and the
     * final unset must name all three boundaries.
     */
    public MedalBoundaries setMedalBoundaries(ActorContext actor, String gold, String silver, String bronze) {
        accessKernel.authorizeMedalBoundaries(actor);

        EventState state = eventStateRepository.load();
        MedalBoundaries current = state.getMedalBoundaries();
        int max = rules.maxTotal() + 1;

        Integer newGold = boundary(gold, current.getGold(), "gold medal boundary", max);
        Integer newSilver = boundary(silver, current.getSilver(), "silver medal boundary", max);
        Integer newBronze = boundary(bronze, current.getBronze(), "bronze medal boundary", max);

        int setCount = (newGold != null ? 1 : 0) + (newSilver != null ? 1 : 0) + (newBronze != null ? 1 : 0);
        if (setCount != 0 && setCount != 3) {
            throw new FormatInvalidException(current.isSet()
                ? "Must unset all medal boundaries at once"
                : "Must set all medal boundaries at once");
        }

        MedalBoundaries updated = MedalBoundaries.of(newGold, newSilver, newBronze);
        if (updated.equals(current)) {
            log.info("Medal boundaries unchanged");
            return current;
        }
        if (updated.isSet()) {
            if (newGold < newSilver || newSilver < newBronze) {
                throw new FormatInvalidException("Medal boundaries must not increase from gold to bronze");
            }
            if (state.isRegistrationEnabled()) {
                throw new StateConflictException("Registration must be disabled before medal boundaries are set");
            }
            if (anyScoresMissing()) {
                throw new StateConflictException("Scores not all entered");
            }
        }

        state.changeMedalBoundaries(updated);
        eventStateRepository.save(state);

        String detail = updated.isSet() ? "Medal boundaries: " + updated : "Medal boundaries unset";
        notificationService.record("event", "medal boundaries", String.valueOf(EventState.SINGLETON_ID),
            actor.getPrincipal(), detail);
        log.info("Medal boundaries changed: {}", updated);
        return updated;
    }

    /**
     * Results of every active contestant, ordered by contestant code.
     */
    @Transactional(readOnly = true)
    public List<ContestantResult> results() {
        MedalBoundaries boundaries = eventStateRepository.load().getMedalBoundaries();
        List<ContestantResult> results = new ArrayList<>();
        for (Person person : activeContestants()) {
            List<Integer> scores = new ArrayList<>();
            for (int p = 1; p <= rules.getNumProblems(); p++) {
                scores.add(person.getScores().get(p));
            }
            Award award = boundaries.isSet()
                ? Award.derive(person.getScores(), boundaries, rules.getMarksPerProblem(),
                    rules.isHonourableMentions())
                : null;
            results.add(new ContestantResult(person.getId(), roles.contestantCode(person).orElseThrow(),
                person.getCountry().getCode(), person.fullName(), scores, person.totalScore(), award));
        }
        return results;
    }

    private Map<String, Person> contestantsByCode(Country country) {
        Map<String, Person> result = new LinkedHashMap<>();
        personRepository.findActiveByCountry(country.getId()).stream()
            .filter(roles::isContestant)
            .sorted(Comparator.comparing(p -> roles.require(p.getPrimaryRole()).contestantNumber()))
            .forEach(p -> result.put(roles.contestantCode(p).orElseThrow(), p));
        return result;
    }

    private List<Person> activeContestants() {
        return personRepository.findAllActive().stream()
            .filter(roles::isContestant)
            .sorted(Comparator.comparing((Person p) -> p.getCountry().getCode())
                .thenComparing(p -> roles.require(p.getPrimaryRole()).contestantNumber()))
            .toList();
    }

    private boolean anyScoresMissing() {
        for (Person person : activeContestants()) {
            for (int p = 1; p <= rules.getNumProblems(); p++) {
                if (!person.getScores().containsKey(p)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void requireScoresOpen(EventStatus status) {
        if (status.medalBoundariesSet()) {
            throw new StateConflictException("Scores cannot be entered after medal boundaries are set");
        }
        if (status.registrationEnabled()) {
            throw new StateConflictException("Registration must be disabled before scores are entered");
        }
    }

    private static Integer boundary(String submitted, Integer current, String description, int max) {
        if (submitted == null) {
            return current;
        }
        return FieldValidators.parseSmallInt(submitted, description, max);
    }
}
