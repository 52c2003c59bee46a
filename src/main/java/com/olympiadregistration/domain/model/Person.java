package com.olympiadregistration.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

/**
 * Person aggregate root: a participant or member of staff.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>belongs to exactly one Country</li>
 *   <li>at most one non-retired Person per (Country, role) except for
 *       observer roles and staff countries</li>
 *   <li>secondary roles only for staff countries</li>
 * </ul>
 */
@Entity
@Table(name = "people")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class Person {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "country_id", nullable = false)
    private Country country;

    @Column(name = "primary_role")
    private String primaryRole;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "person_other_roles", joinColumns = @JoinColumn(name = "person_id"))
    @Column(name = "role")
    private Set<String> otherRoles = new LinkedHashSet<>();

    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "person_guide_for",
        joinColumns = @JoinColumn(name = "person_id"),
        inverseJoinColumns = @JoinColumn(name = "country_id"))
    private Set<Country> guideFor = new LinkedHashSet<>();

    @Column(name = "given_name")
    private String givenName;

    @Column(name = "family_name")
    private String familyName;

    @Column(name = "passport_given_name")
    private String passportGivenName;

    @Column(name = "passport_family_name")
    private String passportFamilyName;

    @Column(name = "gender")
    private String gender;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "person_languages", joinColumns = @JoinColumn(name = "person_id"))
    @OrderColumn(name = "position")
    @Column(name = "language")
    private List<String> languages = new ArrayList<>();

    @Column(name = "diet")
    private String diet;

    @Column(name = "tshirt")
    private String tshirt;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "place", column = @Column(name = "arrival_place")),
        @AttributeOverride(name = "date", column = @Column(name = "arrival_date")),
        @AttributeOverride(name = "time", column = @Column(name = "arrival_time")),
        @AttributeOverride(name = "flight", column = @Column(name = "arrival_flight"))
    })
    private TravelLeg arrival;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "place", column = @Column(name = "departure_place")),
        @AttributeOverride(name = "date", column = @Column(name = "departure_date")),
        @AttributeOverride(name = "time", column = @Column(name = "departure_time")),
        @AttributeOverride(name = "flight", column = @Column(name = "departure_flight"))
    })
    private TravelLeg departure;

    @Column(name = "room_type")
    private String roomType;

    @Column(name = "room_share_with")
    private String roomShareWith;

    @Column(name = "room_number")
    private String roomNumber;

    @Column(name = "phone_number")
    private String phoneNumber;

    @Column(name = "passport_number")
    private String passportNumber;

    @Column(name = "nationality")
    private String nationality;

    @Column(name = "generic_url")
    private String genericUrl;

    /**
     * Set by administrators to skip required-field checks.
     */
    @Column(name = "incomplete", nullable = false)
    private boolean incomplete;

    @Column(name = "event_photos_consent")
    private Boolean eventPhotosConsent;

    @Enumerated(EnumType.STRING)
    @Column(name = "photo_consent")
    private PhotoConsent photoConsent;

    @Column(name = "diet_consent")
    private Boolean dietConsent;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "photo_id")
    private RegistrationFile photo;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "consent_form_id")
    private RegistrationFile consentForm;

    /**
     * Score per problem number; an absent key is an unset cell.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "person_scores", joinColumns = @JoinColumn(name = "person_id"))
    @MapKeyColumn(name = "problem")
    @Column(name = "score")
    private Map<Integer, Integer> scores = new HashMap<>();

    @Column(name = "retired", nullable = false)
    private boolean retired;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Transient
    private final List<DomainEvent> domainEvents = new ArrayList<>();

    /**
     * Create a new Person from audited fields.
     */
    public static Person create(PersonFields fields) {
        Person person = new Person();
        person.createdAt = Instant.now();
        person.copyFrom(fields);
        person.addDomainEvent("registered");
        return person;
    }

    /**
     * Apply an audited edit.
     */
    public void apply(PersonFields fields) {
        copyFrom(fields);
        addDomainEvent("updated");
    }

    public void replacePhoto(RegistrationFile file) {
        this.photo = file;
        this.updatedAt = Instant.now();
    }

    public void replaceConsentForm(RegistrationFile file) {
        this.consentForm = file;
        this.updatedAt = Instant.now();
    }

    /**
     * Set or clear one score cell.
     *
     * @param problem 1-based problem number
     * @param score new value, or null to clear
     * @return true if the cell changed
     */
    public boolean recordScore(int problem, Integer score) {
        Integer previous = score == null ? scores.remove(problem) : scores.put(problem, score);
        boolean changed = !Objects.equals(previous, score);
        if (changed) {
            this.updatedAt = Instant.now();
        }
        return changed;
    }

    public Optional<Integer> getScore(int problem) {
        return Optional.ofNullable(scores.get(problem));
    }

    /**
     * Sum of the set score cells.
     */
    public int totalScore() {
        return scores.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Stop guiding a country (used when that country is retired).
     */
    public boolean stopGuiding(Country guided) {
        boolean removed = guideFor.removeIf(c -> Objects.equals(c.getId(), guided.getId()));
        if (removed) {
            this.updatedAt = Instant.now();
        }
        return removed;
    }

    public void retire() {
        this.retired = true;
        this.updatedAt = Instant.now();
        addDomainEvent("retired");
    }

    /**
     * Every role held, primary first.
     */
    public Set<String> allRoles() {
        Set<String> roles = new LinkedHashSet<>();
        if (primaryRole != null) {
            roles.add(primaryRole);
        }
        roles.addAll(otherRoles);
        return roles;
    }

    public String fullName() {
        return (Objects.toString(givenName, "") + " " + Objects.toString(familyName, "")).trim();
    }

    public TravelLeg getArrival() {
        return arrival != null ? arrival : TravelLeg.empty();
    }

    public TravelLeg getDeparture() {
        return departure != null ? departure : TravelLeg.empty();
    }

    public Set<String> getOtherRoles() {
        return Collections.unmodifiableSet(otherRoles);
    }

    public Set<Country> getGuideFor() {
        return Collections.unmodifiableSet(guideFor);
    }

    public List<String> getLanguages() {
        return Collections.unmodifiableList(languages);
    }

    public Map<Integer, Integer> getScores() {
        return Collections.unmodifiableMap(scores);
    }

    public List<DomainEvent> collectDomainEvents() {
        List<DomainEvent> events = domainEvents.stream()
            .map(e -> e.withAggregateId(id))
            .toList();
        domainEvents.clear();
        return events;
    }

    private void copyFrom(PersonFields fields) {
        this.country = fields.getCountry();
        this.primaryRole = fields.getPrimaryRole();
        this.otherRoles = new LinkedHashSet<>(fields.getOtherRoles());
        this.guideFor = new LinkedHashSet<>(fields.getGuideFor());
        this.givenName = fields.getGivenName();
        this.familyName = fields.getFamilyName();
        this.passportGivenName = fields.getPassportGivenName();
        this.passportFamilyName = fields.getPassportFamilyName();
        this.gender = fields.getGender();
        this.dateOfBirth = fields.getDateOfBirth();
        this.languages = new ArrayList<>(fields.getLanguages());
        this.diet = fields.getDiet();
        this.tshirt = fields.getTshirt();
        this.arrival = fields.getArrival() != null ? fields.getArrival() : TravelLeg.empty();
        this.departure = fields.getDeparture() != null ? fields.getDeparture() : TravelLeg.empty();
        this.roomType = fields.getRoomType();
        this.roomShareWith = fields.getRoomShareWith();
        this.roomNumber = fields.getRoomNumber();
        this.phoneNumber = fields.getPhoneNumber();
        this.passportNumber = fields.getPassportNumber();
        this.nationality = fields.getNationality();
        this.genericUrl = fields.getGenericUrl();
        this.incomplete = fields.isIncomplete();
        this.eventPhotosConsent = fields.getEventPhotosConsent();
        this.photoConsent = fields.getPhotoConsent();
        this.dietConsent = fields.getDietConsent();
        this.updatedAt = Instant.now();
    }

    private void addDomainEvent(String action) {
        domainEvents.add(new DomainEvent("person", action, id,
            country.getCode() + " " + Objects.toString(primaryRole, ""), Instant.now()));
    }
}
