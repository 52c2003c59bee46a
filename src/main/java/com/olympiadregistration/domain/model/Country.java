package com.olympiadregistration.domain.model;

import com.olympiadregistration.domain.exception.StateConflictException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Country aggregate root: a national team, or the staff pseudo-country.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code code} is upper case and unique among non-retired countries</li>
 *   <li>{@code name} is unique among non-retired countries</li>
 *   <li>{@code staff} and {@code participantsOk} never change after creation</li>
 *   <li>staff countries carry no expected numbers</li>
 * </ul>
 * Uniqueness is checked by the country auditor against the current store
 * state; retired countries keep their code so the columns are not unique.
 */
@Entity
@Table(name = "countries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class Country {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "code", nullable = false)
    private String code;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "is_staff", nullable = false, updatable = false)
    private boolean staff;

    @Column(name = "participants_ok", nullable = false, updatable = false)
    private boolean participantsOk;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "country_contact_emails", joinColumns = @JoinColumn(name = "country_id"))
    @OrderColumn(name = "position")
    @Column(name = "email")
    private List<String> contactEmails = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "country_contact_extra", joinColumns = @JoinColumn(name = "country_id"))
    @OrderColumn(name = "position")
    @Column(name = "email")
    private List<String> contactExtra = new ArrayList<>();

    @Embedded
    private ExpectedNumbers expected;

    @Column(name = "numbers_confirmed", nullable = false)
    private boolean numbersConfirmed;

    @Column(name = "generic_url")
    private String genericUrl;

    /**
     * Current flag; earlier flags stay stored and become superseded.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "flag_id")
    private RegistrationFile flag;

    @Column(name = "leader_email")
    private String leaderEmail;

    @Column(name = "physical_address", length = 2000)
    private String physicalAddress;

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

    private Country(CountryFields fields) {
        this.staff = fields.isStaff();
        this.participantsOk = fields.isParticipantsOk();
        this.createdAt = Instant.now();
        copyFrom(fields);
    }

    /**
     * Create a new Country from audited fields.
     *
     * @param fields audited field set
     * @return new, unsaved Country
     */
    public static Country create(CountryFields fields) {
        Country country = new Country(fields);
        country.addDomainEvent("created", country.code);
        return country;
    }

    /**
     * Apply an audited edit. Immutable flags are left untouched; the auditor
     * has already rejected any attempt to change them.
     */
    public void apply(CountryFields fields) {
        copyFrom(fields);
        addDomainEvent("updated", code);
    }

    /**
     * Apply a preregistration edit: only expected numbers and the
     * virtual-event contact details change.
     */
    public void applyPreregistration(CountryFields fields) {
        this.expected = fields.getExpected();
        this.numbersConfirmed = fields.isNumbersConfirmed();
        this.leaderEmail = fields.getLeaderEmail();
        this.physicalAddress = fields.getPhysicalAddress();
        this.updatedAt = Instant.now();
        addDomainEvent("preregistration updated", code);
    }

    /**
     * Point the flag slot at a newly stored file.
     */
    public void replaceFlag(RegistrationFile file) {
        this.flag = file;
        this.updatedAt = Instant.now();
    }

    /**
     * Retire (soft delete) this country.
     *
     * @throws StateConflictException if this is the staff country
     */
    public void retire() {
        if (staff) {
            throw new StateConflictException("The special staff country cannot be retired");
        }
        this.retired = true;
        this.updatedAt = Instant.now();
        addDomainEvent("retired", code);
    }

    public boolean isNormal() {
        return !staff;
    }

    public List<String> getContactEmails() {
        return Collections.unmodifiableList(contactEmails);
    }

    public List<String> getContactExtra() {
        return Collections.unmodifiableList(contactExtra);
    }

    /**
     * Collect and clear pending domain events.
     */
    public List<DomainEvent> collectDomainEvents() {
        List<DomainEvent> events = domainEvents.stream()
            .map(e -> e.withAggregateId(id))
            .toList();
        domainEvents.clear();
        return events;
    }

    private void copyFrom(CountryFields fields) {
        this.code = fields.getCode();
        this.name = fields.getName();
        this.contactEmails = new ArrayList<>(fields.getContactEmails());
        this.contactExtra = new ArrayList<>(fields.getContactExtra());
        this.expected = fields.getExpected() != null ? fields.getExpected() : ExpectedNumbers.none();
        this.numbersConfirmed = fields.isNumbersConfirmed();
        this.genericUrl = fields.getGenericUrl();
        this.leaderEmail = fields.getLeaderEmail();
        this.physicalAddress = fields.getPhysicalAddress();
        this.updatedAt = Instant.now();
    }

    private void addDomainEvent(String action, String detail) {
        domainEvents.add(new DomainEvent("country", action, id, detail, Instant.now()));
    }
}
