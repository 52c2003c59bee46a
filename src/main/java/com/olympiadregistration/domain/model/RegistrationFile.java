package com.olympiadregistration.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable uploaded file: a flag, photo or consent form.
 *
 * <p>Every upload creates a new row. The owning record points at its newest
 * file; earlier files for the same slot remain stored but are superseded.
 * Visibility is never stored here: it is computed on each read from the
 * owner's current state.
 */
@Entity
@Table(name = "registration_files")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class RegistrationFile {

    public static final int MAX_SIZE = 16 * 1024 * 1024;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false)
    private FileKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "format", nullable = false, updatable = false)
    private FileFormat format;

    @Column(name = "declared_filename", updatable = false)
    private String declaredFilename;

    /**
     * Id of the owning Country (flags) or Person (photos, consent forms).
     */
    @Column(name = "owner_id")
    private Long ownerId;

    @Column(name = "content", nullable = false, updatable = false, length = MAX_SIZE)
    private byte[] content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private RegistrationFile(VerifiedUpload upload, Long ownerId) {
        this.kind = upload.kind();
        this.format = upload.format();
        this.declaredFilename = upload.filename();
        this.content = upload.content();
        this.ownerId = ownerId;
        this.createdAt = Instant.now();
    }

    public static RegistrationFile of(VerifiedUpload upload, Long ownerId) {
        return new RegistrationFile(upload, ownerId);
    }

    /**
     * Filename used when serving the file, derived from the sniffed format.
     */
    public String downloadFilename() {
        return kind.getDownloadPrefix() + id + "." + format.getExtension();
    }
}
