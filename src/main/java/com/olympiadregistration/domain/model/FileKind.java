package com.olympiadregistration.domain.model;

import java.util.Set;

/**
 * The slot a file occupies on its owning record.
 */
public enum FileKind {

    FLAG("flag", "Flags", "flag", Set.of(FileFormat.PNG)),
    PHOTO("photo", "Photos", "photo", Set.of(FileFormat.JPEG, FileFormat.PNG)),
    CONSENT_FORM("consent form", "Consent forms", "consent-form", Set.of(FileFormat.PDF));

    private final String description;
    private final String pluralDescription;
    private final String downloadPrefix;
    private final Set<FileFormat> allowedFormats;

    FileKind(String description, String pluralDescription, String downloadPrefix,
             Set<FileFormat> allowedFormats) {
        this.description = description;
        this.pluralDescription = pluralDescription;
        this.downloadPrefix = downloadPrefix;
        this.allowedFormats = allowedFormats;
    }

    public String getDescription() {
        return description;
    }

    public String getPluralDescription() {
        return pluralDescription;
    }

    public String getDownloadPrefix() {
        return downloadPrefix;
    }

    public Set<FileFormat> getAllowedFormats() {
        return allowedFormats;
    }

    /**
     * Whether files of this kind belong to a Person (as opposed to a Country).
     */
    public boolean isPersonFile() {
        return this != FLAG;
    }
}
