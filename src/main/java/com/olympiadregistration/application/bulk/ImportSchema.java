package com.olympiadregistration.application.bulk;

import java.util.List;
import java.util.Optional;

/**
 * Column-name-to-field mapping for one kind of bulk import. The schema
 * only turns cells into a submission; every rule is left to the auditor.
 *
 * @param <S> submission type fed to the auditor
 */
public interface ImportSchema<S> {

    /**
     * Entity kind, used in messages and metrics.
     */
    String kind();

    List<ColumnSpec> columns();

    /**
     * Build the submission for one row.
     *
     * @param row cleaned row
     * @param attachments files from the accompanying ZIP archive
     */
    S toSubmission(ImportRow row, AttachmentArchive attachments);

    default Optional<ColumnSpec> column(String name) {
        return columns().stream().filter(c -> c.name().equals(name)).findFirst();
    }
}
