package com.olympiadregistration.domain.audit;

import com.olympiadregistration.domain.exception.FormatInvalidException;
import com.olympiadregistration.domain.model.FileFormat;
import com.olympiadregistration.domain.model.FileKind;
import com.olympiadregistration.domain.model.FileUpload;
import com.olympiadregistration.domain.model.VerifiedUpload;

import java.util.stream.Collectors;

/**
 * Checks an upload's sniffed format against its slot and its filename.
 */
final class UploadVerifier {

    private UploadVerifier() {
    }

    static VerifiedUpload verify(FileUpload upload, FileKind kind) {
        if (upload == null) {
            return null;
        }
        FileFormat format = FileFormat.sniff(upload.content())
            .filter(kind.getAllowedFormats()::contains)
            .orElseThrow(() -> new FormatInvalidException(
                kind.getPluralDescription() + " must be in " + formatNames(kind) + " format"));
        if (!format.matchesFilename(upload.filename())) {
            throw new FormatInvalidException("Filename extension for " + kind.getDescription()
                + " must match contents (" + format.getExtension() + ")");
        }
        return new VerifiedUpload(kind, format, upload.filename(), upload.content());
    }

    private static String formatNames(FileKind kind) {
        return kind.getAllowedFormats().stream()
            .sorted()
            .map(Enum::name)
            .collect(Collectors.joining(" or "));
    }
}
