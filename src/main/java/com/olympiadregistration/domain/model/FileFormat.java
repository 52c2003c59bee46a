package com.olympiadregistration.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Binary formats accepted for uploaded files, identified by content sniffing
 * rather than by the declared filename.
 */
public enum FileFormat {

    JPEG("jpg", "image/jpeg", Set.of("jpg", "jpeg")),
    PNG("png", "image/png", Set.of("png")),
    PDF("pdf", "application/pdf", Set.of("pdf"));

    private static final byte[] PNG_MAGIC = {
        (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n'
    };
    private static final byte[] JPEG_MAGIC = {(byte) 0xff, (byte) 0xd8, (byte) 0xff};
    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F', '-'};

    private final String extension;
    private final String contentType;
    private final Set<String> acceptedExtensions;

    FileFormat(String extension, String contentType, Set<String> acceptedExtensions) {
        this.extension = extension;
        this.contentType = contentType;
        this.acceptedExtensions = acceptedExtensions;
    }

    public String getExtension() {
        return extension;
    }

    public String getContentType() {
        return contentType;
    }

    /**
     * Whether the extension of {@code filename} (case-insensitive) names this
     * format.
     */
    public boolean matchesFilename(String filename) {
        if (filename == null) {
            return false;
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return false;
        }
        String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return acceptedExtensions.contains(ext);
    }

    /**
     * Identify the format of some file content from its leading bytes.
     *
     * @param content file content
     * @return the sniffed format, or empty if not one we accept
     */
    public static Optional<FileFormat> sniff(byte[] content) {
        if (content == null) {
            return Optional.empty();
        }
        if (startsWith(content, PNG_MAGIC)) {
            return Optional.of(PNG);
        }
        if (startsWith(content, JPEG_MAGIC)) {
            return Optional.of(JPEG);
        }
        if (startsWith(content, PDF_MAGIC)) {
            return Optional.of(PDF);
        }
        return Optional.empty();
    }

    private static boolean startsWith(byte[] content, byte[] magic) {
        return content.length >= magic.length
            && Arrays.equals(Arrays.copyOf(content, magic.length), magic);
    }
}
