package com.olympiadregistration.domain.model;

/**
 * An upload whose sniffed format has been checked against its slot and its
 * declared extension.
 */
public record VerifiedUpload(FileKind kind, FileFormat format, String filename, byte[] content) {
}
