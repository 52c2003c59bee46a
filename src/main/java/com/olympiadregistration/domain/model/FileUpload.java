package com.olympiadregistration.domain.model;

/**
 * A file as submitted by the user, before format checks.
 *
 * @param filename declared filename, used only for its extension
 * @param content raw bytes
 */
public record FileUpload(String filename, byte[] content) {
}
