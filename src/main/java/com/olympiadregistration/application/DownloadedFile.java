package com.olympiadregistration.application;

/**
 * A file ready to be served.
 *
 * @param filename download filename derived from the sniffed format
 * @param contentType MIME type derived from the sniffed format
 * @param content file bytes
 */
public record DownloadedFile(String filename, String contentType, byte[] content) {
}
