package com.olympiadregistration.interfaces.api;

import com.olympiadregistration.domain.exception.FormatInvalidException;
import com.olympiadregistration.domain.model.FileUpload;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Conversion of multipart parts into domain uploads.
 */
final class MultipartUploads {

    private MultipartUploads() {
    }

    /**
     * @return the upload, or null if no file was sent
     */
    static FileUpload toUpload(MultipartFile part) {
        byte[] content = bytes(part);
        return content == null ? null : new FileUpload(part.getOriginalFilename(), content);
    }

    /**
     * @return the part's bytes, or null if no file was sent
     */
    static byte[] bytes(MultipartFile part) {
        if (part == null || part.isEmpty()) {
            return null;
        }
        try {
            return part.getBytes();
        } catch (IOException e) {
            throw new FormatInvalidException("Could not read uploaded file " + part.getName(), e);
        }
    }
}
