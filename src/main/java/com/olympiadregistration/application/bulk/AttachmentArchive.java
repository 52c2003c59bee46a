package com.olympiadregistration.application.bulk;

import com.olympiadregistration.domain.exception.BulkImportException;
import com.olympiadregistration.domain.exception.FormatInvalidException;
import com.olympiadregistration.domain.exception.ReferenceInvalidException;
import com.olympiadregistration.domain.model.FileUpload;
import com.olympiadregistration.domain.model.RegistrationFile;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Files supplied in the ZIP archive accompanying a bulk import, looked up
 * by the member name given in a {@code Flag}, {@code Photo} or
 * {@code Consent Form} cell.
 */
@Slf4j
public final class AttachmentArchive {

    private static final AttachmentArchive EMPTY = new AttachmentArchive(Map.of());

    private final Map<String, byte[]> members;

    private AttachmentArchive(Map<String, byte[]> members) {
        this.members = members;
    }

    public static AttachmentArchive empty() {
        return EMPTY;
    }

    /**
     * Read every regular member of a ZIP archive into memory.
     *
     * @param zip archive bytes, or null for no archive
     * @throws FormatInvalidException if the archive cannot be read or a
     *         member exceeds the maximum file size
     */
    public static AttachmentArchive read(byte[] zip) {
        if (zip == null || zip.length == 0) {
            return EMPTY;
        }
        Map<String, byte[]> members = new HashMap<>();
        boolean sawEntry = false;
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                sawEntry = true;
                if (entry.isDirectory()) {
                    continue;
                }
                members.put(entry.getName(), readMember(in, entry.getName()));
            }
        } catch (IOException e) {
            log.warn("Rejected unreadable ZIP file: {}", e.getMessage());
            throw new FormatInvalidException("Invalid ZIP file");
        }
        if (!sawEntry) {
            throw new FormatInvalidException("Invalid ZIP file");
        }
        log.debug("Read ZIP file: members={}", members.size());
        return new AttachmentArchive(members);
    }

    /**
     * Look up a member for a row.
     *
     * @return the upload, or null if {@code filename} is null
     * @throws BulkImportException if the archive has no such member
     */
    public FileUpload get(String filename, int row) {
        if (filename == null) {
            return null;
        }
        byte[] content = members.get(filename);
        if (content == null) {
            throw new BulkImportException(row,
                new ReferenceInvalidException("file " + filename + " not in ZIP file"));
        }
        return new FileUpload(filename, content);
    }

    private static byte[] readMember(ZipInputStream in, String name) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int read;
        while ((read = in.read(buffer)) != -1) {
            out.write(buffer, 0, read);
            if (out.size() > RegistrationFile.MAX_SIZE) {
                throw new FormatInvalidException("ZIP file member " + name + " too large");
            }
        }
        return out.toByteArray();
    }
}
