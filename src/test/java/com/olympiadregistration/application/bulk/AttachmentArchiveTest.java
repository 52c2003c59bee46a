package com.olympiadregistration.application.bulk;

import com.olympiadregistration.domain.exception.BulkImportException;
import com.olympiadregistration.domain.exception.ErrorKind;
import com.olympiadregistration.domain.exception.FormatInvalidException;
import com.olympiadregistration.domain.model.FileUpload;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static com.olympiadregistration.support.RegistrationTestContext.PNG;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class AttachmentArchiveTest {

    @Test
    void members_looked_up_by_name() throws IOException {
        AttachmentArchive archive = AttachmentArchive.read(BulkImportServiceTest.zip(Map.of("flags/abc.png", PNG)));

        FileUpload upload = archive.get("flags/abc.png", 1);
        assertEquals("flags/abc.png", upload.filename());
        assertArrayEquals(PNG, upload.content());
        assertNull(archive.get(null, 1));

        BulkImportException missing = assertThrows(BulkImportException.class, () -> archive.get("abc.png", 4));
        assertEquals("row 4: file abc.png not in ZIP file", missing.getMessage());
        assertEquals(ErrorKind.REFERENCE_INVALID, missing.getKind());
    }

    @Test
    void no_archive_is_empty() {
        assertSame(AttachmentArchive.empty(), AttachmentArchive.read(null));
        assertThrows(BulkImportException.class, () -> AttachmentArchive.empty().get("abc.png", 1));
    }

    @Test
    void garbage_rejected() {
        FormatInvalidException e = assertThrows(FormatInvalidException.class,
            () -> AttachmentArchive.read("not a zip file".getBytes(UTF_8)));
        assertEquals("Invalid ZIP file", e.getMessage());
    }
}
