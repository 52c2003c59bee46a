package com.olympiadregistration.domain.visibility;

import com.olympiadregistration.domain.exception.PermissionDeniedException;
import com.olympiadregistration.domain.model.FileFormat;
import com.olympiadregistration.domain.model.FileKind;
import com.olympiadregistration.domain.model.PhotoConsent;
import com.olympiadregistration.domain.model.RegistrationFile;
import com.olympiadregistration.domain.model.VerifiedUpload;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FileVisibilityResolverTest {

    private static final long COUNTRY = 3L;
    private static final long PERSON = 40L;

    private static final Viewer ADMIN = new Viewer(true, null, null);
    private static final Viewer OWN_DELEGATE = new Viewer(false, COUNTRY, null);
    private static final Viewer OTHER_DELEGATE = new Viewer(false, 4L, null);
    private static final Viewer SELF = new Viewer(false, null, PERSON);
    private static final Viewer ANONYMOUS = Viewer.anonymous();

    private final FileVisibilityResolver withConsent = new FileVisibilityResolver(true);
    private final FileVisibilityResolver withoutConsent = new FileVisibilityResolver(false);

    private static RegistrationFile file(FileKind kind, FileFormat format) {
        return RegistrationFile.of(new VerifiedUpload(kind, format, "upload." + format.getExtension(), new byte[0]),
            PERSON);
    }

    private static FileOwnership personOwner(PhotoConsent consent) {
        return new FileOwnership(COUNTRY, PERSON, true, false, consent);
    }

    @Test
    void current_flag_is_public() {
        RegistrationFile flag = file(FileKind.FLAG, FileFormat.PNG);
        FileOwnership owner = new FileOwnership(COUNTRY, null, true, false, null);

        assertEquals(FileVisibility.PUBLIC, withConsent.resolve(flag, owner));
        assertTrue(withConsent.canView(flag, owner, ANONYMOUS));
    }

    @Test
    void superseded_file_is_for_administrators_only() {
        RegistrationFile flag = file(FileKind.FLAG, FileFormat.PNG);
        FileOwnership owner = new FileOwnership(COUNTRY, null, false, false, null);

        assertEquals(FileVisibility.SUPERSEDED, withConsent.resolve(flag, owner));
        assertFalse(withConsent.canView(flag, owner, OWN_DELEGATE));
        assertTrue(withConsent.canView(flag, owner, ADMIN));
    }

    @Test
    void photo_visibility_follows_consent() {
        RegistrationFile photo = file(FileKind.PHOTO, FileFormat.JPEG);

        assertEquals(FileVisibility.PUBLIC, withConsent.resolve(photo, personOwner(PhotoConsent.WEBSITE_AND_BADGE)));
        assertEquals(FileVisibility.BADGE_ONLY, withConsent.resolve(photo, personOwner(PhotoConsent.BADGE_ONLY)));
        assertEquals(FileVisibility.PRIVATE, withConsent.resolve(photo, personOwner(PhotoConsent.NOT_GIVEN)));
        assertEquals(FileVisibility.PRIVATE, withConsent.resolve(photo, personOwner(null)));

        assertEquals(FileVisibility.PUBLIC, withoutConsent.resolve(photo, personOwner(null)));
    }

    @Test
    void badge_only_photo_visible_to_owner_side() {
        RegistrationFile photo = file(FileKind.PHOTO, FileFormat.JPEG);
        FileOwnership owner = personOwner(PhotoConsent.BADGE_ONLY);

        assertTrue(withConsent.canView(photo, owner, OWN_DELEGATE));
        assertTrue(withConsent.canView(photo, owner, SELF));
        assertFalse(withConsent.canView(photo, owner, OTHER_DELEGATE));
        assertFalse(withConsent.canView(photo, owner, ANONYMOUS));
    }

    @Test
    void consent_form_is_always_private() {
        RegistrationFile form = file(FileKind.CONSENT_FORM, FileFormat.PDF);
        FileOwnership owner = personOwner(PhotoConsent.WEBSITE_AND_BADGE);

        assertEquals(FileVisibility.PRIVATE, withoutConsent.resolve(form, owner));
        assertThrows(PermissionDeniedException.class, () -> withoutConsent.authorize(form, owner, ANONYMOUS));
        assertDoesNotThrow(() -> withoutConsent.authorize(form, owner, OWN_DELEGATE));
    }

    @Test
    void retired_owner_hides_public_files() {
        RegistrationFile photo = file(FileKind.PHOTO, FileFormat.JPEG);
        FileOwnership retired = new FileOwnership(COUNTRY, PERSON, true, true, PhotoConsent.WEBSITE_AND_BADGE);

        assertEquals(FileVisibility.PRIVATE, withConsent.resolve(photo, retired));
        assertFalse(withConsent.canView(photo, retired, ANONYMOUS));
        assertFalse(withConsent.canView(photo, FileOwnership.orphaned(), OWN_DELEGATE));
    }
}
