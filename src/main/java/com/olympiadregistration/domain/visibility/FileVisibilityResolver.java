package com.olympiadregistration.domain.visibility;

import com.olympiadregistration.domain.exception.PermissionDeniedException;
import com.olympiadregistration.domain.model.PhotoConsent;
import com.olympiadregistration.domain.model.RegistrationFile;

import java.util.Objects;

/**
 * Computes file visibility as a pure function of the file, its owner's
 * current state and the viewer. Nothing is stored, so a consent change
 * takes effect on the next read.
 */
public class FileVisibilityResolver {

    private final boolean consentUi;

    /**
     * @param consentUi whether photo consent is collected; without it every
     *        current photo is public
     */
    public FileVisibilityResolver(boolean consentUi) {
        this.consentUi = consentUi;
    }

    public FileVisibility resolve(RegistrationFile file, FileOwnership owner) {
        if (!owner.current()) {
            return FileVisibility.SUPERSEDED;
        }
        FileVisibility visibility = switch (file.getKind()) {
            case FLAG -> FileVisibility.PUBLIC;
            case PHOTO -> photoVisibility(owner.photoConsent());
            case CONSENT_FORM -> FileVisibility.PRIVATE;
        };
        if (visibility == FileVisibility.PUBLIC && owner.ownerRetired()) {
            return FileVisibility.PRIVATE;
        }
        return visibility;
    }

    public boolean canView(RegistrationFile file, FileOwnership owner, Viewer viewer) {
        if (viewer.administrator()) {
            return true;
        }
        return switch (resolve(file, owner)) {
            case PUBLIC -> true;
            case BADGE_ONLY, PRIVATE -> isOwnerSide(owner, viewer);
            case SUPERSEDED -> false;
        };
    }

    /**
     * @throws PermissionDeniedException if the viewer may not be served the file
     */
    public void authorize(RegistrationFile file, FileOwnership owner, Viewer viewer) {
        if (!canView(file, owner, viewer)) {
            throw new PermissionDeniedException("You do not have permission to view this file");
        }
    }

    private FileVisibility photoVisibility(PhotoConsent consent) {
        if (!consentUi) {
            return FileVisibility.PUBLIC;
        }
        if (consent == null) {
            return FileVisibility.PRIVATE;
        }
        return switch (consent) {
            case WEBSITE_AND_BADGE -> FileVisibility.PUBLIC;
            case BADGE_ONLY -> FileVisibility.BADGE_ONLY;
            case NOT_GIVEN -> FileVisibility.PRIVATE;
        };
    }

    private static boolean isOwnerSide(FileOwnership owner, Viewer viewer) {
        if (viewer.countryId() != null && Objects.equals(viewer.countryId(), owner.countryId())) {
            return true;
        }
        return viewer.personId() != null && Objects.equals(viewer.personId(), owner.personId());
    }
}
