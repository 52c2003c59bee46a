package com.olympiadregistration.application;

import com.olympiadregistration.config.PerformanceConfiguration.RegistrationMetrics;
import com.olympiadregistration.domain.exception.PermissionDeniedException;
import com.olympiadregistration.domain.exception.RecordNotFoundException;
import com.olympiadregistration.domain.model.RegistrationFile;
import com.olympiadregistration.domain.repository.CountryRepository;
import com.olympiadregistration.domain.repository.PersonRepository;
import com.olympiadregistration.domain.repository.RegistrationFileRepository;
import com.olympiadregistration.domain.visibility.FileOwnership;
import com.olympiadregistration.domain.visibility.FileVisibilityResolver;
import com.olympiadregistration.infrastructure.security.ActorContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Serves stored files after resolving their visibility against the owner's
 * current state.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class FileDownloadService {

    private final RegistrationFileRepository fileRepository;
    private final CountryRepository countryRepository;
    private final PersonRepository personRepository;
    private final FileVisibilityResolver visibilityResolver;
    private final RegistrationMetrics metrics;

    /**
     * @throws RecordNotFoundException if no such file exists
     * @throws PermissionDeniedException if the actor may not see the file
     */
    public DownloadedFile download(ActorContext actor, Long id) {
        RegistrationFile file = fileRepository.findById(id)
            .orElseThrow(() -> new RecordNotFoundException("File not found: " + id));

        FileOwnership ownership = ownershipOf(file);
        try {
            visibilityResolver.authorize(file, ownership, actor.toViewer());
        } catch (PermissionDeniedException e) {
            metrics.recordFileAccess(file.getKind().name(), false);
            log.warn("File access denied: id={}, kind={}, principal={}",
                id, file.getKind(), Encode.forJava(actor.getPrincipal()));
            throw e;
        }

        metrics.recordFileAccess(file.getKind().name(), true);
        log.debug("File served: id={}, kind={}", id, file.getKind());
        return new DownloadedFile(file.downloadFilename(), file.getFormat().getContentType(), file.getContent());
    }

    private FileOwnership ownershipOf(RegistrationFile file) {
        if (file.getOwnerId() == null) {
            return FileOwnership.orphaned();
        }
        if (file.getKind().isPersonFile()) {
            return personRepository.findById(file.getOwnerId())
                .map(person -> FileOwnership.ofPerson(person, file))
                .orElseGet(FileOwnership::orphaned);
        }
        return countryRepository.findById(file.getOwnerId())
            .map(country -> FileOwnership.ofCountry(country, file))
            .orElseGet(FileOwnership::orphaned);
    }
}
