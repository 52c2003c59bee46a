package com.olympiadregistration.domain.repository;

import com.olympiadregistration.domain.model.RegistrationFile;

import java.util.Optional;

/**
 * Append-only store of uploaded files.
 */
public interface RegistrationFileRepository {

    Optional<RegistrationFile> findById(Long id);

    RegistrationFile save(RegistrationFile file);
}
