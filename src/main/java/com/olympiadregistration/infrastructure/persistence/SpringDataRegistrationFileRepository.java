package com.olympiadregistration.infrastructure.persistence;

import com.olympiadregistration.domain.model.RegistrationFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SpringDataRegistrationFileRepository extends JpaRepository<RegistrationFile, Long> {
}
