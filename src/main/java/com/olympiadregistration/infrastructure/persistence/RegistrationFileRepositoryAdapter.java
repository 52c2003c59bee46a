package com.olympiadregistration.infrastructure.persistence;

import com.olympiadregistration.domain.model.RegistrationFile;
import com.olympiadregistration.domain.repository.RegistrationFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class RegistrationFileRepositoryAdapter implements RegistrationFileRepository {

    private final SpringDataRegistrationFileRepository springDataRepository;

    @Override
    public Optional<RegistrationFile> findById(Long id) {
        return springDataRepository.findById(id);
    }

    @Override
    public RegistrationFile save(RegistrationFile file) {
        RegistrationFile saved = springDataRepository.save(file);
        log.info("File stored: id={}, kind={}, format={}, size={}",
            saved.getId(), saved.getKind(), saved.getFormat(), saved.getContent().length);
        return saved;
    }
}
