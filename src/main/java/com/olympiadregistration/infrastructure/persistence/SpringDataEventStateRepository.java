package com.olympiadregistration.infrastructure.persistence;

import com.olympiadregistration.domain.model.EventState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SpringDataEventStateRepository extends JpaRepository<EventState, Long> {
}
