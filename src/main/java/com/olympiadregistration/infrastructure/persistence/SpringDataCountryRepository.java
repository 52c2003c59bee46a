package com.olympiadregistration.infrastructure.persistence;

import com.olympiadregistration.domain.model.Country;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the Country aggregate.
 */
@Repository
public interface SpringDataCountryRepository extends JpaRepository<Country, Long> {

    Optional<Country> findFirstByCodeAndRetiredFalse(String code);

    Optional<Country> findFirstByNameAndRetiredFalse(String name);

    Optional<Country> findFirstByStaffTrue();

    List<Country> findByRetiredFalseOrderByCodeAsc();

    /**
     * Whether a non-retired country other than {@code excludeId} has this code.
     * A null {@code excludeId} excludes nothing.
     */
    @Query("SELECT COUNT(c) > 0 FROM Country c WHERE c.code = :code AND c.retired = false"
        + " AND (:excludeId IS NULL OR c.id <> :excludeId)")
    boolean existsActiveCode(@Param("code") String code, @Param("excludeId") Long excludeId);

    @Query("SELECT COUNT(c) > 0 FROM Country c WHERE c.name = :name AND c.retired = false"
        + " AND (:excludeId IS NULL OR c.id <> :excludeId)")
    boolean existsActiveName(@Param("name") String name, @Param("excludeId") Long excludeId);
}
