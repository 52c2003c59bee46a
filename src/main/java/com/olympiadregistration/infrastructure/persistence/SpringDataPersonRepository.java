package com.olympiadregistration.infrastructure.persistence;

import com.olympiadregistration.domain.model.Person;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the Person aggregate.
 */
@Repository
public interface SpringDataPersonRepository extends JpaRepository<Person, Long> {

    List<Person> findByCountryIdAndRetiredFalseOrderByIdAsc(Long countryId);

    List<Person> findByRetiredFalseOrderByIdAsc();

    @Query("SELECT COUNT(p) > 0 FROM Person p WHERE p.country.id = :countryId AND p.primaryRole = :role"
        + " AND p.retired = false AND (:excludeId IS NULL OR p.id <> :excludeId)")
    boolean existsActiveWithRole(@Param("countryId") Long countryId, @Param("role") String role,
                                 @Param("excludeId") Long excludeId);

    @Query("SELECT DISTINCT p FROM Person p JOIN p.guideFor g WHERE g.id = :countryId AND p.retired = false")
    List<Person> findActiveGuidesFor(@Param("countryId") Long countryId);
}
