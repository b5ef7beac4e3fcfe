package com.docfederation.repository;

import com.docfederation.model.enrollment.EnrollmentStatus;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EnrollmentRepository extends JpaRepository<RepositoryEnrollment, Long> {

    Optional<RepositoryEnrollment> findByOwnerAndName(String owner, String name);

    /**
     * Row-locked read used by every sync-state mutation so concurrent outcomes
     * for the same repository are applied one after the other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM RepositoryEnrollment e WHERE e.owner = :owner AND e.name = :name")
    Optional<RepositoryEnrollment> findForUpdate(@Param("owner") String owner, @Param("name") String name);

    boolean existsBySlug(String slug);

    List<RepositoryEnrollment> findByStatusOrderBySlugAsc(EnrollmentStatus status);

    List<RepositoryEnrollment> findAllByOrderBySlugAsc();

    @Query("SELECT COALESCE(MAX(e.lastAppliedSequence), 0) FROM RepositoryEnrollment e")
    long highestAppliedSequence();
}
