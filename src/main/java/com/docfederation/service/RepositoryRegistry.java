package com.docfederation.service;

import com.docfederation.exception.AlreadyEnrolledException;
import com.docfederation.exception.EnrollmentNotFoundException;
import com.docfederation.exception.StaleRevisionException;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.model.enrollment.RepositoryKey;
import com.docfederation.model.enrollment.SyncOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of enrolled repositories and their sync state.
 */
public interface RepositoryRegistry {

    /**
     * Enrolls a repository, or re-activates a suspended one under its original slug.
     *
     * @return the namespace slug
     * @throws AlreadyEnrolledException if the repository is already active
     */
    String enroll(String owner, String name, String defaultBranch);

    /**
     * Suspends an enrollment. No-op when it is already suspended.
     *
     * @return true if the status changed
     * @throws EnrollmentNotFoundException if the repository was never enrolled
     */
    boolean unenroll(String owner, String name);

    /**
     * @throws EnrollmentNotFoundException if the repository was never enrolled
     */
    RepositoryEnrollment get(String owner, String name);

    Optional<RepositoryEnrollment> find(RepositoryKey key);

    List<RepositoryEnrollment> listAll();

    /**
     * Active enrollments ordered by slug.
     */
    List<RepositoryEnrollment> listActive();

    /**
     * Applies the terminal outcome of a sync job. Outcomes must arrive in job
     * order; an outcome for a job at or below the last applied sequence is
     * rejected.
     *
     * @throws StaleRevisionException if a newer job's outcome was already recorded
     */
    RepositoryEnrollment recordSyncOutcome(String owner, String name, String revision, long sequence,
                                           SyncOutcome outcome, String error);

    /**
     * Highest job sequence ever recorded, used to seed the job counter on startup.
     */
    long highestAppliedSequence();
}
