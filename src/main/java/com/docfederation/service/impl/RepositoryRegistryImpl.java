package com.docfederation.service.impl;

import com.docfederation.exception.AlreadyEnrolledException;
import com.docfederation.exception.EnrollmentNotFoundException;
import com.docfederation.exception.StaleRevisionException;
import com.docfederation.model.enrollment.EnrollmentStatus;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.model.enrollment.RepositoryKey;
import com.docfederation.model.enrollment.SyncOutcome;
import com.docfederation.repository.EnrollmentRepository;
import com.docfederation.service.RepositoryRegistry;
import com.docfederation.util.GitInputValidator;
import com.docfederation.util.SlugGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA-backed registry of enrolled repositories.
 *
 * <p>Every mutation of one enrollment takes a pessimistic row lock, so sync
 * outcomes for the same repository are applied one at a time and in job
 * sequence order; an outcome older than the last applied one is rejected with
 * {@link StaleRevisionException}. Suspended enrollments are kept with their
 * slug so a later enroll restores the same namespace.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepositoryRegistryImpl implements RepositoryRegistry {

    static final int MAX_ENROLL_ATTEMPTS = 3;

    private final EnrollmentRepository enrollmentRepository;
    private final TransactionTemplate transactionTemplate;

    /**
     * Each attempt runs in its own transaction. A unique-constraint violation
     * means a concurrent enroll won: of this repository (reported as
     * {@code AlreadyEnrolled}) or of the derived slug (retried with a fresh slug).
     */
    @Override
    public String enroll(String owner, String name, String defaultBranch) {
        GitInputValidator.validateRepositoryPart("owner", owner);
        GitInputValidator.validateRepositoryPart("name", name);
        GitInputValidator.validateBranchName(defaultBranch);
        RepositoryKey key = RepositoryKey.of(owner, name);

        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> enrollOnce(key, defaultBranch));
            } catch (DataIntegrityViolationException e) {
                if (enrollmentRepository.findByOwnerAndName(key.owner(), key.name()).isPresent()) {
                    log.warn("Concurrent enrollment of {} detected", key);
                    throw new AlreadyEnrolledException(key.fullName());
                }
                if (attempt >= MAX_ENROLL_ATTEMPTS) {
                    throw e;
                }
                log.warn("Slug of {} was taken concurrently (attempt {}/{}): {}",
                        key, attempt, MAX_ENROLL_ATTEMPTS, e.getMostSpecificCause().getMessage());
            }
        }
    }

    private String enrollOnce(RepositoryKey key, String defaultBranch) {
        Optional<RepositoryEnrollment> existing = enrollmentRepository.findForUpdate(key.owner(), key.name());
        if (existing.isPresent()) {
            RepositoryEnrollment enrollment = existing.get();
            if (enrollment.isActive()) {
                throw new AlreadyEnrolledException(key.fullName());
            }
            enrollment.reactivate(defaultBranch, Instant.now());
            log.info("Re-activated {} under slug '{}'", key, enrollment.getSlug());
            return enrollment.getSlug();
        }

        String slug = SlugGenerator.derive(key, enrollmentRepository::existsBySlug);
        enrollmentRepository.saveAndFlush(RepositoryEnrollment.create(key, defaultBranch, slug, Instant.now()));
        log.info("Enrolled {} (branch={}) under slug '{}'", key, defaultBranch, slug);
        return slug;
    }

    @Override
    @Transactional
    public boolean unenroll(String owner, String name) {
        RepositoryKey key = RepositoryKey.of(owner, name);
        RepositoryEnrollment enrollment = enrollmentRepository.findForUpdate(key.owner(), key.name())
                .orElseThrow(() -> new EnrollmentNotFoundException(key.fullName()));
        if (!enrollment.isActive()) {
            log.debug("{} is already suspended", key);
            return false;
        }
        enrollment.suspend(Instant.now());
        log.info("Suspended {} (slug '{}')", key, enrollment.getSlug());
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public RepositoryEnrollment get(String owner, String name) {
        RepositoryKey key = RepositoryKey.of(owner, name);
        return find(key).orElseThrow(() -> new EnrollmentNotFoundException(key.fullName()));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RepositoryEnrollment> find(RepositoryKey key) {
        return enrollmentRepository.findByOwnerAndName(key.owner(), key.name());
    }

    @Override
    @Transactional(readOnly = true)
    public List<RepositoryEnrollment> listAll() {
        return enrollmentRepository.findAllByOrderBySlugAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public List<RepositoryEnrollment> listActive() {
        return enrollmentRepository.findByStatusOrderBySlugAsc(
                EnrollmentStatus.ACTIVE);
    }

    @Override
    @Transactional(noRollbackFor = StaleRevisionException.class)
    public RepositoryEnrollment recordSyncOutcome(String owner, String name, String revision, long sequence,
                                                  SyncOutcome outcome, String error) {
        RepositoryKey key = RepositoryKey.of(owner, name);
        RepositoryEnrollment enrollment = enrollmentRepository.findForUpdate(key.owner(), key.name())
                .orElseThrow(() -> new EnrollmentNotFoundException(key.fullName()));

        if (sequence <= enrollment.getLastAppliedSequence()) {
            throw new StaleRevisionException(key.fullName(), sequence, enrollment.getLastAppliedSequence());
        }

        enrollment.applySyncOutcome(revision, sequence, outcome, error, Instant.now());
        log.info("Recorded {} for {} at {} (job #{})", outcome, key, revision, sequence);
        return enrollment;
    }

    @Override
    @Transactional(readOnly = true)
    public long highestAppliedSequence() {
        return enrollmentRepository.highestAppliedSequence();
    }
}
