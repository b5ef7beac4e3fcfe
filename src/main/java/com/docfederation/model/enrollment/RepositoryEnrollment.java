package com.docfederation.model.enrollment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A repository registered for inclusion in the unified site.
 *
 * <p>The slug is assigned once and never changes. Everything else moves only
 * through the transition methods below; there are no setters.
 */
@Entity
@Table(name = "REPOSITORY_ENROLLMENTS",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_enrollment_repo", columnNames = {"owner", "name"}),
                @UniqueConstraint(name = "uk_enrollment_slug", columnNames = {"slug"})
        },
        indexes = {
                @Index(name = "idx_enrollment_status", columnList = "status")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RepositoryEnrollment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner", nullable = false, length = 100)
    private String owner;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "default_branch", nullable = false, length = 255)
    private String defaultBranch;

    @Column(name = "slug", nullable = false, updatable = false, length = 120)
    private String slug;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EnrollmentStatus status;

    @Column(name = "last_synced_revision", length = 64)
    private String lastSyncedRevision;

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_outcome", length = 20)
    private SyncOutcome lastOutcome;

    @Column(name = "last_attempted_revision", length = 64)
    private String lastAttemptedRevision;

    @Column(name = "last_attempted_at")
    private Instant lastAttemptedAt;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "last_applied_sequence", nullable = false)
    private long lastAppliedSequence;

    @Column(name = "enrolled_at", nullable = false)
    private Instant enrolledAt;

    @Column(name = "suspended_at")
    private Instant suspendedAt;

    @Version
    @Column(name = "row_version")
    private long version;

    public static RepositoryEnrollment create(RepositoryKey key, String defaultBranch, String slug, Instant now) {
        RepositoryEnrollment enrollment = new RepositoryEnrollment();
        enrollment.owner = key.owner();
        enrollment.name = key.name();
        enrollment.defaultBranch = defaultBranch;
        enrollment.slug = slug;
        enrollment.status = EnrollmentStatus.ACTIVE;
        enrollment.enrolledAt = now;
        return enrollment;
    }

    public RepositoryKey key() {
        return RepositoryKey.of(owner, name);
    }

    public boolean isActive() {
        return status == EnrollmentStatus.ACTIVE;
    }

    /**
     * Re-activates a suspended enrollment. The slug is kept.
     */
    public void reactivate(String defaultBranch, Instant now) {
        this.status = EnrollmentStatus.ACTIVE;
        this.defaultBranch = defaultBranch;
        this.enrolledAt = now;
        this.suspendedAt = null;
    }

    public void suspend(Instant now) {
        if (status == EnrollmentStatus.SUSPENDED) {
            return;
        }
        this.status = EnrollmentStatus.SUSPENDED;
        this.suspendedAt = now;
    }

    /**
     * Applies the terminal outcome of one sync job. A failure leaves the
     * last-known-good revision untouched.
     */
    public void applySyncOutcome(String revision, long sequence, SyncOutcome outcome, String error, Instant now) {
        this.lastAppliedSequence = sequence;
        this.lastOutcome = outcome;
        this.lastAttemptedRevision = revision;
        this.lastAttemptedAt = now;
        if (outcome == SyncOutcome.SUCCEEDED) {
            this.lastSyncedRevision = revision;
            this.lastSyncedAt = now;
            this.lastError = null;
        } else {
            this.lastError = truncate(error);
        }
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= 2000) {
            return error;
        }
        return error.substring(0, 1997) + "...";
    }
}
