package com.docfederation.api;

import com.docfederation.model.enrollment.EnrollmentStatus;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.model.enrollment.SyncOutcome;
import com.docfederation.model.sync.SyncState;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Sync status of one enrollment.
 *
 * {@code lastSyncedRevision} is the revision the site serves; a failed later
 * attempt shows up in {@code lastAttemptedRevision} and {@code lastError}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnrollmentStatusResponse {

    private String repository;
    private String slug;
    private String defaultBranch;
    private EnrollmentStatus status;
    private SyncState state;
    private String lastSyncedRevision;
    private Instant lastSyncedAt;
    private SyncOutcome lastOutcome;
    private String lastAttemptedRevision;
    private Instant lastAttemptedAt;
    private String lastError;
    private Instant enrolledAt;
    private Instant suspendedAt;

    public static EnrollmentStatusResponse from(RepositoryEnrollment enrollment, SyncState state) {
        return EnrollmentStatusResponse.builder()
                .repository(enrollment.key().fullName())
                .slug(enrollment.getSlug())
                .defaultBranch(enrollment.getDefaultBranch())
                .status(enrollment.getStatus())
                .state(state)
                .lastSyncedRevision(enrollment.getLastSyncedRevision())
                .lastSyncedAt(enrollment.getLastSyncedAt())
                .lastOutcome(enrollment.getLastOutcome())
                .lastAttemptedRevision(enrollment.getLastAttemptedRevision())
                .lastAttemptedAt(enrollment.getLastAttemptedAt())
                .lastError(enrollment.getLastError())
                .enrolledAt(enrollment.getEnrolledAt())
                .suspendedAt(enrollment.getSuspendedAt())
                .build();
    }
}
