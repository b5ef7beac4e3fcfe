package com.docfederation.model.sync;

import com.docfederation.model.enrollment.RepositoryKey;

import java.time.Instant;

/**
 * One unit of fetch + rewrite + index work.
 *
 * @param sequence monotonically increasing across all jobs; orders outcomes
 *                 when they are recorded against the enrollment
 */
public record SyncJob(RepositoryKey repository,
                      String revision,
                      TriggerSource trigger,
                      long sequence,
                      Instant createdAt) {

    public static final String LATEST = "latest";

    public boolean isLatest() {
        return LATEST.equals(revision);
    }

    public String dedupKey() {
        return repository.fullName() + "@" + revision;
    }
}
