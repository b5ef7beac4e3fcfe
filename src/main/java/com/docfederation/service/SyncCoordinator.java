package com.docfederation.service;

import com.docfederation.model.enrollment.RepositoryKey;
import com.docfederation.model.sync.SubmitResult;
import com.docfederation.model.sync.SyncState;
import com.docfederation.model.sync.TriggerSource;

import java.time.Duration;

/**
 * Runs sync jobs: at most one at a time per repository, different
 * repositories in parallel up to the worker limit.
 */
public interface SyncCoordinator {

    /**
     * Schedules a sync of {@code revision} (a commit hash or "latest").
     * While a job for the repository is running, the newest submission waits
     * and replaces any older waiting one.
     */
    SubmitResult submit(RepositoryKey repository, String revision, TriggerSource trigger);

    SyncState getState(RepositoryKey repository);

    /**
     * Drops waiting work and removes every published artifact of a suspended repository.
     */
    void purge(RepositoryKey repository);

    /**
     * Blocks until no job is running or waiting.
     *
     * @return false if the timeout elapsed first
     */
    boolean awaitQuiescence(Duration timeout) throws InterruptedException;
}
