package com.docfederation.service.impl;

import com.docfederation.model.enrollment.RepositoryKey;
import com.docfederation.model.sync.SubmitResult;
import com.docfederation.model.sync.SubmitStatus;
import com.docfederation.model.sync.SyncJob;
import com.docfederation.model.sync.SyncState;
import com.docfederation.model.sync.TriggerSource;
import com.docfederation.service.RepositoryRegistry;
import com.docfederation.service.SyncCoordinator;
import com.docfederation.service.SyncJobExecutor;
import com.docfederation.util.GitInputValidator;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-repository lanes on top of the shared sync worker pool.
 *
 * Each lane holds at most one running job and one waiting job. A submission
 * for a busy repository becomes the waiting job, replacing an older one, so a
 * burst of pushes collapses to the running revision plus the newest one. When
 * the running job finishes its lane dispatches the waiting job. The pool size
 * bounds how many repositories sync at once.
 */
@Slf4j
@Service
public class SyncCoordinatorImpl implements SyncCoordinator {

    private final SyncJobExecutor jobExecutor;
    private final TaskExecutor workers;
    private final RepositoryRegistry registry;

    private final ConcurrentHashMap<RepositoryKey, Lane> lanes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger outstanding = new AtomicInteger();
    private final Object quiescence = new Object();

    public SyncCoordinatorImpl(SyncJobExecutor jobExecutor,
                               @Qualifier("syncExecutor") TaskExecutor workers,
                               RepositoryRegistry registry) {
        this.jobExecutor = jobExecutor;
        this.workers = workers;
        this.registry = registry;
    }

    @PostConstruct
    void seedSequence() {
        sequence.set(registry.highestAppliedSequence());
        log.info("Sync job sequence starts after #{}", sequence.get());
    }

    @Override
    public SubmitResult submit(RepositoryKey repository, String revision, TriggerSource trigger) {
        GitInputValidator.validateRevision(revision);
        Lane lane = lanes.computeIfAbsent(repository, k -> new Lane());

        SyncJob toDispatch = null;
        SubmitResult result;
        synchronized (lane) {
            // A running "latest" may have fetched before the new push, so it never covers another "latest"
            boolean coveredByRunning = !SyncJob.LATEST.equals(revision) && isSameTarget(lane.running, revision);
            if (coveredByRunning || isSameTarget(lane.pending, revision)) {
                SyncJob existing = isSameTarget(lane.pending, revision) ? lane.pending : lane.running;
                log.debug("{}@{} already scheduled as job #{}", repository, revision, existing.sequence());
                return new SubmitResult(SubmitStatus.ALREADY_SCHEDULED, existing.sequence());
            }

            SyncJob job = new SyncJob(repository, revision, trigger, sequence.incrementAndGet(), Instant.now());
            if (lane.running == null) {
                lane.running = job;
                outstanding.incrementAndGet();
                toDispatch = job;
                result = new SubmitResult(SubmitStatus.STARTED, job.sequence());
            } else {
                if (lane.pending != null) {
                    log.info("Job #{} for {} superseded by #{} ({})",
                            lane.pending.sequence(), repository, job.sequence(), revision);
                } else {
                    outstanding.incrementAndGet();
                }
                lane.pending = job;
                result = new SubmitResult(SubmitStatus.QUEUED, job.sequence());
            }
        }

        if (toDispatch != null) {
            dispatch(lane, toDispatch);
        }
        log.info("Submitted {}@{} (trigger={}): {} as job #{}",
                repository, revision, trigger, result.status(), result.sequence());
        return result;
    }

    @Override
    public SyncState getState(RepositoryKey repository) {
        Lane lane = lanes.get(repository);
        return lane == null ? SyncState.IDLE : lane.state;
    }

    @Override
    public void purge(RepositoryKey repository) {
        Lane lane = lanes.get(repository);
        if (lane != null) {
            boolean dropped;
            synchronized (lane) {
                dropped = lane.pending != null;
                lane.pending = null;
            }
            if (dropped) {
                log.info("Dropped waiting job for {}", repository);
                release();
            }
        }
        jobExecutor.purge(repository);
    }

    @Override
    public boolean awaitQuiescence(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (quiescence) {
            while (outstanding.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(quiescence, remaining);
            }
            return true;
        }
    }

    private void dispatch(Lane lane, SyncJob job) {
        try {
            workers.execute(() -> run(lane, job));
        } catch (TaskRejectedException e) {
            log.error("Worker pool rejected job #{} for {}", job.sequence(), job.repository(), e);
            finish(lane, job);
        }
    }

    private void run(Lane lane, SyncJob job) {
        try {
            jobExecutor.execute(job, state -> lane.state = state);
        } catch (RuntimeException e) {
            log.error("Job #{} for {} escaped the executor", job.sequence(), job.repository(), e);
        } finally {
            finish(lane, job);
        }
    }

    private void finish(Lane lane, SyncJob job) {
        SyncJob next;
        synchronized (lane) {
            lane.state = SyncState.IDLE;
            next = lane.pending;
            lane.pending = null;
            lane.running = next;
        }
        log.debug("Job #{} for {} finished", job.sequence(), job.repository());
        release();
        if (next != null) {
            dispatch(lane, next);
        }
    }

    private void release() {
        if (outstanding.decrementAndGet() == 0) {
            synchronized (quiescence) {
                quiescence.notifyAll();
            }
        }
    }

    private static boolean isSameTarget(SyncJob job, String revision) {
        return job != null && job.revision().equals(revision);
    }

    private static final class Lane {
        private SyncJob running;
        private SyncJob pending;
        private volatile SyncState state = SyncState.IDLE;
    }
}
