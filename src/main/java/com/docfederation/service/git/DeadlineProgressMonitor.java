package com.docfederation.service.git;

import com.docfederation.util.Deadline;
import org.eclipse.jgit.lib.EmptyProgressMonitor;

/**
 * Lets JGit abort a running clone or fetch once the job deadline has passed.
 */
class DeadlineProgressMonitor extends EmptyProgressMonitor {

    private final Deadline deadline;

    DeadlineProgressMonitor(Deadline deadline) {
        this.deadline = deadline;
    }

    @Override
    public boolean isCancelled() {
        return deadline.isExpired() || Thread.currentThread().isInterrupted();
    }
}
