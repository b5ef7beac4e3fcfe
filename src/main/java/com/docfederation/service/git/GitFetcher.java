package com.docfederation.service.git;

import com.docfederation.exception.FetchException;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.model.enrollment.RepositoryKey;
import com.docfederation.util.Deadline;

/**
 * Brings a repository working copy to a target revision.
 */
public interface GitFetcher {

    /**
     * Clones on first use, fetches incrementally afterwards, then checks out
     * {@code revision} (or the default branch head for "latest").
     *
     * @throws FetchException on any failure; transient ones were already retried
     */
    WorkingTree fetch(RepositoryEnrollment enrollment, String revision, Deadline deadline);

    /**
     * Removes the working copy of a repository, if any.
     */
    void discard(RepositoryKey repository);
}
