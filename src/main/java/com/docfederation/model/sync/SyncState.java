package com.docfederation.model.sync;

/**
 * Per-repository pipeline phase. A repository is IDLE between jobs.
 */
public enum SyncState {
    IDLE,
    FETCHING,
    REWRITING,
    INDEXING
}
