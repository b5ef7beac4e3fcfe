package com.docfederation.model.sync;

public enum SubmitStatus {
    /** Dispatched to a worker immediately. */
    STARTED,
    /** Waiting behind the running job; may still be superseded. */
    QUEUED,
    /** Same revision is already running or waiting. */
    ALREADY_SCHEDULED
}
