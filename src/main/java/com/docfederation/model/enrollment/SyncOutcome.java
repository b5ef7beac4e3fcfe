package com.docfederation.model.enrollment;

public enum SyncOutcome {
    SUCCEEDED,
    FAILED
}
