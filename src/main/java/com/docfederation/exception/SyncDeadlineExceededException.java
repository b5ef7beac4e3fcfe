package com.docfederation.exception;

import lombok.Getter;

@Getter
public class SyncDeadlineExceededException extends DocSyncException {

    private final String phase;

    public SyncDeadlineExceededException(String phase) {
        super(ErrorCode.TIMEOUT, "Sync deadline exceeded during " + phase);
        this.phase = phase;
    }
}
