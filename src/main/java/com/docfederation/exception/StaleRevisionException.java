package com.docfederation.exception;

import lombok.Getter;

/**
 * A sync outcome arrived for a job older than the one already recorded.
 */
@Getter
public class StaleRevisionException extends DocSyncException {

    private final long sequence;
    private final long lastAppliedSequence;

    public StaleRevisionException(String repository, long sequence, long lastAppliedSequence) {
        super(ErrorCode.STALE_REVISION, String.format(
                "Outcome for %s job #%d is older than applied job #%d",
                repository, sequence, lastAppliedSequence));
        this.sequence = sequence;
        this.lastAppliedSequence = lastAppliedSequence;
    }
}
