package com.docfederation.exception;

/**
 * Base class of everything the git fetcher can fail with.
 */
public abstract class FetchException extends DocSyncException {

    protected FetchException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    /**
     * Whether another attempt could succeed without operator action.
     */
    public abstract boolean isRetryable();
}
