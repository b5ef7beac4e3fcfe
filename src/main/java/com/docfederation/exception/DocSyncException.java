package com.docfederation.exception;

import lombok.Getter;

/**
 * Root of the pipeline's failure taxonomy. The {@link ErrorCode} decides the
 * HTTP status; fetch failures additionally say whether they are retryable.
 */
@Getter
public class DocSyncException extends RuntimeException {

    private final ErrorCode errorCode;

    public DocSyncException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DocSyncException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
