package com.docfederation.exception;

public class WorkingCopyException extends FetchException {

    public WorkingCopyException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
