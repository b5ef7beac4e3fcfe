package com.docfederation.exception;

public class FetchTimeoutException extends FetchException {

    public FetchTimeoutException(String message, Throwable cause) {
        super(ErrorCode.TIMEOUT, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
