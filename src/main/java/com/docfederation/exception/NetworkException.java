package com.docfederation.exception;

public class NetworkException extends FetchException {

    public NetworkException(String message, Throwable cause) {
        super(ErrorCode.NETWORK_ERROR, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
