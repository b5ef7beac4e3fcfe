package com.docfederation.exception;

/**
 * Remote deleted, renamed or no longer readable with our credentials.
 */
public class RepositoryGoneException extends FetchException {

    public RepositoryGoneException(String message, Throwable cause) {
        super(ErrorCode.REPOSITORY_GONE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
