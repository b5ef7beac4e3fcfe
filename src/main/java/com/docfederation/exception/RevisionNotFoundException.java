package com.docfederation.exception;

import lombok.Getter;

@Getter
public class RevisionNotFoundException extends FetchException {

    private final String revision;

    public RevisionNotFoundException(String repository, String revision, Throwable cause) {
        super(ErrorCode.REVISION_NOT_FOUND, "Revision " + revision + " not found in " + repository, cause);
        this.revision = revision;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
