package com.docfederation.exception;

import lombok.Getter;

@Getter
public class AlreadyEnrolledException extends DocSyncException {

    private final String repository;

    public AlreadyEnrolledException(String repository) {
        super(ErrorCode.ALREADY_ENROLLED, "Repository already enrolled: " + repository);
        this.repository = repository;
    }
}
