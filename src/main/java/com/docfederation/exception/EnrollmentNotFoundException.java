package com.docfederation.exception;

import lombok.Getter;

@Getter
public class EnrollmentNotFoundException extends DocSyncException {

    private final String repository;

    public EnrollmentNotFoundException(String repository) {
        super(ErrorCode.NOT_FOUND, "Repository not enrolled: " + repository);
        this.repository = repository;
    }
}
