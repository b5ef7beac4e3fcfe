package com.docfederation.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy shared by the pipeline and the REST layer.
 */
@Getter
public enum ErrorCode {
    INVALID_SIGNATURE(HttpStatus.UNAUTHORIZED),
    ALREADY_ENROLLED(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    STALE_REVISION(HttpStatus.CONFLICT),
    NETWORK_ERROR(HttpStatus.BAD_GATEWAY),
    TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    REVISION_NOT_FOUND(HttpStatus.NOT_FOUND),
    REPOSITORY_GONE(HttpStatus.GONE),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }
}
