package com.docfederation.model.webhook;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum IngressOutcome {
    ACCEPTED(HttpStatus.ACCEPTED),
    DUPLICATE(HttpStatus.OK),
    IGNORED(HttpStatus.OK),
    UNKNOWN_REPOSITORY(HttpStatus.NOT_FOUND);

    private final HttpStatus status;

    IngressOutcome(HttpStatus status) {
        this.status = status;
    }
}
