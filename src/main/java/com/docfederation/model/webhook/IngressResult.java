package com.docfederation.model.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngressResult {

    private IngressOutcome outcome;
    private String repository;
    private String revision;
    private String message;

    public static IngressResult of(IngressOutcome outcome, String repository, String revision, String message) {
        return IngressResult.builder()
                .outcome(outcome)
                .repository(repository)
                .revision(revision)
                .message(message)
                .build();
    }
}
