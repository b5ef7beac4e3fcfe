package com.docfederation.api;

import com.docfederation.model.sync.SubmitResult;
import com.docfederation.model.sync.SubmitStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncTriggerResponse {

    private String repository;
    private String revision;
    private SubmitStatus status;
    private long jobSequence;

    public static SyncTriggerResponse of(String repository, String revision, SubmitResult result) {
        return SyncTriggerResponse.builder()
                .repository(repository)
                .revision(revision)
                .status(result.status())
                .jobSequence(result.sequence())
                .build();
    }
}
