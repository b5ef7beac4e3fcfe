package com.docfederation.api;

import com.docfederation.model.sync.SubmitStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrollResponse {

    private String repository;
    private String slug;
    private SubmitStatus sync;
    private long jobSequence;
}
