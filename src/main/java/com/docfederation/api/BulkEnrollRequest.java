package com.docfederation.api;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Enroll several repositories in one call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkEnrollRequest {

    /**
     * Repositories as {@code owner/name}.
     */
    @NotEmpty
    private List<String> repositories;

    /**
     * Skipped entries, matched against {@code owner/name} or the bare name.
     */
    @Builder.Default
    private List<String> exclude = new ArrayList<>();

    /**
     * Applied to every repository. Defaults to {@code main}.
     */
    private String defaultBranch;
}
