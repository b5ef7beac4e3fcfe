package com.docfederation.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Enroll repository request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrollRequest {

    @NotBlank
    private String owner;

    @NotBlank
    private String name;

    /**
     * Defaults to {@code main}.
     */
    private String defaultBranch;
}
