package com.docfederation.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkEnrollResponse {

    private int requested;
    private int enrolled;
    private int excluded;
    private List<Result> results;

    /**
     * Outcome for one repository. {@code slug} is set on success, {@code error} otherwise.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Result {
        private String repository;
        private boolean success;
        private String slug;
        private String error;

        public static Result enrolled(EnrollResponse response) {
            return Result.builder().repository(response.getRepository()).success(true).slug(response.getSlug()).build();
        }

        public static Result failed(String repository, String error) {
            return Result.builder().repository(repository).success(false).error(error).build();
        }
    }
}
