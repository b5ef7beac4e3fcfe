package com.docfederation.api;

import com.docfederation.model.docs.SearchHit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    private String query;
    private int offset;

    /**
     * Hits on this page.
     */
    private int totalResults;
    private List<SearchHit> results;

    public static SearchResponse of(String query, int offset, List<SearchHit> results) {
        return SearchResponse.builder()
                .query(query)
                .offset(offset)
                .totalResults(results.size())
                .results(results)
                .build();
    }
}
