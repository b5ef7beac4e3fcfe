package com.docfederation.api;

import com.docfederation.configuration.AppProperties;
import com.docfederation.model.docs.SearchHit;
import com.docfederation.search.SearchService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Search over the unified site, filtered by what the caller may see.
 * The caller identity comes from the header set by the authenticating proxy.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class SearchController {

    private final SearchService searchService;
    private final AppProperties appProperties;

    @GetMapping
    public ResponseEntity<SearchResponse> search(@RequestParam("q") String query,
                                                 @RequestParam(defaultValue = "0") int offset,
                                                 @RequestParam(defaultValue = "10") int limit,
                                                 HttpServletRequest request) {
        String identity = request.getHeader(appProperties.getAccess().getIdentityHeader());
        List<SearchHit> hits = searchService.query(query, identity, offset, limit);
        return ResponseEntity.ok(SearchResponse.of(query, Math.max(offset, 0), hits));
    }
}
