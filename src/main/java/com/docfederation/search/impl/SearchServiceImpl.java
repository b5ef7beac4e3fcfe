package com.docfederation.search.impl;

import com.docfederation.model.docs.SearchHit;
import com.docfederation.search.AccessPolicy;
import com.docfederation.search.SearchIndex;
import com.docfederation.search.SearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Search entry point for the REST layer.
 *
 * <p>The caller identity is resolved to its visible repositories through the
 * {@link AccessPolicy} before the index is consulted, so hidden repositories
 * never contribute hits, snippets or counts. Page sizes are clamped to
 * {@value #MAX_LIMIT}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {

    static final int MAX_LIMIT = 100;

    private final SearchIndex searchIndex;
    private final AccessPolicy accessPolicy;

    @Override
    public List<SearchHit> query(String text, String identity, int offset, int limit) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Query text cannot be blank");
        }
        int start = Math.max(offset, 0);
        int pageSize = Math.min(Math.max(limit, 1), MAX_LIMIT);
        Set<String> visible = accessPolicy.visibleRepositories(identity);

        // Filtering happens inside the index, so the page is cut from visible hits only
        int window = (int) Math.min((long) start + pageSize, Integer.MAX_VALUE);
        List<SearchHit> hits = searchIndex.query(text, visible, window);
        List<SearchHit> page = start >= hits.size() ? List.of() : List.copyOf(hits.subList(start, hits.size()));
        log.debug("Search '{}' by {} over {} repositories: {} hit(s) from offset {}",
                text, identity, visible.size(), page.size(), start);
        return page;
    }
}
