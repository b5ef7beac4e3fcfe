package com.docfederation.search;

import com.docfederation.model.docs.SearchHit;

import java.util.List;

public interface SearchService {

    /**
     * Ranked results restricted to what {@code identity} may see.
     */
    default List<SearchHit> query(String text, String identity, int limit) {
        return query(text, identity, 0, limit);
    }

    /**
     * One page of the ranked results visible to {@code identity}.
     *
     * @param offset number of visible hits to skip; negative values count as 0
     */
    List<SearchHit> query(String text, String identity, int offset, int limit);
}
