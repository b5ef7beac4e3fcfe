package com.docfederation.search;

import com.docfederation.model.docs.SearchHit;
import com.docfederation.model.docs.SearchIndexEntry;

import java.util.List;
import java.util.Set;

/**
 * Repository-tagged document index.
 */
public interface SearchIndex {

    /**
     * Replaces every entry of {@code repository} in one step. Queries see
     * either the old set or the new one.
     */
    void replaceRepository(String repository, List<SearchIndexEntry> entries);

    void removeRepository(String repository);

    /**
     * @param visibleRepositories only entries of these repositories are returned
     */
    List<SearchHit> query(String text, Set<String> visibleRepositories, int limit);

    List<SearchIndexEntry> entries(String repository);
}
