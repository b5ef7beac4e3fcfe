package com.docfederation.model.docs;

import java.util.List;

/**
 * @param repository {@code owner/name} that owns the page, used for access filtering
 */
public record SearchIndexEntry(String unifiedPath,
                               String repository,
                               String slug,
                               String title,
                               String bodyText,
                               List<String> headingAnchors) {

    public SearchIndexEntry {
        headingAnchors = headingAnchors == null ? List.of() : List.copyOf(headingAnchors);
    }
}
