package com.docfederation.model.docs;

import java.time.Instant;
import java.util.List;

/**
 * Manifest of one namespace in the published content store.
 *
 * @param documentPaths repository-relative paths of every published file
 */
public record PublishedRepository(String slug,
                                  String repository,
                                  String revision,
                                  Instant publishedAt,
                                  List<String> documentPaths,
                                  NavigationFragment navigation) {

    public PublishedRepository {
        documentPaths = documentPaths == null ? List.of() : List.copyOf(documentPaths);
    }
}
