package com.docfederation.rewrite;

import java.util.Map;
import java.util.Set;

/**
 * Everything the link rewriter may resolve against during one sync pass.
 *
 * @param currentSlug       namespace of the repository being rewritten
 * @param currentFiles      files the current repository publishes, repository-relative
 * @param otherRepositories published file sets of the other active namespaces, keyed by slug
 */
public record NamespaceMap(String currentSlug,
                           Set<String> currentFiles,
                           Map<String, Set<String>> otherRepositories) {

    public NamespaceMap {
        currentFiles = Set.copyOf(currentFiles);
        otherRepositories = Map.copyOf(otherRepositories);
    }

    public boolean isKnownSlug(String slug) {
        return currentSlug.equals(slug) || otherRepositories.containsKey(slug);
    }

    public Set<String> filesOf(String slug) {
        if (currentSlug.equals(slug)) {
            return currentFiles;
        }
        return otherRepositories.getOrDefault(slug, Set.of());
    }
}
