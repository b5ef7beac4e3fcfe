package com.docfederation.rewrite;

import com.docfederation.model.docs.DocumentNode;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * @param documents documentation sources, sorted by path
 * @param assets    non-documentation files published alongside the documents
 */
public record CollectedTree(List<DocumentNode> documents, List<String> assets) {

    public CollectedTree {
        documents = List.copyOf(documents);
        assets = List.copyOf(assets);
    }

    /**
     * Repository paths that will exist in the published namespace. Same-repository
     * links only resolve against these.
     */
    public Set<String> publishedFiles() {
        Set<String> files = new HashSet<>(assets);
        documents.forEach(document -> files.add(document.path()));
        return Set.copyOf(files);
    }
}
