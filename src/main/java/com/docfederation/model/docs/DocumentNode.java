package com.docfederation.model.docs;

import java.util.List;

/**
 * One documentation file of a single sync pass.
 *
 * @param path repository-relative, '/'-separated
 */
public record DocumentNode(String path,
                           String rawContent,
                           String contentHash,
                           String rewrittenContent,
                           List<LinkTarget> links) {

    public DocumentNode {
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static DocumentNode of(String path, String rawContent, String contentHash) {
        return new DocumentNode(path, rawContent, contentHash, null, List.of());
    }

    public DocumentNode withRewrite(String rewritten, List<LinkTarget> resolvedLinks) {
        return new DocumentNode(path, rawContent, contentHash, rewritten, resolvedLinks);
    }

    /**
     * Content to publish: rewritten if the rewriter has run, raw otherwise.
     */
    public String content() {
        return rewrittenContent != null ? rewrittenContent : rawContent;
    }

    public long unresolvedCount() {
        return links.stream().filter(LinkTarget::isUnresolved).count();
    }
}
