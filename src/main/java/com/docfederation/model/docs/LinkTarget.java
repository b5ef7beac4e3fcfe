package com.docfederation.model.docs;

/**
 * Where one link in a document ended up.
 *
 * @param original       the destination exactly as written in the source
 * @param unifiedPath    rewritten destination without anchor, null for unresolved and external links
 * @param anchor         fragment without the leading '#', or null
 * @param repositorySlug namespace the link points into, null when not internal
 */
public record LinkTarget(String original,
                         String unifiedPath,
                         String anchor,
                         LinkKind kind,
                         String repositorySlug) {

    public static LinkTarget external(String original) {
        return new LinkTarget(original, null, null, LinkKind.EXTERNAL, null);
    }

    public static LinkTarget unresolved(String original) {
        return new LinkTarget(original, null, null, LinkKind.UNRESOLVED, null);
    }

    public boolean isUnresolved() {
        return kind == LinkKind.UNRESOLVED;
    }
}
