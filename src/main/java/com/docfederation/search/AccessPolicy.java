package com.docfederation.search;

import java.util.Set;

/**
 * Resolves a viewer identity to the repositories that viewer may see.
 * Authentication itself happens at the edge; the identity arrives already verified.
 */
public interface AccessPolicy {

    /**
     * @param identity authenticated user, or null for anonymous callers
     * @return lower-case {@code owner/name} identifiers
     */
    Set<String> visibleRepositories(String identity);
}
