package com.docfederation.model.docs;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of the generated site config.
 *
 * @param version     bumped only when the content changes
 * @param content     the YAML document, byte-identical for identical inputs
 * @param contentHash sha256 of content, hex
 * @param namespaces  slugs merged into this snapshot, sorted
 */
public record UnifiedConfig(long version,
                            String content,
                            String contentHash,
                            List<String> namespaces,
                            Instant generatedAt) {

    public UnifiedConfig {
        namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
    }
}
