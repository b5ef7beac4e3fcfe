package com.docfederation.model.webhook;

import java.util.List;

/**
 * The parts of a GitHub push payload the pipeline looks at.
 *
 * @param changedFiles union of added, modified and removed paths over all commits
 */
public record PushEvent(String owner,
                        String name,
                        String ref,
                        String headRevision,
                        boolean deleted,
                        List<String> changedFiles) {

    public PushEvent {
        changedFiles = changedFiles == null ? List.of() : List.copyOf(changedFiles);
    }

    public String branch() {
        return ref != null && ref.startsWith("refs/heads/") ? ref.substring("refs/heads/".length()) : ref;
    }
}
