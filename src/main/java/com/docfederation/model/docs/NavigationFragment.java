package com.docfederation.model.docs;

import java.util.List;

/**
 * Navigation of one repository, replaced as a whole on every successful sync.
 *
 * @param repository {@code owner/name}
 */
public record NavigationFragment(String slug,
                                 String repository,
                                 String title,
                                 String revision,
                                 List<NavigationEntry> entries) {

    public NavigationFragment {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
