package com.docfederation.model.docs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A page or a section in a navigation tree.
 *
 * @param path unified path of a page, null for sections
 * @param file published file of a page relative to the site output root
 *             (e.g. {@code guide/docs/setup.md}), null for sections
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record NavigationEntry(String title, String path, String file, List<NavigationEntry> children) {

    public NavigationEntry {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static NavigationEntry page(String title, String path, String file) {
        return new NavigationEntry(title, path, file, List.of());
    }

    public static NavigationEntry section(String title, List<NavigationEntry> children) {
        return new NavigationEntry(title, null, null, children);
    }

    @JsonIgnore
    public boolean isSection() {
        return path == null;
    }
}
