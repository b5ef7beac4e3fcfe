package com.docfederation.model.enrollment;

import com.google.common.base.Preconditions;

import java.util.Locale;

/**
 * Case-insensitive {@code owner/name} identity of a source repository.
 */
public record RepositoryKey(String owner, String name) {

    public RepositoryKey {
        Preconditions.checkArgument(owner != null && !owner.isBlank(), "owner is required");
        Preconditions.checkArgument(name != null && !name.isBlank(), "name is required");
        owner = owner.trim().toLowerCase(Locale.ROOT);
        name = name.trim().toLowerCase(Locale.ROOT);
    }

    public static RepositoryKey of(String owner, String name) {
        return new RepositoryKey(owner, name);
    }

    /**
     * Parses {@code owner/name}.
     */
    public static RepositoryKey parse(String fullName) {
        Preconditions.checkArgument(fullName != null, "repository is required");
        int slash = fullName.indexOf('/');
        Preconditions.checkArgument(slash > 0 && slash < fullName.length() - 1
                        && fullName.indexOf('/', slash + 1) < 0,
                "Expected owner/name but got: %s", fullName);
        return new RepositoryKey(fullName.substring(0, slash), fullName.substring(slash + 1));
    }

    public String fullName() {
        return owner + "/" + name;
    }

    @Override
    public String toString() {
        return fullName();
    }
}
