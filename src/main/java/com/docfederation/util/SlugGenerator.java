package com.docfederation.util;

import com.docfederation.model.enrollment.RepositoryKey;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * Derives the unified namespace slug of a repository.
 *
 * The repository name is preferred ("acme/guide" becomes "guide"); on a clash
 * the owner is appended, then a counter.
 */
public final class SlugGenerator {

    private static final int MAX_LENGTH = 100;

    private SlugGenerator() {
    }

    public static String normalize(String value) {
        String slug = value.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        if (slug.length() > MAX_LENGTH) {
            slug = slug.substring(0, MAX_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? "repo" : slug;
    }

    /**
     * @param taken whether a slug already belongs to another enrollment
     */
    public static String derive(RepositoryKey key, Predicate<String> taken) {
        String base = normalize(key.name());
        if (!taken.test(base)) {
            return base;
        }
        String qualified = normalize(key.name() + "-" + key.owner());
        if (!taken.test(qualified)) {
            return qualified;
        }
        for (int i = 2; ; i++) {
            String candidate = qualified + "-" + i;
            if (!taken.test(candidate)) {
                return candidate;
            }
        }
    }
}
