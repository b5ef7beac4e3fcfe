package com.docfederation.search.impl;

import com.docfederation.configuration.AccessProperties;
import com.docfederation.configuration.AppProperties;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.search.AccessPolicy;
import com.docfederation.service.RepositoryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Access policy driven by {@code app.access}: per-identity grants of
 * {@code owner/name} or {@code owner/*}, plus repositories everyone may see.
 * Anonymous callers only see the public repositories.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfiguredAccessPolicy implements AccessPolicy {

    private final AppProperties appProperties;
    private final RepositoryRegistry registry;

    @Override
    public Set<String> visibleRepositories(String identity) {
        AccessProperties access = appProperties.getAccess();
        Set<String> visible = new HashSet<>();
        List<RepositoryEnrollment> enrolled = registry.listAll();

        expand(access.getPublicRepositories(), enrolled, visible);
        if (identity != null && !identity.isBlank()) {
            expand(access.getGrants().getOrDefault(identity, List.of()), enrolled, visible);
        }
        log.debug("Identity '{}' may see {} repositories", identity, visible.size());
        return visible;
    }

    private static void expand(List<String> patterns, List<RepositoryEnrollment> enrolled, Set<String> visible) {
        for (String pattern : patterns) {
            String normalized = pattern.trim().toLowerCase(Locale.ROOT);
            if (normalized.endsWith("/*")) {
                String owner = normalized.substring(0, normalized.length() - 2);
                enrolled.stream()
                        .filter(e -> e.getOwner().equals(owner))
                        .forEach(e -> visible.add(e.key().fullName()));
            } else if (!normalized.isEmpty()) {
                visible.add(normalized);
            }
        }
    }
}
