package com.docfederation.service;

import com.docfederation.configuration.SiteProperties;
import com.docfederation.model.docs.NavigationEntry;
import com.docfederation.model.docs.NavigationFragment;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges navigation fragments into the site-wide config document.
 *
 * A pure function: identical inputs produce byte-identical YAML. Suspended
 * enrollments and enrollments without a published fragment are left out;
 * the rest appear in slug order after the home page.
 */
public class UnifiedConfigGenerator {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS));

    private final SiteProperties site;

    public UnifiedConfigGenerator(SiteProperties site) {
        this.site = site;
    }

    public Result regenerate(List<RepositoryEnrollment> enrollments, Map<String, NavigationFragment> fragments) {
        List<RepositoryEnrollment> included = enrollments.stream()
                .filter(RepositoryEnrollment::isActive)
                .filter(e -> fragments.containsKey(e.getSlug()))
                .sorted(Comparator.comparing(RepositoryEnrollment::getSlug))
                .toList();

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("site_name", site.getName());
        if (site.getDescription() != null) {
            config.put("site_description", site.getDescription());
        }
        if (site.getUrl() != null) {
            config.put("site_url", site.getUrl());
        }
        config.put("theme", Map.of("name", site.getTheme()));

        List<Object> nav = new ArrayList<>();
        nav.add(Map.of("Home", site.getHomePage()));
        List<Object> namespaces = new ArrayList<>();
        List<String> slugs = new ArrayList<>();
        for (RepositoryEnrollment enrollment : included) {
            NavigationFragment fragment = fragments.get(enrollment.getSlug());
            nav.add(Map.of(fragment.title(), toNav(fragment.entries())));

            Map<String, Object> namespace = new LinkedHashMap<>();
            namespace.put("slug", enrollment.getSlug());
            namespace.put("repository", enrollment.key().fullName());
            namespace.put("revision", fragment.revision());
            namespaces.add(namespace);
            slugs.add(enrollment.getSlug());
        }
        config.put("nav", nav);
        config.put("extra", Map.of("namespaces", namespaces));

        try {
            return new Result(yamlMapper.writeValueAsString(config), List.copyOf(slugs));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unified config is not serializable", e);
        }
    }

    private static List<Object> toNav(List<NavigationEntry> entries) {
        List<Object> nav = new ArrayList<>(entries.size());
        for (NavigationEntry entry : entries) {
            if (entry.isSection()) {
                nav.add(Map.of(entry.title(), toNav(entry.children())));
            } else {
                nav.add(Map.of(entry.title(), entry.file()));
            }
        }
        return nav;
    }

    /**
     * @param namespaces slugs merged into the document, in output order
     */
    public record Result(String content, List<String> namespaces) {
    }
}
