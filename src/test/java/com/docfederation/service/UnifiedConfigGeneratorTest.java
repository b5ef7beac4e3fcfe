package com.docfederation.service;

import com.docfederation.configuration.SiteProperties;
import com.docfederation.model.docs.NavigationEntry;
import com.docfederation.model.docs.NavigationFragment;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.model.enrollment.RepositoryKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Unified Config Generator")
class UnifiedConfigGeneratorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private UnifiedConfigGenerator generator;

    @BeforeEach
    void setUp() {
        SiteProperties site = new SiteProperties();
        site.setName("Acme Docs");
        site.setUrl("https://docs.acme.test");
        site.setOutputDir("/tmp/unused");
        generator = new UnifiedConfigGenerator(site);
    }

    private static RepositoryEnrollment enrollment(String owner, String name, String slug) {
        return RepositoryEnrollment.create(RepositoryKey.of(owner, name), "main", slug, NOW);
    }

    private static NavigationFragment fragment(String slug, String repository, String title, String revision) {
        return new NavigationFragment(slug, repository, title, revision, List.of(
                NavigationEntry.page("Overview", "/" + slug + "/README/", slug + "/README.md"),
                NavigationEntry.section("Install", List.of(
                        NavigationEntry.page("Steps", "/" + slug + "/install/steps/", slug + "/install/steps.md")))));
    }

    @Test
    @DisplayName("Namespaces appear in slug order whatever the input order")
    void ordersBySlug() {
        // Given
        RepositoryEnrollment platform = enrollment("acme", "platform", "platform");
        RepositoryEnrollment guide = enrollment("acme", "guide", "guide");
        Map<String, NavigationFragment> fragments = Map.of(
                "platform", fragment("platform", "acme/platform", "Platform", "123456"),
                "guide", fragment("guide", "acme/guide", "Guide", "aaa111"));

        // When
        UnifiedConfigGenerator.Result result = generator.regenerate(List.of(platform, guide), fragments);

        // Then
        assertThat(result.namespaces()).containsExactly("guide", "platform");
        assertThat(result.content().indexOf("Guide:")).isLessThan(result.content().indexOf("Platform:"));
        assertThat(result.content())
                .startsWith("site_name: Acme Docs\n")
                .contains("site_url: https://docs.acme.test")
                .contains("- Home: index.md")
                .contains("guide/install/steps.md")
                .contains("repository: acme/guide")
                .contains("revision: aaa111")
                .contains("revision: \"123456\"")
                .doesNotContain("---");
    }

    @Test
    @DisplayName("Identical inputs produce byte-identical output")
    void isDeterministic() {
        List<RepositoryEnrollment> enrollments = List.of(
                enrollment("acme", "guide", "guide"), enrollment("acme", "platform", "platform"));
        Map<String, NavigationFragment> fragments = Map.of(
                "guide", fragment("guide", "acme/guide", "Guide", "aaa111"),
                "platform", fragment("platform", "acme/platform", "Platform", "bbb222"));

        String first = generator.regenerate(enrollments, fragments).content();
        String second = generator.regenerate(List.of(enrollments.get(1), enrollments.get(0)), fragments).content();

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Suspended and never-synced repositories are omitted")
    void omitsSuspendedAndUnpublished() {
        RepositoryEnrollment guide = enrollment("acme", "guide", "guide");
        RepositoryEnrollment ghost = enrollment("acme", "ghost", "ghost");
        ghost.suspend(NOW);
        RepositoryEnrollment pending = enrollment("acme", "pending", "pending");

        UnifiedConfigGenerator.Result result = generator.regenerate(List.of(guide, ghost, pending), Map.of(
                "guide", fragment("guide", "acme/guide", "Guide", "aaa111"),
                "ghost", fragment("ghost", "acme/ghost", "Ghost", "ccc333")));

        assertThat(result.namespaces()).containsExactly("guide");
        assertThat(result.content()).doesNotContain("ghost").doesNotContain("pending");
    }

    @Test
    @DisplayName("An empty registry still yields a valid site skeleton")
    void emptyRegistry() {
        UnifiedConfigGenerator.Result result = generator.regenerate(List.of(), Map.of());

        assertThat(result.namespaces()).isEmpty();
        assertThat(result.content()).contains("site_name: Acme Docs", "- Home: index.md", "namespaces: []");
    }
}
