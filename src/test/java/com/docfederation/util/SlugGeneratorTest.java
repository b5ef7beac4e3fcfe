package com.docfederation.util;

import com.docfederation.model.enrollment.RepositoryKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Slug Generator")
class SlugGeneratorTest {

    @Test
    @DisplayName("Repository name is used when free")
    void usesName() {
        assertThat(SlugGenerator.derive(RepositoryKey.of("Acme", "Platform.Docs"), slug -> false))
                .isEqualTo("platform-docs");
    }

    @Test
    @DisplayName("Clashes add the owner, then a counter")
    void resolvesClashes() {
        Set<String> taken = Set.of("docs", "docs-acme", "docs-acme-2");

        assertThat(SlugGenerator.derive(RepositoryKey.of("other", "docs"), taken::contains)).isEqualTo("docs-other");
        assertThat(SlugGenerator.derive(RepositoryKey.of("acme", "docs"), taken::contains)).isEqualTo("docs-acme-3");
    }

    @Test
    @DisplayName("Normalization keeps slugs URL safe")
    void normalizes() {
        assertThat(SlugGenerator.normalize("__My  Repo!!")).isEqualTo("my-repo");
        assertThat(SlugGenerator.normalize("___")).isEqualTo("repo");
        assertThat(SlugGenerator.normalize("a".repeat(150))).hasSize(100);
    }
}
