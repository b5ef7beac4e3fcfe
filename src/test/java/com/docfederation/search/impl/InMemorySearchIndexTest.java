package com.docfederation.search.impl;

import com.docfederation.model.docs.SearchHit;
import com.docfederation.model.docs.SearchIndexEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("In-Memory Search Index")
class InMemorySearchIndexTest {

    private final InMemorySearchIndex index = new InMemorySearchIndex();

    private static SearchIndexEntry entry(String repository, String path, String title, String body) {
        String slug = repository.substring(repository.indexOf('/') + 1);
        return new SearchIndexEntry(path, repository, slug, title, body, List.of());
    }

    @Test
    @DisplayName("Replacing a repository drops its old pages only")
    void replaceIsScopedToRepository() {
        // Given
        index.replaceRepository("acme/guide", List.of(
                entry("acme/guide", "/guide/old/", "Old page", "kubernetes install"),
                entry("acme/guide", "/guide/install/", "Install", "kubernetes install")));
        index.replaceRepository("acme/platform", List.of(
                entry("acme/platform", "/platform/ops/", "Ops", "kubernetes operations")));

        // When
        index.replaceRepository("acme/guide", List.of(
                entry("acme/guide", "/guide/install/", "Install", "kubernetes install")));

        // Then
        List<SearchHit> hits = index.query("kubernetes", Set.of("acme/guide", "acme/platform"), 10);
        assertThat(hits).extracting(SearchHit::unifiedPath)
                .containsExactlyInAnyOrder("/guide/install/", "/platform/ops/");
        assertThat(index.entries("ACME/Guide")).hasSize(1);
    }

    @Test
    @DisplayName("Only visible repositories are searched")
    void filtersByVisibility() {
        index.replaceRepository("acme/public", List.of(entry("acme/public", "/public/a/", "A", "shared term")));
        index.replaceRepository("acme/secret", List.of(entry("acme/secret", "/secret/b/", "B", "shared term")));

        assertThat(index.query("shared", Set.of("acme/public"), 10))
                .extracting(SearchHit::repository).containsExactly("acme/public");
        assertThat(index.query("shared", Set.of(), 10)).isEmpty();
    }

    @Test
    @DisplayName("Title matches outrank body matches and the limit applies")
    void ranksTitleHigher() {
        index.replaceRepository("acme/guide", List.of(
                entry("acme/guide", "/guide/body/", "Other", "deploy deploy"),
                entry("acme/guide", "/guide/title/", "Deploy", "nothing here"),
                entry("acme/guide", "/guide/none/", "None", "unrelated")));

        List<SearchHit> hits = index.query("Deploy", Set.of("acme/guide"), 1);

        assertThat(hits).singleElement().satisfies(hit -> {
            assertThat(hit.unifiedPath()).isEqualTo("/guide/title/");
            assertThat(hit.score()).isEqualTo(3.0);
        });
    }

    @Test
    @DisplayName("Snippets centre on the first match")
    void buildsSnippetAroundMatch() {
        String body = "x".repeat(200) + " needle " + "y".repeat(200);
        index.replaceRepository("acme/guide", List.of(entry("acme/guide", "/guide/long/", "Long", body)));

        SearchHit hit = index.query("needle", Set.of("acme/guide"), 5).get(0);

        assertThat(hit.snippet()).startsWith("...").endsWith("...").contains("needle");
    }

    @Test
    @DisplayName("Removing a repository empties its results")
    void removeRepository() {
        index.replaceRepository("acme/guide", List.of(entry("acme/guide", "/guide/a/", "A", "text")));

        index.removeRepository("acme/guide");

        assertThat(index.query("text", Set.of("acme/guide"), 10)).isEmpty();
        assertThat(index.entries("acme/guide")).isEmpty();
    }
}
