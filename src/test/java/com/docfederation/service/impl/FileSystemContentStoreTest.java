package com.docfederation.service.impl;

import com.docfederation.configuration.AppProperties;
import com.docfederation.model.docs.DocumentNode;
import com.docfederation.model.docs.NavigationEntry;
import com.docfederation.model.docs.NavigationFragment;
import com.docfederation.model.docs.PublishedRepository;
import com.docfederation.service.PublishedContentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("File System Content Store")
class FileSystemContentStoreTest {

    @TempDir
    Path temp;

    private AppProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getSite().setOutputDir(temp.resolve("site").toString());
    }

    private FileSystemContentStore newStore() throws IOException {
        FileSystemContentStore store = new FileSystemContentStore(properties, objectMapper);
        store.load();
        return store;
    }

    private static PublishedRepository manifest(String revision, List<String> paths) {
        NavigationFragment navigation = new NavigationFragment("guide", "acme/guide", "Guide", revision,
                List.of(NavigationEntry.page("Setup", "/guide/docs/setup/", "guide/docs/setup.md")));
        return new PublishedRepository("guide", "acme/guide", revision, Instant.now(), paths, navigation);
    }

    @Test
    @DisplayName("A publish replaces the previous version completely")
    void publishReplaces() throws IOException {
        // Given
        FileSystemContentStore store = newStore();
        Path assets = Files.createDirectories(temp.resolve("tree/docs/img"));
        Files.writeString(assets.resolve("a.png"), "png");
        store.publish(manifest("aaa111", List.of("docs/old.md", "docs/img/a.png")),
                List.of(DocumentNode.of("docs/old.md", "old", "h")), temp.resolve("tree"), List.of("docs/img/a.png"));

        // When
        store.publish(manifest("bbb222", List.of("docs/setup.md")),
                List.of(DocumentNode.of("docs/setup.md", "raw", "h").withRewrite("rewritten", List.of())),
                temp.resolve("tree"), List.of()).confirm();

        // Then
        Path live = temp.resolve("site/guide");
        assertThat(live.resolve("docs/setup.md")).hasContent("rewritten");
        assertThat(live.resolve("docs/old.md")).doesNotExist();
        assertThat(live.resolve("docs/img/a.png")).doesNotExist();
        assertThat(store.find("guide")).get().extracting(PublishedRepository::revision).isEqualTo("bbb222");
        try (var entries = Files.list(temp.resolve("site"))) {
            assertThat(entries.map(p -> p.getFileName().toString())).containsExactly("guide");
        }
    }

    @Test
    @DisplayName("Manifests survive a restart; leftovers of interrupted publishes are cleaned")
    void reloadsManifests() throws IOException {
        newStore().publish(manifest("aaa111", List.of("README.md")),
                List.of(DocumentNode.of("README.md", "# Hi", "h")), temp, List.of());
        Files.createDirectories(temp.resolve("site/.staging-guide-123"));

        FileSystemContentStore restarted = newStore();

        assertThat(restarted.snapshot()).containsKey("guide");
        assertThat(restarted.snapshot().get("guide").navigation().entries()).hasSize(1);
        assertThat(temp.resolve("site/.staging-guide-123")).doesNotExist();
    }

    @Test
    @DisplayName("Purge removes the namespace")
    void purge() throws IOException {
        FileSystemContentStore store = newStore();
        store.publish(manifest("aaa111", List.of("README.md")),
                List.of(DocumentNode.of("README.md", "# Hi", "h")), temp, List.of());

        store.purge("guide");

        assertThat(store.find("guide")).isEmpty();
        assertThat(temp.resolve("site/guide")).doesNotExist();
    }

    @Test
    @DisplayName("Rolling back a publish restores the previous version and manifest")
    void rollbackRestoresPreviousVersion() throws IOException {
        // Given
        FileSystemContentStore store = newStore();
        store.publish(manifest("aaa111", List.of("docs/old.md")),
                List.of(DocumentNode.of("docs/old.md", "old", "h")), temp, List.of()).confirm();

        // When
        PublishedContentStore.Publication publication = store.publish(manifest("bbb222", List.of("docs/new.md")),
                List.of(DocumentNode.of("docs/new.md", "new", "h")), temp, List.of());
        assertThat(temp.resolve("site/guide/docs/new.md")).exists();
        publication.rollback();

        // Then
        Path live = temp.resolve("site/guide");
        assertThat(live.resolve("docs/old.md")).hasContent("old");
        assertThat(live.resolve("docs/new.md")).doesNotExist();
        assertThat(store.find("guide")).get().extracting(PublishedRepository::revision).isEqualTo("aaa111");
        try (var entries = Files.list(temp.resolve("site"))) {
            assertThat(entries.map(p -> p.getFileName().toString())).containsExactly("guide");
        }
    }

    @Test
    @DisplayName("Rolling back a first publish removes the namespace")
    void rollbackOfFirstPublishRemovesNamespace() throws IOException {
        FileSystemContentStore store = newStore();

        store.publish(manifest("aaa111", List.of("README.md")),
                List.of(DocumentNode.of("README.md", "readme", "h")), temp, List.of()).rollback();

        assertThat(store.find("guide")).isEmpty();
        assertThat(temp.resolve("site/guide")).doesNotExist();
    }
}
