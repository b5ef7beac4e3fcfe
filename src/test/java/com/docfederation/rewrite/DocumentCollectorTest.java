package com.docfederation.rewrite;

import com.docfederation.configuration.AppProperties;
import com.docfederation.model.docs.DocumentNode;
import com.docfederation.model.docs.LinkKind;
import com.docfederation.model.docs.LinkTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Document Collector")
class DocumentCollectorTest {

    @TempDir
    Path root;

    private void write(String path, String content) throws IOException {
        Path target = root.resolve(path);
        Files.createDirectories(target.getParent());
        Files.writeString(target, content);
    }

    @Test
    @DisplayName("Collects documents and assets, skipping excluded directories and oversized files")
    void collects() throws IOException {
        // Given
        write("README.md", "# Readme");
        write("docs/guide.MD", "# Guide");
        write("docs/ref.rst", "Ref");
        write("docs/img/arch.png", "png");
        write("src/Main.java", "class Main {}");
        write("node_modules/pkg/README.md", "# vendored");
        write("docs/huge.md", "x".repeat(64));

        AppProperties properties = new AppProperties();
        properties.getSite().setMaxDocumentBytes(32);
        DocumentCollector collector = new DocumentCollector(properties);

        // When
        CollectedTree tree = collector.collect(root);

        // Then
        assertThat(tree.documents()).extracting(DocumentNode::path)
                .containsExactly("README.md", "docs/guide.MD", "docs/ref.rst");
        assertThat(tree.assets()).containsExactly("docs/img/arch.png");
        assertThat(tree.publishedFiles())
                .containsExactlyInAnyOrder("README.md", "docs/guide.MD", "docs/ref.rst", "docs/img/arch.png");
        assertThat(tree.documents().get(0).contentHash()).hasSize(64);
        assertThat(tree.documents().get(0).rawContent()).isEqualTo("# Readme");
    }

    @Test
    @DisplayName("Links to files that are never published stay unresolved")
    void linksOnlyResolveAgainstPublishedFiles() throws IOException {
        // Given: a source file and an oversized document next to the page linking them
        write("docs/setup.md", "See [code](../src/App.java) and [big](big.md) and [arch](img/arch.png)");
        write("docs/big.md", "x".repeat(64));
        write("docs/img/arch.png", "png");
        write("src/App.java", "class App {}");

        AppProperties properties = new AppProperties();
        properties.getSite().setMaxDocumentBytes(32);
        CollectedTree tree = new DocumentCollector(properties).collect(root);
        NamespaceMap namespaces = new NamespaceMap("guide", tree.publishedFiles(), Map.of());

        // When
        DocumentNode result = new LinkRewriter(Set.of("md")).rewrite(tree.documents().get(0), namespaces);

        // Then
        assertThat(tree.documents()).extracting(DocumentNode::path).containsExactly("docs/setup.md");
        assertThat(result.rewrittenContent())
                .isEqualTo("See [code](../src/App.java) and [big](big.md) and [arch](/guide/docs/img/arch.png)");
        assertThat(result.links()).extracting(LinkTarget::kind)
                .containsExactly(LinkKind.UNRESOLVED, LinkKind.UNRESOLVED, LinkKind.INTERNAL_SAME_REPO);
    }

    @Test
    @DisplayName("Documents that are not valid UTF-8 are skipped, not published with replacement characters")
    void skipsInvalidUtf8Documents() throws IOException {
        // Given: Latin-1 bytes for "café"
        write("README.md", "# Readme");
        Files.write(root.resolve("latin1.md"), new byte[]{'c', 'a', 'f', (byte) 0xE9});

        // When
        CollectedTree tree = new DocumentCollector(new AppProperties()).collect(root);

        // Then
        assertThat(tree.documents()).extracting(DocumentNode::path).containsExactly("README.md");
        assertThat(tree.publishedFiles()).doesNotContain("latin1.md");
        assertThat(DocumentCollector.decode("café".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo("café");
    }
}
