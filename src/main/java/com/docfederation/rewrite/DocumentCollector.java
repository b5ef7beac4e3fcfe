package com.docfederation.rewrite;

import com.docfederation.configuration.AppProperties;
import com.docfederation.configuration.SiteProperties;
import com.docfederation.exception.WorkingCopyException;
import com.docfederation.model.docs.DocumentNode;
import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the documentation sources out of a checked-out working tree.
 * Symlinks are never followed.
 *
 * <p>Documents over the size limit and documents that are not valid UTF-8 are
 * skipped with a warning; links to them stay unresolved.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentCollector {

    private static final Set<String> ASSET_EXTENSIONS = Set.of(
            "png", "jpg", "jpeg", "gif", "svg", "webp", "ico", "pdf");

    private final AppProperties appProperties;

    public CollectedTree collect(Path root) {
        SiteProperties site = appProperties.getSite();
        Set<String> excluded = Set.copyOf(site.getExcludedDirs());
        Set<String> docExtensions = lowerCase(site.getDocExtensions());

        List<DocumentNode> documents = new ArrayList<>();
        List<String> assets = new ArrayList<>();

        try {
            java.nio.file.Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && excluded.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    String relative = relativize(root, file);

                    String extension = Files.getFileExtension(relative).toLowerCase(Locale.ROOT);
                    if (docExtensions.contains(extension)) {
                        if (attrs.size() > site.getMaxDocumentBytes()) {
                            log.warn("Skipping {} ({} bytes exceeds limit)", relative, attrs.size());
                            return FileVisitResult.CONTINUE;
                        }
                        byte[] bytes = java.nio.file.Files.readAllBytes(file);
                        String text = decode(bytes);
                        if (text == null) {
                            log.warn("Skipping {}: not valid UTF-8", relative);
                            return FileVisitResult.CONTINUE;
                        }
                        String hash = Hashing.sha256().hashBytes(bytes).toString();
                        documents.add(DocumentNode.of(relative, text, hash));
                    } else if (ASSET_EXTENSIONS.contains(extension)) {
                        assets.add(relative);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new WorkingCopyException("Failed to read working tree " + root, e);
        }

        documents.sort(Comparator.comparing(DocumentNode::path));
        assets.sort(Comparator.naturalOrder());
        log.debug("Collected {} documents and {} assets from {}", documents.size(), assets.size(), root);
        return new CollectedTree(documents, assets);
    }

    /**
     * @return the decoded text, or null when the bytes are not valid UTF-8
     */
    static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static Set<String> lowerCase(List<String> values) {
        Set<String> result = new HashSet<>();
        for (String value : values) {
            result.add(value.toLowerCase(Locale.ROOT));
        }
        return result;
    }
}
