package com.docfederation.service.impl;

import com.docfederation.configuration.AppProperties;
import com.docfederation.exception.WorkingCopyException;
import com.docfederation.model.docs.DocumentNode;
import com.docfederation.model.docs.PublishedRepository;
import com.docfederation.service.PublishedContentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes each namespace under {@code app.site.output-dir/{slug}/}.
 *
 * A new version is written to a staging directory next to the live one and
 * moved into place, so the live directory always holds one complete sync.
 * The manifest ({@value #MANIFEST}) is reloaded on startup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileSystemContentStore implements PublishedContentStore {

    static final String MANIFEST = "_navigation.json";

    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    private final Map<String, PublishedRepository> manifests = new ConcurrentHashMap<>();

    @PostConstruct
    void load() throws IOException {
        Path root = root();
        Files.createDirectories(root);
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (name.startsWith(".")) {
                    // Leftover staging or trash directory from an interrupted publish
                    FileSystemUtils.deleteRecursively(entry);
                    continue;
                }
                Path manifest = entry.resolve(MANIFEST);
                if (Files.isRegularFile(manifest)) {
                    try {
                        PublishedRepository published = objectMapper.readValue(manifest.toFile(), PublishedRepository.class);
                        manifests.put(published.slug(), published);
                    } catch (IOException e) {
                        log.warn("Ignoring unreadable manifest {}: {}", manifest, e.getMessage());
                    }
                }
            }
        }
        log.info("Loaded {} published namespace(s) from {}", manifests.size(), root);
    }

    @Override
    public Publication publish(PublishedRepository manifest, List<DocumentNode> documents, Path assetRoot,
                               List<String> assets) {
        Path root = root();
        String slug = manifest.slug();
        Path live = root.resolve(slug);
        Path staging = root.resolve(".staging-" + slug + "-" + UUID.randomUUID());

        try {
            Files.createDirectories(staging);
            for (DocumentNode document : documents) {
                Path target = safeResolve(staging, document.path());
                Files.createDirectories(target.getParent());
                Files.writeString(target, document.content(), StandardCharsets.UTF_8);
            }
            for (String asset : assets) {
                Path target = safeResolve(staging, asset);
                Files.createDirectories(target.getParent());
                Files.copy(safeResolve(assetRoot, asset), target, StandardCopyOption.REPLACE_EXISTING);
            }
            objectMapper.writeValue(staging.resolve(MANIFEST).toFile(), manifest);

            Path previous = swap(root, staging, live);
            PublishedRepository previousManifest = manifests.put(slug, manifest);
            log.info("Published {} document(s) and {} asset(s) for '{}' at {}",
                    documents.size(), assets.size(), slug, manifest.revision());
            return new SwappedNamespace(slug, live, previous, previousManifest);
        } catch (IOException e) {
            throw new WorkingCopyException("Failed to publish namespace " + slug, e);
        } finally {
            FileSystemUtils.deleteRecursively(staging.toFile());
        }
    }

    @Override
    public Optional<PublishedRepository> find(String slug) {
        return Optional.ofNullable(manifests.get(slug));
    }

    @Override
    public Map<String, PublishedRepository> snapshot() {
        return new TreeMap<>(manifests);
    }

    @Override
    public void purge(String slug) {
        PublishedRepository removed = manifests.remove(slug);
        Path live = root().resolve(slug);
        try {
            if (FileSystemUtils.deleteRecursively(live)) {
                log.info("Purged published namespace '{}'", slug);
            } else if (removed != null) {
                log.warn("Namespace '{}' had a manifest but no directory", slug);
            }
        } catch (IOException e) {
            throw new WorkingCopyException("Failed to purge namespace " + slug, e);
        }
    }

    /**
     * Moves staging into place.
     *
     * @return where the previous live directory was moved, or null if there was none
     */
    private Path swap(Path root, Path staging, Path live) throws IOException {
        Path trash = root.resolve(".trash-" + live.getFileName() + "-" + UUID.randomUUID());
        boolean hadLive = Files.exists(live);
        if (hadLive) {
            move(live, trash);
        }
        try {
            move(staging, live);
        } catch (IOException e) {
            if (hadLive) {
                move(trash, live);
            }
            throw e;
        }
        return hadLive ? trash : null;
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to);
        }
    }

    private static Path safeResolve(Path base, String relative) {
        Path resolved = base.resolve(relative).normalize();
        if (!resolved.startsWith(base.normalize())) {
            throw new IllegalArgumentException("Path escapes namespace: " + relative);
        }
        return resolved;
    }

    private Path root() {
        return Path.of(appProperties.getSite().getOutputDir());
    }

    private final class SwappedNamespace implements Publication {

        private final String slug;
        private final Path live;
        private final Path previous;
        private final PublishedRepository previousManifest;

        private SwappedNamespace(String slug, Path live, Path previous, PublishedRepository previousManifest) {
            this.slug = slug;
            this.live = live;
            this.previous = previous;
            this.previousManifest = previousManifest;
        }

        @Override
        public void confirm() {
            if (previous == null) {
                return;
            }
            try {
                FileSystemUtils.deleteRecursively(previous);
            } catch (IOException e) {
                // Removed on the next startup
                log.warn("Could not delete previous version of '{}' at {}: {}", slug, previous, e.getMessage());
            }
        }

        @Override
        public void rollback() {
            try {
                FileSystemUtils.deleteRecursively(live);
                if (previous != null) {
                    move(previous, live);
                }
            } catch (IOException e) {
                throw new WorkingCopyException("Failed to restore previous version of namespace " + slug, e);
            }
            if (previousManifest != null) {
                manifests.put(slug, previousManifest);
            } else {
                manifests.remove(slug);
            }
            log.warn("Rolled back namespace '{}' to {}", slug,
                    previousManifest != null ? previousManifest.revision() : "nothing");
        }
    }
}
