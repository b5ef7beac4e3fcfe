package com.docfederation.service;

import com.docfederation.configuration.AppProperties;
import com.docfederation.exception.WorkingCopyException;
import com.docfederation.model.docs.NavigationFragment;
import com.docfederation.model.docs.PublishedRepository;
import com.docfederation.model.docs.UnifiedConfig;
import com.google.common.hash.Hashing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the current {@link UnifiedConfig} and replaces it wholesale.
 *
 * Regenerations are serialized and always read the latest committed
 * enrollments and fragments. Readers get an immutable snapshot without locking.
 */
@Slf4j
@Service
public class UnifiedConfigPublisher {

    private final RepositoryRegistry registry;
    private final PublishedContentStore contentStore;
    private final AppProperties appProperties;
    private final UnifiedConfigGenerator generator;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicReference<UnifiedConfig> current = new AtomicReference<>();

    public UnifiedConfigPublisher(RepositoryRegistry registry,
                                  PublishedContentStore contentStore,
                                  AppProperties appProperties) {
        this.registry = registry;
        this.contentStore = contentStore;
        this.appProperties = appProperties;
        this.generator = new UnifiedConfigGenerator(appProperties.getSite());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        regenerate();
    }

    public UnifiedConfig regenerate() {
        writeLock.lock();
        try {
            Map<String, NavigationFragment> fragments = new LinkedHashMap<>();
            for (PublishedRepository published : contentStore.snapshot().values()) {
                if (published.navigation() != null) {
                    fragments.put(published.slug(), published.navigation());
                }
            }
            UnifiedConfigGenerator.Result result = generator.regenerate(registry.listAll(), fragments);
            String hash = Hashing.sha256().hashString(result.content(), StandardCharsets.UTF_8).toString();

            UnifiedConfig previous = current.get();
            if (previous != null && previous.contentHash().equals(hash)) {
                log.debug("Unified config unchanged (version {})", previous.version());
                return previous;
            }

            long version = previous == null ? 1 : previous.version() + 1;
            UnifiedConfig next = new UnifiedConfig(version, result.content(), hash, result.namespaces(), Instant.now());
            writeArtifact(next);
            current.set(next);
            log.info("Unified config regenerated: version={}, namespaces={}", version, next.namespaces());
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Latest snapshot, generating the first one if needed.
     */
    public UnifiedConfig current() {
        UnifiedConfig config = current.get();
        return config != null ? config : regenerate();
    }

    private void writeArtifact(UnifiedConfig config) {
        String configFile = appProperties.getSite().getConfigFile();
        if (configFile == null || configFile.isBlank()) {
            return;
        }
        Path target = Path.of(configFile);
        try {
            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, ".unified-config", ".tmp");
            Files.writeString(temp, config.content(), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new WorkingCopyException("Failed to write unified config to " + target, e);
        }
    }
}
