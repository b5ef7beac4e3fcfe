package com.docfederation.service;

import com.docfederation.configuration.AppProperties;
import com.docfederation.exception.DocSyncException;
import com.docfederation.exception.EnrollmentNotFoundException;
import com.docfederation.exception.RepositoryGoneException;
import com.docfederation.exception.StaleRevisionException;
import com.docfederation.model.docs.DocumentNode;
import com.docfederation.model.docs.NavigationFragment;
import com.docfederation.model.docs.PublishedRepository;
import com.docfederation.model.docs.SearchIndexEntry;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.model.enrollment.RepositoryKey;
import com.docfederation.model.enrollment.SyncOutcome;
import com.docfederation.model.sync.SyncJob;
import com.docfederation.model.sync.SyncState;
import com.docfederation.rewrite.CollectedTree;
import com.docfederation.rewrite.DocumentCollector;
import com.docfederation.rewrite.LinkRewriter;
import com.docfederation.rewrite.NamespaceMap;
import com.docfederation.rewrite.NavigationBuilder;
import com.docfederation.search.SearchIndex;
import com.docfederation.search.SearchIndexBuilder;
import com.docfederation.service.git.GitFetcher;
import com.docfederation.service.git.WorkingTree;
import com.docfederation.util.Deadline;
import com.google.common.util.concurrent.Striped;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Runs one {@link SyncJob} end to end: fetch, rewrite, index, commit.
 *
 * <p>Nothing becomes visible before the commit step. The commit publishes in
 * a fixed order (documents and navigation, search entries, unified config,
 * enrollment outcome) so config regeneration always sees the new fragment.
 * Any failure before that leaves the previously published state untouched;
 * a failure during the commit puts the previous pages and search entries back
 * before the job is recorded as failed.
 *
 * <p>Commits and purges of the same repository are serialized by a striped lock.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncJobExecutor {

    private final RepositoryRegistry registry;
    private final GitFetcher gitFetcher;
    private final DocumentCollector documentCollector;
    private final LinkRewriter linkRewriter;
    private final NavigationBuilder navigationBuilder;
    private final SearchIndexBuilder searchIndexBuilder;
    private final SearchIndex searchIndex;
    private final PublishedContentStore contentStore;
    private final UnifiedConfigPublisher configPublisher;
    private final AppProperties appProperties;

    private final Striped<Lock> commitLocks = Striped.lock(64);

    public void execute(SyncJob job, Consumer<SyncState> phase) {
        RepositoryKey key = job.repository();
        Optional<RepositoryEnrollment> found = registry.find(key);
        if (found.isEmpty() || !found.get().isActive()) {
            log.info("Skipping job #{} for {}: not actively enrolled", job.sequence(), key);
            return;
        }
        RepositoryEnrollment enrollment = found.get();
        Deadline deadline = Deadline.after(appProperties.getSync().getJobDeadline());
        String revision = job.revision();

        log.info("Sync job #{} started for {} at {} (trigger={})", job.sequence(), key, revision, job.trigger());
        try {
            phase.accept(SyncState.FETCHING);
            WorkingTree tree = gitFetcher.fetch(enrollment, job.revision(), deadline);
            revision = tree.revision();

            deadline.check("rewrite");
            phase.accept(SyncState.REWRITING);
            CollectedTree collected = documentCollector.collect(tree.root());
            NamespaceMap namespaces = namespaceMap(enrollment, collected);
            List<DocumentNode> rewritten = new ArrayList<>(collected.documents().size());
            for (DocumentNode document : collected.documents()) {
                rewritten.add(linkRewriter.rewrite(document, namespaces));
            }
            long unresolved = rewritten.stream().mapToLong(DocumentNode::unresolvedCount).sum();
            if (unresolved > 0) {
                log.info("{}: {} unresolved link(s) across {} document(s)", key, unresolved, rewritten.size());
            }
            NavigationFragment fragment = navigationBuilder.build(
                    enrollment.getSlug(), key.fullName(), revision, rewritten);

            deadline.check("index");
            phase.accept(SyncState.INDEXING);
            List<SearchIndexEntry> entries = searchIndexBuilder.build(enrollment.getSlug(), key.fullName(), rewritten);

            deadline.check("commit");
            commit(job, revision, tree.root(), collected, rewritten, fragment, entries);

        } catch (RepositoryGoneException e) {
            log.warn("{} is gone upstream, suspending: {}", key, e.getMessage());
            recordFailure(job, revision, e);
            suspendAndPurge(key);
        } catch (DocSyncException e) {
            log.warn("Sync job #{} for {} failed ({}): {}", job.sequence(), key, e.getErrorCode(), e.getMessage());
            recordFailure(job, revision, e);
        } catch (RuntimeException e) {
            log.error("Sync job #{} for {} failed unexpectedly", job.sequence(), key, e);
            recordFailure(job, revision, e);
        }
    }

    /**
     * Removes search entries, published pages and the working copy of a
     * repository and regenerates the unified config without it.
     */
    public void purge(RepositoryKey key) {
        Lock lock = commitLocks.get(key);
        lock.lock();
        try {
            registry.find(key).ifPresent(enrollment -> contentStore.purge(enrollment.getSlug()));
            searchIndex.removeRepository(key.fullName());
            gitFetcher.discard(key);
            configPublisher.regenerate();
        } finally {
            lock.unlock();
        }
    }

    private void commit(SyncJob job, String revision, Path root, CollectedTree collected,
                        List<DocumentNode> documents, NavigationFragment fragment, List<SearchIndexEntry> entries) {
        RepositoryKey key = job.repository();
        Lock lock = commitLocks.get(key);
        lock.lock();
        try {
            RepositoryEnrollment current = registry.find(key).orElse(null);
            if (current == null || !current.isActive()) {
                log.info("{} was suspended while job #{} ran, discarding result", key, job.sequence());
                return;
            }
            if (job.sequence() <= current.getLastAppliedSequence()) {
                log.warn("Job #{} for {} is older than applied job #{}, discarding result",
                        job.sequence(), key, current.getLastAppliedSequence());
                return;
            }

            List<String> published = new ArrayList<>();
            documents.forEach(d -> published.add(d.path()));
            published.addAll(collected.assets());
            PublishedRepository manifest = new PublishedRepository(
                    current.getSlug(), key.fullName(), revision, Instant.now(), published, fragment);

            List<SearchIndexEntry> previousEntries = searchIndex.entries(key.fullName());
            PublishedContentStore.Publication publication =
                    contentStore.publish(manifest, documents, root, collected.assets());
            try {
                searchIndex.replaceRepository(key.fullName(), entries);
                configPublisher.regenerate();
                registry.recordSyncOutcome(key.owner(), key.name(), revision, job.sequence(),
                        SyncOutcome.SUCCEEDED, null);
            } catch (RuntimeException e) {
                try {
                    rollback(key, publication, previousEntries);
                } catch (RuntimeException rollbackFailure) {
                    log.error("Rollback of job #{} for {} failed", job.sequence(), key, rollbackFailure);
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            }
            publication.confirm();

            log.info("Sync job #{} for {} committed at {}", job.sequence(), key, revision);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Restores what the site served before a commit that failed halfway.
     */
    private void rollback(RepositoryKey key, PublishedContentStore.Publication publication,
                          List<SearchIndexEntry> previousEntries) {
        log.warn("Restoring previously published content of {}", key);
        publication.rollback();
        if (previousEntries.isEmpty()) {
            searchIndex.removeRepository(key.fullName());
        } else {
            searchIndex.replaceRepository(key.fullName(), previousEntries);
        }
        configPublisher.regenerate();
    }

    private NamespaceMap namespaceMap(RepositoryEnrollment enrollment, CollectedTree collected) {
        Set<String> activeSlugs = registry.listActive().stream()
                .map(RepositoryEnrollment::getSlug)
                .collect(Collectors.toSet());
        Map<String, Set<String>> others = new HashMap<>();
        contentStore.snapshot().forEach((slug, published) -> {
            if (!slug.equals(enrollment.getSlug()) && activeSlugs.contains(slug)) {
                others.put(slug, Set.copyOf(published.documentPaths()));
            }
        });
        return new NamespaceMap(enrollment.getSlug(), collected.publishedFiles(), others);
    }

    private void recordFailure(SyncJob job, String revision, Exception cause) {
        RepositoryKey key = job.repository();
        try {
            registry.recordSyncOutcome(key.owner(), key.name(), revision, job.sequence(),
                    SyncOutcome.FAILED, cause.getMessage());
        } catch (StaleRevisionException e) {
            log.warn("Not recording failure of job #{} for {}: {}", job.sequence(), key, e.getMessage());
        } catch (EnrollmentNotFoundException e) {
            log.warn("Not recording failure of job #{}: {}", job.sequence(), e.getMessage());
        }
    }

    private void suspendAndPurge(RepositoryKey key) {
        try {
            registry.unenroll(key.owner(), key.name());
        } catch (EnrollmentNotFoundException e) {
            log.warn("Cannot suspend {}: {}", key, e.getMessage());
            return;
        }
        purge(key);
    }
}
