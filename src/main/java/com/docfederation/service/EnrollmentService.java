package com.docfederation.service;

import com.docfederation.api.BulkEnrollResponse;
import com.docfederation.api.EnrollResponse;
import com.docfederation.api.EnrollmentStatusResponse;
import com.docfederation.api.SyncTriggerResponse;
import com.docfederation.exception.DocSyncException;
import com.docfederation.model.enrollment.RepositoryKey;
import com.docfederation.model.sync.SubmitResult;
import com.docfederation.model.sync.SyncJob;
import com.docfederation.model.sync.TriggerSource;
import com.docfederation.util.GitInputValidator;
import com.google.common.base.Splitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Manual enrollment operations: each one combines a registry change with the
 * sync work it implies.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrollmentService {

    static final String DEFAULT_BRANCH = "main";

    private final RepositoryRegistry registry;
    private final SyncCoordinator coordinator;

    /**
     * Enrolls (or re-activates) a repository and schedules its first sync.
     */
    public EnrollResponse enroll(String owner, String name, String defaultBranch) {
        String branch = defaultBranch == null || defaultBranch.isBlank() ? DEFAULT_BRANCH : defaultBranch;
        String slug = registry.enroll(owner, name, branch);
        RepositoryKey key = RepositoryKey.of(owner, name);
        SubmitResult submitted = coordinator.submit(key, SyncJob.LATEST, TriggerSource.MANUAL);
        return EnrollResponse.builder()
                .repository(key.fullName())
                .slug(slug)
                .sync(submitted.status())
                .jobSequence(submitted.sequence())
                .build();
    }

    /**
     * Enrolls every listed {@code owner/name} that is not excluded. A failure
     * is reported for its repository and does not stop the others.
     */
    public BulkEnrollResponse enrollAll(List<String> repositories, List<String> exclude, String defaultBranch) {
        Set<String> excluded = exclude == null ? Set.of() : exclude.stream()
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<BulkEnrollResponse.Result> results = new ArrayList<>();
        int skipped = 0;
        for (String entry : repositories) {
            String repository = entry == null ? "" : entry.trim();
            List<String> parts = Splitter.on('/').trimResults().splitToList(repository);
            String bareName = parts.get(parts.size() - 1).toLowerCase(Locale.ROOT);
            if (excluded.contains(repository.toLowerCase(Locale.ROOT)) || excluded.contains(bareName)) {
                log.info("Bulk enrollment: {} excluded", repository);
                skipped++;
                continue;
            }
            if (parts.size() != 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
                results.add(BulkEnrollResponse.Result.failed(repository, "Expected owner/name"));
                continue;
            }
            try {
                results.add(BulkEnrollResponse.Result.enrolled(enroll(parts.get(0), parts.get(1), defaultBranch)));
            } catch (DocSyncException | IllegalArgumentException e) {
                log.warn("Bulk enrollment of {} failed: {}", repository, e.getMessage());
                results.add(BulkEnrollResponse.Result.failed(repository, e.getMessage()));
            }
        }

        int enrolled = (int) results.stream().filter(BulkEnrollResponse.Result::isSuccess).count();
        log.info("Bulk enrollment: enrolled {}/{} repositories ({} excluded)",
                enrolled, repositories.size() - skipped, skipped);
        return BulkEnrollResponse.builder()
                .requested(repositories.size())
                .enrolled(enrolled)
                .excluded(skipped)
                .results(results)
                .build();
    }

    /**
     * Suspends a repository and removes its pages, search entries and navigation.
     */
    public EnrollmentStatusResponse unenroll(String owner, String name) {
        RepositoryKey key = RepositoryKey.of(owner, name);
        if (registry.unenroll(owner, name)) {
            coordinator.purge(key);
        }
        return status(owner, name);
    }

    public SyncTriggerResponse triggerSync(String owner, String name, String revision) {
        String target = revision == null || revision.isBlank() ? SyncJob.LATEST : revision;
        GitInputValidator.validateRevision(target);
        RepositoryKey key = RepositoryKey.of(owner, name);
        if (!registry.get(owner, name).isActive()) {
            throw new IllegalArgumentException("Repository " + key + " is suspended; enroll it again first");
        }
        SubmitResult submitted = coordinator.submit(key, target, TriggerSource.MANUAL);
        return SyncTriggerResponse.of(key.fullName(), target, submitted);
    }

    public EnrollmentStatusResponse status(String owner, String name) {
        RepositoryKey key = RepositoryKey.of(owner, name);
        return EnrollmentStatusResponse.from(registry.get(owner, name), coordinator.getState(key));
    }

    public List<EnrollmentStatusResponse> list() {
        return registry.listAll().stream()
                .map(e -> EnrollmentStatusResponse.from(e, coordinator.getState(e.key())))
                .toList();
    }
}
