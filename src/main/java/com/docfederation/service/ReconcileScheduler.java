package com.docfederation.service;

import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.model.sync.SyncJob;
import com.docfederation.model.sync.TriggerSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically re-syncs every active enrollment at its branch head, catching
 * pushes whose webhook was lost.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.sync", name = "reconcile-enabled", havingValue = "true")
public class ReconcileScheduler {

    private final RepositoryRegistry registry;
    private final SyncCoordinator coordinator;

    @Scheduled(fixedDelayString = "${app.sync.reconcile-interval}",
            initialDelayString = "${app.sync.reconcile-interval}")
    public void reconcile() {
        List<RepositoryEnrollment> active = registry.listActive();
        log.info("Reconciling {} active enrollment(s)", active.size());
        for (RepositoryEnrollment enrollment : active) {
            try {
                coordinator.submit(enrollment.key(), SyncJob.LATEST, TriggerSource.RECONCILE);
            } catch (RuntimeException e) {
                log.error("Failed to schedule reconcile for {}", enrollment.key(), e);
            }
        }
    }
}
