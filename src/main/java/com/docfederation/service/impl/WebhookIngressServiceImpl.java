package com.docfederation.service.impl;

import com.docfederation.configuration.AppProperties;
import com.docfederation.configuration.WebhookProperties;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.model.enrollment.RepositoryKey;
import com.docfederation.model.sync.SubmitResult;
import com.docfederation.model.sync.TriggerSource;
import com.docfederation.model.webhook.IngressOutcome;
import com.docfederation.model.webhook.IngressResult;
import com.docfederation.model.webhook.PushEvent;
import com.docfederation.service.RepositoryRegistry;
import com.docfederation.service.SyncCoordinator;
import com.docfederation.service.WebhookIngressService;
import com.docfederation.service.webhook.PushEventParser;
import com.docfederation.service.webhook.RecentDeliveryWindow;
import com.docfederation.service.webhook.WebhookSignatureVerifier;
import com.google.common.io.Files;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns signed GitHub push deliveries into sync jobs.
 *
 * <p>A delivery goes through these checks in order, and the first that
 * applies decides the answer:
 * <ol>
 *   <li>HMAC-SHA256 signature over the raw body ({@code 401} on mismatch);</li>
 *   <li>event type: {@code ping} and non-push events are acknowledged as ignored;</li>
 *   <li>branch deletions are ignored;</li>
 *   <li>enrollment: unknown repositories are reported, suspended ones ignored;</li>
 *   <li>only pushes to the enrollment's default branch count, optionally only
 *       those touching documentation;</li>
 *   <li>{@code owner/name@revision} already accepted within the dedup window
 *       is acknowledged as a duplicate.</li>
 * </ol>
 * Only then is a job submitted. The response never waits for the sync itself.
 * If the submit fails, the dedup key is released so a redelivery can retry.
 */
@Slf4j
@Service
public class WebhookIngressServiceImpl implements WebhookIngressService {

    private static final Set<String> DOC_CONFIG_FILES = Set.of("mkdocs.yml", "mkdocs.yaml");

    private final WebhookSignatureVerifier signatureVerifier;
    private final PushEventParser parser;
    private final RepositoryRegistry registry;
    private final SyncCoordinator coordinator;
    private final AppProperties appProperties;
    private final RecentDeliveryWindow recentDeliveries;

    public WebhookIngressServiceImpl(WebhookSignatureVerifier signatureVerifier,
                                     PushEventParser parser,
                                     RepositoryRegistry registry,
                                     SyncCoordinator coordinator,
                                     AppProperties appProperties) {
        this.signatureVerifier = signatureVerifier;
        this.parser = parser;
        this.registry = registry;
        this.coordinator = coordinator;
        this.appProperties = appProperties;
        WebhookProperties webhook = appProperties.getWebhook();
        this.recentDeliveries = new RecentDeliveryWindow(webhook.getDedupWindow(), webhook.getDedupMaxEntries());
    }

    @Override
    public IngressResult handle(byte[] payload, String signature, String eventType, String deliveryId) {
        signatureVerifier.verify(payload, signature);

        if ("ping".equals(eventType)) {
            log.info("Webhook ping received (delivery {})", deliveryId);
            return IngressResult.of(IngressOutcome.IGNORED, null, null, "pong");
        }
        if (!"push".equals(eventType)) {
            log.debug("Ignoring '{}' event (delivery {})", eventType, deliveryId);
            return IngressResult.of(IngressOutcome.IGNORED, null, null, "Event type ignored: " + eventType);
        }

        PushEvent event = parser.parse(payload);
        RepositoryKey key = RepositoryKey.of(event.owner(), event.name());
        String repository = key.fullName();

        if (event.deleted() || event.headRevision() == null) {
            return IngressResult.of(IngressOutcome.IGNORED, repository, null, "Branch deletion ignored");
        }

        Optional<RepositoryEnrollment> enrollment = registry.find(key);
        if (enrollment.isEmpty()) {
            log.info("Push for unknown repository {} (delivery {})", repository, deliveryId);
            return IngressResult.of(IngressOutcome.UNKNOWN_REPOSITORY, repository, event.headRevision(),
                    "Repository is not enrolled");
        }
        if (!enrollment.get().isActive()) {
            return IngressResult.of(IngressOutcome.IGNORED, repository, event.headRevision(),
                    "Repository enrollment is suspended");
        }
        if (!enrollment.get().getDefaultBranch().equals(event.branch())) {
            return IngressResult.of(IngressOutcome.IGNORED, repository, event.headRevision(),
                    "Push to " + event.ref() + " ignored");
        }
        if (appProperties.getWebhook().isRequireDocChanges() && !touchesDocs(event)) {
            return IngressResult.of(IngressOutcome.IGNORED, repository, event.headRevision(),
                    "No documentation changes");
        }

        String dedupKey = repository + "@" + event.headRevision();
        if (!recentDeliveries.markIfFirst(dedupKey)) {
            log.info("Duplicate push {} (delivery {}) acknowledged", dedupKey, deliveryId);
            return IngressResult.of(IngressOutcome.DUPLICATE, repository, event.headRevision(),
                    "Duplicate delivery");
        }

        SubmitResult submitted;
        try {
            submitted = coordinator.submit(key, event.headRevision(), TriggerSource.WEBHOOK);
        } catch (RuntimeException e) {
            recentDeliveries.forget(dedupKey);
            throw e;
        }
        log.info("Push {} (delivery {}) accepted as job #{} ({})",
                dedupKey, deliveryId, submitted.sequence(), submitted.status());
        return IngressResult.of(IngressOutcome.ACCEPTED, repository, event.headRevision(),
                "Sync " + submitted.status().name().toLowerCase(Locale.ROOT));
    }

    private boolean touchesDocs(PushEvent event) {
        Set<String> extensions = appProperties.getSite().getDocExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return event.changedFiles().stream().anyMatch(path ->
                path.startsWith("docs/") || path.contains("/docs/")
                        || DOC_CONFIG_FILES.contains(path)
                        || extensions.contains(Files.getFileExtension(path).toLowerCase(Locale.ROOT)));
    }
}
