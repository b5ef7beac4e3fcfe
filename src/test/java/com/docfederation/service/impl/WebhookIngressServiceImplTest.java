package com.docfederation.service.impl;

import com.docfederation.configuration.AppProperties;
import com.docfederation.exception.InvalidSignatureException;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.model.enrollment.RepositoryKey;
import com.docfederation.model.sync.SubmitResult;
import com.docfederation.model.sync.SubmitStatus;
import com.docfederation.model.sync.TriggerSource;
import com.docfederation.model.webhook.IngressOutcome;
import com.docfederation.model.webhook.IngressResult;
import com.docfederation.service.RepositoryRegistry;
import com.docfederation.service.SyncCoordinator;
import com.docfederation.service.webhook.PushEventParser;
import com.docfederation.service.webhook.WebhookSignatureVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Webhook Ingress Service")
class WebhookIngressServiceImplTest {

    private static final String SECRET = "s3cret";
    private static final String HEAD = "abc123abc123abc123abc123abc123abc123abc1";
    private static final RepositoryKey GUIDE = RepositoryKey.of("acme", "guide");

    private final RepositoryRegistry registry = mock(RepositoryRegistry.class);
    private final SyncCoordinator coordinator = mock(SyncCoordinator.class);
    private AppProperties properties;
    private WebhookIngressServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getGithub().setWebhookSecret(SECRET);
        service = newService();

        RepositoryEnrollment guide = RepositoryEnrollment.create(GUIDE, "main", "guide", Instant.now());
        when(registry.find(GUIDE)).thenReturn(Optional.of(guide));
        when(registry.find(RepositoryKey.of("acme", "unknown"))).thenReturn(Optional.empty());
        when(coordinator.submit(any(), anyString(), any())).thenReturn(new SubmitResult(SubmitStatus.STARTED, 7L));
    }

    private WebhookIngressServiceImpl newService() {
        return new WebhookIngressServiceImpl(new WebhookSignatureVerifier(properties),
                new PushEventParser(new ObjectMapper()), registry, coordinator, properties);
    }

    private static byte[] push(String repository, String ref, String head, String changed) {
        return ("{\"ref\":\"" + ref + "\",\"after\":\"" + head + "\","
                + "\"repository\":{\"full_name\":\"" + repository + "\"},"
                + "\"head_commit\":{\"id\":\"" + head + "\"},"
                + "\"commits\":[{\"modified\":[\"" + changed + "\"]}]}").getBytes(StandardCharsets.UTF_8);
    }

    private IngressResult deliver(byte[] payload, String event) {
        return service.handle(payload, WebhookSignatureVerifier.signatureHeader(SECRET, payload), event, "d-1");
    }

    @Test
    @DisplayName("Valid push is accepted and submitted once; the redelivery is a duplicate")
    void acceptsThenDeduplicates() {
        // Given
        byte[] payload = push("acme/guide", "refs/heads/main", HEAD, "docs/setup.md");

        // When
        IngressResult first = deliver(payload, "push");
        IngressResult second = deliver(payload, "push");

        // Then
        assertThat(first.getOutcome()).isEqualTo(IngressOutcome.ACCEPTED);
        assertThat(first.getRepository()).isEqualTo("acme/guide");
        assertThat(first.getRevision()).isEqualTo(HEAD);
        assertThat(second.getOutcome()).isEqualTo(IngressOutcome.DUPLICATE);
        verify(coordinator, times(1)).submit(GUIDE, HEAD, TriggerSource.WEBHOOK);
    }

    @Test
    @DisplayName("Bad signatures never reach the coordinator")
    void rejectsBadSignature() {
        byte[] payload = push("acme/guide", "refs/heads/main", HEAD, "docs/setup.md");

        assertThatThrownBy(() -> service.handle(payload, "sha256=00", "push", "d-1"))
                .isInstanceOf(InvalidSignatureException.class);
        verify(coordinator, never()).submit(any(), anyString(), any());
    }

    @Test
    @DisplayName("Unknown repositories, other branches, pings and deletions")
    void ignoresIrrelevantDeliveries() {
        assertThat(deliver(push("acme/unknown", "refs/heads/main", HEAD, "a.md"), "push").getOutcome())
                .isEqualTo(IngressOutcome.UNKNOWN_REPOSITORY);
        assertThat(deliver(push("acme/guide", "refs/heads/feature", HEAD, "a.md"), "push").getOutcome())
                .isEqualTo(IngressOutcome.IGNORED);
        assertThat(deliver("{\"zen\":\"hi\"}".getBytes(StandardCharsets.UTF_8), "ping").getOutcome())
                .isEqualTo(IngressOutcome.IGNORED);
        assertThat(deliver("{}".getBytes(StandardCharsets.UTF_8), "issues").getOutcome())
                .isEqualTo(IngressOutcome.IGNORED);
        assertThat(deliver(push("acme/guide", "refs/heads/main", "0000000000000000000000000000000000000000", "a.md"),
                "push").getOutcome()).isEqualTo(IngressOutcome.IGNORED);
        verify(coordinator, never()).submit(any(), anyString(), any());
    }

    @Test
    @DisplayName("Suspended repositories are acknowledged but not synced")
    void ignoresSuspended() {
        RepositoryEnrollment suspended = RepositoryEnrollment.create(GUIDE, "main", "guide", Instant.now());
        suspended.suspend(Instant.now());
        when(registry.find(GUIDE)).thenReturn(Optional.of(suspended));

        IngressResult result = deliver(push("acme/guide", "refs/heads/main", HEAD, "docs/a.md"), "push");

        assertThat(result.getOutcome()).isEqualTo(IngressOutcome.IGNORED);
        verify(coordinator, never()).submit(any(), anyString(), any());
    }

    @Test
    @DisplayName("With doc filtering on, code-only pushes are skipped")
    void filtersCodeOnlyPushes() {
        properties.getWebhook().setRequireDocChanges(true);
        service = newService();

        IngressResult codeOnly = deliver(push("acme/guide", "refs/heads/main", HEAD, "src/Main.java"), "push");
        IngressResult docs = deliver(push("acme/guide", "refs/heads/main", HEAD, "guide/intro.md"), "push");

        assertThat(codeOnly.getOutcome()).isEqualTo(IngressOutcome.IGNORED);
        assertThat(docs.getOutcome()).isEqualTo(IngressOutcome.ACCEPTED);
    }

    @Test
    @DisplayName("A failed submission does not poison the dedup window")
    void forgetsOnSubmitFailure() {
        byte[] payload = push("acme/guide", "refs/heads/main", HEAD, "docs/setup.md");
        when(coordinator.submit(any(), anyString(), any()))
                .thenThrow(new IllegalStateException("pool shut down"))
                .thenReturn(new SubmitResult(SubmitStatus.STARTED, 8L));

        assertThatThrownBy(() -> deliver(payload, "push")).isInstanceOf(IllegalStateException.class);
        assertThat(deliver(payload, "push").getOutcome()).isEqualTo(IngressOutcome.ACCEPTED);
    }

    @Test
    @DisplayName("Concurrent redeliveries of one push submit exactly one sync")
    void concurrentDuplicatesSubmitOnce() throws Exception {
        // Given
        byte[] payload = push("acme/guide", "refs/heads/main", HEAD, "docs/setup.md");
        String signature = WebhookSignatureVerifier.signatureHeader(SECRET, payload);
        int deliveries = 16;
        ExecutorService pool = Executors.newFixedThreadPool(deliveries);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IngressResult>> results = new ArrayList<>();

        // When: every delivery is released at the same moment
        try {
            for (int i = 0; i < deliveries; i++) {
                String deliveryId = "d-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return service.handle(payload, signature, "push", deliveryId);
                }));
            }
            start.countDown();

            List<IngressOutcome> outcomes = new ArrayList<>();
            for (Future<IngressResult> result : results) {
                outcomes.add(result.get(10, TimeUnit.SECONDS).getOutcome());
            }

            // Then
            assertThat(outcomes).containsOnlyOnce(IngressOutcome.ACCEPTED);
            assertThat(outcomes).filteredOn(outcome -> outcome == IngressOutcome.DUPLICATE).hasSize(deliveries - 1);
            verify(coordinator, times(1)).submit(GUIDE, HEAD, TriggerSource.WEBHOOK);
        } finally {
            pool.shutdownNow();
        }
    }
}
