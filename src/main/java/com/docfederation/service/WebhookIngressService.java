package com.docfederation.service;

import com.docfederation.exception.InvalidSignatureException;
import com.docfederation.model.webhook.IngressResult;

/**
 * Validates, decodes and deduplicates push notifications, then hands them to
 * the {@link SyncCoordinator}. Never waits for the sync itself.
 */
public interface WebhookIngressService {

    /**
     * @param payload    raw request body, exactly as signed
     * @param signature  {@code X-Hub-Signature-256} header
     * @param eventType  {@code X-GitHub-Event} header
     * @param deliveryId {@code X-GitHub-Delivery} header, for logging only
     * @throws InvalidSignatureException if the signature does not verify
     */
    IngressResult handle(byte[] payload, String signature, String eventType, String deliveryId);
}
