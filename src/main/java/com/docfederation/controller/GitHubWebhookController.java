package com.docfederation.controller;

import com.docfederation.model.webhook.IngressResult;
import com.docfederation.service.WebhookIngressService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GitHub push webhook.
 *
 * 202 accepted for processing, 200 for duplicates and ignored events,
 * 401 on a bad signature, 404 for repositories that were never enrolled.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
public class GitHubWebhookController {

    private final WebhookIngressService ingressService;

    @PostMapping("/github")
    public ResponseEntity<IngressResult> handleGitHubWebhook(
            @RequestBody byte[] payload,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestHeader(value = "X-GitHub-Event", required = false) String eventType,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId) {

        log.debug("Webhook delivery {} ({} bytes, event={})", deliveryId, payload.length, eventType);
        IngressResult result = ingressService.handle(payload, signature, eventType, deliveryId);
        return ResponseEntity.status(result.getOutcome().getStatus()).body(result);
    }
}
