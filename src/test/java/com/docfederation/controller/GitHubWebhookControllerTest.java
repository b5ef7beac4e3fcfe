package com.docfederation.controller;

import com.docfederation.service.webhook.WebhookSignatureVerifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("GitHub Webhook Controller")
class GitHubWebhookControllerTest {

    private static final String SECRET = "test-webhook-secret";

    @Autowired
    private MockMvc mockMvc;

    private static byte[] push(String fullName) {
        return ("{\"ref\":\"refs/heads/main\",\"after\":\"abc123abc123abc123abc123abc123abc123abc1\","
                + "\"repository\":{\"full_name\":\"" + fullName + "\"},"
                + "\"head_commit\":{\"id\":\"abc123abc123abc123abc123abc123abc123abc1\"}}")
                .getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Wrong signature returns 401")
    void rejectsBadSignature() throws Exception {
        // Given
        byte[] payload = push("acme/anything");

        // When / Then
        mockMvc.perform(post("/api/v1/webhooks/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-GitHub-Event", "push")
                        .header("X-Hub-Signature-256", WebhookSignatureVerifier.signatureHeader("wrong", payload))
                        .content(payload))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_SIGNATURE"));
    }

    @Test
    @DisplayName("Missing signature returns 401")
    void rejectsUnsigned() throws Exception {
        mockMvc.perform(post("/api/v1/webhooks/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-GitHub-Event", "push")
                        .content(push("acme/anything")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Push for a repository that was never enrolled returns 404")
    void unknownRepository() throws Exception {
        byte[] payload = push("acme/never-enrolled-repo");

        mockMvc.perform(post("/api/v1/webhooks/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-GitHub-Event", "push")
                        .header("X-Hub-Signature-256", WebhookSignatureVerifier.signatureHeader(SECRET, payload))
                        .content(payload))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.outcome").value("UNKNOWN_REPOSITORY"))
                .andExpect(jsonPath("$.repository").value("acme/never-enrolled-repo"));
    }

    @Test
    @DisplayName("Ping is acknowledged with 200")
    void ping() throws Exception {
        byte[] payload = "{\"zen\":\"Keep it logically awesome.\"}".getBytes(StandardCharsets.UTF_8);

        mockMvc.perform(post("/api/v1/webhooks/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-GitHub-Event", "ping")
                        .header("X-Hub-Signature-256", WebhookSignatureVerifier.signatureHeader(SECRET, payload))
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("IGNORED"));
    }

    @Test
    @DisplayName("Signed but malformed payload returns 400")
    void malformedPayload() throws Exception {
        byte[] payload = "{\"ref\":\"refs/heads/main\"}".getBytes(StandardCharsets.UTF_8);

        mockMvc.perform(post("/api/v1/webhooks/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-GitHub-Event", "push")
                        .header("X-Hub-Signature-256", WebhookSignatureVerifier.signatureHeader(SECRET, payload))
                        .content(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }
}
