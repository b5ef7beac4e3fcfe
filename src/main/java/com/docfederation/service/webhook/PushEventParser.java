package com.docfederation.service.webhook;

import com.docfederation.model.webhook.PushEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decodes the fields of a GitHub push payload that drive a sync.
 */
@Component
@RequiredArgsConstructor
public class PushEventParser {

    private static final String ZERO_REVISION = "0000000000000000000000000000000000000000";

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException if the payload is not a usable push event
     */
    public PushEvent parse(byte[] payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new IllegalArgumentException("Webhook payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Webhook payload is not a JSON object");
        }

        JsonNode repository = root.path("repository");
        String owner = text(repository.path("owner").path("login"));
        if (owner == null) {
            owner = text(repository.path("owner").path("name"));
        }
        String name = text(repository.path("name"));
        String fullName = text(repository.path("full_name"));
        if ((owner == null || name == null) && fullName != null && fullName.contains("/")) {
            owner = fullName.substring(0, fullName.indexOf('/'));
            name = fullName.substring(fullName.indexOf('/') + 1);
        }
        if (owner == null || name == null) {
            throw new IllegalArgumentException("Webhook payload has no repository owner/name");
        }

        String after = text(root.path("after"));
        String head = text(root.path("head_commit").path("id"));
        String revision = head != null ? head : after;
        boolean deleted = root.path("deleted").asBoolean(false) || ZERO_REVISION.equals(after);

        Set<String> files = new LinkedHashSet<>();
        for (JsonNode commit : root.path("commits")) {
            for (String field : List.of("added", "modified", "removed")) {
                commit.path(field).forEach(path -> files.add(path.asText()));
            }
        }

        return new PushEvent(owner, name, text(root.path("ref")), revision, deleted, List.copyOf(files));
    }

    private static String text(JsonNode node) {
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
