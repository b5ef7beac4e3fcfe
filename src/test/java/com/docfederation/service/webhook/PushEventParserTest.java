package com.docfederation.service.webhook;

import com.docfederation.model.webhook.PushEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Push Event Parser")
class PushEventParserTest {

    private final PushEventParser parser = new PushEventParser(new ObjectMapper());

    private PushEvent parse(String json) {
        return parser.parse(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Reads repository, branch, head commit and changed files")
    void parsesPush() {
        PushEvent event = parse("""
                {
                  "ref": "refs/heads/main",
                  "after": "1111111111111111111111111111111111111111",
                  "repository": {"name": "Guide", "full_name": "Acme/Guide", "owner": {"login": "Acme"}},
                  "head_commit": {"id": "abc123abc123abc123abc123abc123abc123abc1"},
                  "commits": [
                    {"added": ["docs/new.md"], "modified": ["README.md"], "removed": []},
                    {"added": [], "modified": ["docs/new.md"], "removed": ["src/Main.java"]}
                  ]
                }
                """);

        assertThat(event.owner()).isEqualTo("Acme");
        assertThat(event.name()).isEqualTo("Guide");
        assertThat(event.branch()).isEqualTo("main");
        assertThat(event.headRevision()).isEqualTo("abc123abc123abc123abc123abc123abc123abc1");
        assertThat(event.deleted()).isFalse();
        assertThat(event.changedFiles()).containsExactly("docs/new.md", "README.md", "src/Main.java");
    }

    @Test
    @DisplayName("Branch deletions are flagged")
    void detectsDeletion() {
        PushEvent event = parse("""
                {"ref": "refs/heads/old", "after": "0000000000000000000000000000000000000000",
                 "repository": {"full_name": "acme/guide"}}
                """);

        assertThat(event.deleted()).isTrue();
        assertThat(event.owner()).isEqualTo("acme");
        assertThat(event.name()).isEqualTo("guide");
    }

    @Test
    @DisplayName("Payloads without a repository are rejected")
    void rejectsIncompletePayload() {
        assertThatThrownBy(() -> parse("{\"ref\": \"refs/heads/main\"}")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("not json")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("[]")).isInstanceOf(IllegalArgumentException.class);
    }
}
