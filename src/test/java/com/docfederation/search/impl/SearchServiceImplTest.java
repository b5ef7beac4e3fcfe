package com.docfederation.search.impl;

import com.docfederation.model.docs.SearchHit;
import com.docfederation.model.docs.SearchIndexEntry;
import com.docfederation.search.AccessPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Search Service")
class SearchServiceImplTest {

    private final InMemorySearchIndex index = new InMemorySearchIndex();
    private final AccessPolicy policy = identity ->
            "alice".equals(identity) ? Set.of("acme/guide", "acme/internal") : Set.of("acme/guide");
    private final SearchServiceImpl service = new SearchServiceImpl(index, policy);

    @BeforeEach
    void setUp() {
        index.replaceRepository("acme/guide", List.of(
                new SearchIndexEntry("/guide/a/", "acme/guide", "guide", "Alpha", "release notes", List.of())));
        List<SearchIndexEntry> internal = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            internal.add(new SearchIndexEntry("/internal/p" + i + "/", "acme/internal", "internal",
                    "Page " + i, "release checklist", List.of()));
        }
        index.replaceRepository("acme/internal", internal);
    }

    @Test
    @DisplayName("Anonymous callers see public repositories only")
    void anonymousSeesPublic() {
        List<SearchHit> hits = service.query("release", null, 10);

        assertThat(hits).extracting(SearchHit::repository).containsOnly("acme/guide");
    }

    @Test
    @DisplayName("Granted identities see more, and limits are clamped")
    void grantedIdentityAndLimitClamp() {
        assertThat(service.query("release", "alice", 1000)).hasSize(SearchServiceImpl.MAX_LIMIT);
        assertThat(service.query("release", "alice", 0)).hasSize(1);
    }

    @Test
    @DisplayName("Offset pages through the visible hits only")
    void pagesWithOffset() {
        List<SearchHit> firstThree = service.query("release", "alice", 0, 3);

        assertThat(service.query("release", "alice", 1, 2)).isEqualTo(firstThree.subList(1, 3));
        assertThat(service.query("release", "alice", -5, 1)).isEqualTo(firstThree.subList(0, 1));
        assertThat(service.query("release", "alice", 151, 10)).isEmpty();
        assertThat(service.query("release", null, 1, 10)).isEmpty();
    }

    @Test
    @DisplayName("Blank queries are rejected")
    void rejectsBlankQuery() {
        assertThatThrownBy(() -> service.query("  ", "alice", 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
