package com.docfederation.search.impl;

import com.docfederation.model.docs.SearchHit;
import com.docfederation.model.docs.SearchIndexEntry;
import com.docfederation.search.SearchIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one immutable entry list per repository and swaps it on upsert.
 *
 * Matching is plain term counting with title hits weighted higher. It stands
 * in for a real ranking engine; only the repository-scoped replace and the
 * visibility filter are contractual.
 */
@Slf4j
@Service
public class InMemorySearchIndex implements SearchIndex {

    private static final int TITLE_WEIGHT = 3;
    private static final int SNIPPET_RADIUS = 80;

    private final Map<String, List<Indexed>> byRepository = new ConcurrentHashMap<>();

    @Override
    public void replaceRepository(String repository, List<SearchIndexEntry> entries) {
        List<Indexed> indexed = entries.stream().map(Indexed::new).toList();
        List<Indexed> previous = byRepository.put(key(repository), indexed);
        log.info("Indexed {} page(s) for {} (previously {})",
                indexed.size(), repository, previous == null ? 0 : previous.size());
    }

    @Override
    public void removeRepository(String repository) {
        List<Indexed> removed = byRepository.remove(key(repository));
        if (removed != null) {
            log.info("Removed {} page(s) of {} from the search index", removed.size(), repository);
        }
    }

    @Override
    public List<SearchHit> query(String text, Set<String> visibleRepositories, int limit) {
        List<String> terms = terms(text);
        if (terms.isEmpty() || visibleRepositories.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<SearchHit> hits = new ArrayList<>();
        for (String repository : visibleRepositories) {
            for (Indexed indexed : byRepository.getOrDefault(key(repository), List.of())) {
                int score = 0;
                for (String term : terms) {
                    score += TITLE_WEIGHT * occurrences(indexed.title, term) + occurrences(indexed.body, term);
                }
                if (score > 0) {
                    SearchIndexEntry entry = indexed.entry;
                    hits.add(new SearchHit(entry.unifiedPath(), entry.title(), snippet(indexed, terms),
                            entry.repository(), score));
                }
            }
        }
        hits.sort(Comparator.comparingDouble(SearchHit::score).reversed().thenComparing(SearchHit::unifiedPath));
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }

    @Override
    public List<SearchIndexEntry> entries(String repository) {
        return byRepository.getOrDefault(key(repository), List.of()).stream().map(i -> i.entry).toList();
    }

    private static List<String> terms(String text) {
        if (text == null) {
            return List.of();
        }
        List<String> terms = new ArrayList<>();
        for (String term : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!term.isEmpty() && !terms.contains(term)) {
                terms.add(term);
            }
        }
        return terms;
    }

    private static int occurrences(String haystack, String term) {
        int count = 0;
        int from = 0;
        while ((from = haystack.indexOf(term, from)) >= 0) {
            count++;
            from += term.length();
        }
        return count;
    }

    private static String snippet(Indexed indexed, List<String> terms) {
        String body = indexed.entry.bodyText();
        int at = -1;
        for (String term : terms) {
            at = indexed.body.indexOf(term);
            if (at >= 0) {
                break;
            }
        }
        if (at < 0) {
            return body.length() <= 2 * SNIPPET_RADIUS ? body : body.substring(0, 2 * SNIPPET_RADIUS) + "...";
        }
        int start = Math.max(0, at - SNIPPET_RADIUS);
        int end = Math.min(body.length(), at + SNIPPET_RADIUS);
        return (start > 0 ? "..." : "") + body.substring(start, end) + (end < body.length() ? "..." : "");
    }

    private static String key(String repository) {
        return repository.toLowerCase(Locale.ROOT);
    }

    private static final class Indexed {
        private final SearchIndexEntry entry;
        private final String title;
        private final String body;

        private Indexed(SearchIndexEntry entry) {
            this.entry = entry;
            this.title = entry.title() == null ? "" : entry.title().toLowerCase(Locale.ROOT);
            this.body = entry.bodyText() == null ? "" : entry.bodyText().toLowerCase(Locale.ROOT);
        }
    }
}
