package com.docfederation.search;

import com.docfederation.model.docs.DocumentNode;
import com.docfederation.model.docs.SearchIndexEntry;
import com.docfederation.rewrite.FrontMatter;
import com.docfederation.rewrite.LinkRewriter;
import com.docfederation.rewrite.NavigationBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns rewritten documents into search entries: plain text body, title and
 * the anchors a renderer generates for each heading.
 */
@Component
@RequiredArgsConstructor
public class SearchIndexBuilder {

    private static final Pattern FENCE_LINE = Pattern.compile("^ {0,3}(```|~~~).*$", Pattern.MULTILINE);
    private static final Pattern HEADING = Pattern.compile("^ {0,3}#{1,6}[ \\t]+(.+?)[ \\t#]*$");
    private static final Pattern IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern REFERENCE_DEFINITION = Pattern.compile("(?m)^ {0,3}\\[[^\\]]+\\]:.*$");
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern MARKUP = Pattern.compile("[*_`~>#|]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final LinkRewriter linkRewriter;

    public List<SearchIndexEntry> build(String slug, String repository, List<DocumentNode> documents) {
        List<SearchIndexEntry> entries = new ArrayList<>(documents.size());
        for (DocumentNode document : documents) {
            String body = FrontMatter.parse(document.content()).body();
            entries.add(new SearchIndexEntry(
                    linkRewriter.unifiedPath(slug, document.path()),
                    repository,
                    slug,
                    NavigationBuilder.titleOf(document),
                    plainText(body),
                    headingAnchors(body)));
        }
        return entries;
    }

    static String plainText(String markdown) {
        String text = FENCE_LINE.matcher(markdown).replaceAll(" ");
        text = REFERENCE_DEFINITION.matcher(text).replaceAll(" ");
        text = IMAGE.matcher(text).replaceAll("$1");
        text = LINK.matcher(text).replaceAll("$1");
        text = HTML_TAG.matcher(text).replaceAll(" ");
        text = MARKUP.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * GitHub-style anchors: lower case, punctuation dropped, spaces to dashes,
     * repeated headings suffixed with -1, -2 and so on.
     */
    static List<String> headingAnchors(String markdown) {
        List<String> anchors = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        boolean inFence = false;
        for (String line : markdown.split("\\r?\\n")) {
            if (FENCE_LINE.matcher(line).matches()) {
                inFence = !inFence;
                continue;
            }
            if (inFence) {
                continue;
            }
            Matcher heading = HEADING.matcher(line);
            if (!heading.matches()) {
                continue;
            }
            String base = heading.group(1).toLowerCase(Locale.ROOT)
                    .replaceAll("[^\\p{L}\\p{N} _-]", "")
                    .trim()
                    .replace(' ', '-');
            int count = seen.merge(base, 1, Integer::sum);
            anchors.add(count == 1 ? base : base + "-" + (count - 1));
        }
        return anchors;
    }
}
