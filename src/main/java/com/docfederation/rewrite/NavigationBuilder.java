package com.docfederation.rewrite;

import com.docfederation.model.docs.DocumentNode;
import com.docfederation.model.docs.NavigationEntry;
import com.docfederation.model.docs.NavigationFragment;
import com.google.common.io.Files;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a repository's navigation tree from its directory layout and
 * front matter.
 *
 * Within a directory the index page comes first, then pages by
 * {@code nav_order} and path, then sub-directories as sections in name order.
 * Pages with {@code nav_exclude: true} are left out. Titles come from
 * front-matter {@code title}, the first level-one heading, or the file name.
 */
public class NavigationBuilder {

    private static final Pattern HEADING = Pattern.compile("^#[ \\t]+(.+?)[ \\t#]*$", Pattern.MULTILINE);

    private final LinkRewriter linkRewriter;

    public NavigationBuilder(LinkRewriter linkRewriter) {
        this.linkRewriter = linkRewriter;
    }

    public NavigationFragment build(String slug, String repository, String revision, List<DocumentNode> documents) {
        Directory root = new Directory("");
        String rootTitle = null;

        for (DocumentNode document : documents) {
            FrontMatter frontMatter = FrontMatter.parse(document.content());
            if (frontMatter.flag("nav_exclude")) {
                continue;
            }
            boolean index = isIndex(document.path());
            String title = titleOf(document.path(), frontMatter, index);
            Integer order = frontMatter.integer("nav_order");
            Page page = new Page(document.path(), title, index, order == null ? Integer.MAX_VALUE : order,
                    NavigationEntry.page(title, linkRewriter.unifiedPath(slug, document.path()),
                            slug + "/" + document.path()));

            if (index && !document.path().contains("/")) {
                rootTitle = rootTitle == null ? frontMatter.string("title") : rootTitle;
            }
            root.add(document.path(), page);
        }

        String title = rootTitle != null ? rootTitle : humanize(repository.substring(repository.indexOf('/') + 1));
        return new NavigationFragment(slug, repository, title, revision, root.entries());
    }

    /**
     * Display title of a document, as used in navigation and search results.
     */
    public static String titleOf(DocumentNode document) {
        return titleOf(document.path(), FrontMatter.parse(document.content()), isIndex(document.path()));
    }

    static String titleOf(String path, FrontMatter frontMatter, boolean index) {
        String title = frontMatter.string("title");
        if (title != null && !title.isEmpty()) {
            return title;
        }
        Matcher heading = HEADING.matcher(stripFences(frontMatter.body()));
        if (heading.find()) {
            return heading.group(1).trim();
        }
        if (index) {
            return "Overview";
        }
        return humanize(Files.getNameWithoutExtension(path));
    }

    static String humanize(String name) {
        String words = name.replaceAll("[-_]+", " ").trim();
        if (words.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    private static boolean isIndex(String path) {
        String name = Files.getNameWithoutExtension(path).toLowerCase(Locale.ROOT);
        return name.equals("index") || name.equals("readme");
    }

    private static String stripFences(String body) {
        return body.replaceAll("(?ms)^ {0,3}(```|~~~).*?^ {0,3}\\1[^\\n]*$", "");
    }

    private record Page(String path, String title, boolean index, int order, NavigationEntry entry) {
    }

    private static final class Directory {

        private static final Comparator<Page> PAGE_ORDER = Comparator
                .comparing((Page p) -> !p.index())
                .thenComparingInt(Page::order)
                .thenComparing(Page::path);

        private final String name;
        private final List<Page> pages = new ArrayList<>();
        private final Map<String, Directory> children = new TreeMap<>();

        private Directory(String name) {
            this.name = name;
        }

        void add(String relativePath, Page page) {
            int slash = relativePath.indexOf('/');
            if (slash < 0) {
                pages.add(page);
                return;
            }
            String child = relativePath.substring(0, slash);
            children.computeIfAbsent(child, Directory::new).add(relativePath.substring(slash + 1), page);
        }

        List<NavigationEntry> entries() {
            List<NavigationEntry> entries = new ArrayList<>();
            pages.stream().sorted(PAGE_ORDER).forEach(page -> entries.add(page.entry()));
            for (Directory child : children.values()) {
                List<NavigationEntry> childEntries = child.entries();
                if (!childEntries.isEmpty()) {
                    entries.add(NavigationEntry.section(humanize(child.name), childEntries));
                }
            }
            return entries;
        }
    }
}
