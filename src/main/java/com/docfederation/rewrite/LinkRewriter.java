package com.docfederation.rewrite;

import com.docfederation.model.docs.DocumentNode;
import com.docfederation.model.docs.LinkKind;
import com.docfederation.model.docs.LinkTarget;
import com.google.common.base.Splitter;
import com.google.common.io.Files;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the relative links of a markdown document into the unified namespace.
 *
 * <p>Handles inline links and images ({@code [text](target "title")},
 * {@code ![alt](<target with spaces>)}) and reference definitions
 * ({@code [ref]: target}). Fenced and indented code blocks and inline code
 * spans are copied verbatim. Non-markdown documents (reStructuredText) are
 * published as they are. For every relative target:
 * <ol>
 *   <li>resolve it against the source file's directory;</li>
 *   <li>if the same repository publishes that file, rewrite to
 *       {@code /{slug}/{path-without-extension}/} keeping query and anchor;</li>
 *   <li>if it uses cross-repository syntax ({@code @slug/path} or a path that
 *       climbs one level above the repository root into a sibling slug),
 *       resolve it against that namespace;</li>
 *   <li>otherwise leave the text untouched and record it as unresolved.</li>
 * </ol>
 *
 * <p>Root-absolute targets are already unified and pass through, which makes
 * rewriting idempotent. The class is stateless and thread-safe.
 */
@Slf4j
public class LinkRewriter {

    private static final Pattern SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*:");
    private static final Pattern FENCE = Pattern.compile("^ {0,3}(`{3,}|~{3,})");
    private static final Pattern LIST_ITEM = Pattern.compile("^ {0,3}([-*+]|\\d{1,9}[.)])([ \t]|$)");
    private static final Set<String> MARKDOWN_EXTENSIONS = Set.of("md", "markdown", "mdown", "mkd");
    private static final Pattern REFERENCE_DEFINITION =
            Pattern.compile("^( {0,3}\\[(?!\\^)[^\\]]+\\]:[ \\t]*)(<[^>]*>|\\S+)(.*)$");
    private static final Splitter PATH_SPLITTER = Splitter.on('/');

    private final Set<String> docExtensions;

    public LinkRewriter(Set<String> docExtensions) {
        Set<String> lower = new HashSet<>();
        docExtensions.forEach(ext -> lower.add(ext.toLowerCase(Locale.ROOT)));
        this.docExtensions = Set.copyOf(lower);
    }

    public DocumentNode rewrite(DocumentNode document, NamespaceMap namespaces) {
        if (!isMarkdown(document.path())) {
            return document.withRewrite(document.rawContent(), List.of());
        }
        List<LinkTarget> links = new ArrayList<>();
        String rewritten = rewriteContent(document.rawContent(), document.path(), namespaces, links);
        long unresolved = links.stream().filter(LinkTarget::isUnresolved).count();
        if (unresolved > 0) {
            log.debug("{}: {} unresolved link(s) in {}", namespaces.currentSlug(), unresolved, document.path());
        }
        return document.withRewrite(rewritten, links);
    }

    /**
     * Unified location of a repository file. Documentation files lose their
     * extension and gain a trailing slash; everything else keeps its name.
     */
    public String unifiedPath(String slug, String repositoryPath) {
        String extension = Files.getFileExtension(repositoryPath).toLowerCase(Locale.ROOT);
        String path = repositoryPath;
        if (docExtensions.contains(extension)) {
            path = path.substring(0, path.length() - extension.length() - 1) + "/";
        }
        return ("/" + slug + "/" + path).replace(" ", "%20");
    }

    String rewriteContent(String content, String sourcePath, NamespaceMap namespaces, List<LinkTarget> links) {
        StringBuilder out = new StringBuilder(content.length() + 64);
        String openFence = null;
        boolean previousBlank = true;
        boolean inIndentedCode = false;
        boolean inList = false;

        int lineStart = 0;
        while (lineStart < content.length()) {
            int newline = content.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? content.length() : newline + 1;
            String line = content.substring(lineStart, lineEnd);
            String bare = stripLineEnding(line);
            boolean blank = bare.isBlank();
            boolean indented = !blank && indentation(bare) >= 4;
            lineStart = lineEnd;

            if (openFence == null && (inIndentedCode ? blank || indented : indented && previousBlank && !inList)) {
                // Indented code block
                inIndentedCode = true;
                previousBlank = blank;
                out.append(line);
                continue;
            }
            inIndentedCode = false;

            Matcher fence = FENCE.matcher(bare);
            if (openFence != null) {
                if (fence.find() && fence.group(1).charAt(0) == openFence.charAt(0)
                        && fence.group(1).length() >= openFence.length()
                        && bare.substring(fence.end()).isBlank()) {
                    openFence = null;
                }
                out.append(line);
            } else if (fence.find()) {
                openFence = fence.group(1);
                out.append(line);
            } else {
                Matcher definition = REFERENCE_DEFINITION.matcher(bare);
                if (definition.matches()) {
                    out.append(definition.group(1))
                            .append(rewriteDestination(definition.group(2), sourcePath, namespaces, links))
                            .append(definition.group(3))
                            .append(line, bare.length(), line.length());
                } else {
                    rewriteInline(line, sourcePath, namespaces, links, out);
                }
            }

            if (LIST_ITEM.matcher(bare).find()) {
                inList = true;
            } else if (!blank && indentation(bare) == 0) {
                inList = false;
            }
            previousBlank = blank;
        }
        return out.toString();
    }

    /**
     * Leading whitespace width, a tab counting as four columns.
     */
    private static int indentation(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += 4 - width % 4;
            } else {
                break;
            }
        }
        return width;
    }

    private static boolean isMarkdown(String path) {
        return MARKDOWN_EXTENSIONS.contains(Files.getFileExtension(path).toLowerCase(Locale.ROOT));
    }

    private void rewriteInline(String line, String sourcePath, NamespaceMap namespaces,
                               List<LinkTarget> links, StringBuilder out) {
        int i = 0;
        int n = line.length();
        while (i < n) {
            char c = line.charAt(i);

            if (c == '\\' && i + 1 < n) {
                out.append(c).append(line.charAt(i + 1));
                i += 2;
                continue;
            }

            if (c == '`') {
                int run = countRun(line, i, '`');
                int close = findClosingRun(line, i + run, run);
                if (close < 0) {
                    out.append(line, i, i + run);
                    i += run;
                } else {
                    out.append(line, i, close + run);
                    i = close + run;
                }
                continue;
            }

            if (c == ']' && i + 1 < n && line.charAt(i + 1) == '(') {
                out.append("](");
                int start = i + 2;
                while (start < n && (line.charAt(start) == ' ' || line.charAt(start) == '\t')) {
                    out.append(line.charAt(start));
                    start++;
                }
                int end = destinationEnd(line, start);
                if (end > start) {
                    out.append(rewriteDestination(line.substring(start, end), sourcePath, namespaces, links));
                }
                i = end;
                continue;
            }

            out.append(c);
            i++;
        }
    }

    /**
     * End (exclusive) of a link destination starting at {@code start}: either
     * a {@code <...>} block, or a run without whitespace and with balanced parentheses.
     */
    private static int destinationEnd(String line, int start) {
        int n = line.length();
        if (start < n && line.charAt(start) == '<') {
            int close = line.indexOf('>', start + 1);
            return close < 0 ? start : close + 1;
        }
        int depth = 0;
        int i = start;
        while (i < n) {
            char c = line.charAt(i);
            if (c == '\\' && i + 1 < n) {
                i += 2;
                continue;
            }
            if (Character.isWhitespace(c)) {
                break;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    break;
                }
                depth--;
            }
            i++;
        }
        return i;
    }

    private String rewriteDestination(String destination, String sourcePath, NamespaceMap namespaces,
                                      List<LinkTarget> links) {
        boolean angled = destination.startsWith("<") && destination.endsWith(">");
        String target = angled ? destination.substring(1, destination.length() - 1) : destination;

        String replacement = resolve(target, sourcePath, namespaces, links);
        if (replacement == null) {
            return destination;
        }
        return angled ? "<" + replacement + ">" : replacement;
    }

    /**
     * @return the rewritten target, or null to keep the original text
     */
    String resolve(String target, String sourcePath, NamespaceMap namespaces, List<LinkTarget> links) {
        if (target.isEmpty() || target.startsWith("#")) {
            return null;
        }
        if (target.startsWith("//") || SCHEME.matcher(target).find()) {
            links.add(LinkTarget.external(target));
            return null;
        }

        String path = target;
        String anchor = null;
        String query = null;
        int hash = path.indexOf('#');
        if (hash >= 0) {
            anchor = path.substring(hash + 1);
            path = path.substring(0, hash);
        }
        int question = path.indexOf('?');
        if (question >= 0) {
            query = path.substring(question + 1);
            path = path.substring(0, question);
        }
        String suffix = (query != null ? "?" + query : "") + (anchor != null ? "#" + anchor : "");
        String decoded = path.replace("%20", " ");

        if (decoded.startsWith("/")) {
            links.add(classifyRootAbsolute(target, path, anchor, namespaces));
            return null;
        }

        if (decoded.startsWith("@")) {
            int slash = decoded.indexOf('/');
            String slug = slash < 0 ? decoded.substring(1) : decoded.substring(1, slash);
            String rest = slash < 0 ? "" : decoded.substring(slash + 1);
            Resolved resolved = normalize(List.of(), rest);
            if (resolved.escapes() > 0) {
                links.add(LinkTarget.unresolved(target));
                return null;
            }
            return resolveIn(target, slug, resolved.path(), anchor, suffix, namespaces, links);
        }

        String sourceDir = sourcePath.contains("/") ? sourcePath.substring(0, sourcePath.lastIndexOf('/')) : "";
        Resolved resolved = normalize(sourceDir.isEmpty() ? List.of() : PATH_SPLITTER.splitToList(sourceDir),
                decoded);
        if (resolved.escapes() > 1) {
            links.add(LinkTarget.unresolved(target));
            return null;
        }
        if (resolved.escapes() == 1) {
            // Sibling checkout style: ../other-repo/docs/page.md
            int slash = resolved.path().indexOf('/');
            String slug = slash < 0 ? resolved.path() : resolved.path().substring(0, slash);
            String rest = slash < 0 ? "" : resolved.path().substring(slash + 1);
            if (slug.isEmpty()) {
                links.add(LinkTarget.unresolved(target));
                return null;
            }
            return resolveIn(target, slug, rest, anchor, suffix, namespaces, links);
        }
        return resolveIn(target, namespaces.currentSlug(), resolved.path(), anchor, suffix, namespaces, links);
    }

    private String resolveIn(String original, String slug, String path, String anchor, String suffix,
                             NamespaceMap namespaces, List<LinkTarget> links) {
        if (!namespaces.isKnownSlug(slug)) {
            links.add(LinkTarget.unresolved(original));
            return null;
        }
        String file = lookup(namespaces.filesOf(slug), path);
        if (file == null) {
            links.add(LinkTarget.unresolved(original));
            return null;
        }
        String unified = unifiedPath(slug, file);
        LinkKind kind = slug.equals(namespaces.currentSlug()) ? LinkKind.INTERNAL_SAME_REPO : LinkKind.CROSS_REPO;
        links.add(new LinkTarget(original, unified, emptyToNull(anchor), kind, slug));
        return unified + suffix;
    }

    private LinkTarget classifyRootAbsolute(String original, String path, String anchor, NamespaceMap namespaces) {
        List<String> segments = PATH_SPLITTER.omitEmptyStrings().splitToList(path);
        String slug = segments.isEmpty() ? "" : segments.get(0);
        if (slug.equals(namespaces.currentSlug())) {
            return new LinkTarget(original, path, emptyToNull(anchor), LinkKind.INTERNAL_SAME_REPO, slug);
        }
        if (namespaces.isKnownSlug(slug)) {
            return new LinkTarget(original, path, emptyToNull(anchor), LinkKind.CROSS_REPO, slug);
        }
        return LinkTarget.external(original);
    }

    /**
     * Finds the file a repository path points to. A directory resolves to its
     * index page.
     */
    private static String lookup(Set<String> files, String path) {
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        if (!trimmed.isEmpty() && !path.endsWith("/") && files.contains(trimmed)) {
            return trimmed;
        }
        String prefix = trimmed.isEmpty() ? "" : trimmed + "/";
        for (String index : List.of("index.md", "README.md", "readme.md")) {
            if (files.contains(prefix + index)) {
                return prefix + index;
            }
        }
        return null;
    }

    /**
     * Applies {@code relative} to {@code base}. Climbing above the root is
     * counted rather than rejected so sibling-repository links can be detected.
     */
    private static Resolved normalize(List<String> base, String relative) {
        Deque<String> stack = new ArrayDeque<>(base);
        int escapes = 0;
        boolean trailingSlash = relative.endsWith("/");
        for (String segment : PATH_SPLITTER.split(relative)) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (stack.isEmpty()) {
                    escapes++;
                } else {
                    stack.removeLast();
                }
                continue;
            }
            stack.addLast(segment);
        }
        String joined = String.join("/", stack);
        if (trailingSlash && !joined.isEmpty()) {
            joined = joined + "/";
        }
        return new Resolved(joined, escapes);
    }

    private record Resolved(String path, int escapes) {
    }

    private static int countRun(String line, int from, char c) {
        int i = from;
        while (i < line.length() && line.charAt(i) == c) {
            i++;
        }
        return i - from;
    }

    private static int findClosingRun(String line, int from, int length) {
        int i = from;
        while (i < line.length()) {
            if (line.charAt(i) == '`') {
                int run = countRun(line, i, '`');
                if (run == length) {
                    return i;
                }
                i += run;
            } else {
                i++;
            }
        }
        return -1;
    }

    private static String stripLineEnding(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
