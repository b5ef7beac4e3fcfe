package com.docfederation.util;

import com.docfederation.model.sync.SyncJob;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validates repository identifiers, branches and revisions before they reach
 * JGit, the workspace layout or a clone URL.
 *
 * Owner and name end up as directory names under the workspace and as path
 * segments of the clone URL, so anything that could climb out of either
 * ("..", slashes, control characters) is rejected.
 */
@Slf4j
public final class GitInputValidator {

    private static final Pattern REPOSITORY_PART = Pattern.compile("^[A-Za-z0-9_.-]{1,100}$");
    private static final Pattern BRANCH = Pattern.compile("^[A-Za-z0-9/_.-]+$");
    private static final Pattern COMMIT_HASH = Pattern.compile("^[a-fA-F0-9]{4,64}$");

    private GitInputValidator() {
    }

    /**
     * Validates one half of an {@code owner/name} pair.
     *
     * @param label "owner" or "name", used in the error message
     */
    public static void validateRepositoryPart(String label, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Repository " + label + " cannot be null or blank");
        }
        if (!REPOSITORY_PART.matcher(value).matches() || value.startsWith(".") || value.contains("..")) {
            log.warn("⚠️ SECURITY: Rejected repository {}: {}", label, sanitizeForLogging(value));
            throw new IllegalArgumentException("Invalid repository " + label + ": " + sanitizeForLogging(value));
        }
    }

    /**
     * Allowed characters: a-z A-Z 0-9 / _ . -
     * plus the git-check-ref-format rules that matter for branch heads.
     */
    public static void validateBranchName(String branchName) {
        if (branchName == null || branchName.isBlank()) {
            throw new IllegalArgumentException("Branch name cannot be null or blank");
        }
        if (branchName.length() > 200) {
            throw new IllegalArgumentException("Branch name too long (max 200 characters): " + branchName.length());
        }
        if (!BRANCH.matcher(branchName).matches()) {
            log.warn("⚠️ SECURITY: Rejected branch name: {}", sanitizeForLogging(branchName));
            throw new IllegalArgumentException(
                    "Invalid branch name. Only alphanumeric characters, dash, underscore, slash, and dot are allowed. "
                            + "Received: " + sanitizeForLogging(branchName));
        }
        if (branchName.startsWith("/") || branchName.endsWith("/")) {
            throw new IllegalArgumentException("Branch name cannot start or end with '/': " + branchName);
        }
        if (branchName.startsWith(".") || branchName.endsWith(".") || branchName.contains("..")) {
            throw new IllegalArgumentException("Branch name has an invalid '.' sequence: " + branchName);
        }
        if (branchName.contains("//")) {
            throw new IllegalArgumentException("Branch name cannot contain consecutive slashes '//': " + branchName);
        }
        if (branchName.endsWith(".lock")) {
            throw new IllegalArgumentException("Branch name cannot end with '.lock': " + branchName);
        }
    }

    /**
     * A sync target is either a 4-64 character hex commit hash or {@code latest}.
     */
    public static void validateRevision(String revision) {
        if (revision == null || revision.isBlank()) {
            throw new IllegalArgumentException("Revision cannot be null or blank");
        }
        if (SyncJob.LATEST.equals(revision)) {
            return;
        }
        if (!COMMIT_HASH.matcher(revision).matches()) {
            log.warn("⚠️ SECURITY: Rejected invalid revision: {}", sanitizeForLogging(revision));
            throw new IllegalArgumentException("Invalid revision. Must be 'latest' or 4-64 hexadecimal characters.");
        }
    }

    static String sanitizeForLogging(String input) {
        if (input == null) return "null";

        String sanitized = input.length() > 100 ? input.substring(0, 100) + "..." : input;

        return sanitized
                .replaceAll("[\\r\\n]", " ")
                .replaceAll("[;|&$`<>(){}\\[\\]\\\\]", "?");
    }
}
