package com.docfederation.service.git;

import com.docfederation.config.GlobalRetryConfig;
import com.docfederation.configuration.AppProperties;
import com.docfederation.exception.FetchException;
import com.docfederation.exception.FetchTimeoutException;
import com.docfederation.exception.NetworkException;
import com.docfederation.exception.RepositoryGoneException;
import com.docfederation.exception.RevisionNotFoundException;
import com.docfederation.exception.SyncDeadlineExceededException;
import com.docfederation.exception.WorkingCopyException;
import com.docfederation.model.enrollment.RepositoryEnrollment;
import com.docfederation.model.enrollment.RepositoryKey;
import com.docfederation.model.sync.SyncJob;
import com.docfederation.util.Deadline;
import com.docfederation.util.GitInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.FetchCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.TransportCommand;
import org.eclipse.jgit.api.errors.CanceledException;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.InvalidRemoteException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.errors.NoRemoteRepositoryException;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * {@link GitFetcher} on top of JGit. One working copy per repository lives
 * under {@code app.workspace-dir/{owner}/{name}}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JGitFetcher implements GitFetcher {

    private static final String REMOTE = "origin";

    private final AppProperties appProperties;
    private final GlobalRetryConfig retryConfig;

    @Override
    public WorkingTree fetch(RepositoryEnrollment enrollment, String revision, Deadline deadline) {
        GitInputValidator.validateRevision(revision);
        GitInputValidator.validateBranchName(enrollment.getDefaultBranch());

        RepositoryKey key = enrollment.key();
        int maxAttempts = Math.max(1, retryConfig.getMaxAttempts());

        for (int attempt = 1; ; attempt++) {
            deadline.check("fetch");
            try {
                return fetchOnce(enrollment, revision, deadline);
            } catch (FetchException e) {
                if (deadline.isExpired()) {
                    throw new SyncDeadlineExceededException("fetch");
                }
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                long backoff = retryConfig.backoffFor(attempt);
                if (deadline.remaining().toMillis() <= backoff) {
                    log.warn("Not retrying {} ({}): deadline too close", key, e.getMessage());
                    throw e;
                }
                log.warn("Fetch attempt {}/{} for {} failed ({}), retrying in {} ms",
                        attempt, maxAttempts, key, e.getMessage(), backoff);
                sleep(backoff);
            }
        }
    }

    @Override
    public void discard(RepositoryKey repository) {
        File dir = workingCopyDir(repository);
        if (dir.exists()) {
            log.info("Discarding working copy of {}", repository);
            FileSystemUtils.deleteRecursively(dir);
        }
    }

    File workingCopyDir(RepositoryKey key) {
        return Path.of(appProperties.getWorkspaceDir(), key.owner(), key.name()).toFile();
    }

    private WorkingTree fetchOnce(RepositoryEnrollment enrollment, String revision, Deadline deadline) {
        RepositoryKey key = enrollment.key();
        String branch = enrollment.getDefaultBranch();
        File destination = workingCopyDir(key);

        Git git = null;
        try {
            git = openExisting(destination);
            if (git == null) {
                git = cloneInto(key, branch, destination, deadline);
            } else {
                fetchBranch(git, key, branch, false, deadline);
            }

            ObjectId commit = resolve(git.getRepository(), revision, branch);
            if (commit == null && !SyncJob.LATEST.equals(revision) && isShallow(destination)) {
                // Older commits live below the shallow boundary
                log.info("{} not in shallow history of {}, deepening", revision, key);
                fetchBranch(git, key, branch, true, deadline);
                commit = resolve(git.getRepository(), revision, branch);
            }
            if (commit == null) {
                throw new RevisionNotFoundException(key.fullName(),
                        SyncJob.LATEST.equals(revision) ? "refs/heads/" + branch : revision, null);
            }

            git.checkout().setName(commit.getName()).setForced(true).call();
            git.clean().setCleanDirectories(true).setForce(true).call();

            log.info("Checked out {} at {}", key, commit.getName());
            return new WorkingTree(key, destination.toPath(), commit.getName());

        } catch (GitAPIException e) {
            throw classify(key, e);
        } catch (JGitInternalException e) {
            throw new WorkingCopyException("Git operation failed for " + key + ": " + e.getMessage(), e);
        } finally {
            if (git != null) git.close();
        }
    }

    private Git openExisting(File destination) {
        if (!new File(destination, ".git").exists()) {
            if (destination.exists()) {
                FileSystemUtils.deleteRecursively(destination);
            }
            return null;
        }
        try {
            return Git.open(destination);
        } catch (RepositoryNotFoundException e) {
            log.warn("Working copy at {} is unusable, re-cloning", destination);
            FileSystemUtils.deleteRecursively(destination);
            return null;
        } catch (IOException e) {
            throw new WorkingCopyException("Cannot open working copy " + destination, e);
        }
    }

    private Git cloneInto(RepositoryKey key, String branch, File destination, Deadline deadline)
            throws GitAPIException {
        destination.getParentFile().mkdirs();
        String url = appProperties.getGithub().cloneUrl(key.owner(), key.name());
        log.info("Cloning {} (branch {}) into {}", key, branch, destination);

        CloneCommand clone = Git.cloneRepository()
                .setURI(url)
                .setDirectory(destination)
                .setBranchesToClone(List.of("refs/heads/" + branch))
                .setNoCheckout(true);
        int depth = appProperties.getSync().getCloneDepth();
        if (depth > 0) {
            clone.setDepth(depth);
        }
        configureTransport(clone, deadline);
        try {
            return clone.call();
        } catch (GitAPIException | RuntimeException e) {
            FileSystemUtils.deleteRecursively(destination);
            throw e;
        }
    }

    private void fetchBranch(Git git, RepositoryKey key, String branch, boolean unshallow, Deadline deadline)
            throws GitAPIException {
        log.debug("Fetching {} for {}", branch, key);
        FetchCommand fetch = git.fetch()
                .setRemote(REMOTE)
                .setRefSpecs(new RefSpec("+refs/heads/" + branch + ":refs/remotes/" + REMOTE + "/" + branch))
                .setRemoveDeletedRefs(true);
        if (unshallow) {
            fetch.setUnshallow(true);
        }
        configureTransport(fetch, deadline);
        fetch.call();
    }

    private void configureTransport(TransportCommand<?, ?> command, Deadline deadline) {
        long timeoutSeconds = Math.min(appProperties.getSync().getFetchTimeout().toSeconds(),
                deadline.remaining().toSeconds());
        command.setTimeout((int) Math.max(1, timeoutSeconds));
        String token = appProperties.getGithub().getToken();
        if (token != null && !token.isBlank()) {
            command.setCredentialsProvider(new UsernamePasswordCredentialsProvider("x-access-token", token));
        }
        if (command instanceof FetchCommand fetch) {
            fetch.setProgressMonitor(new DeadlineProgressMonitor(deadline));
        } else if (command instanceof CloneCommand clone) {
            clone.setProgressMonitor(new DeadlineProgressMonitor(deadline));
        }
    }

    private ObjectId resolve(Repository repository, String revision, String branch) {
        String expression = SyncJob.LATEST.equals(revision)
                ? "refs/remotes/" + REMOTE + "/" + branch
                : revision;
        try {
            return repository.resolve(expression + "^{commit}");
        } catch (RevisionSyntaxException | IOException e) {
            log.debug("Cannot resolve {}: {}", expression, e.getMessage());
            return null;
        }
    }

    private boolean isShallow(File destination) {
        return Files.exists(destination.toPath().resolve(".git").resolve("shallow"));
    }

    /**
     * Maps a JGit failure onto the fetch error taxonomy.
     */
    FetchException classify(RepositoryKey key, GitAPIException e) {
        String repository = key.fullName();
        if (e instanceof CanceledException) {
            return new FetchTimeoutException("Fetch of " + repository + " was cancelled", e);
        }
        if (e instanceof InvalidRemoteException || hasCause(e, NoRemoteRepositoryException.class)) {
            return new RepositoryGoneException("Remote " + repository + " no longer exists", e);
        }

        String message = allMessages(e);
        if (message.contains("not authorized") || message.contains("authentication")
                || message.contains("repository not found")) {
            return new RepositoryGoneException("Remote " + repository + " is gone or access was revoked", e);
        }
        if (message.contains("remote does not have") || message.contains("remote branch")) {
            return new RevisionNotFoundException(repository, "requested ref", e);
        }
        if (hasCause(e, SocketTimeoutException.class) || hasCause(e, InterruptedIOException.class)
                || message.contains("timeout") || message.contains("timed out")) {
            return new FetchTimeoutException("Fetch of " + repository + " timed out", e);
        }
        if (e instanceof org.eclipse.jgit.api.errors.TransportException
                || hasCause(e, UnknownHostException.class) || hasCause(e, IOException.class)) {
            return new NetworkException("Transport failure for " + repository + ": " + e.getMessage(), e);
        }
        return new WorkingCopyException("Git operation failed for " + repository + ": " + e.getMessage(), e);
    }

    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static String allMessages(Throwable e) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null) {
                sb.append(t.getMessage()).append(' ');
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchTimeoutException("Interrupted while waiting to retry", e);
        }
    }
}
