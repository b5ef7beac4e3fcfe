package com.docfederation.service.git;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.revwalk.RevCommit;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Builds throw-away upstream repositories on the local file system.
 */
public final class GitRemotes {

    private GitRemotes() {
    }

    /**
     * Root the test profile's clone URL template points at.
     */
    public static Path sharedRoot() {
        return Path.of(System.getProperty("java.io.tmpdir"), "docfed-test-remotes");
    }

    public static Path create(Path root, String owner, String name) {
        Path dir = root.resolve(owner).resolve(name);
        FileSystemUtils.deleteRecursively(dir.toFile());
        try {
            Files.createDirectories(dir);
            Git.init().setDirectory(dir.toFile()).setInitialBranch("main").call().close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (GitAPIException e) {
            throw new IllegalStateException(e);
        }
        return dir;
    }

    /**
     * Writes {@code files} into the repository and commits them on the current branch.
     *
     * @return the new commit id
     */
    public static String commit(Path repository, Map<String, String> files) {
        try (Git git = Git.open(repository.toFile())) {
            for (Map.Entry<String, String> file : files.entrySet()) {
                Path target = repository.resolve(file.getKey());
                Files.createDirectories(target.getParent());
                Files.writeString(target, file.getValue(), StandardCharsets.UTF_8);
            }
            git.add().addFilepattern(".").call();
            RevCommit commit = git.commit()
                    .setMessage("update " + String.join(", ", files.keySet()))
                    .setAuthor("Docs Bot", "docs@example.com")
                    .setCommitter("Docs Bot", "docs@example.com")
                    .setSign(false)
                    .call();
            return commit.getName();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (GitAPIException e) {
            throw new IllegalStateException(e);
        }
    }

    public static void delete(Path repository) {
        FileSystemUtils.deleteRecursively(repository.toFile());
    }
}
