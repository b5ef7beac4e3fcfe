package com.docfederation.service.git;

import com.docfederation.model.enrollment.RepositoryKey;

import java.nio.file.Path;

/**
 * A working copy checked out at an exact commit.
 *
 * @param revision full commit hash, never "latest"
 */
public record WorkingTree(RepositoryKey repository, Path root, String revision) {
}
