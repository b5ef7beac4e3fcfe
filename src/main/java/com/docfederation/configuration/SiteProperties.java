package com.docfederation.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Global chrome of the unified site plus where published artifacts are written.
 */
@Data
public class SiteProperties {

    @NotBlank
    private String name = "Unified Documentation";

    private String url;

    private String description;

    @NotBlank
    private String theme = "material";

    @NotBlank
    private String homePage = "index.md";

    /**
     * Root for rewritten documents, one sub-directory per namespace slug.
     */
    @NotBlank
    private String outputDir;

    /**
     * Unified config artifact. Left blank, the config is only served over HTTP.
     */
    private String configFile;

    @NotEmpty
    private List<String> docExtensions = new ArrayList<>(List.of("md", "markdown", "rst"));

    private List<String> excludedDirs = new ArrayList<>(List.of(".git", "node_modules", "target", "build", "site"));

    /**
     * Documents larger than this are skipped.
     */
    private long maxDocumentBytes = 2 * 1024 * 1024;
}
