package com.docfederation.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GitHubProperties {

    @NotBlank
    private String baseUrl = "https://github.com";

    /**
     * Clone URL with {baseUrl}, {owner} and {name} placeholders.
     * Point it at file:// remotes for local mirrors.
     */
    @NotBlank
    private String cloneUrlTemplate = "{baseUrl}/{owner}/{name}.git";

    /**
     * Optional token for private repositories. Sent as the password of the
     * x-access-token user.
     */
    private String token;

    /**
     * Shared secret for X-Hub-Signature-256 verification.
     */
    private String webhookSecret;

    public String cloneUrl(String owner, String name) {
        return cloneUrlTemplate
                .replace("{baseUrl}", baseUrl)
                .replace("{owner}", owner)
                .replace("{name}", name);
    }
}
