package com.docfederation.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @NotBlank(message = "Workspace directory path is required")
    private String workspaceDir;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GitHubProperties github = new GitHubProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SyncProperties sync = new SyncProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private WebhookProperties webhook = new WebhookProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SiteProperties site = new SiteProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AccessProperties access = new AccessProperties();
}
