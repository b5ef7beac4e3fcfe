package com.docfederation.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class WebhookProperties {

    /**
     * How long an (owner, name, revision) delivery is remembered for deduplication.
     */
    @NotNull
    private Duration dedupWindow = Duration.ofMinutes(10);

    @Min(1)
    private long dedupMaxEntries = 10_000;

    /**
     * Acknowledge pushes that touch no documentation file without syncing.
     */
    private boolean requireDocChanges = false;
}
