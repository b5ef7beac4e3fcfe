package com.docfederation.configuration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class SyncProperties {

    /**
     * Repositories synced in parallel. Each repository still runs one job at a time.
     */
    @Min(1)
    @Max(64)
    private int maxConcurrentSyncs = 4;

    /**
     * Hard wall-clock limit for a whole job (fetch + rewrite + index + commit).
     */
    @NotNull
    private Duration jobDeadline = Duration.ofMinutes(10);

    /**
     * Transport timeout for a single clone or fetch attempt.
     */
    @NotNull
    private Duration fetchTimeout = Duration.ofMinutes(2);

    /**
     * Depth of the first clone. 0 clones full history.
     */
    @Min(0)
    private int cloneDepth = 1;

    private boolean reconcileEnabled = false;

    @NotNull
    private Duration reconcileInterval = Duration.ofHours(1);
}
