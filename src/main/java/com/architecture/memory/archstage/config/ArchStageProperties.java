package com.architecture.memory.archstage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from the {@code archstage.*} keys of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "archstage")
public class ArchStageProperties {

    /**
     * Directory holding model/ and changesets/.
     */
    private String modelRoot = ".";

    /**
     * How long a computed projection may be served from cache.
     */
    private Duration projectionCacheTtl = Duration.ofMinutes(5);

    /**
     * Discarded changesets older than this are purged by the cleanup scheduler.
     */
    private Duration changesetRetention = Duration.ofDays(7);

    /**
     * How often the cleanup scheduler runs.
     */
    private long cleanupIntervalMs = 3_600_000;

    private String modelName = "architecture-model";
}
