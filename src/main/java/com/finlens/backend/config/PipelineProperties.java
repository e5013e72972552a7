package com.finlens.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Chunked processing limits.
 *
 * Example:
 * finlens.pipeline.chunk-size=1000
 * finlens.pipeline.max-rows=10000
 * finlens.pipeline.max-workers=4
 */
@Data
@ConfigurationProperties(prefix = "finlens.pipeline")
public class PipelineProperties {

    /**
     * Rows per chunk handed to a single worker.
     */
    private int chunkSize = 1000;

    /**
     * Hard cap on rows per batch. Larger batches are rejected, never truncated.
     */
    private int maxRows = 10000;

    /**
     * Concurrent chunk workers.
     */
    private int maxWorkers = 4;
}
