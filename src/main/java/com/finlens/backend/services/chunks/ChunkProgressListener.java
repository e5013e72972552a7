package com.finlens.backend.services.chunks;

/**
 * Receives queued/processing/done transitions per chunk. Called from worker threads; implementations must be
 * thread-safe.
 */
@FunctionalInterface
public interface ChunkProgressListener {

    ChunkProgressListener NONE = progress -> { };

    void onProgress(ChunkProgress progress);
}
