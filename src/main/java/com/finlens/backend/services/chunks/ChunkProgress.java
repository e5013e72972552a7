package com.finlens.backend.services.chunks;

import com.finlens.backend.enums.ChunkStatus;

public record ChunkProgress(int chunkIndex, int totalChunks, ChunkStatus status, int rows) {
}
