package com.finlens.backend.enums;

public enum ChunkStatus {
    QUEUED,
    PROCESSING,
    DONE
}
