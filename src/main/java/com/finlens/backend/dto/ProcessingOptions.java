package com.finlens.backend.dto;

import java.util.concurrent.atomic.AtomicBoolean;

import com.finlens.backend.services.chunks.ChunkProgressListener;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ProcessingOptions {

    /**
     * ISO code to convert every amount into; null keeps each transaction's own currency.
     */
    private final String targetCurrency;

    @Builder.Default
    private final ChunkProgressListener listener = ChunkProgressListener.NONE;

    /**
     * Set to true to stop before the next chunk starts.
     */
    @Builder.Default
    private final AtomicBoolean cancellation = new AtomicBoolean(false);

    public static ProcessingOptions defaults() {
        return ProcessingOptions.builder().build();
    }

    public boolean isCancelled() {
        return cancellation.get();
    }
}
