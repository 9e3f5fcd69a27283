package com.trustgate.guard.quota;

/**
 * Read-side thresholds. Process-wide and immutable; they apply uniformly to
 * every session.
 *
 * @param maxReadFileBytes  single-file read cap (also bounds a line slice)
 * @param maxBatchFileBytes per-file cap inside a batch read
 * @param maxBatchFiles     paths processed per batch read
 * @param maxGlobResults    entries returned per listing or content search
 */
public record QuotaLimits(
        long maxReadFileBytes,
        long maxBatchFileBytes,
        int  maxBatchFiles,
        int  maxGlobResults) {

    public static final QuotaLimits DEFAULTS = new QuotaLimits(1_048_576, 1_048_576, 100, 1_000);

    public QuotaLimits {
        if (maxReadFileBytes < 1 || maxBatchFileBytes < 1 || maxBatchFiles < 1 || maxGlobResults < 1) {
            throw new IllegalArgumentException("Quota limits must be positive");
        }
    }
}
