package com.lshann.index.storage;

import java.util.Locale;

/**
 * Occupancy accumulator used by {@link StorageBackend#describe()} implementations.
 */
final class TableStats {
    private int buckets;
    private long entries;
    private int min = Integer.MAX_VALUE;
    private int max;

    void addBucket(int size) {
        buckets++;
        entries += size;
        min = Math.min(min, size);
        max = Math.max(max, size);
    }

    String format(int tableId) {
        if (buckets == 0) {
            return String.format(Locale.ROOT, "table %d: empty", tableId);
        }
        return String.format(Locale.ROOT,
                "table %d: buckets=%d, entries=%d, bucket size min=%d avg=%.2f max=%d",
                tableId, buckets, entries, min, (double) entries / buckets, max);
    }
}
