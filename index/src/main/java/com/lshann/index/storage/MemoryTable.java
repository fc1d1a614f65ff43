package com.lshann.index.storage;

import com.lshann.common.BucketNotFoundException;
import com.lshann.common.DataPoint;
import com.lshann.common.LshException;
import com.lshann.common.Signature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory storage: one {@code signature -> index set} map per table and one shared
 * growable list of points.
 *
 * Not thread-safe; callers serialize mutations.
 */
public final class MemoryTable implements StorageBackend {

    private final List<Map<Signature, Set<Integer>>> tables;
    private final ArrayList<DataPoint> points = new ArrayList<>();

    public MemoryTable(int numTables) {
        if (numTables <= 0) {
            throw LshException.invalidParameter("n_hash_tables must be > 0, got " + numTables);
        }
        this.tables = new ArrayList<>(numTables);
        for (int t = 0; t < numTables; t++) {
            tables.add(new HashMap<>());
        }
    }

    @Override
    public int appendPoint(DataPoint point) {
        points.add(point);
        return points.size() - 1;
    }

    @Override
    public void put(Signature signature, int pointIndex, int tableId) {
        table(tableId).computeIfAbsent(signature, k -> new HashSet<>()).add(pointIndex);
    }

    @Override
    public Set<Integer> queryBucket(Signature signature, int tableId) throws BucketNotFoundException {
        Set<Integer> bucket = table(tableId).get(signature);
        if (bucket == null) {
            throw new BucketNotFoundException(signature, tableId);
        }
        return Collections.unmodifiableSet(bucket);
    }

    @Override
    public void delete(Signature signature, float[] point, int tableId) {
        Map<Signature, Set<Integer>> table = table(tableId);
        Set<Integer> bucket = table.get(signature);
        if (bucket == null) {
            return;
        }
        Iterator<Integer> it = bucket.iterator();
        while (it.hasNext()) {
            if (points.get(it.next()).sameAs(point)) {
                it.remove();
            }
        }
        if (bucket.isEmpty()) {
            table.remove(signature);
        }
    }

    @Override
    public void increaseStorage(int additional) {
        if (additional > 0) {
            points.ensureCapacity(points.size() + additional);
        }
    }

    @Override
    public DataPoint indexToPoint(int pointIndex) {
        if (pointIndex < 0 || pointIndex >= points.size()) {
            throw LshException.backendFault("Unknown point index: " + pointIndex, null);
        }
        return points.get(pointIndex);
    }

    @Override
    public int pointCount() {
        return points.size();
    }

    @Override
    public int numTables() {
        return tables.size();
    }

    /** Number of non-empty buckets in a table. */
    public int bucketCount(int tableId) {
        return table(tableId).size();
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("MemoryTable{tables=").append(tables.size())
                .append(", points=").append(points.size()).append('}');
        for (int t = 0; t < tables.size(); t++) {
            TableStats stats = new TableStats();
            for (Set<Integer> bucket : tables.get(t).values()) {
                stats.addBucket(bucket.size());
            }
            sb.append('\n').append("  ").append(stats.format(t));
        }
        return sb.toString();
    }

    private Map<Signature, Set<Integer>> table(int tableId) {
        if (tableId < 0 || tableId >= tables.size()) {
            throw new IllegalArgumentException("Invalid table ID: " + tableId);
        }
        return tables.get(tableId);
    }
}
