package com.lshann.index.storage;

import com.lshann.common.BucketNotFoundException;
import com.lshann.common.DataPoint;
import com.lshann.common.LshException;
import com.lshann.common.Signature;
import org.rocksdb.CompressionType;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Durable storage on RocksDB.
 *
 * Key layout (all integers big-endian):
 * <pre>
 *   'P' | index                          -> point, dim x float32
 *   'B' | table | signature | index      -> empty (one key per bucket member)
 *   'M' | name                           -> metadata (point count, table count, layout)
 * </pre>
 * A bucket is the set of keys sharing a {@code 'B' | table | signature} prefix, so
 * {@link #put} is idempotent by construction and an emptied bucket disappears with its
 * last key. The database can be inspected offline with standard RocksDB tooling, or in
 * process through {@link #exportBuckets(int)}.
 */
public final class RocksDbTable implements StorageBackend {
    private static final Logger logger = LoggerFactory.getLogger(RocksDbTable.class);

    private static final byte POINT  = 'P';
    private static final byte BUCKET = 'B';
    private static final byte META   = 'M';

    private static final byte[] META_COUNT  = metaKey("count");
    private static final byte[] META_TABLES = metaKey("tables");
    private static final byte[] META_LAYOUT = metaKey("layout");

    static {
        try {
            RocksDB.loadLibrary();
            logger.info("RocksDB native library loaded.");
        } catch (Throwable t) {
            throw new RuntimeException("Failed to load RocksDB native library", t);
        }
    }

    private final RocksDB db;
    private final Options options;
    private final WriteOptions writeOptions;
    private final String dbPath;
    private final int numTables;
    private int pointCount;
    private volatile boolean closed = false;

    private RocksDbTable(Path dir, int numTables, boolean syncWrites) throws IOException {
        this.dbPath = dir.toString();
        this.numTables = numTables;

        Files.createDirectories(dir);

        this.options = new Options()
                .setCreateIfMissing(true)
                .setWriteBufferSize(16 * 1024 * 1024)
                .setMaxBackgroundJobs(2)
                .setCompressionType(CompressionType.NO_COMPRESSION)
                .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);
        this.writeOptions = new WriteOptions().setSync(syncWrites);

        try {
            this.db = RocksDB.open(options, dbPath);
        } catch (RocksDBException e) {
            writeOptions.close();
            options.close();
            throw new IOException("RocksDB open failed at " + dbPath, e);
        }

        try {
            byte[] tables = db.get(META_TABLES);
            if (tables == null) {
                db.put(writeOptions, META_TABLES, intBytes(numTables));
            } else if (readInt(tables) != numTables) {
                int stored = readInt(tables);
                closeHandles();
                throw LshException.invalidParameter("Database at " + dbPath + " holds "
                        + stored + " tables, requested " + numTables);
            }
            byte[] count = db.get(META_COUNT);
            this.pointCount = count == null ? 0 : readInt(count);
        } catch (RocksDBException e) {
            closeHandles();
            throw new IOException("RocksDB metadata read failed at " + dbPath, e);
        }
        logger.info("RocksDbTable opened at {} (tables={}, points={}, syncWrites={})",
                dbPath, numTables, pointCount, syncWrites);
    }

    /**
     * Opens (or creates) the database under {@code dir}.
     *
     * @throws IOException if the directory or database cannot be opened
     * @throws LshException INVALID_PARAMETER if an existing database has another table count
     */
    public static RocksDbTable open(Path dir, int numTables, boolean syncWrites) throws IOException {
        Objects.requireNonNull(dir, "dir");
        if (numTables <= 0) {
            throw LshException.invalidParameter("n_hash_tables must be > 0, got " + numTables);
        }
        return new RocksDbTable(dir, numTables, syncWrites);
    }

    // ------------------- point store -------------------

    @Override
    public synchronized int appendPoint(DataPoint point) {
        ensureOpen();
        int index = pointCount;
        try (WriteBatch batch = new WriteBatch()) {
            batch.put(pointKey(index), encodePoint(point));
            batch.put(META_COUNT, intBytes(index + 1));
            db.write(writeOptions, batch);
        } catch (RocksDBException e) {
            throw LshException.backendFault("appendPoint failed at " + dbPath, e);
        }
        pointCount = index + 1;
        return index;
    }

    @Override
    public synchronized DataPoint indexToPoint(int pointIndex) {
        ensureOpen();
        try {
            byte[] v = (pointIndex < 0 || pointIndex >= pointCount) ? null : db.get(pointKey(pointIndex));
            if (v == null) {
                throw LshException.backendFault("Unknown point index: " + pointIndex, null);
            }
            return decodePoint(v);
        } catch (RocksDBException e) {
            throw LshException.backendFault("indexToPoint failed for " + pointIndex, e);
        }
    }

    @Override
    public synchronized int pointCount() {
        return pointCount;
    }

    @Override
    public int numTables() {
        return numTables;
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    @Override
    public void increaseStorage(int additional) {
        // RocksDB grows on demand.
        logger.debug("increaseStorage({}) ignored by RocksDbTable", additional);
    }

    // ------------------- buckets -------------------

    @Override
    public synchronized void put(Signature signature, int pointIndex, int tableId) {
        ensureOpen();
        checkTable(tableId);
        try {
            db.put(writeOptions, bucketKey(tableId, signature, pointIndex), new byte[0]);
        } catch (RocksDBException e) {
            throw LshException.backendFault("put failed for table " + tableId, e);
        }
    }

    @Override
    public synchronized Set<Integer> queryBucket(Signature signature, int tableId) throws BucketNotFoundException {
        ensureOpen();
        checkTable(tableId);
        byte[] prefix = bucketPrefix(tableId, signature);
        Set<Integer> members = new TreeSet<>();
        try (RocksIterator it = db.newIterator()) {
            for (it.seek(prefix); it.isValid(); it.next()) {
                byte[] k = it.key();
                if (!isMember(k, prefix)) break;
                members.add(ByteBuffer.wrap(k, prefix.length, Integer.BYTES).getInt());
            }
            it.status();
        } catch (RocksDBException e) {
            throw LshException.backendFault("queryBucket failed for table " + tableId, e);
        }
        if (members.isEmpty()) {
            throw new BucketNotFoundException(signature, tableId);
        }
        return members;
    }

    @Override
    public synchronized void delete(Signature signature, float[] point, int tableId) {
        ensureOpen();
        checkTable(tableId);
        byte[] prefix = bucketPrefix(tableId, signature);
        try (RocksIterator it = db.newIterator();
             WriteBatch batch = new WriteBatch()) {
            for (it.seek(prefix); it.isValid(); it.next()) {
                byte[] k = it.key();
                if (!isMember(k, prefix)) break;
                int idx = ByteBuffer.wrap(k, prefix.length, Integer.BYTES).getInt();
                byte[] stored = db.get(pointKey(idx));
                if (stored != null && decodePoint(stored).sameAs(point)) {
                    batch.delete(k);
                }
            }
            it.status();
            if (batch.count() > 0) {
                db.write(writeOptions, batch);
            }
        } catch (RocksDBException e) {
            throw LshException.backendFault("delete failed for table " + tableId, e);
        }
    }

    /**
     * Full contents of one table, signature to member indices, in key order.
     */
    public synchronized Map<Signature, Set<Integer>> exportBuckets(int tableId) {
        ensureOpen();
        checkTable(tableId);
        byte[] prefix = tablePrefix(tableId);
        Map<Signature, Set<Integer>> out = new LinkedHashMap<>();
        try (RocksIterator it = db.newIterator()) {
            for (it.seek(prefix); it.isValid(); it.next()) {
                byte[] k = it.key();
                if (!startsWith(k, prefix)) break;
                ByteBuffer buf = ByteBuffer.wrap(k, prefix.length, k.length - prefix.length);
                int sigLen = (k.length - prefix.length - Integer.BYTES) / Integer.BYTES;
                Signature sig = Signature.read(buf, sigLen);
                out.computeIfAbsent(sig, s -> new TreeSet<>()).add(buf.getInt());
            }
            it.status();
        } catch (RocksDBException e) {
            throw LshException.backendFault("exportBuckets failed for table " + tableId, e);
        }
        return out;
    }

    @Override
    public synchronized void verifyLayout(String layout) {
        ensureOpen();
        Objects.requireNonNull(layout, "layout");
        byte[] want = layout.getBytes(StandardCharsets.UTF_8);
        try {
            byte[] have = db.get(META_LAYOUT);
            if (have == null) {
                db.put(writeOptions, META_LAYOUT, want);
            } else if (!Arrays.equals(have, want)) {
                throw LshException.invalidParameter("Database at " + dbPath + " was built with layout ["
                        + new String(have, StandardCharsets.UTF_8) + "], requested [" + layout + "]");
            }
        } catch (RocksDBException e) {
            throw LshException.backendFault("verifyLayout failed at " + dbPath, e);
        }
    }

    @Override
    public synchronized String describe() {
        ensureOpen();
        StringBuilder sb = new StringBuilder();
        sb.append("RocksDbTable{path=").append(dbPath)
                .append(", tables=").append(numTables)
                .append(", points=").append(pointCount).append('}');
        for (int t = 0; t < numTables; t++) {
            TableStats stats = new TableStats();
            for (Set<Integer> bucket : exportBuckets(t).values()) {
                stats.addBucket(bucket.size());
            }
            sb.append('\n').append("  ").append(stats.format(t));
        }
        return sb.toString();
    }

    public String getPath() {
        return dbPath;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            logger.warn("RocksDbTable at {} already closed", dbPath);
            return;
        }
        try {
            db.syncWal();
        } catch (RocksDBException e) {
            logger.warn("syncWal failed while closing {}", dbPath, e);
        }
        closeHandles();
        logger.info("RocksDbTable closed at {} (points={})", dbPath, pointCount);
    }

    private void closeHandles() {
        closed = true;
        if (db != null) {
            db.close();
        }
        writeOptions.close();
        options.close();
    }

    private void ensureOpen() {
        if (closed) {
            throw LshException.backendFault("RocksDbTable at " + dbPath + " is closed", null);
        }
    }

    private void checkTable(int tableId) {
        if (tableId < 0 || tableId >= numTables) {
            throw new IllegalArgumentException("Invalid table ID: " + tableId);
        }
    }

    // ------------------- encoding -------------------

    private static byte[] metaKey(String name) {
        byte[] n = name.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(1 + n.length).put(META).put(n).array();
    }

    private static byte[] pointKey(int index) {
        return ByteBuffer.allocate(1 + Integer.BYTES).put(POINT).putInt(index).array();
    }

    private static byte[] tablePrefix(int tableId) {
        return ByteBuffer.allocate(1 + Integer.BYTES).put(BUCKET).putInt(tableId).array();
    }

    private static byte[] bucketPrefix(int tableId, Signature signature) {
        ByteBuffer buf = ByteBuffer.allocate(1 + Integer.BYTES + signature.byteSize());
        buf.put(BUCKET).putInt(tableId);
        signature.writeTo(buf);
        return buf.array();
    }

    private static byte[] bucketKey(int tableId, Signature signature, int pointIndex) {
        ByteBuffer buf = ByteBuffer.allocate(1 + Integer.BYTES + signature.byteSize() + Integer.BYTES);
        buf.put(BUCKET).putInt(tableId);
        signature.writeTo(buf);
        buf.putInt(pointIndex);
        return buf.array();
    }

    /** A bucket member key is exactly the prefix followed by one index. */
    private static boolean isMember(byte[] key, byte[] prefix) {
        return key.length == prefix.length + Integer.BYTES && startsWith(key, prefix);
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) return false;
        return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static byte[] encodePoint(DataPoint p) {
        ByteBuffer buf = ByteBuffer.allocate(p.dimension() * Float.BYTES);
        for (int i = 0; i < p.dimension(); i++) {
            buf.putFloat(p.get(i));
        }
        return buf.array();
    }

    private static DataPoint decodePoint(byte[] bytes) {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        float[] v = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < v.length; i++) {
            v[i] = buf.getFloat();
        }
        return DataPoint.of(v);
    }

    private static byte[] intBytes(int v) {
        return ByteBuffer.allocate(Integer.BYTES).putInt(v).array();
    }

    private static int readInt(byte[] bytes) {
        return ByteBuffer.wrap(bytes).getInt();
    }
}
