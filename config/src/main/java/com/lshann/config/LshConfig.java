package com.lshann.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Index configuration.
 *
 * - Loaded from JSON via {@link #load(String, boolean)}.
 * - Cached per absolute/real path.
 * - Nested blocks: l2, mips, storage.
 *
 * Only upper bounds are clamped here. Semantic validation (zero dimension, bucket width,
 * MIPS bounds) belongs to the hash families, which reject bad values at construction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LshConfig {

    static final int MAX_TABLES      = 1024;
    static final int MAX_PROJECTIONS = 4096;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Per-path cache for loaded configs. */
    private static final ConcurrentMap<String, LshConfig> configCache = new ConcurrentHashMap<>();

    /* ======================== Top-level fields ======================== */

    @JsonProperty("family")
    private HashFamilyType family = HashFamilyType.SRP;

    @JsonProperty("nProjections")
    private int nProjections = 8;

    @JsonProperty("nHashTables")
    private int nHashTables = 10;

    @JsonProperty("dim")
    private int dim = 0;

    /** 0 = random seeding. */
    @JsonProperty("seed")
    private long seed = 0L;

    @JsonProperty("metricsEnabled")
    private boolean metricsEnabled = true;

    @JsonProperty("l2")
    private L2Config l2 = new L2Config();

    @JsonProperty("mips")
    private MipsConfig mips = new MipsConfig();

    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    /* ======================== Static loading API ======================== */

    public static LshConfig load(String path, boolean refresh) throws ConfigLoadException {
        Objects.requireNonNull(path, "Config path cannot be null");
        String key;
        try {
            Path p = Paths.get(path).toAbsolutePath().normalize();
            if (Files.exists(p)) {
                p = p.toRealPath();
            }
            key = p.toString();
        } catch (Exception e) {
            throw new ConfigLoadException("Invalid config path: " + path, e);
        }

        if (!refresh) {
            LshConfig cached = configCache.get(key);
            if (cached != null) return cached;
        }

        LshConfig cfg;
        try {
            Path p = Paths.get(key);
            if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
                throw new IOException("Config file not found or not readable: " + key);
            }
            cfg = MAPPER.readValue(p.toFile(), LshConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read/parse LshConfig from " + key, e);
        }
        if (cfg == null) {
            throw new ConfigLoadException("Empty config document: " + key, null);
        }
        cfg.normalize();

        configCache.put(key, cfg);
        return cfg;
    }

    /** Parses a JSON document without touching the cache. */
    public static LshConfig parse(String json) throws ConfigLoadException {
        Objects.requireNonNull(json, "json");
        try {
            LshConfig cfg = MAPPER.readValue(json, LshConfig.class);
            if (cfg == null) {
                throw new ConfigLoadException("Empty config document", null);
            }
            cfg.normalize();
            return cfg;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse LshConfig", e);
        }
    }

    public static void clearCache() {
        configCache.clear();
    }

    private void normalize() {
        nHashTables  = Math.min(nHashTables, MAX_TABLES);
        nProjections = Math.min(nProjections, MAX_PROJECTIONS);
        if (family == null) family = HashFamilyType.SRP;
        if (l2 == null) l2 = new L2Config();
        if (mips == null) mips = new MipsConfig();
        if (storage == null) storage = new StorageConfig();
        if (storage.type == null) storage.type = StorageType.MEMORY;
    }

    /* ======================== Getters ======================== */

    public HashFamilyType getFamily() {
        return family;
    }

    public int getNProjections() {
        return nProjections;
    }

    public int getNHashTables() {
        return nHashTables;
    }

    public int getDim() {
        return dim;
    }

    public long getSeed() {
        return seed;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public L2Config getL2() {
        return l2;
    }

    public MipsConfig getMips() {
        return mips;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    /* ======================== Nested config types ======================== */

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class L2Config {
        /** Bucket width. */
        @JsonProperty("r")
        public float r = 4.0f;

        public float getR() {
            return r;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MipsConfig {
        @JsonProperty("r")
        public float r = 2.5f;

        /** Norm-rescaling bound, must lie in (0, 1). */
        @JsonProperty("U")
        public float u = 0.83f;

        /** Extra asymmetric-transform terms. */
        @JsonProperty("m")
        public int m = 3;

        /** Largest expected stored norm; 0 fits it from the first stored batch. */
        @JsonProperty("maxNorm")
        public float maxNorm = 0.0f;

        public float getR() {
            return r;
        }

        public float getU() {
            return u;
        }

        public int getM() {
            return m;
        }

        public float getMaxNorm() {
            return maxNorm;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        @JsonProperty("type")
        public StorageType type = StorageType.MEMORY;

        /** Database directory, only used by {@link StorageType#ROCKSDB}. */
        @JsonProperty("path")
        public String path = "lsh-data/rocksdb";

        @JsonProperty("syncWrites")
        public boolean syncWrites = false;

        public StorageType getType() {
            return type;
        }

        public String getPath() {
            return path;
        }

        public boolean isSyncWrites() {
            return syncWrites;
        }
    }

    public static class ConfigLoadException extends Exception {
        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
