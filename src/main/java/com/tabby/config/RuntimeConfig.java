package com.tabby.config;

import com.tabby.debug.DebugLevel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * RuntimeConfig
 *
 * Per-instance knobs for the value runtime.
 *
 * JSON shape (all keys optional, unknown keys ignored):
 * {
 *   "poolCapacity": 32,
 *   "longStringThreshold": 31,
 *   "debugLevel": "INFO",
 *   "checkIntegrity": false
 * }
 *
 * Sources:
 *  - defaults()                 built-in values
 *  - load()                     classpath resource tabby-runtime.json, defaults when absent
 *  - fromJson(String) / fromFile(Path)
 */
public final class RuntimeConfig {

    public static final String RESOURCE_NAME = "tabby-runtime.json";

    public static final int DEFAULT_POOL_CAPACITY = 32;
    public static final int DEFAULT_LONG_STRING_THRESHOLD = 31;

    private static final ObjectMapper OM = new ObjectMapper();

    private int poolCapacity = DEFAULT_POOL_CAPACITY;
    private int longStringThreshold = DEFAULT_LONG_STRING_THRESHOLD;
    private DebugLevel debugLevel = DebugLevel.INFO;
    private boolean checkIntegrity = false;

    public static RuntimeConfig defaults() {
        return new RuntimeConfig();
    }

    public static RuntimeConfig load() {
        try (InputStream in = RuntimeConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) return defaults();
            return fromNode(OM.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
    }

    public static RuntimeConfig fromJson(String json) {
        if (json == null || json.trim().isEmpty()) return defaults();
        try {
            return fromNode(OM.readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid runtime config JSON: " + e.getMessage(), e);
        }
    }

    public static RuntimeConfig fromFile(Path path) {
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    private static RuntimeConfig fromNode(JsonNode root) {
        RuntimeConfig cfg = defaults();
        if (root == null || !root.isObject()) return cfg;

        JsonNode n = root.get("poolCapacity");
        if (n != null && n.canConvertToInt()) cfg.setPoolCapacity(n.asInt());

        n = root.get("longStringThreshold");
        if (n != null && n.canConvertToInt()) cfg.setLongStringThreshold(n.asInt());

        n = root.get("debugLevel");
        if (n != null && n.isTextual()) {
            try {
                cfg.setDebugLevel(DebugLevel.valueOf(n.asText().trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown debugLevel: " + n.asText(), e);
            }
        }

        n = root.get("checkIntegrity");
        if (n != null && n.isBoolean()) cfg.setCheckIntegrity(n.asBoolean());

        return cfg;
    }

    public int getPoolCapacity() { return poolCapacity; }

    public RuntimeConfig setPoolCapacity(int poolCapacity) {
        if (poolCapacity < 0) throw new IllegalArgumentException("poolCapacity must be >= 0: " + poolCapacity);
        this.poolCapacity = poolCapacity;
        return this;
    }

    public int getLongStringThreshold() { return longStringThreshold; }

    public RuntimeConfig setLongStringThreshold(int longStringThreshold) {
        if (longStringThreshold < 0) {
            throw new IllegalArgumentException("longStringThreshold must be >= 0: " + longStringThreshold);
        }
        this.longStringThreshold = longStringThreshold;
        return this;
    }

    public DebugLevel getDebugLevel() { return debugLevel; }

    public RuntimeConfig setDebugLevel(DebugLevel debugLevel) {
        this.debugLevel = (debugLevel == null) ? DebugLevel.INFO : debugLevel;
        return this;
    }

    public boolean isCheckIntegrity() { return checkIntegrity; }

    public RuntimeConfig setCheckIntegrity(boolean checkIntegrity) {
        this.checkIntegrity = checkIntegrity;
        return this;
    }

    @Override
    public String toString() {
        return "RuntimeConfig{poolCapacity=" + poolCapacity
                + ", longStringThreshold=" + longStringThreshold
                + ", debugLevel=" + debugLevel
                + ", checkIntegrity=" + checkIntegrity + "}";
    }
}
