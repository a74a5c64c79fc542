package com.github.cinder;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import com.google.common.base.Preconditions;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

public class ConfigReader {

    public static final String DEFAULT_CONFIG_FILE = "cinder.cfg";

    public static Config readConfig() {
        var path = Path.of(DEFAULT_CONFIG_FILE);
        if (!Files.isRegularFile(path)) {
            return new Config();
        }
        return readConfig(path);
    }

    public static Config readConfig(Path path) {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            properties.load(in);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return fromProperties(properties);
    }

    static Config fromProperties(Properties properties) {
        var config = new Config();
        config.slabSize = (int) readPositive(properties, "arena.slabSize", config.slabSize);
        config.byteLimit = readNonNegative(properties, "arena.byteLimit", config.byteLimit);
        return config;
    }

    private static long readPositive(Properties properties, String key, long fallback) {
        long value = readNonNegative(properties, key, fallback);
        Preconditions.checkArgument(value > 0 && value <= Integer.MAX_VALUE, "%s must be a positive int", key);
        return value;
    }

    private static long readNonNegative(Properties properties, String key, long fallback) {
        var raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
        Preconditions.checkArgument(value >= 0, "%s must not be negative", key);
        return value;
    }

    @ToString
    public static class Config {
        @Accessors(fluent = true)
        @Getter
        int slabSize = Arena.DEFAULT_SLAB_SIZE;
        @Accessors(fluent = true)
        @Getter
        long byteLimit = 0;

        public void applyConfig(ConfigTarget ct) {
            ct.setSlabSize(slabSize);
            ct.setByteLimit(byteLimit);
        }
    }

    public interface ConfigTarget {
        void setSlabSize(int slabSize);
        void setByteLimit(long byteLimit);
    }

}
