package com.github.cinder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.cinder.ast.AstContext;

public class ConfigReaderTest {

    @Test
    public void testReadsFile() {
        var config = ConfigReader.readConfig(Path.of("src/test/resources/small-arena.cfg"));
        assertEquals(256, config.slabSize());
        assertEquals(1024, config.byteLimit());
    }

    @Test
    public void testDefaults() {
        var config = ConfigReader.fromProperties(new Properties());
        assertEquals(Arena.DEFAULT_SLAB_SIZE, config.slabSize());
        assertEquals(0, config.byteLimit());
    }

    @Test
    public void testNoConfigFileInWorkingDirectory() {
        var config = ConfigReader.readConfig();
        assertEquals(Arena.DEFAULT_SLAB_SIZE, config.slabSize());
        assertEquals(0, config.byteLimit());
    }

    @Test
    public void testAppliesToContext() {
        var config = ConfigReader.readConfig(Path.of("src/test/resources/small-arena.cfg"));
        try (var ctx = AstContext.fromConfig(config)) {
            assertEquals(256, ctx.arena().slabSize());
            assertEquals(1024, ctx.arena().byteLimit());
        }
    }

    @Test
    public void testMissingFile() {
        assertThrows(RuntimeException.class, () -> ConfigReader.readConfig(Path.of("src/test/resources/nope.cfg")));
    }

    @ParameterizedTest
    @MethodSource("invalid")
    public void testRejectsInvalidValues(String key, String value) {
        var properties = new Properties();
        properties.setProperty(key, value);
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.fromProperties(properties));
    }

    private static Object[][] invalid() {
        return new Object[][] {
            { "arena.slabSize", "0" },
            { "arena.slabSize", "-4" },
            { "arena.slabSize", "4294967296" },
            { "arena.slabSize", "big" },
            { "arena.byteLimit", "-1" },
        };
    }
}
