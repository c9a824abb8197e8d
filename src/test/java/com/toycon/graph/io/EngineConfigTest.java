package com.toycon.graph.io;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class EngineConfigTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testBuiltInDefaults() {
        EngineConfig config = new EngineConfig();
        assertEquals(42L, config.getRandomSeed());
        assertEquals(1024, config.getRingBufferSize());
        assertEquals(100, config.getOriginX());
        assertEquals(400, config.getMaxY());
        assertEquals(256, config.getMaxNestingDepth());
    }

    @Test
    public void testClasspathResource() {
        EngineConfig config = EngineConfig.defaults();
        assertEquals(42L, config.getRandomSeed());
        assertEquals(80, config.getRowStep());
        assertEquals(200, config.getColumnStep());
    }

    @Test
    public void testPartialJsonKeepsDefaultsAndIgnoresUnknown() {
        EngineConfig config = EngineConfig.parse("{\"randomSeed\": 7, \"rowStep\": 40, \"theme\": \"dark\"}");
        assertEquals(7L, config.getRandomSeed());
        assertEquals(40, config.getRowStep());
        assertEquals(1024, config.getRingBufferSize());
    }

    @Test
    public void testLayoutFromConfig() {
        EngineConfig config = EngineConfig.parse("{\"originX\": 0, \"originY\": 0, \"rowStep\": 10, \"maxY\": 10}");
        var layout = config.newLayout();
        assertArrayEquals(new int[] { 0, 0 }, layout.next());
        assertArrayEquals(new int[] { 0, 10 }, layout.next());
        assertArrayEquals(new int[] { 200, 0 }, layout.next());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        Path file = tmp.newFile("toycon.json").toPath();
        Files.writeString(file, "{\"ringBufferSize\": 64}");
        assertEquals(64, EngineConfig.load(file).getRingBufferSize());
    }

    @Test(expected = UncheckedIOException.class)
    public void testInvalidJson() {
        EngineConfig.parse("{ not json");
    }
}
