package com.toycon.graph.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toycon.graph.dsl.ColumnLayout;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Engine and host settings.
 *
 * Every field has a working default, so an empty JSON object (or no file at
 * all) yields a usable configuration.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {
    public static final String RESOURCE = "toycon.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Seed of the evaluator's random source. */
    private long randomSeed = 42L;
    /** Host ring buffer capacity; must be a power of two. */
    private int ringBufferSize = 1024;
    /** Minimum gap between two logged host errors. */
    private long errorLogIntervalMillis = 1000L;
    /** Deepest allowed nesting of parentheses, abs() and if blocks in a script. */
    private int maxNestingDepth = 256;

    // Layout of generated nodes
    private int originX = 100;
    private int originY = 100;
    private int rowStep = 80;
    private int maxY = 400;
    private int columnStep = 200;

    /** A fresh layout cursor positioned at the origin. */
    public ColumnLayout newLayout() {
        return new ColumnLayout(originX, originY, rowStep, maxY, columnStep);
    }

    /** Reads a JSON configuration file. */
    public static EngineConfig load(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), EngineConfig.class);
    }

    public static EngineConfig parse(String json) {
        try {
            return MAPPER.readValue(json, EngineConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid engine configuration", e);
        }
    }

    /**
     * Loads {@value #RESOURCE} from the classpath, or the built-in defaults
     * when the resource is absent.
     */
    public static EngineConfig defaults() {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using built-in defaults", RESOURCE);
                return new EngineConfig();
            }
            return MAPPER.readValue(in, EngineConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }
}
