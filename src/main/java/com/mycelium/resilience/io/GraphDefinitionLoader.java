package com.mycelium.resilience.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@link GraphDefinition}s from JSON.
 *
 * Malformed JSON and structurally invalid definitions raise
 * {@link IllegalArgumentException}; failing to read the source raises
 * {@link UncheckedIOException}.
 */
public final class GraphDefinitionLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphDefinitionLoader() {
    }

    public static GraphDefinition load(Path path) {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph definition from " + path, e);
        }
        return parse(json);
    }

    public static GraphDefinition parse(String json) {
        GraphDefinition def;
        try {
            def = MAPPER.readValue(json, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed graph definition: " + e.getOriginalMessage(), e);
        }
        if (def == null || def.getGraph() == null)
            throw new IllegalArgumentException("Graph definition has no 'graph' block");
        return def;
    }

    public static GraphDefinition fromClasspath(String resource) {
        try (InputStream in = GraphDefinitionLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Graph definition resource not found: " + resource);
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph definition resource " + resource, e);
        }
    }
}
