package com.eis.cdc.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON form of {@link GraphLayoutDescriptor}, used for clipboard and preview
 * exchange.
 */
public final class LayoutJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LayoutJson() {
        // Utility class
    }

    public static String write(GraphLayoutDescriptor descriptor) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(descriptor);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize layout: " + e.getMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a layout descriptor.
     */
    public static GraphLayoutDescriptor read(String json) {
        try {
            GraphLayoutDescriptor d = MAPPER.readValue(json, GraphLayoutDescriptor.class);
            if (d.getNodes() == null)
                throw new IllegalArgumentException("Missing 'nodes' key");
            return d;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed layout JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static void writeFile(GraphLayoutDescriptor descriptor, Path path) throws IOException {
        Files.writeString(path, write(descriptor));
    }

    public static GraphLayoutDescriptor readFile(Path path) throws IOException {
        return read(Files.readString(path));
    }
}
