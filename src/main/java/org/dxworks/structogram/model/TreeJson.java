package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON exchange of structogram trees.
 */
public final class TreeJson {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private TreeJson() {
        // utility class
    }

    public static Node read(String json) throws IOException {
        return MAPPER.readValue(json, Node.class);
    }

    public static Node read(Path file) throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        // Remove BOM if present
        if (json.startsWith("\uFEFF")) {
            json = json.substring(1);
        }
        return read(json);
    }

    public static String write(Node tree) throws IOException {
        return MAPPER.writerFor(Node.class).writeValueAsString(tree);
    }
}
