package org.dxworks.structogram;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.structogram.editor.MarkerNormalizer;
import org.dxworks.structogram.model.Node;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static final Path SAMPLES = Paths.get("src/test/resources/samples");

    /** Tree shape without markers and identifiers, for comparing trees modulo ids. */
    public static String structure(Node tree) throws IOException {
        return APPROVAL_MAPPER.writeValueAsString(MarkerNormalizer.stripMarkers(tree));
    }

    public static String sample(String relativePath) throws IOException {
        return Files.readString(SAMPLES.resolve(relativePath), StandardCharsets.UTF_8);
    }
}
