package org.dxworks.structogram;

import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.TreeJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    @TempDir
    Path dir;

    private final StructogramConfig config = StructogramConfig.defaults();

    private Path file(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }

    private int run(String... args) {
        return App.run(args, config);
    }

    @Test
    void run_WithoutArguments_IsUsageError() {
        assertEquals(App.EXIT_USAGE, run());
        assertEquals(App.EXIT_USAGE, run("parse"));
    }

    @Test
    void run_UnknownCommand_IsUsageError() throws IOException {
        Path input = file("program.txt", "a()");

        assertEquals(App.EXIT_USAGE, run("draw", input.toString()));
    }

    @Test
    void run_MissingInput_Fails() {
        assertEquals(App.EXIT_FAILURE, run("parse", dir.resolve("absent.txt").toString()));
    }

    @Test
    void generate_LanguageFromOutputExtension() throws IOException {
        Path input = file("program.txt", "\uFEFFinput(\"n\")\noutput(\"n\")\n");
        Path output = dir.resolve("out/program.py");

        assertEquals(App.EXIT_OK, run("generate", input.toString(), output.toString()));
        assertEquals("n = input(\"Eingabe\")\nprint(n)\n", Files.readString(output, StandardCharsets.UTF_8));
    }

    @Test
    void generate_UnsupportedLanguage_Fails() throws IOException {
        Path input = file("program.txt", "a()");

        assertEquals(App.EXIT_FAILURE, run("generate", input.toString(), "cobol"));
    }

    @Test
    void parse_WritesEditableTree() throws IOException {
        Path input = file("program.txt", "if x:\n    a()\n");
        Path output = dir.resolve("tree.json");

        assertEquals(App.EXIT_OK, run("parse", input.toString(), output.toString()));
        Node tree = TreeJson.read(output);
        assertEquals("InsertNode", tree.typeName());
        assertEquals("BranchNode", tree.follow().typeName());
    }

    @Test
    void clean_EmptyTreeIsNull() throws IOException {
        Path input = file("empty.txt", "# only a comment\n");
        Path output = dir.resolve("clean.json");

        assertEquals(App.EXIT_OK, run("clean", input.toString(), output.toString()));
        assertEquals("null", Files.readString(output, StandardCharsets.UTF_8));
    }

    @Test
    void layout_WritesGeometry() throws IOException {
        Path input = file("program.txt", "a()\nb()");
        Path output = dir.resolve("layout.json");

        assertEquals(App.EXIT_OK, run("layout", input.toString(), output.toString()));
        String json = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"totalHeight\" : 80.0"), json);
        assertTrue(json.contains("\"nodeType\" : \"TaskNode\""), json);
    }

    @Test
    void run_MalformedJson_Fails() throws IOException {
        Path input = file("broken.json", "{\"type\": ");

        assertEquals(App.EXIT_FAILURE, run("pseudocode", input.toString()));
    }
}
