package org.dxworks.structogram;

import org.dxworks.structogram.editor.MarkerNormalizer;
import org.dxworks.structogram.editor.StructureEditor;
import org.dxworks.structogram.generator.CodeGenerator;
import org.dxworks.structogram.layout.AverageCharWidthFontMetrics;
import org.dxworks.structogram.layout.LayoutEngine;
import org.dxworks.structogram.layout.LayoutResult;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.TreeJson;
import org.dxworks.structogram.parser.MalformedConstructException;
import org.dxworks.structogram.parser.PseudocodeParser;
import org.dxworks.structogram.serializer.PseudocodeSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Set;

public class App {

    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Set<String> COMMANDS = Set.of("parse", "pseudocode", "generate", "layout", "clean");

    public static void main(String[] args) {
        int code = run(args, StructogramConfig.load());
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, StructogramConfig config) {
        if (args.length < 2) {
            printUsage();
            return EXIT_USAGE;
        }

        String command = args[0];
        if (!COMMANDS.contains(command)) {
            System.err.println("Error: Unknown command: " + command);
            printUsage();
            return EXIT_USAGE;
        }
        Path input = Paths.get(args[1]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            return EXIT_FAILURE;
        }
        String target = args.length > 2 ? args[2] : null;

        try {
            switch (command) {
                case "parse" -> write(TreeJson.write(readTree(input, config)), target);
                case "pseudocode" -> write(new PseudocodeSerializer(config.getKeywords())
                        .serialize(readTree(input, config)) + "\n", target);
                case "generate" -> generate(readTree(input, config), target, config);
                case "layout" -> write(TreeJson.MAPPER.writeValueAsString(layout(readTree(input, config), config)), target);
                case "clean" -> write(cleanJson(readTree(input, config)), target);
                default -> throw new IllegalStateException("Unhandled command: " + command);
            }
        } catch (IOException | MalformedConstructException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar structogram.jar <command> <input> [target]");
        System.err.println("  parse <input.txt> [output.json]              pseudocode to tree JSON");
        System.err.println("  pseudocode <input.json> [output.txt]         tree JSON to pseudocode");
        System.err.println("  generate <input> [language|output-file]      tree or pseudocode to source code");
        System.err.println("  layout <input> [output.json]                 tree or pseudocode to diagram geometry");
        System.err.println("  clean <input.json> [output.json]             tree JSON without markers and ids");
        System.err.println("Supported languages: python, java, javascript");
    }

    /** Reads a JSON tree ({@code .json}) or parses pseudocode (anything else). */
    static Node readTree(Path input, StructogramConfig config) throws IOException {
        if (LanguageDetector.isTreeJson(input)) {
            LOGGER.info("Reading tree from {}", input);
            return TreeJson.read(input);
        }
        String source = Files.readString(input, StandardCharsets.UTF_8);
        // Remove BOM if present
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }
        LOGGER.info("Parsing pseudocode from {}", input);
        return new PseudocodeParser(config.getKeywords()).parse(source);
    }

    private static void generate(Node tree, String target, StructogramConfig config) throws IOException {
        CodeGenerator generator = new CodeGenerator(config.languageRegistry());
        if (target == null) {
            write(generator.generateCode(tree, config.getDefaultLanguage()), null);
            return;
        }
        Path targetPath = Paths.get(target);
        Optional<Language> detected = LanguageDetector.detectLanguage(targetPath);
        if (detected.isPresent()) {
            write(generator.generateCode(tree, detected.get().getName()), target);
        } else {
            write(generator.generateCode(tree, target), null);
        }
    }

    static LayoutResult layout(Node tree, StructogramConfig config) {
        LayoutEngine engine = new LayoutEngine(config.layoutOptions(), new AverageCharWidthFontMetrics());
        return engine.diagram(StructureEditor.prepare(tree), config.getWidth());
    }

    private static String cleanJson(Node tree) throws IOException {
        Node clean = MarkerNormalizer.stripMarkers(tree);
        return clean == null ? "null" : TreeJson.write(clean);
    }

    private static void write(String content, String target) throws IOException {
        if (target == null) {
            System.out.print(content);
            if (!content.endsWith("\n")) {
                System.out.println();
            }
            return;
        }
        Path output = Paths.get(target);
        // Create parent directories if they don't exist
        if (output.toAbsolutePath().getParent() != null) {
            Files.createDirectories(output.toAbsolutePath().getParent());
        }
        Files.writeString(output, content, StandardCharsets.UTF_8);
        System.out.println("Output written to: " + output.toAbsolutePath());
    }
}
