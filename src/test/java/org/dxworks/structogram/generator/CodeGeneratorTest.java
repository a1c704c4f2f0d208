package org.dxworks.structogram.generator;

import org.dxworks.structogram.model.Branch;
import org.dxworks.structogram.model.CaseLabel;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.PostTestLoop;
import org.dxworks.structogram.model.PreTestLoop;
import org.dxworks.structogram.model.Switch;
import org.dxworks.structogram.model.Task;
import org.dxworks.structogram.parser.PseudocodeParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CodeGeneratorTest {

    @Test
    void generate_Python_InputThenOutput() {
        Node tree = new PseudocodeParser().parse("input(\"n\")\noutput(\"n\")");

        assertEquals("n = input(\"Eingabe\")\nprint(n)\n", CodeGenerator.generate(tree, "python"));
    }

    @Test
    void generate_UnknownLanguage_ListsSupportedOnes() {
        Node tree = new Task(null, "x = 1", null);

        UnsupportedLanguageException e = assertThrows(UnsupportedLanguageException.class,
                () -> CodeGenerator.generate(tree, "cobol"));
        assertEquals("Unsupported language: cobol. Supported: java, javascript, python", e.getMessage());
        assertEquals("cobol", e.getLanguage());
        assertEquals(List.of("java", "javascript", "python"), e.getSupported());
    }

    @Test
    void generate_LanguageNameIgnoresCase() {
        assertEquals("x = 1;\n", CodeGenerator.generate(new Task(null, "x = 1", null), " Java "));
    }

    @Test
    void generate_EmptyTree_GivesEmptyText() {
        assertEquals("", CodeGenerator.generate(new PseudocodeParser().parse(""), "java"));
        assertEquals("", CodeGenerator.generate(null, "python"));
    }

    @Test
    void generate_Python_EmptyBlocksGetPass() {
        Node tree = new Branch(null, "ready", new Task(null, "go()", null), null, null, null);

        assertEquals("if ready:\n    go()\nelse:\n    pass\n", CodeGenerator.generate(tree, "python"));
    }

    @Test
    void generate_Java_EmptyBlocksStayEmpty() {
        Node tree = new PreTestLoop(null, "busy", null, null);

        assertEquals("while (busy) {\n}\n", CodeGenerator.generate(tree, "java"));
    }

    @Test
    void generate_Python_SwitchWithoutCases_RunsDefaultBody() {
        Node tree = new Switch(null, "x", List.of(), true,
                new CaseLabel(null, "Default", new Task(null, "fallback()", null)), null, null);

        assertEquals("fallback()\n", CodeGenerator.generate(tree, "python"));
    }

    @Test
    void generate_DisabledDefault_IsOmitted() {
        Node tree = new Switch(null, "x",
                List.of(new CaseLabel(null, "1", new Task(null, "one()", null))), false,
                new CaseLabel(null, "Default", new Task(null, "never()", null)), null, null);

        String python = CodeGenerator.generate(tree, "python");
        String java = CodeGenerator.generate(tree, "java");

        assertEquals("if x == 1:\n    one()\n", python);
        assertFalse(java.contains("default"));
        assertFalse(java.contains("never()"));
    }

    @Test
    void generate_Python_PostTestLoopWithEmptyBody() {
        Node tree = new PostTestLoop(null, "again", null, null);

        assertEquals("while True:\n    if not (again):\n        break\n", CodeGenerator.generate(tree, "python"));
    }

    @Test
    void generate_EveryLineEndsWithNewline() {
        Node tree = new Task(null, "a()", new Task(null, "b()", null));

        String code = CodeGenerator.generate(tree, "javascript");
        assertTrue(code.endsWith("\n"));
        assertEquals(2, code.split("\n").length);
    }

    @Test
    void generate_RegisteredTemplate_IsUsed() {
        CodeTemplate pseudoBasic = CodeTemplate.python();
        pseudoBasic.outputPrefix = "PRINT ";
        pseudoBasic.outputSuffix = "";
        LanguageRegistry registry = LanguageRegistry.builtins().register("Basic", pseudoBasic);

        Node tree = new PseudocodeParser().parse("output(\"hello\")");
        assertEquals("PRINT hello\n", new CodeGenerator(registry).generateCode(tree, "basic"));
        assertTrue(registry.supports("BASIC"));
        assertEquals(List.of("basic", "java", "javascript", "python"), registry.supportedLanguages());
    }

    @Test
    void register_RejectsBlankNames() {
        LanguageRegistry registry = new LanguageRegistry();

        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", CodeTemplate.java()));
        assertThrows(IllegalArgumentException.class, () -> registry.register("java", null));
    }
}
