package org.dxworks.structogram.serializer;

import org.dxworks.structogram.TestUtils;
import org.dxworks.structogram.model.Branch;
import org.dxworks.structogram.model.CaseLabel;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.Output;
import org.dxworks.structogram.model.Switch;
import org.dxworks.structogram.model.Task;
import org.dxworks.structogram.parser.KeywordMap;
import org.dxworks.structogram.parser.PseudocodeParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class PseudocodeSerializerTest {

    private final PseudocodeSerializer serializer = new PseudocodeSerializer();

    @Test
    void serialize_BranchWithColumnWidths() {
        Node tree = new Branch(null, "x > 0", new Output(null, "pos", null), null, List.of(0.7, 0.3),
                new Task(null, "done()", null));

        assertEquals(String.join("\n",
                "if x > 0 [0.7, 0.3]:",
                "    output(\"pos\")",
                "else:",
                "done()"), serializer.serialize(tree));
    }

    @Test
    void serialize_SwitchWritesDefaultOnlyWhenEnabled() {
        CaseLabel red = new CaseLabel(null, "red", new Task(null, "stop()", null));
        CaseLabel fallback = new CaseLabel(null, "Default", new Task(null, "wait()", null));

        assertEquals("switch color [1, 0]:\n    case red:\n        stop()\n    else:\n        wait()",
                serializer.serialize(new Switch(null, "color", List.of(red), true, fallback, List.of(1.0, 0.0), null)));
        assertEquals("switch color:\n    case red:\n        stop()",
                serializer.serialize(new Switch(null, "color", List.of(red), false, fallback, null, null)));
    }

    @Test
    void serialize_EmptyTree() {
        assertEquals("", serializer.serialize(new PseudocodeParser().parse("# nothing here")));
        assertEquals("", serializer.serialize(null));
    }

    @Test
    void roundTrip_Program() throws IOException {
        Node tree = new PseudocodeParser().parse(TestUtils.sample("pseudocode/program.txt"));

        Node reparsed = new PseudocodeParser().parse(serializer.serialize(tree));

        assertEquals(TestUtils.structure(tree), TestUtils.structure(reparsed));
    }

    @Test
    void roundTrip_GermanKeywords() throws IOException {
        Node tree = PseudocodeParser.parse(TestUtils.sample("pseudocode/programm_de.txt"), KeywordMap.GERMAN);

        String pseudocode = PseudocodeSerializer.serialize(tree, KeywordMap.GERMAN);
        Node reparsed = PseudocodeParser.parse(pseudocode, KeywordMap.GERMAN);

        assertEquals(TestUtils.structure(tree), TestUtils.structure(reparsed));
        assertEquals("eingabe(\"zahl\")", pseudocode.lines().findFirst().orElseThrow());
    }

    @Test
    void formatNumber_DropsIntegralFraction() {
        assertEquals("1", PseudocodeSerializer.formatNumber(1.0));
        assertEquals("10", PseudocodeSerializer.formatNumber(10.0));
        assertEquals("0", PseudocodeSerializer.formatNumber(0.0));
        assertEquals("0.25", PseudocodeSerializer.formatNumber(0.25));
    }

    @Test
    void formatNumber_NeverUsesExponent() {
        assertEquals("0.0005", PseudocodeSerializer.formatNumber(0.0005));
        assertEquals("0.9995", PseudocodeSerializer.formatNumber(0.9995));
        assertEquals("12345678", PseudocodeSerializer.formatNumber(1.2345678E7));
    }

    @Test
    void roundTrip_TinyColumnWidths() throws IOException {
        Node tree = new PseudocodeParser().parse("switch c [0.0005, 0.9995]:\n    case 1:\n        a()");

        String source = serializer.serialize(tree);
        Node reparsed = new PseudocodeParser().parse(source);

        assertEquals("switch c [0.0005, 0.9995]:\n    case 1:\n        a()", source);
        Switch sw = (Switch) reparsed.follow();
        assertEquals("c", sw.text);
        assertEquals(List.of(0.0005, 0.9995), sw.columnWidths);
        assertEquals(TestUtils.structure(tree), TestUtils.structure(reparsed));
    }
}
