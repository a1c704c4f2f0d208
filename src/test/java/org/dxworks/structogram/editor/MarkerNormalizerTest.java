package org.dxworks.structogram.editor;

import org.dxworks.structogram.TestUtils;
import org.dxworks.structogram.model.Branch;
import org.dxworks.structogram.model.CaseLabel;
import org.dxworks.structogram.model.EmptyMarker;
import org.dxworks.structogram.model.InsertionPoint;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.Nodes;
import org.dxworks.structogram.model.Switch;
import org.dxworks.structogram.model.Task;
import org.dxworks.structogram.model.TreeJson;
import org.dxworks.structogram.parser.PseudocodeParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

public class MarkerNormalizerTest {

    @Test
    void wrap_NullGivesEmptyChain() {
        InsertionPoint root = assertInstanceOf(InsertionPoint.class, MarkerNormalizer.wrapWithInsertionPoints(null));

        assertInstanceOf(EmptyMarker.class, root.followElement);
        assertNotNull(root.id);
    }

    @Test
    void wrap_CleanBranch() {
        Node clean = new Branch(null, "x", new Task(null, "a()", null), null, null, null);

        InsertionPoint root = assertInstanceOf(InsertionPoint.class, MarkerNormalizer.wrapWithInsertionPoints(clean));
        Branch branch = assertInstanceOf(Branch.class, root.followElement);

        InsertionPoint trueChain = assertInstanceOf(InsertionPoint.class, branch.trueChild);
        Task task = assertInstanceOf(Task.class, trueChain.followElement);
        assertInstanceOf(EmptyMarker.class, assertInstanceOf(InsertionPoint.class, task.followElement).followElement);
        InsertionPoint falseChain = assertInstanceOf(InsertionPoint.class, branch.falseChild);
        assertInstanceOf(EmptyMarker.class, falseChain.followElement);
        assertInstanceOf(EmptyMarker.class, assertInstanceOf(InsertionPoint.class, branch.followElement).followElement);
    }

    @Test
    void wrap_CollapsesConsecutiveInsertionPoints() {
        Node tree = new InsertionPoint("ip1", new InsertionPoint("ip2", new Task("t", "a()", null)));

        InsertionPoint root = assertInstanceOf(InsertionPoint.class, MarkerNormalizer.wrapWithInsertionPoints(tree));

        assertEquals("ip2", root.id);
        assertEquals("t", root.followElement.id());
    }

    @Test
    void wrap_IsIdempotent() throws IOException {
        Node tree = new PseudocodeParser().parse(TestUtils.sample("pseudocode/program.txt"));

        Node wrapped = MarkerNormalizer.wrapWithInsertionPoints(tree);

        assertEquals(TreeJson.write(tree), TreeJson.write(wrapped));
        assertEquals(TreeJson.write(wrapped), TreeJson.write(MarkerNormalizer.wrapWithInsertionPoints(wrapped)));
    }

    @Test
    void wrap_SwitchWithoutDefaultGetsDisabledDefault() {
        Node clean = new Switch(null, "x", List.of(new CaseLabel(null, "1", null)), false, null, null, null);

        Node wrapped = MarkerNormalizer.wrapWithInsertionPoints(clean);

        Switch sw = assertInstanceOf(Switch.class, wrapped.follow());
        assertFalse(sw.defaultEnabled);
        assertEquals("Default", sw.defaultCase.text);
        assertInstanceOf(InsertionPoint.class, sw.defaultCase.followElement);
        assertInstanceOf(InsertionPoint.class, sw.cases.get(0).followElement);
    }

    @Test
    void strip_RemovesMarkersAndIdentifiers() throws IOException {
        Node tree = new PseudocodeParser().parse("if x:\n    a()\nb()");

        Node clean = MarkerNormalizer.stripMarkers(tree);

        Branch branch = assertInstanceOf(Branch.class, clean);
        assertNull(branch.id);
        assertNull(branch.falseChild);
        assertNull(assertInstanceOf(Task.class, branch.trueChild).followElement);
        assertEquals("b()", branch.followElement.text());
        assertEquals(0, Nodes.collectIds(clean).size());
    }

    @Test
    void strip_EmptyTreeGivesNull() {
        assertNull(MarkerNormalizer.stripMarkers(new PseudocodeParser().parse("")));
    }

    @Test
    void stripThenWrap_KeepsStructure() throws IOException {
        Node tree = new PseudocodeParser().parse(TestUtils.sample("pseudocode/program.txt"));

        Node rewrapped = StructureEditor.prepare(MarkerNormalizer.stripMarkers(tree));

        assertEquals(TestUtils.structure(tree), TestUtils.structure(rewrapped));
        assertEquals(StructureEditor.collectInsertionPoints(tree).size(),
                StructureEditor.collectInsertionPoints(rewrapped).size());
    }

    @Test
    void ensureIdentifiers_KeepsExistingOnesAndSharesSubtrees() {
        Task tail = new Task("keep", "b()", null);
        Node tree = new Task(null, "a()", tail);

        Node identified = MarkerNormalizer.ensureIdentifiers(tree);

        assertNotNull(identified.id());
        assertSame(tail, identified.follow());
        assertSame(tail, MarkerNormalizer.ensureIdentifiers(tail));
    }
}
