package org.dxworks.structogram.layout;

import org.dxworks.structogram.TestUtils;
import org.dxworks.structogram.editor.StructureEditor;
import org.dxworks.structogram.editor.StructureEditor.EditableNode;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.parser.PseudocodeParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LayoutEngineTest {

    private static final double EPSILON = 1e-9;

    private final LayoutEngine engine = new LayoutEngine();

    private static Node parse(String source) {
        return new PseudocodeParser().parse(source);
    }

    private static String idOf(Node tree, String text) {
        return StructureEditor.collectEditableNodes(tree).stream()
                .filter(node -> text.equals(node.text))
                .map(node -> node.id)
                .findFirst()
                .orElseThrow();
    }

    private static Box box(LayoutResult result, Node tree, String text) {
        return result.findBox(idOf(tree, text)).orElseThrow();
    }

    @Test
    void layout_SingleTask() {
        Node tree = parse("a()");

        LayoutResult result = engine.diagram(tree, 200);

        assertEquals(LayoutEngine.ROW_HEIGHT, result.totalHeight);
        Box task = box(result, tree, "a()");
        assertEquals(0, task.x);
        assertEquals(0, task.y);
        assertEquals(200, task.width);
        assertEquals(LayoutEngine.ROW_HEIGHT, task.height);
    }

    @Test
    void measure_MatchesLaidOutHeight() throws IOException {
        Node tree = parse(TestUtils.sample("pseudocode/program.txt"));

        for (double width : new double[]{120, 300, 600}) {
            assertEquals(engine.measure(tree, width), engine.layout(tree, 0, 0, width, null).totalHeight);
            assertEquals(engine.measure(tree, width), engine.diagram(tree, width).totalHeight);
        }
    }

    @Test
    void layout_StretchGoesToLastContentNode() {
        Node tree = parse("a()\nb()");

        LayoutResult result = engine.layout(tree, 10, 20, 200, 100.0);

        assertEquals(100, result.totalHeight);
        Box first = box(result, tree, "a()");
        Box last = box(result, tree, "b()");
        assertEquals(LayoutEngine.ROW_HEIGHT, first.height);
        assertEquals(20, first.y);
        assertEquals(60, last.height, EPSILON);
        assertEquals(120, last.bottom(), EPSILON);
    }

    @Test
    void layout_StretchIntoTrailingBranchGrowsBothColumns() {
        Node tree = parse("a()\nif x:\n    b()\n    c()\nelse:\n    d()");
        LayoutResult natural = engine.layout(tree, 0, 0, 200, null);
        double available = natural.totalHeight + 70;

        LayoutResult stretched = engine.layout(tree, 0, 0, 200, available);

        assertEquals(available, stretched.totalHeight);
        Box before = box(natural, tree, "a()");
        Box after = box(stretched, tree, "a()");
        assertEquals(before.y, after.y);
        assertEquals(before.height, after.height);
        assertEquals(before.width, after.width);
        Box branch = box(stretched, tree, "x");
        assertEquals(box(natural, tree, "x").height + 70, branch.height, EPSILON);
        assertEquals(branch.bottom(), box(stretched, tree, "c()").bottom(), EPSILON);
        assertEquals(branch.bottom(), box(stretched, tree, "d()").bottom(), EPSILON);
        assertEquals(box(natural, tree, "b()").height, box(stretched, tree, "b()").height);
    }

    @Test
    void layout_ShorterAvailableHeightIsIgnored() {
        Node tree = parse("a()\nb()");

        assertEquals(80, engine.layout(tree, 0, 0, 200, 10.0).totalHeight);
    }

    @Test
    void layout_BranchColumnsEndTogether() {
        Node tree = parse("if x [0.7, 0.3]:\n    a()\n    b()\nelse:\n    c()");

        LayoutResult result = engine.diagram(tree, 200);

        Box a = box(result, tree, "a()");
        Box b = box(result, tree, "b()");
        Box c = box(result, tree, "c()");
        assertEquals(140, a.width, EPSILON);
        assertEquals(140, c.x, EPSILON);
        assertEquals(60, c.width, EPSILON);
        assertEquals(a.y, c.y, EPSILON);
        assertEquals(b.bottom(), c.bottom(), EPSILON);
        assertEquals(box(result, tree, "x").bottom(), c.bottom(), EPSILON);
    }

    @Test
    void layout_SwitchColumns() {
        Node tree = parse(String.join("\n",
                "switch x:",
                "    case 1:",
                "        a()",
                "    case 2:",
                "        b()",
                "        c()",
                "    else:",
                "        d()"));

        LayoutResult result = engine.diagram(tree, 300);

        assertEquals(0, box(result, tree, "1").x, EPSILON);
        assertEquals(100, box(result, tree, "2").x, EPSILON);
        assertEquals(200, box(result, tree, "Default").x, EPSILON);
        assertEquals(box(result, tree, "c()").bottom(), box(result, tree, "a()").bottom(), EPSILON);
        assertEquals(box(result, tree, "c()").bottom(), box(result, tree, "d()").bottom(), EPSILON);
    }

    @Test
    void layout_BoxesStayInsideTheirParents() throws IOException {
        Node tree = StructureEditor.prepare(parse(TestUtils.sample("pseudocode/program.txt")));
        double width = 400;

        LayoutResult result = engine.diagram(tree, width);

        assertFalse(result.boxes.isEmpty());
        for (Box box : result.boxes) {
            assertTrue(box.x >= -EPSILON && box.y >= -EPSILON, box.toString());
            assertTrue(box.right() <= width + EPSILON, box.toString());
            assertTrue(box.bottom() <= result.totalHeight + EPSILON, box.toString());
        }
        List<EditableNode> nodes = StructureEditor.collectEditableNodes(tree);
        for (EditableNode node : nodes) {
            assertTrue(result.findBox(node.id).isPresent(), node.text);
        }
        assertTrue(result.boxes.stream().noneMatch(box -> "Placeholder".equals(box.nodeType)));
    }

    @Test
    void layout_LongTextWrapsAndGrowsRow() {
        Node tree = parse("one two three four five six seven eight");

        LayoutResult result = engine.diagram(tree, 101);

        TextLabel label = result.labels.get(0);
        assertEquals(List.of("one two", "three four", "five six", "seven", "eight"), label.lines);
        assertEquals(5 * 14 * 1.3 + 2 * LayoutEngine.PADDING_Y, result.totalHeight, EPSILON);
    }

    @Test
    void layout_InsertionPointHeightIsConfigurable() {
        LayoutEngine spaced = new LayoutEngine(new LayoutOptions(14, 5, "Ja", "Nein"), new AverageCharWidthFontMetrics());
        Node tree = parse("a()");

        LayoutResult result = spaced.diagram(tree, 200);

        assertEquals(50, result.totalHeight, EPSILON);
        assertEquals(5, result.findBox(tree.id()).orElseThrow().height, EPSILON);
        assertEquals(5, box(result, tree, "a()").y, EPSILON);
    }

    @Test
    void layout_BranchUsesConfiguredLabels() {
        LayoutEngine german = new LayoutEngine(new LayoutOptions(14, 0, "Ja", "Nein"), new AverageCharWidthFontMetrics());

        LayoutResult result = german.diagram(parse("if x:\n    a()"), 200);

        assertTrue(result.labels.stream().anyMatch(label -> label.text().equals("Ja")));
        assertTrue(result.labels.stream().anyMatch(label -> label.text().equals("Nein")));
    }

    @Test
    void diagram_ClosesRightAndBottomEdge() {
        LayoutResult result = engine.diagram(parse("a()"), 200);

        LineSegment right = result.lines.get(result.lines.size() - 2);
        LineSegment bottom = result.lines.get(result.lines.size() - 1);
        assertEquals(200, right.x1);
        assertEquals(200, right.x2);
        assertEquals(40, bottom.y1);
        assertEquals(40, bottom.y2);
    }

    @Test
    void columnWidths_FallBackToEqualSplit() {
        double[] widths = LayoutEngine.columnWidths(300, 3, List.of(0.5, 0.5));

        assertEquals(100, widths[0], EPSILON);
        assertEquals(100, widths[2], EPSILON);
        assertEquals(150, LayoutEngine.columnWidths(300, 2, List.of(0.5, 0.5))[1], EPSILON);
    }

    @Test
    void options_RejectInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> new LayoutOptions(0, 0, "True", "False"));
        assertThrows(IllegalArgumentException.class,
                () -> new LayoutOptions(14, -1, "True", "False"));
    }
}
