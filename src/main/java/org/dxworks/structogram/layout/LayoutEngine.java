package org.dxworks.structogram.layout;

import org.dxworks.structogram.model.Branch;
import org.dxworks.structogram.model.CaseLabel;
import org.dxworks.structogram.model.CountLoop;
import org.dxworks.structogram.model.EmptyMarker;
import org.dxworks.structogram.model.FunctionDef;
import org.dxworks.structogram.model.Input;
import org.dxworks.structogram.model.InsertionPoint;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.NodeVisitor;
import org.dxworks.structogram.model.Nodes;
import org.dxworks.structogram.model.Output;
import org.dxworks.structogram.model.PostTestLoop;
import org.dxworks.structogram.model.PreTestLoop;
import org.dxworks.structogram.model.Switch;
import org.dxworks.structogram.model.Task;
import org.dxworks.structogram.model.TryCatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Computes the nested-box geometry of a structogram.
 * <p>
 * Heights are measured bottom-up first and boxes are then placed top-down. When a chain is
 * given more height than it needs, the last content node of the chain takes the difference,
 * so parallel columns end at the same line.
 * <p>
 * Every block draws its own top and left border; {@link #diagram} adds the right edge and the
 * closing bottom line of the whole drawing.
 */
public class LayoutEngine {

    public static final double ROW_HEIGHT = 40;
    public static final double LOOP_INDENT = 20;
    public static final double PADDING_X = 8;
    public static final double PADDING_Y = 6;
    static final double LINE_HEIGHT_FACTOR = 1.3;
    static final double BRANCH_LABEL_FONT_FACTOR = 0.8;
    static final double FUNCTION_FOOTER_FACTOR = 0.6;

    private final LayoutOptions options;
    private final FontMetrics metrics;

    public LayoutEngine() {
        this(LayoutOptions.defaults(), new AverageCharWidthFontMetrics());
    }

    public LayoutEngine(LayoutOptions options, FontMetrics metrics) {
        this.options = options;
        this.metrics = metrics;
    }

    public LayoutOptions getOptions() {
        return options;
    }

    /** Natural height of the chain starting at {@code node} (a case label includes its body). */
    public double measure(Node node, double width) {
        if (node instanceof CaseLabel) {
            return ownHeight(node, width);
        }
        double height = 0;
        for (Node current = node; current != null; current = current.follow()) {
            height += ownHeight(current, width);
        }
        return height;
    }

    /**
     * Places the chain starting at {@code node} with its top-left corner at {@code (x, y)}.
     *
     * @param availableHeight height to fill, or {@code null} for the natural height
     */
    public LayoutResult layout(Node node, double x, double y, double width, Double availableHeight) {
        Placement placement = new Placement();
        double height = placement.chain(node, x, y, width, availableHeight);
        return placement.result(height);
    }

    /** Lays out a whole tree at the origin and closes the drawing with its right and bottom edge. */
    public LayoutResult diagram(Node tree, double width) {
        Placement placement = new Placement();
        double height = placement.chain(tree, 0, 0, width, null);
        placement.line(width, 0, width, height);
        placement.line(0, height, width, height);
        return placement.result(height);
    }

    // ---- measuring ----

    private double lineHeight() {
        return options.getFontSize() * LINE_HEIGHT_FACTOR;
    }

    private List<String> wrap(String text, double width) {
        return TextWrapper.wrap(text, width - 2 * PADDING_X, options.getFontSize(), metrics);
    }

    /** Height of a text row: wrapped lines plus padding, at least one default row. */
    double rowHeight(String text, double width) {
        int lineCount = wrap(text, width).size();
        return Math.max(ROW_HEIGHT, lineCount * lineHeight() + 2 * PADDING_Y);
    }

    private double slopeHeight() {
        return lineHeight() + PADDING_Y;
    }

    static double[] columnWidths(double width, int count, List<Double> fractions) {
        double[] widths = new double[count];
        if (fractions != null && fractions.size() == count) {
            for (int i = 0; i < count; i++) {
                widths[i] = width * fractions.get(i);
            }
        } else {
            for (int i = 0; i < count; i++) {
                widths[i] = width / count;
            }
        }
        return widths;
    }

    private static String leafLabel(Node node) {
        String text = Nodes.textOrEmpty(node);
        if (node instanceof Input) return "▶ " + text;
        if (node instanceof Output) return "◀ " + text;
        return text;
    }

    private static String functionHeader(FunctionDef node) {
        return Nodes.textOrEmpty(node) + "(" + node.parameterList() + ") {";
    }

    private static String catchLabel(TryCatch node) {
        String text = Nodes.textOrEmpty(node);
        return text.isEmpty() ? "Catch" : "Catch (" + text + ")";
    }

    /** Height of a single node without the chain that follows it. */
    private double ownHeight(Node node, double width) {
        return node.accept(new NodeVisitor<Double>() {
            @Override
            public Double visitInsertionPoint(InsertionPoint n) {
                return options.getInsertionPointHeight();
            }

            @Override
            public Double visitEmptyMarker(EmptyMarker n) {
                return 0.0;
            }

            @Override
            public Double visitTask(Task n) {
                return rowHeight(leafLabel(n), width);
            }

            @Override
            public Double visitInput(Input n) {
                return rowHeight(leafLabel(n), width);
            }

            @Override
            public Double visitOutput(Output n) {
                return rowHeight(leafLabel(n), width);
            }

            @Override
            public Double visitBranch(Branch n) {
                double[] cols = columnWidths(width, 2, n.columnWidths);
                double header = rowHeight(n.text, width) + 2 * slopeHeight();
                return header + Math.max(measure(n.trueChild, cols[0]), measure(n.falseChild, cols[1]));
            }

            @Override
            public Double visitSwitch(Switch n) {
                return rowHeight(n.text, width) + slopeHeight() + switchColumnsHeight(n, width);
            }

            @Override
            public Double visitCaseLabel(CaseLabel n) {
                return rowHeight(n.text, width) + measure(n.followElement, width);
            }

            @Override
            public Double visitPreTestLoop(PreTestLoop n) {
                double row = rowHeight(n.text, width);
                return row + loopBody(n.child, row, width);
            }

            @Override
            public Double visitCountLoop(CountLoop n) {
                double row = rowHeight(n.text, width);
                return row + loopBody(n.child, row, width);
            }

            @Override
            public Double visitPostTestLoop(PostTestLoop n) {
                double row = rowHeight(n.text, width);
                return loopBody(n.child, row, width) + row;
            }

            @Override
            public Double visitFunctionDef(FunctionDef n) {
                double row = rowHeight(functionHeader(n), width);
                return row + loopBody(n.child, row, width) + ROW_HEIGHT * FUNCTION_FOOTER_FACTOR;
            }

            @Override
            public Double visitTryCatch(TryCatch n) {
                double tryRow = rowHeight("Try", width);
                double catchRow = rowHeight(catchLabel(n), width);
                return tryRow + loopBody(n.tryChild, tryRow, width)
                        + catchRow + loopBody(n.catchChild, catchRow, width);
            }
        });
    }

    /** An indented body is never shorter than half of its header row. */
    private double loopBody(Node child, double row, double width) {
        return Math.max(measure(child, width - LOOP_INDENT), row * 0.5);
    }

    private double switchColumnsHeight(Switch n, double width) {
        int count = n.columnCount();
        double[] cols = columnWidths(width, count, n.columnWidths);
        double max = 0;
        for (int i = 0; i < n.cases.size(); i++) {
            max = Math.max(max, measure(n.cases.get(i), cols[i]));
        }
        if (n.defaultEnabled && n.defaultCase != null) {
            max = Math.max(max, measure(n.defaultCase, cols[count - 1]));
        }
        return max;
    }

    // ---- placing ----

    private final class Placement {
        private final List<Box> boxes = new ArrayList<>();
        private final List<LineSegment> lines = new ArrayList<>();
        private final List<TextLabel> labels = new ArrayList<>();

        LayoutResult result(double height) {
            return new LayoutResult(boxes, lines, labels, height);
        }

        void line(double x1, double y1, double x2, double y2) {
            lines.add(new LineSegment(x1, y1, x2, y2));
        }

        void label(String text, double x, double y, double height, double width, TextLabel.Anchor anchor) {
            labels.add(new TextLabel(wrap(text, width), x, y, height, options.getFontSize(), anchor));
        }

        void smallLabel(String text, double x, double y, double height, TextLabel.Anchor anchor) {
            labels.add(new TextLabel(Collections.singletonList(text == null ? "" : text), x, y, height,
                    options.getFontSize() * BRANCH_LABEL_FONT_FACTOR, anchor));
        }

        void box(Node node, double x, double y, double width, double height) {
            if (node.id() != null) {
                boxes.add(new Box(node.id(), node.typeName(), x, y, width, height));
            }
        }

        /** Places a chain and returns the height it occupies. */
        double chain(Node node, double x, double y, double width, Double availableHeight) {
            double natural = measure(node, width);
            double slack = availableHeight != null && availableHeight > natural ? availableHeight - natural : 0;
            if (node instanceof CaseLabel) {
                place(node, x, y, width, slack);
                return natural + slack;
            }
            Node last = lastContent(node);
            double offset = y;
            for (Node current = node; current != null; current = current.follow()) {
                offset += place(current, x, offset, width, current == last ? slack : 0);
            }
            return slack > 0 ? availableHeight : natural;
        }

        private Node lastContent(Node chain) {
            Node last = null;
            for (Node current = chain; current != null; current = current.follow()) {
                if (!Nodes.isMarker(current)) {
                    last = current;
                }
            }
            return last;
        }

        /** Places one node grown by {@code extra}; returns its height. */
        double place(Node node, double x, double y, double width, double extra) {
            return node.accept(new NodePlacer(x, y, width, extra));
        }

        private final class NodePlacer implements NodeVisitor<Double> {
            private final double x;
            private final double y;
            private final double width;
            private final double extra;

            NodePlacer(double x, double y, double width, double extra) {
                this.x = x;
                this.y = y;
                this.width = width;
                this.extra = extra;
            }

            @Override
            public Double visitInsertionPoint(InsertionPoint n) {
                double height = options.getInsertionPointHeight();
                box(n, x, y, width, height);
                return height;
            }

            @Override
            public Double visitEmptyMarker(EmptyMarker n) {
                return 0.0;
            }

            @Override
            public Double visitTask(Task n) {
                return leaf(n);
            }

            @Override
            public Double visitInput(Input n) {
                return leaf(n);
            }

            @Override
            public Double visitOutput(Output n) {
                return leaf(n);
            }

            private double leaf(Node n) {
                String text = leafLabel(n);
                double row = rowHeight(text, width);
                double height = row + extra;
                box(n, x, y, width, height);
                line(x, y, x + width, y);
                line(x, y, x, y + height);
                label(text, x + PADDING_X, y, row, width, TextLabel.Anchor.START);
                return height;
            }

            @Override
            public Double visitBranch(Branch n) {
                double condition = rowHeight(n.text, width);
                double slope = slopeHeight();
                double header = condition + 2 * slope;
                double[] cols = columnWidths(width, 2, n.columnWidths);
                double divider = x + cols[0];
                double slopeBottom = y + condition + slope;

                line(x, y, x + width, y);
                line(x, y, x, y + header);
                label(n.text, x + width / 2, y, condition, width, TextLabel.Anchor.MIDDLE);
                line(x, y + condition, divider, slopeBottom);
                line(x + width, y + condition, divider, slopeBottom);
                smallLabel(options.getTrueLabel(), x + PADDING_X, slopeBottom, slope, TextLabel.Anchor.START);
                smallLabel(options.getFalseLabel(), x + width - PADDING_X, slopeBottom, slope, TextLabel.Anchor.END);
                line(divider, slopeBottom, divider, y + header);

                double columns = Math.max(measure(n.trueChild, cols[0]), measure(n.falseChild, cols[1])) + extra;
                chain(n.trueChild, x, y + header, cols[0], columns);
                chain(n.falseChild, divider, y + header, cols[1], columns);
                line(divider, y + header, divider, y + header + columns);

                double height = header + columns;
                box(n, x, y, width, height);
                return height;
            }

            @Override
            public Double visitSwitch(Switch n) {
                int count = n.columnCount();
                double[] cols = columnWidths(width, count, n.columnWidths);
                double condition = rowHeight(n.text, width);
                double slope = slopeHeight();
                double header = condition + slope;

                line(x, y, x + width, y);
                line(x, y, x, y + header);
                label(n.text, x + width / 2, y, condition, width, TextLabel.Anchor.MIDDLE);

                double[] boundaries = new double[count + 1];
                for (int i = 0; i < count; i++) {
                    boundaries[i + 1] = boundaries[i] + cols[i];
                }
                if (n.defaultEnabled && count > 0) {
                    // Both diagonals meet at the boundary in front of the default column.
                    double lastBoundary = boundaries[count - 1];
                    line(x, y + condition, x + lastBoundary, y + header);
                    line(x + width, y + condition, x + lastBoundary, y + header);
                    for (int i = 1; i < count - 1; i++) {
                        double diagonalY = y + condition + slope * (boundaries[i] / lastBoundary);
                        line(x + boundaries[i], diagonalY, x + boundaries[i], y + header);
                    }
                } else if (count > 0) {
                    line(x, y + condition, x + width, y + header);
                    for (int i = 1; i < count; i++) {
                        double diagonalY = y + condition + slope * (boundaries[i] / width);
                        line(x + boundaries[i], diagonalY, x + boundaries[i], y + header);
                    }
                }

                double columns = switchColumnsHeight(n, width) + extra;
                double columnX = x;
                for (int i = 0; i < n.cases.size(); i++) {
                    chain(n.cases.get(i), columnX, y + header, cols[i], columns);
                    if (i > 0) {
                        line(columnX, y + header, columnX, y + header + columns);
                    }
                    columnX += cols[i];
                }
                if (n.defaultEnabled && n.defaultCase != null) {
                    chain(n.defaultCase, columnX, y + header, cols[count - 1], columns);
                    line(columnX, y + header, columnX, y + header + columns);
                }

                double height = header + columns;
                box(n, x, y, width, height);
                return height;
            }

            @Override
            public Double visitCaseLabel(CaseLabel n) {
                double row = rowHeight(n.text, width);
                line(x, y, x, y + row);
                label(n.text, x + PADDING_X, y, row, width, TextLabel.Anchor.START);
                double body = measure(n.followElement, width) + extra;
                chain(n.followElement, x, y + row, width, body);
                double height = row + body;
                box(n, x, y, width, height);
                return height;
            }

            @Override
            public Double visitPreTestLoop(PreTestLoop n) {
                return headLoop(n, n.text, n.child);
            }

            @Override
            public Double visitCountLoop(CountLoop n) {
                return headLoop(n, n.text, n.child);
            }

            private double headLoop(Node n, String text, Node child) {
                double row = rowHeight(text, width);
                line(x, y, x + width, y);
                line(x, y, x, y + row);
                label(text, x + PADDING_X, y, row, width, TextLabel.Anchor.START);
                double body = indentedBody(child, y + row, row);
                double height = row + body;
                box(n, x, y, width, height);
                return height;
            }

            /** Places an indented body below {@code top}; the grown part goes to the body. */
            private double indentedBody(Node child, double top, double row) {
                double body = loopBody(child, row, width) + extra;
                line(x, top, x, top + body);
                line(x + LOOP_INDENT, top, x + LOOP_INDENT, top + body);
                chain(child, x + LOOP_INDENT, top, width - LOOP_INDENT, body);
                return body;
            }

            @Override
            public Double visitPostTestLoop(PostTestLoop n) {
                double row = rowHeight(n.text, width);
                line(x, y, x + width, y);
                double body = indentedBody(n.child, y, row);
                double footer = y + body;
                line(x + LOOP_INDENT, footer, x + width, footer);
                line(x, footer, x, footer + row);
                label(n.text, x + PADDING_X, footer, row, width, TextLabel.Anchor.START);
                double height = body + row;
                box(n, x, y, width, height);
                return height;
            }

            @Override
            public Double visitFunctionDef(FunctionDef n) {
                String header = functionHeader(n);
                double row = rowHeight(header, width);
                line(x, y, x + width, y);
                line(x, y, x, y + row);
                label(header, x + PADDING_X, y, row, width, TextLabel.Anchor.START);
                double body = indentedBody(n.child, y + row, row);

                double footerTop = y + row + body;
                double footer = ROW_HEIGHT * FUNCTION_FOOTER_FACTOR;
                line(x + LOOP_INDENT, footerTop, x + width, footerTop);
                line(x, footerTop, x, footerTop + footer);
                labels.add(new TextLabel(List.of("}"), x + PADDING_X, footerTop, footer,
                        options.getFontSize(), TextLabel.Anchor.START));

                double height = row + body + footer;
                box(n, x, y, width, height);
                return height;
            }

            @Override
            public Double visitTryCatch(TryCatch n) {
                double tryRow = rowHeight("Try", width);
                line(x, y, x + width, y);
                line(x, y, x, y + tryRow);
                label("Try", x + PADDING_X, y, tryRow, width, TextLabel.Anchor.START);
                double tryBody = loopBody(n.tryChild, tryRow, width);
                double tryTop = y + tryRow;
                line(x, tryTop, x, tryTop + tryBody);
                line(x + LOOP_INDENT, tryTop, x + LOOP_INDENT, tryTop + tryBody);
                chain(n.tryChild, x + LOOP_INDENT, tryTop, width - LOOP_INDENT, tryBody);

                double catchTop = tryTop + tryBody;
                String catchText = catchLabel(n);
                double catchRow = rowHeight(catchText, width);
                line(x + LOOP_INDENT, catchTop, x + width, catchTop);
                line(x, catchTop, x, catchTop + catchRow);
                label(catchText, x + PADDING_X, catchTop, catchRow, width, TextLabel.Anchor.START);
                double catchBody = indentedBody(n.catchChild, catchTop + catchRow, catchRow);
                double bottom = catchTop + catchRow + catchBody;
                line(x, bottom, x + LOOP_INDENT, bottom);

                double height = tryRow + tryBody + catchRow + catchBody;
                box(n, x, y, width, height);
                return height;
            }
        }
    }
}
