package org.dxworks.structogram.serializer;

import org.dxworks.structogram.model.Branch;
import org.dxworks.structogram.model.CaseLabel;
import org.dxworks.structogram.model.CountLoop;
import org.dxworks.structogram.model.EmptyMarker;
import org.dxworks.structogram.model.FunctionDef;
import org.dxworks.structogram.model.Input;
import org.dxworks.structogram.model.InsertionPoint;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.NodeVisitor;
import org.dxworks.structogram.model.Output;
import org.dxworks.structogram.model.PostTestLoop;
import org.dxworks.structogram.model.PreTestLoop;
import org.dxworks.structogram.model.Switch;
import org.dxworks.structogram.model.Task;
import org.dxworks.structogram.model.TryCatch;
import org.dxworks.structogram.parser.KeywordMap;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes a tree back as pseudocode, using the same keywords, colons and column-width suffixes
 * the parser reads. Lines are joined with {@code \n} and carry no trailing newline.
 */
public class PseudocodeSerializer {

    private static final String INDENT = "    ";

    private final KeywordMap keywords;

    public PseudocodeSerializer() {
        this(KeywordMap.ENGLISH);
    }

    public PseudocodeSerializer(KeywordMap keywords) {
        this.keywords = keywords;
    }

    public static String serialize(Node tree, KeywordMap keywords) {
        return new PseudocodeSerializer(keywords).serialize(tree);
    }

    public String serialize(Node tree) {
        List<String> lines = new ArrayList<>();
        write(tree, 0, lines);
        return String.join("\n", lines);
    }

    private void write(Node node, int level, List<String> lines) {
        if (node != null) {
            node.accept(new LineWriter(level, lines));
        }
    }

    private static String columnWidthSuffix(List<Double> widths) {
        if (widths == null || widths.isEmpty()) return "";
        return " [" + widths.stream().map(PseudocodeSerializer::formatNumber)
                .collect(Collectors.joining(", ")) + "]";
    }

    /**
     * Plain decimal notation, never exponents: {@code 1} rather than {@code 1.0},
     * {@code 0.0005} rather than {@code 5.0E-4}.
     */
    static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String text(Node node) {
        return node.text() == null ? "" : node.text();
    }

    private final class LineWriter implements NodeVisitor<Void> {
        private final int level;
        private final List<String> lines;
        private final String indent;

        LineWriter(int level, List<String> lines) {
            this.level = level;
            this.lines = lines;
            this.indent = INDENT.repeat(level);
        }

        private Void next(Node node) {
            write(node.follow(), level, lines);
            return null;
        }

        @Override
        public Void visitInsertionPoint(InsertionPoint node) {
            return next(node);
        }

        @Override
        public Void visitEmptyMarker(EmptyMarker node) {
            return null;
        }

        @Override
        public Void visitTask(Task node) {
            lines.add(indent + text(node));
            return next(node);
        }

        @Override
        public Void visitInput(Input node) {
            lines.add(indent + keywords.inputKeyword() + "(\"" + text(node) + "\")");
            return next(node);
        }

        @Override
        public Void visitOutput(Output node) {
            lines.add(indent + keywords.outputKeyword() + "(\"" + text(node) + "\")");
            return next(node);
        }

        @Override
        public Void visitBranch(Branch node) {
            lines.add(indent + keywords.ifKeyword() + " " + text(node) + columnWidthSuffix(node.columnWidths) + ":");
            write(node.trueChild, level + 1, lines);
            lines.add(indent + keywords.elseKeyword() + ":");
            write(node.falseChild, level + 1, lines);
            return next(node);
        }

        @Override
        public Void visitSwitch(Switch node) {
            lines.add(indent + keywords.switchKeyword() + " " + text(node) + columnWidthSuffix(node.columnWidths) + ":");
            for (CaseLabel caseLabel : node.cases) {
                write(caseLabel, level + 1, lines);
            }
            if (node.defaultEnabled && node.defaultCase != null) {
                lines.add(INDENT.repeat(level + 1) + keywords.elseKeyword() + ":");
                write(node.defaultCase.followElement, level + 2, lines);
            }
            return next(node);
        }

        @Override
        public Void visitCaseLabel(CaseLabel node) {
            lines.add(indent + keywords.caseKeyword() + " " + text(node) + ":");
            write(node.followElement, level + 1, lines);
            return null;
        }

        @Override
        public Void visitPreTestLoop(PreTestLoop node) {
            lines.add(indent + keywords.repeatKeyword() + " " + keywords.whileKeyword() + " " + text(node) + ":");
            write(node.child, level + 1, lines);
            return next(node);
        }

        @Override
        public Void visitCountLoop(CountLoop node) {
            lines.add(indent + keywords.repeatKeyword() + " " + keywords.forKeyword() + " " + text(node) + ":");
            write(node.child, level + 1, lines);
            return next(node);
        }

        @Override
        public Void visitPostTestLoop(PostTestLoop node) {
            lines.add(indent + keywords.repeatKeyword() + ":");
            write(node.child, level + 1, lines);
            lines.add(indent + keywords.whileKeyword() + " " + text(node));
            return next(node);
        }

        @Override
        public Void visitFunctionDef(FunctionDef node) {
            lines.add(indent + keywords.functionKeyword() + " " + text(node) + "(" + node.parameterList() + "):");
            write(node.child, level + 1, lines);
            return next(node);
        }

        @Override
        public Void visitTryCatch(TryCatch node) {
            lines.add(indent + keywords.tryKeyword() + ":");
            write(node.tryChild, level + 1, lines);
            lines.add(indent + keywords.catchKeyword() + " " + text(node) + ":");
            write(node.catchChild, level + 1, lines);
            return next(node);
        }
    }
}
