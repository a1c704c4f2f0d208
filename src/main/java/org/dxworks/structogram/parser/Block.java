package org.dxworks.structogram.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * A header line together with every deeper-indented line below it.
 */
final class Block {

    private static final Logger LOGGER = LoggerFactory.getLogger(Block.class);

    final SourceLine header;
    final List<SourceLine> children;

    private Block(SourceLine header, List<SourceLine> children) {
        this.header = header;
        this.children = children;
    }

    String text() {
        return header.text;
    }

    /**
     * Partitions {@code lines} into sibling blocks at {@code baseIndent}. Lines deeper than the
     * base indent that precede the first block have no owner and are skipped.
     */
    static List<Block> group(List<SourceLine> lines, int baseIndent) {
        List<Block> blocks = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            SourceLine line = lines.get(i);
            if (line.indent < baseIndent) break;
            if (line.indent > baseIndent) {
                LOGGER.debug("Skipping line without an enclosing block: {}", line);
                i++;
                continue;
            }
            List<SourceLine> children = new ArrayList<>();
            i++;
            while (i < lines.size() && lines.get(i).indent > baseIndent) {
                children.add(lines.get(i));
                i++;
            }
            blocks.add(new Block(line, children));
        }
        return blocks;
    }

    /**
     * Indent of the first nesting level below a block: the shallowest child line, or one unit
     * deeper than {@code parentIndent} when the block has no children.
     */
    static int childIndent(List<SourceLine> children, int parentIndent) {
        int min = Integer.MAX_VALUE;
        for (SourceLine child : children) {
            min = Math.min(min, child.indent);
        }
        return min == Integer.MAX_VALUE ? parentIndent + SourceLine.INDENT_UNIT : min;
    }
}
