package org.dxworks.structogram.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * A significant pseudocode line: its trimmed text and the column its content starts at.
 */
final class SourceLine {

    static final int INDENT_UNIT = 4;
    private static final String TAB_AS_SPACES = " ".repeat(INDENT_UNIT);

    final String text;
    final int indent;
    final int lineNumber;

    SourceLine(String text, int indent, int lineNumber) {
        this.text = text;
        this.indent = indent;
        this.lineNumber = lineNumber;
    }

    /**
     * Splits source text into significant lines. Blank lines and {@code #} comments are dropped,
     * tabs count as one indent unit.
     */
    static List<SourceLine> tokenize(String source) {
        List<SourceLine> lines = new ArrayList<>();
        if (source == null) return lines;
        String[] rawLines = source.split("\r?\n", -1);
        for (int i = 0; i < rawLines.length; i++) {
            String content = rawLines[i].strip();
            if (content.isEmpty() || content.startsWith("#")) continue;
            String expanded = rawLines[i].replace("\t", TAB_AS_SPACES);
            int indent = expanded.length() - expanded.stripLeading().length();
            lines.add(new SourceLine(content, indent, i + 1));
        }
        return lines;
    }

    @Override
    public String toString() {
        return lineNumber + ": " + text;
    }
}
