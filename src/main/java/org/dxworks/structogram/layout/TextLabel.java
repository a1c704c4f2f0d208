package org.dxworks.structogram.layout;

import java.util.List;

/**
 * Text to draw inside a row. {@code x} is the anchor position; the lines are meant to be
 * centered vertically within {@code y .. y + height}.
 */
public final class TextLabel {

    public enum Anchor { START, MIDDLE, END }

    public final List<String> lines;
    public final double x;
    public final double y;
    public final double height;
    public final double fontSize;
    public final Anchor anchor;

    public TextLabel(List<String> lines, double x, double y, double height, double fontSize, Anchor anchor) {
        this.lines = List.copyOf(lines);
        this.x = x;
        this.y = y;
        this.height = height;
        this.fontSize = fontSize;
        this.anchor = anchor;
    }

    public String text() {
        return String.join("\n", lines);
    }
}
