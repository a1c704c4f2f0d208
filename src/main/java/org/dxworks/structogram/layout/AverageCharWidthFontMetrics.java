package org.dxworks.structogram.layout;

/**
 * Approximates text width as a fixed fraction of the font size per character, which is close
 * enough for proportional sans-serif fonts when no rendering surface is available.
 */
public class AverageCharWidthFontMetrics implements FontMetrics {

    public static final double DEFAULT_CHAR_WIDTH_FACTOR = 0.6;

    private final double charWidthFactor;

    public AverageCharWidthFontMetrics() {
        this(DEFAULT_CHAR_WIDTH_FACTOR);
    }

    public AverageCharWidthFontMetrics(double charWidthFactor) {
        if (charWidthFactor <= 0) {
            throw new IllegalArgumentException("Character width factor must be positive: " + charWidthFactor);
        }
        this.charWidthFactor = charWidthFactor;
    }

    @Override
    public double textWidth(String text, double fontSize) {
        if (text == null || text.isEmpty()) return 0;
        return text.codePointCount(0, text.length()) * fontSize * charWidthFactor;
    }
}
