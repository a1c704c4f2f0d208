package org.dxworks.structogram.layout;

/**
 * Presentation settings of the layout engine.
 */
public class LayoutOptions {

    public static final double DEFAULT_FONT_SIZE = 14;
    public static final double DEFAULT_INSERTION_POINT_HEIGHT = 0;
    public static final String DEFAULT_TRUE_LABEL = "True";
    public static final String DEFAULT_FALSE_LABEL = "False";

    private final double fontSize;
    private final double insertionPointHeight;
    private final String trueLabel;
    private final String falseLabel;

    public LayoutOptions(double fontSize, double insertionPointHeight, String trueLabel, String falseLabel) {
        if (fontSize <= 0) {
            throw new IllegalArgumentException("Font size must be positive: " + fontSize);
        }
        if (insertionPointHeight < 0) {
            throw new IllegalArgumentException("Insertion point height must not be negative: " + insertionPointHeight);
        }
        this.fontSize = fontSize;
        this.insertionPointHeight = insertionPointHeight;
        this.trueLabel = trueLabel;
        this.falseLabel = falseLabel;
    }

    public static LayoutOptions defaults() {
        return new LayoutOptions(DEFAULT_FONT_SIZE, DEFAULT_INSERTION_POINT_HEIGHT, DEFAULT_TRUE_LABEL, DEFAULT_FALSE_LABEL);
    }

    public double getFontSize() {
        return fontSize;
    }

    public double getInsertionPointHeight() {
        return insertionPointHeight;
    }

    public String getTrueLabel() {
        return trueLabel;
    }

    public String getFalseLabel() {
        return falseLabel;
    }
}
