package org.dxworks.structogram.layout;

/**
 * Measures rendered text width.
 */
public interface FontMetrics {

    double textWidth(String text, double fontSize);
}
