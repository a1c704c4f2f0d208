package org.dxworks.structogram.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word wrapping. Explicit newlines always break; a single word wider than the line
 * stays on a line of its own.
 */
public final class TextWrapper {

    private TextWrapper() {
        // utility class
    }

    /** Wrapped lines of {@code text}; never empty, an absent text gives one empty line. */
    public static List<String> wrap(String text, double maxWidth, double fontSize, FontMetrics metrics) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            lines.add("");
            return lines;
        }
        for (String paragraph : text.split("\n", -1)) {
            if (paragraph.isEmpty() || metrics.textWidth(paragraph, fontSize) <= maxWidth) {
                lines.add(paragraph);
                continue;
            }
            String current = "";
            for (String word : paragraph.split("\\s+")) {
                String candidate = current.isEmpty() ? word : current + " " + word;
                if (metrics.textWidth(candidate, fontSize) > maxWidth && !current.isEmpty()) {
                    lines.add(current);
                    current = word;
                } else {
                    current = candidate;
                }
            }
            if (!current.isEmpty()) {
                lines.add(current);
            }
        }
        if (lines.isEmpty()) {
            lines.add("");
        }
        return lines;
    }
}
