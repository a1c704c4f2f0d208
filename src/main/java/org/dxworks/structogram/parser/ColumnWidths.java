package org.dxworks.structogram.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an optional trailing column-width list off a branch or switch header, e.g.
 * {@code "x > 0 [0.7, 0.3]"} becomes text {@code "x > 0"} with widths {@code [0.7, 0.3]}.
 */
final class ColumnWidths {

    private static final Pattern SUFFIX = Pattern.compile("^(.*?)\\s*\\[([0-9.,\\s]+)\\]\\s*$");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+\\.?\\d*|\\.\\d+)");

    final String text;
    final List<Double> widths; // null when absent

    private ColumnWidths(String text, List<Double> widths) {
        this.text = text;
        this.widths = widths;
    }

    static ColumnWidths extract(String header) {
        Matcher m = SUFFIX.matcher(header);
        if (!m.matches()) {
            return new ColumnWidths(header, null);
        }
        List<Double> widths = new ArrayList<>();
        for (String token : m.group(2).split(",")) {
            Double value = parseNumber(token.trim());
            if (value != null) {
                widths.add(value);
            }
        }
        return new ColumnWidths(m.group(1).trim(), widths.isEmpty() ? null : widths);
    }

    /** Parses the leading decimal number of a token; malformed tokens yield null. */
    private static Double parseNumber(String token) {
        Matcher m = LEADING_NUMBER.matcher(token);
        if (!m.find()) return null;
        try {
            return Double.parseDouble(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
