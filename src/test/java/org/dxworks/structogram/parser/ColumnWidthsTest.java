package org.dxworks.structogram.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class ColumnWidthsTest {

    @Test
    void extract_SplitsSuffix() {
        ColumnWidths header = ColumnWidths.extract("x > 0 [0.7, 0.3]");

        assertEquals("x > 0", header.text);
        assertEquals(List.of(0.7, 0.3), header.widths);
    }

    @Test
    void extract_WithoutSuffix() {
        ColumnWidths header = ColumnWidths.extract("list[i] > 0");

        assertEquals("list[i] > 0", header.text);
        assertNull(header.widths);
    }

    @Test
    void extract_KeepsLeadingNumberOfEachToken() {
        ColumnWidths header = ColumnWidths.extract("x [.5, 0.25., 1]");

        assertEquals("x", header.text);
        assertEquals(List.of(0.5, 0.25, 1.0), header.widths);
    }
}
