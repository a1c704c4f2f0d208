package org.dxworks.structogram.layout;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TextWrapperTest {

    private static final FontMetrics ONE_PER_CHAR = (text, fontSize) -> text.length();

    @Test
    void wrap_ShortTextStaysOnOneLine() {
        assertEquals(List.of("a b c"), TextWrapper.wrap("a b c", 10, 14, ONE_PER_CHAR));
    }

    @Test
    void wrap_BreaksBetweenWords() {
        assertEquals(List.of("alpha", "beta", "gamma"), TextWrapper.wrap("alpha beta gamma", 8, 14, ONE_PER_CHAR));
    }

    @Test
    void wrap_LongWordKeepsItsOwnLine() {
        assertEquals(List.of("a", "extraordinary", "b"), TextWrapper.wrap("a extraordinary b", 5, 14, ONE_PER_CHAR));
    }

    @Test
    void wrap_ExplicitNewlinesAlwaysBreak() {
        assertEquals(List.of("x = 1", "", "y = 2"), TextWrapper.wrap("x = 1\n\ny = 2", 100, 14, ONE_PER_CHAR));
    }

    @Test
    void wrap_AbsentTextGivesOneEmptyLine() {
        assertEquals(List.of(""), TextWrapper.wrap(null, 100, 14, ONE_PER_CHAR));
        assertEquals(List.of(""), TextWrapper.wrap("", 100, 14, ONE_PER_CHAR));
    }

    @Test
    void averageCharWidth_CountsCodePoints() {
        AverageCharWidthFontMetrics metrics = new AverageCharWidthFontMetrics(0.5);

        assertEquals(10, metrics.textWidth("abcd\uD83D\uDE00", 4), 1e-9);
        assertEquals(0, metrics.textWidth(null, 4));
    }
}
