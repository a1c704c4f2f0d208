package org.dxworks.structogram.parser;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class KeywordMapTest {

    @Test
    void forDialect_FallsBackToEnglish() {
        assertSame(KeywordMap.GERMAN, KeywordMap.forDialect(" DE "));
        assertSame(KeywordMap.ENGLISH, KeywordMap.forDialect("fr"));
        assertSame(KeywordMap.ENGLISH, KeywordMap.forDialect(null));
    }

    @Test
    void of_RequiresEveryKeyword() {
        Map<String, String> keywords = new HashMap<>(KeywordMap.ENGLISH.asMap());
        keywords.remove("catch");
        keywords.put("try", " ");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> KeywordMap.of(keywords));
        assertEquals("Keyword map is missing: try, catch", e.getMessage());
    }

    @Test
    void withOverrides_IgnoresUnknownAndBlankKeys() {
        KeywordMap custom = KeywordMap.ENGLISH.withOverrides(Map.of("if", " wenn ", "else", "", "loop", "x"));

        assertEquals("wenn", custom.ifKeyword());
        assertEquals("else", custom.elseKeyword());
        assertEquals("if", KeywordMap.ENGLISH.ifKeyword());
    }

    @Test
    void get_UnknownKeyword() {
        assertThrows(IllegalArgumentException.class, () -> KeywordMap.ENGLISH.get("goto"));
    }

    @Test
    void labels() {
        assertEquals("Wahr", KeywordMap.GERMAN.trueLabel());
        assertEquals("Falsch", KeywordMap.GERMAN.falseLabel());
        assertEquals("Default", KeywordMap.ENGLISH.defaultLabel());
    }
}
