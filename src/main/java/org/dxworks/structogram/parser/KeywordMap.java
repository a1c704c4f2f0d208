package org.dxworks.structogram.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The literal tokens of a pseudocode dialect.
 * <p>
 * Keys are {@code if, else, repeat, while, for, switch, case, function, try, catch, input,
 * output, true, false, default}. {@code true} and {@code false} label the branch columns of a
 * diagram; {@code default} is the label given to a parsed default case.
 */
public final class KeywordMap {

    public static final List<String> KEYS = List.of(
            "if", "else", "repeat", "while", "for", "switch", "case", "function",
            "try", "catch", "input", "output", "true", "false", "default");

    public static final KeywordMap ENGLISH = of(entries(
            "if", "if", "else", "else",
            "repeat", "repeat", "while", "while", "for", "for",
            "switch", "switch", "case", "case",
            "function", "function",
            "try", "try", "catch", "catch",
            "input", "input", "output", "output",
            "true", "True", "false", "False",
            "default", "Default"));

    public static final KeywordMap GERMAN = of(entries(
            "if", "falls", "else", "sonst",
            "repeat", "wiederhole", "while", "solange", "for", "für",
            "switch", "unterscheide", "case", "fall",
            "function", "funktion",
            "try", "versuche", "catch", "fange",
            "input", "eingabe", "output", "ausgabe",
            "true", "Wahr", "false", "Falsch",
            "default", "Sonst"));

    private final Map<String, String> keywords;

    private KeywordMap(Map<String, String> keywords) {
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    /**
     * Builds a fully custom map. Every key in {@link #KEYS} must be present and non-blank.
     */
    public static KeywordMap of(Map<String, String> keywords) {
        List<String> missing = new ArrayList<>();
        for (String key : KEYS) {
            String value = keywords.get(key);
            if (value == null || value.isBlank()) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Keyword map is missing: " + String.join(", ", missing));
        }
        Map<String, String> trimmed = new LinkedHashMap<>();
        for (String key : KEYS) {
            trimmed.put(key, keywords.get(key).trim());
        }
        return new KeywordMap(trimmed);
    }

    /** Returns the built-in map for {@code "en"} or {@code "de"}; anything else yields English. */
    public static KeywordMap forDialect(String dialect) {
        if (dialect != null && dialect.trim().equalsIgnoreCase("de")) {
            return GERMAN;
        }
        return ENGLISH;
    }

    /** Returns a copy with the given keywords replaced; unknown keys are ignored. */
    public KeywordMap withOverrides(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(keywords);
        overrides.forEach((key, value) -> {
            if (merged.containsKey(key) && value != null && !value.isBlank()) {
                merged.put(key, value);
            }
        });
        return of(merged);
    }

    public String get(String key) {
        String value = keywords.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown keyword: " + key);
        }
        return value;
    }

    public String ifKeyword() { return keywords.get("if"); }
    public String elseKeyword() { return keywords.get("else"); }
    public String repeatKeyword() { return keywords.get("repeat"); }
    public String whileKeyword() { return keywords.get("while"); }
    public String forKeyword() { return keywords.get("for"); }
    public String switchKeyword() { return keywords.get("switch"); }
    public String caseKeyword() { return keywords.get("case"); }
    public String functionKeyword() { return keywords.get("function"); }
    public String tryKeyword() { return keywords.get("try"); }
    public String catchKeyword() { return keywords.get("catch"); }
    public String inputKeyword() { return keywords.get("input"); }
    public String outputKeyword() { return keywords.get("output"); }
    public String trueLabel() { return keywords.get("true"); }
    public String falseLabel() { return keywords.get("false"); }
    public String defaultLabel() { return keywords.get("default"); }

    public Map<String, String> asMap() {
        return keywords;
    }

    private static Map<String, String> entries(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
