package org.dxworks.structogram.generator;

import org.dxworks.structogram.Language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Code templates by language identifier. Identifiers are matched case-insensitively.
 */
public class LanguageRegistry {

    private final Map<String, CodeTemplate> templates = new TreeMap<>();

    /** A registry holding the templates of every {@link Language}. */
    public static LanguageRegistry builtins() {
        LanguageRegistry registry = new LanguageRegistry();
        for (Language lang : Language.values()) {
            registry.register(lang.getName(), createTemplate(lang));
        }
        return registry;
    }

    private static CodeTemplate createTemplate(Language lang) {
        return switch (lang) {
            case PYTHON -> CodeTemplate.python();
            case JAVA -> CodeTemplate.java();
            case JAVASCRIPT -> CodeTemplate.javascript();
        };
    }

    /** Adds or replaces the template for {@code language}. */
    public LanguageRegistry register(String language, CodeTemplate template) {
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("Language identifier must not be blank");
        }
        if (template == null) {
            throw new IllegalArgumentException("Template for " + language + " must not be null");
        }
        templates.put(normalize(language), template);
        return this;
    }

    public CodeTemplate get(String language) {
        CodeTemplate template = language == null ? null : templates.get(normalize(language));
        if (template == null) {
            throw new UnsupportedLanguageException(language, supportedLanguages());
        }
        return template;
    }

    public boolean supports(String language) {
        return language != null && templates.containsKey(normalize(language));
    }

    /** Registered identifiers in alphabetical order. */
    public List<String> supportedLanguages() {
        return Collections.unmodifiableList(new ArrayList<>(templates.keySet()));
    }

    private static String normalize(String language) {
        return language.trim().toLowerCase(Locale.ROOT);
    }
}
