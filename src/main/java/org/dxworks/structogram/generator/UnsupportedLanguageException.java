package org.dxworks.structogram.generator;

import java.util.List;

/**
 * Raised when code is requested for a target language that has no template.
 */
public class UnsupportedLanguageException extends IllegalArgumentException {

    private final String language;
    private final List<String> supported;

    public UnsupportedLanguageException(String language, List<String> supported) {
        super("Unsupported language: " + language + ". Supported: " + String.join(", ", supported));
        this.language = language;
        this.supported = List.copyOf(supported);
    }

    public String getLanguage() {
        return language;
    }

    public List<String> getSupported() {
        return supported;
    }
}
