package org.dxworks.structogram;

/**
 * Target languages with a built-in code template.
 */
public enum Language {
    PYTHON("python", ".py"),
    JAVA("java", ".java"),
    JAVASCRIPT("javascript", ".js");

    private final String name;
    private final String extension;

    Language(String name, String extension) {
        this.name = name;
        this.extension = extension;
    }

    public String getName() {
        return name;
    }

    public String getExtension() {
        return extension;
    }
}
