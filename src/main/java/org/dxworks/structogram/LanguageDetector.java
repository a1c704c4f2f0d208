package org.dxworks.structogram;

import java.nio.file.Path;
import java.util.Optional;

public class LanguageDetector {

    /** Target language implied by the extension of an output file. */
    public static Optional<Language> detectLanguage(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();

        if (fileName.endsWith(".java")) {
            return Optional.of(Language.JAVA);
        } else if (fileName.endsWith(".js") || fileName.endsWith(".mjs")) {
            return Optional.of(Language.JAVASCRIPT);
        } else if (fileName.endsWith(".py")) {
            return Optional.of(Language.PYTHON);
        }

        return Optional.empty();
    }

    /** True for files holding a JSON tree rather than pseudocode. */
    public static boolean isTreeJson(Path filePath) {
        return filePath.getFileName().toString().toLowerCase().endsWith(".json");
    }
}
