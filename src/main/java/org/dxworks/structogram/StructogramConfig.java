package org.dxworks.structogram;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.structogram.generator.CodeTemplate;
import org.dxworks.structogram.generator.LanguageRegistry;
import org.dxworks.structogram.layout.LayoutOptions;
import org.dxworks.structogram.parser.KeywordMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class StructogramConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(StructogramConfig.class);

    private static final String CONFIG_FILE_NAME = "structogram-config.yml";
    private static final int DEFAULT_WIDTH = 600;
    private static final double DEFAULT_FONT_SIZE = LayoutOptions.DEFAULT_FONT_SIZE;
    private static final double DEFAULT_INSERTION_POINT_HEIGHT = LayoutOptions.DEFAULT_INSERTION_POINT_HEIGHT;
    private static final String DEFAULT_KEYWORDS = "en";
    private static final String DEFAULT_LANGUAGE = Language.PYTHON.getName();

    private final int width;
    private final double fontSize;
    private final double insertionPointHeight;
    private final KeywordMap keywords;
    private final String defaultLanguage;
    private final Map<String, CodeTemplate> languages;

    private StructogramConfig(int width, double fontSize, double insertionPointHeight, KeywordMap keywords,
                              String defaultLanguage, Map<String, CodeTemplate> languages) {
        this.width = width;
        this.fontSize = fontSize;
        this.insertionPointHeight = insertionPointHeight;
        this.keywords = keywords;
        this.defaultLanguage = defaultLanguage;
        this.languages = Collections.unmodifiableMap(new LinkedHashMap<>(languages));
    }

    public int getWidth() {
        return width;
    }

    public double getFontSize() {
        return fontSize;
    }

    public double getInsertionPointHeight() {
        return insertionPointHeight;
    }

    public KeywordMap getKeywords() {
        return keywords;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    /** Code templates declared in the configuration, by language identifier. */
    public Map<String, CodeTemplate> getLanguages() {
        return languages;
    }

    public LayoutOptions layoutOptions() {
        return new LayoutOptions(fontSize, insertionPointHeight, keywords.trueLabel(), keywords.falseLabel());
    }

    /** Built-in templates plus the configured ones; configured templates win on a name clash. */
    public LanguageRegistry languageRegistry() {
        LanguageRegistry registry = LanguageRegistry.builtins();
        languages.forEach(registry::register);
        return registry;
    }

    public static StructogramConfig defaults() {
        return new StructogramConfig(DEFAULT_WIDTH, DEFAULT_FONT_SIZE, DEFAULT_INSERTION_POINT_HEIGHT,
                KeywordMap.ENGLISH, DEFAULT_LANGUAGE, Map.of());
    }

    /** Loads {@code structogram-config.yml} from the working directory. */
    public static StructogramConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static StructogramConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    private static StructogramConfig fromYaml(YamlConfig yaml) {
        int effectiveWidth = (yaml.width != null && yaml.width > 0) ? yaml.width : DEFAULT_WIDTH;
        double effectiveFontSize = (yaml.fontSize != null && yaml.fontSize > 0) ? yaml.fontSize : DEFAULT_FONT_SIZE;
        double effectiveInsertionPointHeight = (yaml.insertionPointHeight != null && yaml.insertionPointHeight >= 0)
                ? yaml.insertionPointHeight
                : DEFAULT_INSERTION_POINT_HEIGHT;
        String dialect = yaml.keywords != null ? yaml.keywords : DEFAULT_KEYWORDS;
        KeywordMap keywords = KeywordMap.forDialect(dialect);
        if (yaml.customKeywords != null) {
            keywords = keywords.withOverrides(yaml.customKeywords);
        }
        String effectiveLanguage = (yaml.defaultLanguage != null && !yaml.defaultLanguage.isBlank())
                ? yaml.defaultLanguage.trim()
                : DEFAULT_LANGUAGE;
        Map<String, CodeTemplate> languages = yaml.languages != null ? yaml.languages : Map.of();
        return new StructogramConfig(effectiveWidth, effectiveFontSize, effectiveInsertionPointHeight,
                keywords, effectiveLanguage, languages);
    }

    public static StructogramConfig with(int width, double fontSize, KeywordMap keywords, String defaultLanguage) {
        int effectiveWidth = width > 0 ? width : DEFAULT_WIDTH;
        double effectiveFontSize = fontSize > 0 ? fontSize : DEFAULT_FONT_SIZE;
        return new StructogramConfig(effectiveWidth, effectiveFontSize, DEFAULT_INSERTION_POINT_HEIGHT,
                keywords != null ? keywords : KeywordMap.ENGLISH,
                defaultLanguage != null ? defaultLanguage : DEFAULT_LANGUAGE, Map.of());
    }

    private static class YamlConfig {
        public Integer width;
        public Double fontSize;
        public Double insertionPointHeight;
        public String keywords;
        public Map<String, String> customKeywords;
        public String defaultLanguage;
        public Map<String, CodeTemplate> languages;
    }
}
