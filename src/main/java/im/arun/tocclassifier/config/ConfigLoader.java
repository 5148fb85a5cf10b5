package im.arun.tocclassifier.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "classifier.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ClassifierConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ClassifierConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return sanitize(yamlMapper.readValue(path.toFile(), ClassifierConfig.class));
                }
                logger.warn("Config file {} not found, falling back to bundled configuration", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return sanitize(yamlMapper.readValue(resourceStream, ClassifierConfig.class));
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new ClassifierConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ClassifierConfig();
        }
    }

    public ClassifierConfig load(Map<String, Object> userOptions) {
        ClassifierConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "short_document_max_pages":
                case "shortDocumentMaxPages":
                    parseInt(key, value).ifPresent(config::setShortDocumentMaxPages);
                    break;
                case "front_matter_divisor":
                case "frontMatterDivisor":
                    parseInt(key, value).ifPresent(config::setFrontMatterDivisor);
                    break;
                case "roman_min_run_length":
                case "romanMinRunLength":
                    parseInt(key, value).ifPresent(config::setRomanMinRunLength);
                    break;
                case "output_format":
                case "outputFormat":
                    config.setOutputFormat(String.valueOf(value).strip().toLowerCase(Locale.ROOT));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return sanitize(config);
    }

    public ClassifierConfig getDefaultConfig() {
        return copyConfig(defaultConfig);
    }

    private Optional<Integer> parseInt(String key, Object value) {
        if (value instanceof Number) {
            return Optional.of(((Number) value).intValue());
        }
        try {
            return Optional.of(Integer.parseInt(String.valueOf(value).strip()));
        } catch (NumberFormatException e) {
            logger.error("Error setting config key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replace values that would break the rules (zero divisor, empty runs) with the defaults.
     */
    private ClassifierConfig sanitize(ClassifierConfig config) {
        ClassifierConfig defaults = new ClassifierConfig();
        if (config.getFrontMatterDivisor() <= 0) {
            logger.warn("front_matter_divisor must be positive, using {}", defaults.getFrontMatterDivisor());
            config.setFrontMatterDivisor(defaults.getFrontMatterDivisor());
        }
        if (config.getRomanMinRunLength() <= 0) {
            logger.warn("roman_min_run_length must be positive, using {}", defaults.getRomanMinRunLength());
            config.setRomanMinRunLength(defaults.getRomanMinRunLength());
        }
        if (config.getShortDocumentMaxPages() < 0) {
            config.setShortDocumentMaxPages(0);
        }
        if (!"text".equals(config.getOutputFormat()) && !"json".equals(config.getOutputFormat())) {
            logger.warn("Unknown output format {}, using text", config.getOutputFormat());
            config.setOutputFormat(defaults.getOutputFormat());
        }
        return config;
    }

    private ClassifierConfig copyConfig(ClassifierConfig source) {
        ClassifierConfig copy = new ClassifierConfig();
        copy.setShortDocumentMaxPages(source.getShortDocumentMaxPages());
        copy.setFrontMatterDivisor(source.getFrontMatterDivisor());
        copy.setRomanMinRunLength(source.getRomanMinRunLength());
        copy.setOutputFormat(source.getOutputFormat());
        return copy;
    }
}
