package im.arun.htmldiff.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.htmldiff.diff.Granularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link HtmlDiffConfig} from YAML and merges per-invocation overrides into it.
 * Lookup order: explicit file, then {@code htmldiff.yaml} on the classpath, then built-in defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CLASSPATH_CONFIG = "htmldiff.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final HtmlDiffConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private HtmlDiffConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), HtmlDiffConfig.class);
                }
                logger.warn("Configuration file {} not found, trying classpath", configPath);
            }

            InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CLASSPATH_CONFIG);
            if (resourceStream != null) {
                try (InputStream in = resourceStream) {
                    return yamlMapper.readValue(in, HtmlDiffConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", CLASSPATH_CONFIG);
            return new HtmlDiffConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new HtmlDiffConfig();
        }
    }

    public HtmlDiffConfig getDefaultConfig() {
        return copyConfig(defaultConfig);
    }

    public HtmlDiffConfig load(Map<String, Object> userOptions) {
        HtmlDiffConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            try {
                switch (key) {
                    case "granularity":
                        if (value instanceof Granularity) {
                            config.setGranularity((Granularity) value);
                        } else {
                            config.setGranularity(Granularity.fromValue(value.toString()));
                        }
                        break;
                    case "container_fallback":
                    case "containerFallback":
                        config.setContainerFallback(parseBoolean(value));
                        break;
                    case "document_text_fallback":
                    case "documentTextFallback":
                        config.setDocumentTextFallback(parseBoolean(value));
                        break;
                    case "indent_output":
                    case "indentOutput":
                        config.setIndentOutput(parseBoolean(value));
                        break;
                    case "session_log":
                    case "sessionLog":
                        config.setSessionLog(parseBoolean(value));
                        break;
                    case "log_directory":
                    case "logDirectory":
                        if (value instanceof String) config.setLogDirectory((String) value);
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private HtmlDiffConfig copyConfig(HtmlDiffConfig source) {
        HtmlDiffConfig copy = new HtmlDiffConfig();
        copy.setGranularity(source.getGranularity());
        copy.setContainerFallback(source.isContainerFallback());
        copy.setDocumentTextFallback(source.isDocumentTextFallback());
        copy.setIndentOutput(source.isIndentOutput());
        copy.setSessionLog(source.isSessionLog());
        copy.setLogDirectory(source.getLogDirectory());
        return copy;
    }
}
