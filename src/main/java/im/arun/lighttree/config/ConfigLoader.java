package im.arun.lighttree.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.lighttree.tree.LineStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads display defaults from {@code lighttree.yaml}: an explicit file when given and present,
 * else the classpath resource, else built-in defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String RESOURCE_NAME = "lighttree.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final LightTreeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private LightTreeConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), LightTreeConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, LightTreeConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", RESOURCE_NAME);
            return new LightTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new LightTreeConfig();
        }
    }

    public LightTreeConfig getDefaultConfig() {
        return copyConfig(defaultConfig);
    }

    /**
     * Defaults overridden by {@code userOptions}; both snake_case and camelCase keys are accepted.
     * Values of the wrong type are ignored with a warning.
     */
    public LightTreeConfig load(Map<String, Object> userOptions) {
        LightTreeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "path_separator":
                case "pathSeparator":
                    if (value instanceof String) config.setPathSeparator((String) value);
                    else ignored(key, value);
                    break;
                case "line_type":
                case "lineType":
                    if (value instanceof String) config.setLineType(LineStyle.of((String) value).getLabel());
                    else ignored(key, value);
                    break;
                case "line_max_length":
                case "lineMaxLength":
                    if (value instanceof Integer) config.setLineMaxLength((Integer) value);
                    else ignored(key, value);
                    break;
                case "key_delimiter":
                case "keyDelimiter":
                    if (value instanceof String) config.setKeyDelimiter((String) value);
                    else ignored(key, value);
                    break;
                case "display_key":
                case "displayKey":
                    config.setDisplayKey(parseBoolean(value));
                    break;
                case "limit":
                    if (value == null || value instanceof Integer) config.setLimit((Integer) value);
                    else ignored(key, value);
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private void ignored(String key, Object value) {
        logger.warn("Ignoring configuration key {}: unexpected value {}", key, value);
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

    private LightTreeConfig copyConfig(LightTreeConfig source) {
        LightTreeConfig copy = new LightTreeConfig();
        copy.setPathSeparator(source.getPathSeparator());
        copy.setLineType(source.getLineType());
        copy.setLineMaxLength(source.getLineMaxLength());
        copy.setKeyDelimiter(source.getKeyDelimiter());
        copy.setDisplayKey(source.isDisplayKey());
        copy.setLimit(source.getLimit());
        return copy;
    }
}
