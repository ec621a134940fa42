package im.arun.pathtree.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "pathtree.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final PathTreeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private PathTreeConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), PathTreeConfig.class);
                }
                logger.warn("Config file {} not found, falling back to {}", configPath, DEFAULT_RESOURCE);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, PathTreeConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new PathTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new PathTreeConfig();
        }
    }

    public PathTreeConfig load() {
        return load(null);
    }

    public PathTreeConfig load(Map<String, Object> userOptions) {
        PathTreeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            // a bad separator from the YAML file must fail here, not mid-scan
            config.separatorChar();
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "separator":
                    if (value instanceof String) config.setSeparator((String) value);
                    break;
                case "follow_links":
                case "followLinks":
                    config.setFollowLinks(parseBoolean(value));
                    break;
                case "skip_hidden":
                case "skipHidden":
                    config.setSkipHidden(parseBoolean(value));
                    break;
                case "fail_on_access_denied":
                case "failOnAccessDenied":
                    config.setFailOnAccessDenied(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        // fail fast on a separator the tree cannot use
        config.separatorChar();
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

    private PathTreeConfig copyConfig(PathTreeConfig source) {
        PathTreeConfig copy = new PathTreeConfig();
        copy.setSeparator(source.getSeparator());
        copy.setFollowLinks(source.isFollowLinks());
        copy.setSkipHidden(source.isSkipHidden());
        copy.setFailOnAccessDenied(source.isFailOnAccessDenied());
        return copy;
    }
}
