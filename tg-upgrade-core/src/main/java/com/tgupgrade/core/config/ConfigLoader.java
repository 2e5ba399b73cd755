package com.tgupgrade.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link UpgradeConfig} from YAML files.
 *
 * <p>A missing, unreadable or invalid file yields {@link UpgradeConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * UpgradeConfig config = ConfigLoader.load(Paths.get("tgupgrade.yaml"));
 * String sourceName = config.files().source();
 * }</pre>
 */
public class ConfigLoader {

    /** File name looked up in the working directory when no file is given. */
    public static final String DEFAULT_FILE_NAME = "tgupgrade.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code tgupgrade.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static UpgradeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return UpgradeConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return UpgradeConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            UpgradeConfig config = YAML_MAPPER.readValue(configPath.toFile(), UpgradeConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return UpgradeConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return UpgradeConfig.defaults();
        }
    }
}
