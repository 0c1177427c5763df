package com.templateweaver.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading Template Weaver configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code template-weaver.yaml} into {@link WeaverConfig}.
 * If the config file is missing or invalid, returns {@link WeaverConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * WeaverConfig config = ConfigLoader.load(Paths.get("template-weaver.yaml"));
 *
 * if (config.validation().failOnDirectiveErrors()) {
 *     // directive violations abort processing
 * }
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "template-weaver.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist, can't be parsed or names an unknown parser format,
     * logs a warning and returns {@link WeaverConfig#defaults()}.
     *
     * @param configPath path to {@code template-weaver.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static WeaverConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return WeaverConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return WeaverConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            WeaverConfig config = YAML_MAPPER.readValue(configPath.toFile(), WeaverConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return WeaverConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return WeaverConfig.defaults();
        }
    }
}
