package com.seqdiag.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading {@link DiagramConfig} from YAML files.
 *
 * <p>If the config file is missing, unreadable or invalid, returns {@link DiagramConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DiagramConfig config = ConfigLoader.load(Paths.get("seqdiag.yaml"));
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code seqdiag.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static DiagramConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return DiagramConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return DiagramConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            DiagramConfig config = YAML_MAPPER.readValue(configPath.toFile(), DiagramConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return DiagramConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return DiagramConfig.defaults();
        }
    }
}
