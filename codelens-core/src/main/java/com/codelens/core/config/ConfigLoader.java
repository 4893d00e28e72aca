package com.codelens.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link CodeLensConfig} from {@code codelens.yaml}.
 *
 * <p>Configuration problems never abort an analysis: a missing, unreadable, empty or
 * malformed file yields {@link CodeLensConfig#defaults()}. Sections and keys absent
 * from the file fall back to their own defaults.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeLensConfig config = ConfigLoader.load(Paths.get("codelens.yaml"));
 * if (!config.execution().enabled()) {
 *     // structure-only analysis
 * }
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Configuration file looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = "codelens.yaml";

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code codelens.yaml}
     * @return loaded configuration, or defaults when the file is unusable
     */
    public static CodeLensConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return CodeLensConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CodeLensConfig.defaults();
        }

        String yaml;
        try {
            yaml = Files.readString(configPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read configuration file {}: {}. Using defaults.", configPath, e.getMessage());
            return CodeLensConfig.defaults();
        }
        CodeLensConfig config = parse(yaml, configPath.toString());
        log.debug("Configuration from {}: execution={}, visualization={}, report={}",
            configPath, config.execution().enabled(), config.visualization().generator(), config.report().format());
        return config;
    }

    /**
     * Parses configuration from YAML text.
     *
     * @param yaml YAML document
     * @param origin where the text came from, for log messages
     * @return parsed configuration, or defaults for blank or malformed text
     */
    public static CodeLensConfig parse(String yaml, String origin) {
        if (yaml.isBlank()) {
            log.warn("Configuration file is empty: {}. Using defaults.", origin);
            return CodeLensConfig.defaults();
        }
        try {
            CodeLensConfig config = YAML_MAPPER.readValue(yaml, CodeLensConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", origin);
                return CodeLensConfig.defaults();
            }
            log.info("Loaded configuration from: {}", origin);
            return config;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse configuration {}: {}. Using defaults.", origin, e.getOriginalMessage());
            return CodeLensConfig.defaults();
        }
    }
}
