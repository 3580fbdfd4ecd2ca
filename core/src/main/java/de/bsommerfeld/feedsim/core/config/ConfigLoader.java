package de.bsommerfeld.feedsim.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link SimulationConfig} from a TOML file. A missing file is created
 * with the defaults so users have something to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * @throws ConfigurationException if the file is unreadable, malformed, or
     *                                contains out-of-range values
     */
    public static SimulationConfig load(Path configPath) {
        SimulationConfig config;
        if (Files.exists(configPath)) {
            LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
            try {
                config = MAPPER.readValue(configPath.toFile(), SimulationConfig.class);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration " + configPath, e);
            }
        } else {
            LOG.info("No configuration at {}, writing defaults.", configPath.toAbsolutePath());
            config = new SimulationConfig();
            write(config, configPath);
        }

        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration " + configPath + ": " + e.getMessage(), e);
        }
        return config;
    }

    public static void write(SimulationConfig config, Path configPath) {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(configPath.toFile(), config);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to write configuration " + configPath, e);
        }
    }
}
