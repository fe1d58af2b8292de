package de.bsommerfeld.upvision.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link GlobalConfig} as TOML.
 *
 * <p>
 * A missing file is not an error: the defaults are written to disk so the
 * user has a template to edit, and returned. Sections missing from an
 * existing file keep their defaults; unknown keys are ignored.
 */
public final class ConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false)
            .build();

    private ConfigurationLoader() {
    }

    /**
     * Loads the configuration from {@code configPath}, creating it with
     * defaults if absent.
     *
     * @throws IOException if the file exists but cannot be read or parsed, or
     *                     the defaults cannot be written
     */
    public static GlobalConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            LOG.info("No configuration at {}, writing defaults", configPath);
            GlobalConfig defaults = new GlobalConfig();
            save(configPath, defaults);
            return defaults;
        }
        GlobalConfig config = MAPPER.readValue(configPath.toFile(), GlobalConfig.class);
        if (config.getEngine() == null) {
            config.setEngine(new EngineConfig());
        }
        if (config.getFirstRun() == null) {
            config.setFirstRun(new FirstRunConfig());
        }
        return config;
    }

    /** Writes {@code config} to {@code configPath}, creating parent directories. */
    public static void save(Path configPath, GlobalConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(configPath.toFile(), config);
    }
}
