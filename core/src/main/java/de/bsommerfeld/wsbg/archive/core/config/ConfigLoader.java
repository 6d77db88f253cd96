package de.bsommerfeld.wsbg.archive.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a TOML file. A missing file is created
 * with the default values so operators have a template to edit; keys that
 * are absent from an existing file keep their defaults.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private static final String HEADER = "# WSBG Archive - Global Configuration\n\n";

    private ConfigLoader() {
    }

    public static GlobalConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            GlobalConfig defaults = new GlobalConfig();
            write(path, defaults);
            LOG.info("Created default configuration at {}", path.toAbsolutePath());
            return defaults;
        }
        LOG.info("Loading configuration from {}", path.toAbsolutePath());
        GlobalConfig config = MAPPER.readValue(path.toFile(), GlobalConfig.class);
        config.validate();
        return config;
    }

    public static void write(Path path, GlobalConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, HEADER + MAPPER.writeValueAsString(config));
    }
}
