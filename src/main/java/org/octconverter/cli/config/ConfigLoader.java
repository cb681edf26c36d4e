package org.octconverter.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Optional;

/**
 * Loads the command line configuration in three layers, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Doctconverter.read.deinterlace=true})</li>
 *   <li>one user file: the one given with {@code --config}, else {@code config/octconverter.conf}
 *       in the working directory when it exists</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Only the {@code octconverter.read} and {@code octconverter.logging} blocks are read from the result.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    static final File DEFAULT_USER_FILE = new File("config", "octconverter.conf");

    private ConfigLoader() {
    }

    /**
     * @param explicitFile file from {@code --config}, or {@code null}
     * @return the resolved configuration
     * @throws IllegalArgumentException              if {@code explicitFile} does not exist
     * @throws com.typesafe.config.ConfigException   if a file cannot be parsed or resolved
     */
    public static Config resolve(final File explicitFile) {
        return load(userFile(explicitFile, DEFAULT_USER_FILE));
    }

    /**
     * Picks the user file. An explicit file must exist; the default one is optional.
     */
    static Optional<File> userFile(final File explicitFile, final File defaultFile) {
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            return Optional.of(explicitFile);
        }
        return defaultFile.isFile() ? Optional.of(defaultFile) : Optional.empty();
    }

    static Config load(final Optional<File> userFile) {
        Config user = ConfigFactory.empty();
        if (userFile.isPresent()) {
            LOG.debug("Reading configuration from {}", userFile.get().getAbsolutePath());
            user = ConfigFactory.parseFile(userFile.get());
        } else {
            LOG.debug("No {} found, using built-in defaults", DEFAULT_USER_FILE);
        }
        return ConfigFactory.systemProperties()
            .withFallback(user)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
