package org.shardeval.config;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the application configuration for an orchestration layer embedding the metrics core.
 * <p>
 * Composes HOCON configuration from multiple sources with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file (see {@link #resolve(File)})</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * <p>
 * Uses {@link ConfigFactory#defaultReferenceUnresolved()} so that substitutions are resolved
 * only after all layers are composed.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "shardeval.conf";

    private ConfigLoader() {
    }

    /**
     * Resolves configuration using the fallback cascade:
     * <ol>
     *   <li><strong>Explicit file:</strong> passed by the caller</li>
     *   <li><strong>System property:</strong> {@code -Dconfig.file}</li>
     *   <li><strong>Working directory:</strong> {@code config/shardeval.conf} relative to CWD</li>
     *   <li><strong>Classpath defaults:</strong> {@code reference.conf} only</li>
     * </ol>
     *
     * @param explicitConfigFile config file chosen by the caller, or {@code null} for discovery.
     * @return the fully resolved {@link Config}.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            log.info("Using configuration file {}", explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
            }
            log.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            log.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        log.debug("No '{}/{}' found, using default configuration from classpath", CONFIG_DIR, CONFIG_FILE_NAME);
        return loadDefaults();
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     *
     * @param configFile the configuration file to load.
     * @return the fully resolved {@link Config}.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only.
     *
     * @return the fully resolved {@link Config}.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
