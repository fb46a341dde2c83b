package org.gta3sc.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.gta3sc.compiler.api.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from its sources, in order of precedence:
 * <ol>
 *   <li>Java system properties ({@code -Dgta3sc.dialect.target=gtasa})</li>
 *   <li>Environment variables</li>
 *   <li>The file given with {@code --config}, else {@code gta3sc.conf} in the working directory</li>
 *   <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "gta3sc.conf";

    private ConfigLoader() {}

    /**
     * @param explicitFile The file named on the command line, or {@code null}.
     * @return The resolved configuration.
     * @throws ConfigurationException if the explicit file does not exist or a source cannot be parsed.
     */
    public static Config load(File explicitFile) {
        return load(explicitFile, new File(CONFIG_FILE_NAME));
    }

    static Config load(File explicitFile, File workingDirectoryFile) {
        try {
            final Config fileConfig;
            if (explicitFile != null) {
                if (!explicitFile.isFile()) {
                    throw new ConfigurationException("Configuration file specified via --config was not found: "
                            + explicitFile.getAbsolutePath());
                }
                LOG.debug("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(explicitFile);
            } else if (workingDirectoryFile.isFile()) {
                LOG.debug("Using configuration file found in current directory: {}", workingDirectoryFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(workingDirectoryFile);
            } else {
                LOG.debug("No '{}' found, using classpath defaults", workingDirectoryFile.getPath());
                fileConfig = ConfigFactory.empty();
            }

            // The one provided first wins.
            return ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fileConfig)
                    .withFallback(ConfigFactory.parseResources("reference.conf"))
                    .resolve();
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }
}
