package org.gta3sc.compiler.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.gta3sc.compiler.api.ConfigurationException;
import org.gta3sc.compiler.config.DialectConfiguration;
import org.gta3sc.compiler.config.TargetDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads command definitions from HOCON and builds a {@link CommandCatalog} for one dialect.
 *
 * <h3>Definition Structure:</h3>
 * <pre>
 * commands {
 *   WAIT { id = 1, args = [INT] }
 *   SET {
 *     overloads = [
 *       { name = SET_VAR_INT, id = 4, args = [VAR_INT, INT] }
 *       { name = SET_VAR_FLOAT, id = 5, args = [VAR_FLOAT, FLOAT] }
 *     ]
 *   }
 *   TASK_PLAY_ANIM { id = "0x0605", args = [INT, STRING, STRING, FLOAT], dialects = [gtasa] }
 * }
 * </pre>
 * A command without {@code overloads} has one overload with its own name, {@code id} and {@code args}.
 * {@code dialects} and {@code supported} may appear on commands and on overloads.
 */
public final class CommandCatalogLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CommandCatalogLoader.class);

    /** Classpath location of the bundled definitions. */
    public static final String DEFAULT_RESOURCE = "commands/default.conf";

    private static final String ROOT_KEY = "commands";

    private CommandCatalogLoader() {}

    /**
     * Loads the bundled definitions.
     *
     * @param options The active dialect.
     * @return The catalog.
     * @throws ConfigurationException if the resource is missing or malformed.
     */
    public static CommandCatalog loadDefault(DialectConfiguration options) {
        try {
            Config definitions = ConfigFactory.parseResources(DEFAULT_RESOURCE,
                    ConfigParseOptions.defaults().setAllowMissing(false));
            return load(definitions, options);
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to read bundled command definitions: " + e.getMessage(), e);
        }
    }

    /**
     * Loads definitions from a file.
     *
     * @param file    The HOCON file.
     * @param options The active dialect.
     * @return The catalog.
     * @throws ConfigurationException if the file is missing or malformed.
     */
    public static CommandCatalog load(Path file, DialectConfiguration options) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Command definitions not found: " + file);
        }
        try {
            return load(ConfigFactory.parseFile(file.toFile()).resolve(), options);
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to read command definitions " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds a catalog from parsed definitions.
     *
     * @param definitions A config with a {@code commands} object.
     * @param options     The active dialect; decides which entries are supported.
     * @return The catalog.
     * @throws ConfigurationException if an entry is malformed.
     */
    public static CommandCatalog load(Config definitions, DialectConfiguration options) {
        if (!definitions.hasPath(ROOT_KEY)) {
            throw new ConfigurationException("Command definitions have no '" + ROOT_KEY + "' section");
        }
        TargetDialect target = options.target();
        List<Command> commands = new ArrayList<>();
        Config section = definitions.getConfig(ROOT_KEY);
        for (String name : definitions.getObject(ROOT_KEY).keySet()) {
            try {
                commands.add(readCommand(name, section.getConfig(ConfigUtil.joinPath(name)), target));
            } catch (ConfigException | IllegalArgumentException e) {
                throw new ConfigurationException("Invalid definition of command '" + name + "': " + e.getMessage(), e);
            }
        }
        CommandCatalog catalog = new CommandCatalog(options.language(), commands);
        LOG.debug("Loaded {} commands for target {}", catalog.size(), target);
        return catalog;
    }

    private static Command readCommand(String name, Config entry, TargetDialect target) {
        boolean supported = isSupported(entry, target);
        List<Alternator> alternators = new ArrayList<>();
        if (entry.hasPath("overloads")) {
            for (Config overload : entry.getConfigList("overloads")) {
                String overloadName = overload.hasPath("name") ? overload.getString("name") : name;
                alternators.add(readAlternator(overloadName, overload, supported && isSupported(overload, target)));
            }
        } else {
            alternators.add(readAlternator(name, entry, supported));
        }
        return new Command(name, alternators, supported);
    }

    private static Alternator readAlternator(String name, Config entry, boolean supported) {
        List<ArgumentKind> arguments = new ArrayList<>();
        if (entry.hasPath("args")) {
            for (String kind : entry.getStringList("args")) {
                arguments.add(parseKind(kind));
            }
        }
        boolean variadic = entry.hasPath("variadic") && entry.getBoolean("variadic");
        return new Alternator(name, readId(entry), arguments, variadic, supported);
    }

    // HOCON has no hex literals, so opcodes may also be given as strings like "0x0605".
    private static int readId(Config entry) {
        ConfigValue id = entry.getValue("id");
        if (id.valueType() == ConfigValueType.STRING) {
            return Integer.decode(((String) id.unwrapped()).trim());
        }
        return entry.getInt("id");
    }

    private static boolean isSupported(Config entry, TargetDialect target) {
        if (entry.hasPath("supported") && !entry.getBoolean("supported")) {
            return false;
        }
        if (!entry.hasPath("dialects") || target == TargetDialect.NONE) {
            return true;
        }
        return entry.getStringList("dialects").stream()
                .map(TargetDialect::fromName)
                .anyMatch(target::equals);
    }

    private static ArgumentKind parseKind(String kind) {
        try {
            return ArgumentKind.valueOf(kind.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown argument kind '" + kind + "'", e);
        }
    }
}
