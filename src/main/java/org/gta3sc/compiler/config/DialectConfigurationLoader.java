package org.gta3sc.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.gta3sc.compiler.api.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Builds a {@link DialectConfiguration} from HOCON.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * gta3sc {
 *   dialect {
 *     target = "gtasa"          # none | gta3 | gtavc | gtasa, selects gta3sc.presets.&lt;target&gt;
 *     language = "gta3script"   # gta3script | ir2
 *     features { break-continue = true }
 *     limits { local-var-limit = 32, mission-var-limit = null }
 *     defines { DEBUG = "1" }
 *   }
 *   presets {
 *     gtasa { features { ... }, limits { ... } }
 *   }
 * }
 * </pre>
 * The preset of the selected target is applied first; keys under {@code gta3sc.dialect}
 * override it. A {@code null} limit clears a limit set by the preset.
 */
public final class DialectConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DialectConfigurationLoader.class);

    /** Root path of the dialect settings. */
    public static final String DIALECT_PATH = "gta3sc.dialect";
    /** Root path of the per-dialect presets. */
    public static final String PRESETS_PATH = "gta3sc.presets";

    private static final String TARGET_KEY = "target";
    private static final String LANGUAGE_KEY = "language";
    private static final String FEATURES_KEY = "features";
    private static final String LIMITS_KEY = "limits";
    private static final String DEFINES_KEY = "defines";

    private DialectConfigurationLoader() {}

    /**
     * Creates a builder seeded from the configuration, so that callers (e.g. the command line)
     * can apply further overrides before building.
     *
     * @param root The resolved application configuration.
     * @return A builder with preset and dialect settings applied.
     * @throws ConfigurationException if a value is missing, mistyped or unknown.
     */
    public static DialectConfiguration.Builder toBuilder(Config root) {
        try {
            Config dialect = root.hasPath(DIALECT_PATH) ? root.getConfig(DIALECT_PATH) : ConfigFactory.empty();
            TargetDialect target = dialect.hasPath(TARGET_KEY)
                    ? TargetDialect.fromName(dialect.getString(TARGET_KEY))
                    : TargetDialect.NONE;

            DialectConfiguration.Builder builder = DialectConfiguration.builder().target(target);
            if (dialect.hasPath(LANGUAGE_KEY)) {
                builder.language(parseLanguage(dialect.getString(LANGUAGE_KEY)));
            }

            String presetPath = PRESETS_PATH + "." + target.presetName();
            if (root.hasPath(presetPath)) {
                LOG.debug("Applying dialect preset '{}'", target.presetName());
                apply(builder, root.getConfig(presetPath), presetPath);
            } else {
                LOG.debug("No preset found at '{}', using built-in defaults", presetPath);
            }
            apply(builder, dialect, DIALECT_PATH);
            return builder;
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid dialect configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Loads the dialect configuration.
     *
     * @param root The resolved application configuration.
     * @return The immutable configuration.
     * @throws ConfigurationException if a value is missing, mistyped or unknown.
     */
    public static DialectConfiguration load(Config root) {
        DialectConfiguration configuration = toBuilder(root).build();
        LOG.debug("Loaded {}", configuration);
        return configuration;
    }

    /**
     * Parses a language name, case-insensitively.
     *
     * @param name {@code gta3script} or {@code ir2}.
     * @return The language.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static Language parseLanguage(String name) {
        try {
            return Language.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown language '" + name + "'", e);
        }
    }

    private static void apply(DialectConfiguration.Builder builder, Config section, String path) {
        if (section.hasPath(FEATURES_KEY)) {
            for (Map.Entry<String, ConfigValue> entry : section.getObject(FEATURES_KEY).entrySet()) {
                DialectFeature feature = DialectFeature.fromKey(entry.getKey())
                        .orElseThrow(() -> new ConfigurationException(
                                "Unknown feature '" + entry.getKey() + "' at " + path + "." + FEATURES_KEY));
                builder.feature(feature, asBoolean(entry.getValue(), path + "." + FEATURES_KEY + "." + entry.getKey()));
            }
        }

        if (section.hasPath(LIMITS_KEY)) {
            Config limits = section.getConfig(LIMITS_KEY);
            if (limits.hasPath("local-var-limit")) builder.localVarLimit(limits.getInt("local-var-limit"));
            if (limits.hasPath("mission-var-begin")) builder.missionVarBegin(limits.getInt("mission-var-begin"));
            if (limits.hasPath("timer-index")) builder.timerIndex(limits.getInt("timer-index"));
            applyOptional(limits, "mission-var-limit", builder::missionVarLimit);
            applyOptional(limits, "switch-case-limit", builder::switchCaseLimit);
            applyOptional(limits, "array-elem-limit", builder::arrayElemLimit);
            applyOptional(limits, "cleo", builder::cleo);
        }

        if (section.hasPath(DEFINES_KEY)) {
            for (Map.Entry<String, ConfigValue> entry : section.getObject(DEFINES_KEY).entrySet()) {
                Object value = entry.getValue().unwrapped();
                builder.define(entry.getKey(), value == null ? "1" : value.toString());
            }
        }
    }

    private static void applyOptional(Config limits, String key, Function<OptionalInt, DialectConfiguration.Builder> setter) {
        if (!limits.hasPathOrNull(key)) {
            return;
        }
        setter.apply(limits.getIsNull(key) ? OptionalInt.empty() : OptionalInt.of(limits.getInt(key)));
    }

    private static boolean asBoolean(ConfigValue value, String path) {
        if (value.valueType() != ConfigValueType.BOOLEAN) {
            throw new ConfigurationException("Feature switch at " + path + " must be a boolean, got " + value.valueType());
        }
        return (Boolean) value.unwrapped();
    }
}
