package org.gta3sc.cli.commands;

import org.gta3sc.compiler.api.ConfigurationException;
import org.gta3sc.compiler.config.DialectConfiguration;
import org.gta3sc.compiler.config.DialectConfigurationLoader;
import org.gta3sc.compiler.config.DialectFeature;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Command line options shared by every subcommand that needs a dialect. They override the
 * values from the configuration files.
 */
public class DialectOptions {

    @Option(names = "--dialect", paramLabel = "TARGET",
            description = "Target dialect: none, gta3, gtavc or gtasa.")
    String dialect;

    @Option(names = "--lang", paramLabel = "LANG", description = "Source language: gta3script or ir2.")
    String language;

    @Option(names = {"-f", "--feature"}, paramLabel = "NAME", description = "Enable a feature, e.g. -f break-continue.")
    List<String> enabledFeatures = new ArrayList<>();

    @Option(names = "--no-feature", paramLabel = "NAME", description = "Disable a feature.")
    List<String> disabledFeatures = new ArrayList<>();

    @Option(names = "-D", paramLabel = "NAME[=VALUE]", description = "Define a preprocessor symbol (value defaults to 1).")
    List<String> defines = new ArrayList<>();

    @Option(names = "-U", paramLabel = "NAME", description = "Undefine a preprocessor symbol.")
    List<String> undefines = new ArrayList<>();

    @Option(names = "--local-var-limit", paramLabel = "N")
    Integer localVarLimit;

    @Option(names = "--mission-var-limit", paramLabel = "N")
    Integer missionVarLimit;

    @Option(names = "--switch-case-limit", paramLabel = "N")
    Integer switchCaseLimit;

    @Option(names = "--array-elem-limit", paramLabel = "N")
    Integer arrayElemLimit;

    @Option(names = "--error-limit", paramLabel = "N", description = "Stop a unit after this many errors.")
    Integer errorLimit;

    @Option(names = "--commands", paramLabel = "FILE", description = "Command definitions replacing the bundled ones.")
    Path commandsFile;

    @Option(names = "--models", paramLabel = "FILE", description = "Default model table.")
    Path modelsFile;

    @Option(names = "--level-models", paramLabel = "FILE", description = "Model table of the level.")
    Path levelModelsFile;

    /**
     * @return The target dialect named on the command line, or {@code null}.
     */
    public String dialect() {
        return dialect;
    }

    public Integer errorLimit() {
        return errorLimit;
    }

    public Path commandsFile() {
        return commandsFile;
    }

    public Path modelsFile() {
        return modelsFile;
    }

    public Path levelModelsFile() {
        return levelModelsFile;
    }

    /**
     * Applies the options to a builder seeded from the configuration files.
     *
     * @param builder The builder.
     * @return The same builder.
     * @throws ConfigurationException if an option names an unknown language or feature.
     */
    public DialectConfiguration.Builder applyTo(DialectConfiguration.Builder builder) {
        if (language != null) {
            try {
                builder.language(DialectConfigurationLoader.parseLanguage(language));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
        }
        for (String name : enabledFeatures) {
            builder.enable(feature(name));
        }
        for (String name : disabledFeatures) {
            builder.disable(feature(name));
        }
        if (localVarLimit != null) builder.localVarLimit(localVarLimit);
        if (missionVarLimit != null) builder.missionVarLimit(OptionalInt.of(missionVarLimit));
        if (switchCaseLimit != null) builder.switchCaseLimit(OptionalInt.of(switchCaseLimit));
        if (arrayElemLimit != null) builder.arrayElemLimit(OptionalInt.of(arrayElemLimit));
        for (String define : defines) {
            int eq = define.indexOf('=');
            if (eq < 0) {
                builder.define(define);
            } else {
                builder.define(define.substring(0, eq), define.substring(eq + 1));
            }
        }
        for (String symbol : undefines) {
            builder.undefine(symbol);
        }
        return builder;
    }

    private static DialectFeature feature(String name) {
        return DialectFeature.fromKey(name)
                .orElseThrow(() -> new ConfigurationException("Unknown feature '" + name + "'"));
    }
}
