package org.gta3sc.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.gta3sc.cli.commands.DialectOptions;
import org.gta3sc.compiler.api.ConfigurationException;
import org.gta3sc.compiler.commands.CommandCatalog;
import org.gta3sc.compiler.commands.CommandCatalogLoader;
import org.gta3sc.compiler.config.DialectConfiguration;
import org.gta3sc.compiler.config.DialectConfigurationLoader;
import org.gta3sc.compiler.config.DialectFeature;
import org.gta3sc.compiler.config.TargetDialect;
import org.gta3sc.compiler.diagnostics.DiagnosticSink;
import org.gta3sc.compiler.diagnostics.DiagnosticsEngine;
import org.gta3sc.compiler.diagnostics.HaltJobException;
import org.gta3sc.compiler.diagnostics.SourceContext;
import org.gta3sc.compiler.entities.HoconModelTableLoader;
import org.gta3sc.compiler.entities.ModelTable;
import org.gta3sc.compiler.entities.ModelTableLoader;
import org.gta3sc.compiler.program.ProgramContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Assembles the run-wide state of a compilation from the configuration and the command line.
 */
public final class ProgramContextFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramContextFactory.class);

    private static final String ERROR_LIMIT_PATH = "gta3sc.diagnostics.error-limit";
    private static final String COMMANDS_FILE_PATH = "gta3sc.commands.file";
    private static final String DEFAULT_MODELS_PATH = "gta3sc.models.default-table";
    private static final String LEVEL_MODELS_PATH = "gta3sc.models.level-table";

    private final ModelTableLoader modelLoader;

    public ProgramContextFactory() {
        this(new HoconModelTableLoader());
    }

    /**
     * @param modelLoader Reads the model tables.
     */
    public ProgramContextFactory(ModelTableLoader modelLoader) {
        this.modelLoader = modelLoader;
    }

    /**
     * Resolves the dialect. A target given on the command line selects the preset, so it is
     * folded into the configuration before loading.
     *
     * @param config  The application configuration.
     * @param options The command line overrides.
     * @return The dialect of the run.
     * @throws ConfigurationException if a value is invalid.
     */
    public DialectConfiguration dialect(Config config, DialectOptions options) {
        Config effective = config;
        if (options.dialect() != null) {
            effective = ConfigFactory.parseMap(Map.of(DialectConfigurationLoader.DIALECT_PATH + ".target", options.dialect()))
                    .withFallback(config);
        }
        return options.applyTo(DialectConfigurationLoader.toBuilder(effective)).build();
    }

    /**
     * Creates the diagnostics engine with the configured error limit.
     *
     * @param config  The application configuration.
     * @param options The command line overrides.
     * @param sink    Where diagnostics are written.
     * @return The engine.
     */
    public DiagnosticsEngine diagnostics(Config config, DialectOptions options, DiagnosticSink sink) {
        OptionalInt limit = OptionalInt.empty();
        if (options.errorLimit() != null) {
            limit = OptionalInt.of(options.errorLimit());
        } else if (config.hasPath(ERROR_LIMIT_PATH)) {
            limit = OptionalInt.of(config.getInt(ERROR_LIMIT_PATH));
        }
        return new DiagnosticsEngine(sink, limit);
    }

    /**
     * Checks combinations the dialect record itself accepts but a run cannot use.
     * Runs before any translation unit starts, so an abort raised by the error limit ends here.
     *
     * @param dialect     The dialect.
     * @param diagnostics Receives the problems found.
     * @return {@code true} if the dialect is usable.
     */
    public boolean validate(DialectConfiguration dialect, DiagnosticsEngine diagnostics) {
        if (dialect.target() == TargetDialect.NONE && !dialect.isEnabled(DialectFeature.SYNTAX_ONLY)) {
            try {
                diagnostics.error(SourceContext.none(), "target dialect 'none' requires the '{}' feature",
                        DialectFeature.SYNTAX_ONLY.key());
            } catch (HaltJobException e) {
                LOG.debug("Error limit reached while validating the dialect");
            }
            return false;
        }
        return true;
    }

    /**
     * Loads the command catalog and model tables and bundles them with the dialect and engine.
     *
     * @param config      The application configuration.
     * @param options     The command line overrides.
     * @param dialect     The dialect of the run.
     * @param diagnostics The engine of the run.
     * @return The program context, with model tables installed.
     * @throws ConfigurationException if a definition file is missing or malformed.
     */
    public ProgramContext create(Config config, DialectOptions options, DialectConfiguration dialect,
                                 DiagnosticsEngine diagnostics) {
        Path commandsFile = choose(options.commandsFile(), config, COMMANDS_FILE_PATH);
        CommandCatalog catalog = commandsFile != null
                ? CommandCatalogLoader.load(commandsFile, dialect)
                : CommandCatalogLoader.loadDefault(dialect);

        ProgramContext program = new ProgramContext(dialect, catalog, diagnostics);

        Path defaultModels = choose(options.modelsFile(), config, DEFAULT_MODELS_PATH);
        Path levelModels = choose(options.levelModelsFile(), config, LEVEL_MODELS_PATH);
        program.setupModels(
                defaultModels != null ? modelLoader.loadDefaultTable(defaultModels) : ModelTable.empty(),
                levelModels != null ? modelLoader.loadLevelTable(levelModels) : ModelTable.empty());

        LOG.debug("Program context ready: {} commands, {} default models, {} level models",
                catalog.size(), program.models().defaultModels().size(), program.models().levelModels().size());
        return program;
    }

    private static Path choose(Path fromCommandLine, Config config, String path) {
        if (fromCommandLine != null) {
            return fromCommandLine;
        }
        return config.hasPath(path) ? Path.of(config.getString(path)) : null;
    }
}
