package org.gta3sc.cli.commands;

import com.typesafe.config.Config;
import org.gta3sc.cli.CommandLineInterface;
import org.gta3sc.cli.ProgramContextFactory;
import org.gta3sc.compiler.api.ConfigurationException;
import org.gta3sc.compiler.config.DialectConfiguration;
import org.gta3sc.compiler.config.DialectFeature;
import org.gta3sc.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.Map;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "config", description = "Prints the resolved dialect configuration.")
public class ConfigCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private DialectOptions options;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final ProgramContextFactory factory = new ProgramContextFactory();
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            final Config config = parent.getConfig();
            final DialectConfiguration dialect = factory.dialect(config, options);
            final DiagnosticsEngine diagnostics = factory.diagnostics(config, options, block -> {
                err.println(block);
                err.flush();
            });

            out.println("language: " + dialect.language().name().toLowerCase(Locale.ROOT));
            out.println("target: " + dialect.target().presetName());
            out.println("features: " + dialect.features().stream()
                    .map(DialectFeature::key)
                    .collect(Collectors.joining(", ")));
            out.println("local-var-limit: " + dialect.localVarLimit());
            out.println("mission-var-begin: " + dialect.missionVarBegin());
            out.println("mission-var-limit: " + describe(dialect.missionVarLimit()));
            out.println("switch-case-limit: " + describe(dialect.switchCaseLimit()));
            out.println("array-elem-limit: " + describe(dialect.arrayElemLimit()));
            out.println("timer-index: " + dialect.timerIndex());
            for (Map.Entry<String, String> define : dialect.defines().entrySet()) {
                out.println("define: " + define.getKey() + "=" + define.getValue());
            }
            out.flush();

            return factory.validate(dialect, diagnostics) ? 0 : 1;
        } catch (ConfigurationException e) {
            LOGGER.error("{}", e.getMessage());
            return 2;
        }
    }

    private static String describe(OptionalInt limit) {
        return limit.isPresent() ? Integer.toString(limit.getAsInt()) : "unbounded";
    }
}
