package org.gta3sc.cli.commands;

import com.typesafe.config.Config;
import org.gta3sc.cli.CommandLineInterface;
import org.gta3sc.cli.ProgramContextFactory;
import org.gta3sc.compiler.api.CompilationException;
import org.gta3sc.compiler.api.ConfigurationException;
import org.gta3sc.compiler.commands.Alternator;
import org.gta3sc.compiler.commands.ArgumentKind;
import org.gta3sc.compiler.commands.Command;
import org.gta3sc.compiler.config.DialectConfiguration;
import org.gta3sc.compiler.diagnostics.DiagnosticsEngine;
import org.gta3sc.compiler.diagnostics.SourceContext;
import org.gta3sc.compiler.frontend.lexer.TextStream;
import org.gta3sc.compiler.frontend.lexer.TokenSpan;
import org.gta3sc.compiler.jobs.BatchResult;
import org.gta3sc.compiler.jobs.TranslationUnitScheduler;
import org.gta3sc.compiler.jobs.UnitTask;
import org.gta3sc.compiler.program.ProgramContext;
import org.gta3sc.compiler.program.Script;
import org.gta3sc.compiler.program.ScriptType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Resolves command uses against the catalog of the active dialect. Each argument is handled as
 * its own translation unit, so one unsupported command does not hide problems in the others.
 */
@CommandLine.Command(name = "resolve", description = "Resolves command names, optionally with argument kinds.")
public class ResolveCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResolveCommand.class);

    private static final String THREADS_PATH = "gta3sc.jobs.threads";

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private DialectOptions options;

    @Option(names = {"-j", "--jobs"}, paramLabel = "N", description = "Number of worker threads.")
    private Integer threads;

    @Parameters(paramLabel = "NAME[:KIND,...]", arity = "1..*",
            description = "A command name, e.g. WAIT, or a use with argument kinds, e.g. SET:VAR_INT,INT.")
    private List<String> uses = new ArrayList<>();

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
            if (!factory.validate(dialect, diagnostics)) {
                return 1;
            }
            final ProgramContext program = factory.create(config, options, dialect, diagnostics);

            final AtomicReferenceArray<String> resolved = new AtomicReferenceArray<>(uses.size());
            final List<UnitTask> tasks = new ArrayList<>(uses.size());
            for (int i = 0; i < uses.size(); i++) {
                final int index = i;
                final String unitName = "arg-" + (i + 1);
                final TextStream stream = new TextStream(unitName, uses.get(i));
                tasks.add(new UnitTask(new Script(Path.of(unitName), ScriptType.MAIN),
                        p -> resolved.set(index, resolve(p, stream))));
            }

            final BatchResult result;
            try (TranslationUnitScheduler scheduler = new TranslationUnitScheduler(program, threadCount(config))) {
                result = scheduler.run(tasks);
            }

            for (int i = 0; i < resolved.length(); i++) {
                if (resolved.get(i) != null) {
                    out.println(resolved.get(i));
                }
            }
            out.flush();
            return result.exitCode();
        } catch (ConfigurationException e) {
            LOGGER.error("{}", e.getMessage());
            return 2;
        } catch (CompilationException e) {
            LOGGER.error("{}", e.getMessage(), e.getCause());
            return 2;
        }
    }

    /**
     * Resolves one use written as {@code NAME} or {@code NAME:KIND,KIND}.
     *
     * @return The line to print, or {@code null} if an error was reported.
     */
    static String resolve(ProgramContext program, TextStream stream) {
        final String text = stream.text();
        final int colon = text.indexOf(':');
        final String name = colon < 0 ? text : text.substring(0, colon);
        final SourceContext nameContext = SourceContext.of(stream, new TokenSpan(0, name.length()));

        if (program.isModelFromIde(name)) {
            program.diagnostics().note(nameContext, "'{}' is the name of a model", name);
        }
        final Command command = program.supportedCommandOrFatal(nameContext, program.commands().lookup(name), name);

        if (colon < 0) {
            final StringBuilder line = new StringBuilder(command.name()).append(':');
            for (Alternator alternator : command.alternators()) {
                if (alternator.supported()) {
                    line.append(' ').append(describe(alternator));
                }
            }
            return line.toString();
        }

        final List<ArgumentKind> kinds = new ArrayList<>();
        int begin = colon + 1;
        while (begin <= text.length()) {
            int end = text.indexOf(',', begin);
            if (end < 0) {
                end = text.length();
            }
            final String kind = text.substring(begin, end).trim();
            if (!kind.isEmpty()) {
                try {
                    kinds.add(ArgumentKind.valueOf(kind.toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    program.diagnostics().error(SourceContext.of(stream, new TokenSpan(begin, end)),
                            "unknown argument kind '{}'", kind);
                    return null;
                }
            }
            begin = end + 1;
        }

        final Alternator alternator = program.supportedAlternatorOrFatal(
                nameContext, program.commands().findAlternator(command, kinds), name);
        return command.name() + " -> " + describe(alternator);
    }

    private static String describe(Alternator alternator) {
        return String.format("%s(0x%04X)", alternator.name(), alternator.id());
    }

    private int threadCount(Config config) {
        int count = threads != null ? threads : config.hasPath(THREADS_PATH) ? config.getInt(THREADS_PATH) : 0;
        return count > 0 ? count : Runtime.getRuntime().availableProcessors();
    }
}
