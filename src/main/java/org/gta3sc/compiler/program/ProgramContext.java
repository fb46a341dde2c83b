package org.gta3sc.compiler.program;

import org.gta3sc.compiler.commands.Alternator;
import org.gta3sc.compiler.commands.Command;
import org.gta3sc.compiler.commands.CommandCatalog;
import org.gta3sc.compiler.config.DialectConfiguration;
import org.gta3sc.compiler.diagnostics.DiagnosticsEngine;
import org.gta3sc.compiler.diagnostics.SourceContext;
import org.gta3sc.compiler.entities.ModelRegistry;
import org.gta3sc.compiler.entities.ModelTable;

import java.util.Objects;
import java.util.Optional;

/**
 * Run-wide state shared by every translation unit job: the dialect, the command catalog,
 * the model tables and the diagnostics engine.
 * <p>
 * Everything except the diagnostics counters is read-only once jobs are running.
 */
public final class ProgramContext {

    private final DialectConfiguration options;
    private final CommandCatalog commands;
    private final DiagnosticsEngine diagnostics;
    private final ModelRegistry models = new ModelRegistry();

    /**
     * @param options     The dialect of the run.
     * @param commands    The command catalog built for that dialect.
     * @param diagnostics The engine all units report to.
     */
    public ProgramContext(DialectConfiguration options, CommandCatalog commands, DiagnosticsEngine diagnostics) {
        this.options = Objects.requireNonNull(options, "options");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public DialectConfiguration options() {
        return options;
    }

    public CommandCatalog commands() {
        return commands;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    /**
     * Replaces the model tables. Call only while no job is running.
     *
     * @param defaultModels The global default models.
     * @param levelModels   The models of the current level.
     */
    public void setupModels(ModelTable defaultModels, ModelTable levelModels) {
        models.setup(defaultModels, levelModels);
    }

    /**
     * @param name An identifier, any case.
     * @return {@code true} if it names a known game object.
     */
    public boolean isModelFromIde(CharSequence name) {
        return models.isModelFromIde(name);
    }

    public ModelRegistry models() {
        return models;
    }

    public boolean hasError() {
        return diagnostics.hasError();
    }

    /**
     * Returns the command if it exists and the dialect supports it; aborts the current unit otherwise.
     *
     * @param context Where the command was used.
     * @param command The lookup result.
     * @param name    The name as written, for the message.
     * @return The same command instance.
     * @throws org.gta3sc.compiler.diagnostics.HaltJobException if the command is missing or unsupported.
     */
    public Command supportedCommandOrFatal(SourceContext context, Optional<Command> command, CharSequence name) {
        if (command.isEmpty() || !command.get().supported()) {
            diagnostics.fatalError(context, "command '{}' undefined or unsupported", name);
        }
        return command.get();
    }

    /**
     * Returns the overload if one was found and the dialect supports it; aborts the current unit otherwise.
     *
     * @param context    Where the call was made.
     * @param alternator The overload selection result.
     * @param name       The command name as written, for the message.
     * @return The same overload instance.
     * @throws org.gta3sc.compiler.diagnostics.HaltJobException if no supported overload fits.
     */
    public Alternator supportedAlternatorOrFatal(SourceContext context, Optional<Alternator> alternator, CharSequence name) {
        if (alternator.isEmpty() || !alternator.get().supported()) {
            diagnostics.fatalError(context, "alternator '{}' undefined or unsupported", name);
        }
        return alternator.get();
    }
}
