package org.gta3sc.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * An engine for rendering, emitting and counting diagnostic messages (errors, warnings, notes)
 * that occur during the compilation process.
 * <p>
 * One engine is created per run and shared by all translation unit jobs. Counters are atomic
 * and emission is serialized, so each rendered diagnostic reaches the sink as one contiguous
 * block even when jobs report concurrently. Contexts are resolved during the call and never kept.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final DiagnosticSink sink;
    private final OptionalInt errorLimit;
    private final Object emitLock = new Object();
    private final List<Diagnostic> diagnostics = new CopyOnWriteArrayList<>();

    private final AtomicInteger errorCount = new AtomicInteger();
    private final AtomicInteger warningCount = new AtomicInteger();
    private final AtomicInteger fatalCount = new AtomicInteger();

    /**
     * Creates an engine writing to standard error, without an error limit.
     */
    public DiagnosticsEngine() {
        this(new StandardErrorSink());
    }

    /**
     * Creates an engine without an error limit.
     *
     * @param sink The destination of rendered diagnostics.
     */
    public DiagnosticsEngine(DiagnosticSink sink) {
        this(sink, OptionalInt.empty());
    }

    /**
     * @param sink       The destination of rendered diagnostics.
     * @param errorLimit When present, exceeding this many errors turns into a fatal error.
     */
    public DiagnosticsEngine(DiagnosticSink sink, OptionalInt errorLimit) {
        this.sink = sink;
        this.errorLimit = errorLimit;
    }

    /**
     * Reports an error. Compilation of the unit continues; the run will fail.
     *
     * @param context  Where the error applies.
     * @param template The message template with {@code {}} placeholders.
     * @param args     The template arguments.
     * @throws HaltJobException if an error limit is configured and now exceeded.
     */
    public void error(SourceContext context, String template, Object... args) {
        int count = errorCount.incrementAndGet();
        emit(DiagnosticFormatter.format(Diagnostic.Type.ERROR, context, template, args));

        if (errorLimit.isPresent() && count > errorLimit.getAsInt()) {
            fatalError(SourceContext.none(), "too many errors");
        }
    }

    /**
     * Reports a note. No counter is affected.
     *
     * @param context  Where the note applies.
     * @param template The message template with {@code {}} placeholders.
     * @param args     The template arguments.
     */
    public void note(SourceContext context, String template, Object... args) {
        emit(DiagnosticFormatter.format(Diagnostic.Type.NOTE, context, template, args));
    }

    /**
     * Reports a warning.
     *
     * @param context  Where the warning applies.
     * @param template The message template with {@code {}} placeholders.
     * @param args     The template arguments.
     */
    public void warning(SourceContext context, String template, Object... args) {
        warningCount.incrementAndGet();
        emit(DiagnosticFormatter.format(Diagnostic.Type.WARNING, context, template, args));
    }

    /**
     * Reports a fatal error and aborts the current translation unit. Never returns normally.
     *
     * @param context  Where the error applies.
     * @param template The message template with {@code {}} placeholders.
     * @param args     The template arguments.
     * @throws HaltJobException always, after the diagnostic has been emitted.
     */
    public void fatalError(SourceContext context, String template, Object... args) {
        fatalCount.incrementAndGet();
        emit(DiagnosticFormatter.format(Diagnostic.Type.FATAL, context, template, args));
        LOG.debug("Fatal error reported on thread '{}', halting job", Thread.currentThread().getName());
        throw new HaltJobException();
    }

    /**
     * Adds errors detected in bulk by a collaborator that reported them by other means.
     *
     * @param n The number of errors, may be 0.
     */
    public void registerErrors(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Error count must not be negative: " + n);
        }
        errorCount.addAndGet(n);
    }

    /**
     * Checks whether the run has failed.
     *
     * @return {@code true} if at least one error or fatal error was reported.
     */
    public boolean hasError() {
        return errorCount.get() > 0 || fatalCount.get() > 0;
    }

    public int errorCount() {
        return errorCount.get();
    }

    public int warningCount() {
        return warningCount.get();
    }

    public int fatalCount() {
        return fatalCount.get();
    }

    /**
     * Returns an unmodifiable snapshot of all emitted diagnostics, in emission order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    /**
     * Returns all emitted diagnostics as a single string.
     *
     * @return The rendered diagnostics separated by newlines.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::rendered)
                .collect(Collectors.joining("\n"));
    }

    private void emit(Diagnostic diagnostic) {
        synchronized (emitLock) {
            diagnostics.add(diagnostic);
            sink.emit(diagnostic.rendered());
        }
    }
}
