package org.gta3sc.compiler.diagnostics;

/**
 * Destination of rendered diagnostics. The {@link DiagnosticsEngine} never calls a sink from
 * two threads at once, so implementations need no locking of their own.
 */
@FunctionalInterface
public interface DiagnosticSink {

    /**
     * Writes one rendered diagnostic, which may span several lines, as a single block.
     *
     * @param block The rendered text, without a trailing newline.
     */
    void emit(String block);
}
