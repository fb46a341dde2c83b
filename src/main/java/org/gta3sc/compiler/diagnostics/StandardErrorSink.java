package org.gta3sc.compiler.diagnostics;

import java.io.PrintStream;

/**
 * Writes diagnostics to the process-wide standard error stream, one block per write.
 */
public final class StandardErrorSink implements DiagnosticSink {

    private final PrintStream out;

    /**
     * Creates a sink bound to {@link System#err} as it is at construction time.
     */
    public StandardErrorSink() {
        this(System.err);
    }

    /**
     * @param out The stream to write to.
     */
    public StandardErrorSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void emit(String block) {
        // Newline appended before the write so the block and its terminator go out together.
        out.print(block + System.lineSeparator());
        out.flush();
    }
}
