package org.gta3sc.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, note) that was emitted during
 * the compilation process. It holds only resolved, rendered data, never the context it
 * was reported against.
 *
 * @param type         The severity of the diagnostic.
 * @param message      The interpolated message text.
 * @param fileName     The file the diagnostic refers to, or {@code null} if unknown.
 * @param lineNumber   The 1-based line, or 0 if unknown.
 * @param columnNumber The 1-based column, or 0 if unknown.
 * @param rendered     The exact multi-line text written to the sink.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber,
        String rendered
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** An error that fails the run but lets the unit continue. */
        ERROR("error"),
        /** A warning that does not prevent compilation. */
        WARNING("warning"),
        /** Additional information attached to a previous diagnostic. */
        NOTE("note"),
        /** An error that aborts the current translation unit. */
        FATAL("fatal error");

        private final String label;

        Type(String label) {
            this.label = label;
        }

        /**
         * @return The label written in front of the message, e.g. {@code fatal error}.
         */
        public String label() {
            return label;
        }
    }

    @Override
    public String toString() {
        return rendered;
    }
}
