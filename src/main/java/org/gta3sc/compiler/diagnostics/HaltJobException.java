package org.gta3sc.compiler.diagnostics;

/**
 * Signals that a fatal error was reported and the current translation unit must stop.
 * <p>
 * Thrown only by {@link DiagnosticsEngine#fatalError}. It carries no payload: the diagnostic
 * has already been emitted and counted. It unwinds exactly one job and is caught by that job's
 * driver ({@link org.gta3sc.compiler.jobs.TranslationUnitScheduler}); nothing else may catch it.
 */
public final class HaltJobException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the signal without message, cause or stack trace.
     */
    public HaltJobException() {
        super(null, null, false, false);
    }
}
