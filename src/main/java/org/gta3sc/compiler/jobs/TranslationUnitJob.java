package org.gta3sc.compiler.jobs;

import org.gta3sc.compiler.program.ProgramContext;

/**
 * The work done for one translation unit. A job reports problems through the run's
 * diagnostics engine; a fatal error unwinds the job and ends it early.
 */
@FunctionalInterface
public interface TranslationUnitJob {

    /**
     * @param program The run-wide state shared with all other jobs.
     * @throws org.gta3sc.compiler.diagnostics.HaltJobException if the unit hit a fatal error.
     */
    void compile(ProgramContext program);
}
