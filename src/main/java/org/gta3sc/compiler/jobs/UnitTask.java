package org.gta3sc.compiler.jobs;

import org.gta3sc.compiler.program.Script;

import java.util.Objects;

/**
 * A translation unit paired with the job that processes it.
 *
 * @param script The unit.
 * @param job    The work to run for it.
 */
public record UnitTask(Script script, TranslationUnitJob job) {

    /**
     * Validates the components.
     */
    public UnitTask {
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(job, "job");
    }
}
