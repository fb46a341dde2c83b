package org.gta3sc.compiler.jobs;

/**
 * How the job of a translation unit ended.
 */
public enum UnitOutcome {
    /** The job returned normally. Errors may still have been reported. */
    COMPLETED,
    /** The job was unwound by a fatal error. */
    ABORTED
}
