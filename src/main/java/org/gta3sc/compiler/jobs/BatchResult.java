package org.gta3sc.compiler.jobs;

import org.gta3sc.compiler.program.Script;

import java.util.List;

/**
 * The outcome of a batch of translation units.
 *
 * @param results  One entry per unit, in submission order.
 * @param hasError Whether the diagnostics engine recorded any error once the batch was done.
 */
public record BatchResult(List<UnitResult> results, boolean hasError) {

    /**
     * Ensures the result list is unmodifiable.
     */
    public BatchResult {
        results = List.copyOf(results);
    }

    /**
     * @return The process exit code for the batch: 1 if any error was reported, else 0.
     */
    public int exitCode() {
        return hasError ? 1 : 0;
    }

    public long abortedCount() {
        return results.stream().filter(r -> r.outcome() == UnitOutcome.ABORTED).count();
    }

    /**
     * @param script  The unit.
     * @param outcome How its job ended.
     */
    public record UnitResult(Script script, UnitOutcome outcome) {}
}
