package org.gta3sc.compiler.jobs;

import org.gta3sc.compiler.api.CompilationException;
import org.gta3sc.compiler.diagnostics.HaltJobException;
import org.gta3sc.compiler.program.ProgramContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs translation unit jobs on a fixed pool of worker threads.
 * <p>
 * A {@link HaltJobException} ends only the job that threw it; the other units of the batch
 * keep running. Any other exception escaping a job is a compiler defect and fails the batch
 * once every job has finished.
 */
public class TranslationUnitScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TranslationUnitScheduler.class);

    private final ProgramContext program;
    private final ExecutorService executor;

    /**
     * @param program The run-wide state handed to every job.
     * @param threads The number of worker threads, at least 1.
     */
    public TranslationUnitScheduler(ProgramContext program, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
        }
        this.program = program;
        this.executor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
    }

    /**
     * Runs all tasks and waits for them.
     *
     * @param tasks The units to process.
     * @return The outcome per unit, in submission order.
     * @throws CompilationException if a job failed with anything other than a fatal error,
     *                              or the wait was interrupted.
     */
    public BatchResult run(List<UnitTask> tasks) throws CompilationException {
        LOG.debug("Scheduling {} translation units", tasks.size());
        List<Future<UnitOutcome>> futures = new ArrayList<>(tasks.size());
        for (UnitTask task : tasks) {
            futures.add(executor.submit(() -> runOne(task)));
        }

        List<BatchResult.UnitResult> results = new ArrayList<>(tasks.size());
        CompilationException failure = null;
        for (int i = 0; i < tasks.size(); i++) {
            UnitTask task = tasks.get(i);
            try {
                results.add(new BatchResult.UnitResult(task.script(), futures.get(i).get()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new CompilationException("Interrupted while waiting for translation units", e);
            } catch (ExecutionException e) {
                LOG.error("Translation unit '{}' failed unexpectedly", task.script().displayName(), e.getCause());
                CompilationException unitFailure = CompilationException.inUnit(task.script().displayName(), e.getCause());
                if (failure == null) {
                    failure = unitFailure;
                } else {
                    failure.addSuppressed(unitFailure);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }

        BatchResult result = new BatchResult(results, program.hasError());
        LOG.debug("Batch finished: {} units, {} aborted, errors={}",
                results.size(), result.abortedCount(), result.hasError());
        return result;
    }

    private UnitOutcome runOne(UnitTask task) {
        try {
            task.job().compile(program);
            return UnitOutcome.COMPLETED;
        } catch (HaltJobException e) {
            LOG.debug("Translation unit '{}' aborted by a fatal error", task.script().displayName());
            return UnitOutcome.ABORTED;
        }
    }

    /**
     * Stops the worker threads, waiting briefly for running jobs.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "unit-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
