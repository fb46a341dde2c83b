package org.gta3sc.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class DiagnosticsEngineTest {

    @Mock
    private DiagnosticSink sink;

    @Test
    void countersTrackEachSeverity() {
        DiagnosticsEngine engine = new DiagnosticsEngine(sink);

        engine.note(SourceContext.none(), "n");
        assertThat(engine.hasError()).isFalse();

        engine.warning(SourceContext.none(), "w");
        assertThat(engine.warningCount()).isEqualTo(1);
        assertThat(engine.hasError()).isFalse();

        engine.error(SourceContext.none(), "e");
        assertThat(engine.errorCount()).isEqualTo(1);
        assertThat(engine.hasError()).isTrue();
        assertThat(engine.fatalCount()).isZero();

        InOrder order = inOrder(sink);
        order.verify(sink).emit("gta3sc: note: n");
        order.verify(sink).emit("gta3sc: warning: w");
        order.verify(sink).emit("gta3sc: error: e");
        verifyNoMoreInteractions(sink);
    }

    @Test
    void registerErrorsAddsToErrorCount() {
        DiagnosticsEngine engine = new DiagnosticsEngine(sink);

        engine.registerErrors(0);
        assertThat(engine.hasError()).isFalse();

        engine.registerErrors(3);
        assertThat(engine.errorCount()).isEqualTo(3);
        assertThat(engine.hasError()).isTrue();

        assertThatThrownBy(() -> engine.registerErrors(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fatalErrorEmitsThenHalts() {
        DiagnosticsEngine engine = new DiagnosticsEngine(sink);
        AtomicBoolean reachedAfterFatal = new AtomicBoolean();

        assertThatThrownBy(() -> {
            engine.fatalError(SourceContext.none(), "command '{}' undefined or unsupported", "FOO");
            reachedAfterFatal.set(true);
        }).isInstanceOf(HaltJobException.class);

        assertThat(reachedAfterFatal).isFalse();
        assertThat(engine.fatalCount()).isEqualTo(1);
        assertThat(engine.errorCount()).isZero();
        assertThat(engine.hasError()).isTrue();
        verify(sink).emit("gta3sc: fatal error: command 'FOO' undefined or unsupported");
    }

    @Test
    void haltCarriesNoMessageOrStackTrace() {
        HaltJobException halt = new HaltJobException();

        assertThat(halt.getMessage()).isNull();
        assertThat(halt.getStackTrace()).isEmpty();
    }

    @Test
    void exceedingErrorLimitBecomesFatal() {
        DiagnosticsEngine engine = new DiagnosticsEngine(sink, OptionalInt.of(2));

        engine.error(SourceContext.none(), "one");
        engine.error(SourceContext.none(), "two");

        assertThatThrownBy(() -> engine.error(SourceContext.none(), "three"))
                .isInstanceOf(HaltJobException.class);
        assertThat(engine.errorCount()).isEqualTo(3);
        assertThat(engine.fatalCount()).isEqualTo(1);
        verify(sink).emit("gta3sc: fatal error: too many errors");
    }

    @Test
    void keepsRenderedDiagnosticsInEmissionOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine(sink);

        engine.warning(SourceContext.at(null, "a.sc", 1, 2), "first");
        engine.error(SourceContext.none(), "second");

        assertThat(engine.getDiagnostics())
                .extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.WARNING, Diagnostic.Type.ERROR);
        assertThat(engine.summary()).isEqualTo("a.sc:1:2: warning: first\ngta3sc: error: second");
    }

    @Test
    void concurrentReportsAreCountedAndNeverInterleaved() throws Exception {
        int threads = 8;
        int perThread = 200;
        List<String> blocks = Collections.synchronizedList(new ArrayList<>());
        StringBuilder transcript = new StringBuilder();
        DiagnosticsEngine engine = new DiagnosticsEngine(block -> {
            // Unsynchronized on purpose: the engine must serialize calls.
            transcript.append(block).append('\n');
            blocks.add(block);
        });

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int id = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    engine.warning(SourceContext.at(null, "t" + id + ".sc", i + 1, 1), "warning {} of thread {}", i, id);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();

        assertThat(engine.warningCount()).isEqualTo(threads * perThread);
        assertThat(blocks).hasSize(threads * perThread);
        assertThat(transcript.toString().split("\n"))
                .hasSize(threads * perThread)
                .allMatch(line -> line.matches("t\\d\\.sc:\\d+:1: warning: warning \\d+ of thread \\d"));
    }
}
