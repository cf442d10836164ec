package org.manuscript.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.manuscript.LintReport;
import org.manuscript.ManuscriptLinter;
import org.manuscript.benchmark.domain.SamplePlugins;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads linting different files through one shared linter and the shared
 * language table. Gives a contention baseline for parallel file processing.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentLintBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final ManuscriptLinter linter = new ManuscriptLinter();
        String[] sources;

        @Setup(Level.Trial)
        public void init() {
            sources = new String[]{SamplePlugins.plugin(10), SamplePlugins.unformatted(10)};
        }
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
        }
    }

    @Benchmark
    public LintReport concurrentLintDifferentFiles(SharedState shared, ThreadState local) {
        return shared.linter.lint(shared.sources[local.threadIndex]);
    }
}
