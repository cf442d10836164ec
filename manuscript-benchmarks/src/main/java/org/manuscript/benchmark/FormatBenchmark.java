package org.manuscript.benchmark;

import java.util.concurrent.TimeUnit;

import org.manuscript.benchmark.domain.SamplePlugins;
import org.manuscript.format.ManuscriptFormatter;
import org.openjdk.jmh.annotations.*;

/**
 * Formatter cost on input that needs re-layout and on input that is already
 * canonical.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class FormatBenchmark {

    @State(Scope.Thread)
    public static class SourceState {

        @Param({"1", "20", "200"})
        int methods;

        String unformatted;
        String formatted;
        final ManuscriptFormatter formatter = new ManuscriptFormatter();

        @Setup(Level.Trial)
        public void init() {
            unformatted = SamplePlugins.unformatted(methods);
            formatted = formatter.format(unformatted);
        }
    }

    @Benchmark
    public String formatUnformatted(SourceState state) {
        return state.formatter.format(state.unformatted);
    }

    @Benchmark
    public String formatCanonical(SourceState state) {
        return state.formatter.format(state.formatted);
    }
}
