package org.manuscript.benchmark;

import java.util.concurrent.TimeUnit;

import org.manuscript.LintReport;
import org.manuscript.ManuscriptLinter;
import org.manuscript.benchmark.domain.SamplePlugins;
import org.manuscript.config.LintConfig;
import org.openjdk.jmh.annotations.*;

/**
 * Full lint pipeline cost per file, from raw text to a sorted report.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class LintBenchmark {

    @State(Scope.Thread)
    public static class SourceState {

        @Param({"1", "20", "200"})
        int methods;

        String source;
        final ManuscriptLinter linter = new ManuscriptLinter();
        final ManuscriptLinter strictLinter = new ManuscriptLinter(LintConfig.defaults().withStrict(true));

        @Setup(Level.Trial)
        public void init() {
            source = SamplePlugins.plugin(methods);
        }
    }

    @Benchmark
    public LintReport lint(SourceState state) {
        return state.linter.lint(state.source);
    }

    @Benchmark
    public LintReport lintStrict(SourceState state) {
        return state.strictLinter.lint(state.source);
    }
}
