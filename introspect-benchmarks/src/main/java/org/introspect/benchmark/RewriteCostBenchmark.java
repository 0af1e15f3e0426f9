package org.introspect.benchmark;

import java.util.concurrent.TimeUnit;

import org.introspect.javaparser.AssertionRewriter;
import org.introspect.javaparser.RewriteResult;
import org.openjdk.jmh.annotations.*;

/**
 * Measures source rewriting cost: parse, locate, instrument and splice. Shows what adding
 * introspection to a build costs per compilation unit.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class RewriteCostBenchmark {

    @State(Scope.Thread)
    public static class SourceState {

        @Param({"1", "10", "50"})
        int assertions;

        final AssertionRewriter rewriter = new AssertionRewriter();
        String source;

        @Setup(Level.Trial)
        public void generate() {
            StringBuilder body = new StringBuilder();
            for (int i = 0; i < assertions; i++) {
                body.append("        assert s.getQuantity() % ").append(i + 2)
                    .append(" == 0 && s.getWeight() * 2 < ").append(i + 100).append(".0 || s.isFragile();\n");
            }
            source = "package demo;\n"
                     + "import org.introspect.benchmark.domain.Shipment;\n"
                     + "class Checks {\n"
                     + "    static void check(Shipment s) {\n"
                     + body
                     + "    }\n"
                     + "}\n";
        }
    }

    @Benchmark
    public RewriteResult rewriteUnit(SourceState state) {
        return state.rewriter.rewrite("Checks.java", state.source);
    }

    @Benchmark
    public String rewriteAndPrint(SourceState state) {
        return state.rewriter.rewrite("Checks.java", state.source).getSource();
    }
}
