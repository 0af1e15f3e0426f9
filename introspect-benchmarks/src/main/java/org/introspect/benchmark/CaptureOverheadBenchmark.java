package org.introspect.benchmark;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.introspect.benchmark.domain.Shipment;
import org.introspect.javacompiler.InstrumentingCompiler;
import org.openjdk.jmh.annotations.*;

/**
 * Measures the passing path: an instrumented check against the same check written by hand.
 * Failures are rare in practice, so this is the overhead every assertion pays.
 */
@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 2, jvmArgsAppend = "-ea")
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class CaptureOverheadBenchmark {

    private static final String CHECKS = String.join("\n",
            "package demo;",
            "import org.introspect.benchmark.domain.Shipment;",
            "public class Checks {",
            "    public static void check(Shipment s) {",
            "        assert s.getQuantity() > 0 && s.getWeight() / s.getQuantity() < 50.0 || s.isFragile();",
            "    }",
            "}");

    @State(Scope.Thread)
    public static class ShipmentState {

        MethodHandle instrumented;
        Shipment shipment;

        @Setup(Level.Trial)
        public void compile() throws ReflectiveOperationException {
            Class<?> checks = new InstrumentingCompiler().compile("demo.Checks", CHECKS);
            instrumented = MethodHandles.publicLookup().findStatic(checks, "check",
                                                                   MethodType.methodType(void.class, Shipment.class));
            shipment = new Shipment();
            shipment.setDestination("Rotterdam");
        }

        @Setup(Level.Iteration)
        public void mutateShipment() {
            ThreadLocalRandom rng = ThreadLocalRandom.current();
            shipment.setQuantity(rng.nextInt(1, 100));
            shipment.setWeight(rng.nextDouble(0, 40));
            shipment.setFragile(rng.nextBoolean());
        }
    }

    @Benchmark
    public void instrumentedCheck(ShipmentState state) throws Throwable {
        state.instrumented.invokeExact(state.shipment);
    }

    @Benchmark
    public void plainCheck(ShipmentState state) {
        Shipment s = state.shipment;
        assert s.getQuantity() > 0 && s.getWeight() / s.getQuantity() < 50.0 || s.isFragile();
    }
}
