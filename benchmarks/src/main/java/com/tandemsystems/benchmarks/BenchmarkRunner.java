package com.tandemsystems.benchmarks;

import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

/**
 * Runs the queue and channel benchmarks with settings short enough for a local
 * comparison run.
 *
 * Arguments, all optional: include pattern, fork count, warmup iterations,
 * measurement iterations.
 *
 * <pre>
 * java -cp ... com.tandemsystems.benchmarks.BenchmarkRunner ".*QueueBenchmark.*" 2 5 10
 * </pre>
 */
public class BenchmarkRunner {

    private static final String DEFAULT_PATTERN = "com\\.tandemsystems\\.benchmarks\\..*Benchmark.*";
    private static final int DEFAULT_FORKS = 1;
    private static final int DEFAULT_WARMUP_ITERATIONS = 3;
    private static final int DEFAULT_MEASUREMENT_ITERATIONS = 5;

    public static void main(String[] args) throws RunnerException {
        String pattern = args.length > 0 ? args[0] : DEFAULT_PATTERN;
        int forks = intArg(args, 1, DEFAULT_FORKS);
        int warmups = intArg(args, 2, DEFAULT_WARMUP_ITERATIONS);
        int measurements = intArg(args, 3, DEFAULT_MEASUREMENT_ITERATIONS);

        Options opt = new OptionsBuilder()
                .include(pattern)
                .forks(forks)
                .warmupIterations(warmups)
                .warmupTime(TimeValue.seconds(1))
                .measurementIterations(measurements)
                .measurementTime(TimeValue.seconds(1))
                .shouldFailOnError(true)
                .build();

        System.out.printf("Running %s with %d fork(s), %d warmup and %d measurement iterations%n",
                pattern, forks, warmups, measurements);
        new Runner(opt).run();
    }

    private static int intArg(String[] args, int index, int defaultValue) {
        if (args.length <= index) {
            return defaultValue;
        }
        int value = Integer.parseInt(args[index]);
        if (value < 0) {
            throw new IllegalArgumentException("Argument " + index + " cannot be negative: " + value);
        }
        return value;
    }
}
