// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch;

import com.newrelic.kllsketch.item.ItemTypes;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@State(Scope.Benchmark)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@BenchmarkMode(Mode.AverageTime)

public class UpdateBenchmark {
    @Param("1000000")
    int valueArrayLength;

    Double[] values;
    int valueIndex;

    public enum DataType {
        SEQUENTIAL,
        RANDOM
    }

    @Param({"RANDOM"})
    DataType dataType;

    public enum SketchType {
        SIMPLE,
        CONCURRENT
    }

    @Param({"SIMPLE", "CONCURRENT"})
    SketchType _sketchType; // Starts with "_" to make it the 1st param in alphabetic param name sort order.

    @Param({"200"})
    int k;

    QuantileSketch<Double> sketch;

    @Setup
    public void setup() {
        final KllSketch<Double> kll = new KllSketch<>(ItemTypes.DOUBLE, k);
        switch (_sketchType) {
            case SIMPLE:
                sketch = kll;
                break;
            case CONCURRENT:
                sketch = new ConcurrentKllSketch<>(kll);
                break;
        }

        values = new Double[valueArrayLength];
        for (int i = 0; i < values.length; i++) {
            values[i] = dataType == DataType.SEQUENTIAL
                    ? (double) i
                    : (double) ThreadLocalRandom.current().nextInt(0, values.length);
        }
    }

    @Benchmark
    public Object update() {
        sketch.update(values[valueIndex]);
        if (++valueIndex >= values.length) {
            valueIndex = 0;
        }
        return sketch;
    }

    volatile boolean terminate = false;

    // Multi thread testing.
    public static void main(final String[] args) throws Exception {
        final UpdateBenchmark benchmark = new UpdateBenchmark();

        benchmark.valueArrayLength = 1000_000;
        benchmark.dataType = DataType.RANDOM;
        benchmark._sketchType = SketchType.CONCURRENT;
        benchmark.k = KllSketch.DEFAULT_K;

        int threads = 1;
        int seconds = 5;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-data":
                    benchmark.dataType = DataType.valueOf(args[++i]);
                    break;
                case "-sketch":
                    benchmark._sketchType = SketchType.valueOf(args[++i]);
                    break;
                case "-k":
                    benchmark.k = Integer.parseInt(args[++i]);
                    break;
                case "-seconds":
                    seconds = Integer.parseInt(args[++i]);
                    break;
                case "-threads":
                    threads = Integer.parseInt(args[++i]);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option " + args[i]);
            }
        }

        if (threads > 1 && benchmark._sketchType != SketchType.CONCURRENT) {
            throw new IllegalArgumentException("Multiple threads need -sketch " + SketchType.CONCURRENT);
        }

        benchmark.setup();

        System.out.println("sketch=" + benchmark.sketch.getClass().getName() + " k=" + benchmark.k);

        final ExecutorService threadPool = Executors.newFixedThreadPool(threads);
        final AtomicLong totalCount = new AtomicLong();

        final long startTime = System.currentTimeMillis();

        for (int t = 0; t < threads; t++) {
            threadPool.execute(() -> {
                int valueIndex = 0;
                long count = 0;
                while (!benchmark.terminate) {
                    benchmark.sketch.update(benchmark.values[valueIndex]);
                    count++;
                    if (++valueIndex >= benchmark.values.length) {
                        valueIndex = 0;
                    }
                }
                totalCount.addAndGet(count);
                System.out.println("Thread update count = " + count);
            });
        }

        Thread.sleep(seconds * 1000L);
        benchmark.terminate = true;
        threadPool.shutdown();
        threadPool.awaitTermination(1, TimeUnit.MINUTES);

        final long elapsedTime = System.currentTimeMillis() - startTime;
        final double nsPerUpdate = (double) elapsedTime / totalCount.get() * 1000_000;
        System.out.println("elapsedTime=" + elapsedTime
                + "  nsPerUpdate=" + nsPerUpdate);

        if (totalCount.get() != benchmark.sketch.getN()) {
            throw new RuntimeException("client side count = " + totalCount.get()
                    + ", sketch count = " + benchmark.sketch.getN());
        }

        System.out.println(benchmark.sketch.toString());

        final double[] ranks = new double[]{0, 0.25, 0.5, 0.9, 1};
        final List<Double> quantiles = benchmark.sketch.getQuantiles(ranks, true);

        for (int i = 0; i < ranks.length; i++) {
            System.out.print(ranks[i] + "=" + quantiles.get(i) + " ");
        }
        System.out.println();
    }
}
