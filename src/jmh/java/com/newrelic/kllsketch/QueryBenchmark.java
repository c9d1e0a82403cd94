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

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

// Merge, serialization, and query costs on sketches in estimation mode.
@State(Scope.Benchmark)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@BenchmarkMode(Mode.AverageTime)

public class QueryBenchmark {
    @Param({"100000"})
    int n;

    @Param({"200"})
    int k;

    KllSketch<Double> sketch1;
    KllSketch<Double> sketch2;
    byte[] bytes;

    @Setup
    public void setup() {
        sketch1 = new KllSketch<>(ItemTypes.DOUBLE, k);
        sketch2 = new KllSketch<>(ItemTypes.DOUBLE, k);
        for (int i = 0; i < n; i++) {
            sketch1.update(ThreadLocalRandom.current().nextDouble());
            sketch2.update(ThreadLocalRandom.current().nextDouble());
        }
        bytes = sketch1.serialize();
    }

    @Benchmark
    public Object merge() {
        return new KllSketch<>(sketch1).merge(sketch2);
    }

    @Benchmark
    public Object serialize() {
        return sketch1.serialize();
    }

    @Benchmark
    public Object deserialize() {
        return KllSketch.deserialize(bytes, ItemTypes.DOUBLE);
    }

    // Includes rebuilding the sorted view, which an update invalidates.
    @Benchmark
    public Object quantileAfterUpdate() {
        sketch2.update(ThreadLocalRandom.current().nextDouble());
        return sketch2.getQuantile(0.99, true);
    }

    @Benchmark
    public double rank() {
        return sketch1.getRank(0.5, false);
    }
}
