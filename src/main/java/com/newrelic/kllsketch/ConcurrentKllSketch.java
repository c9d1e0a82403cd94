// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.List;

// A concurrency wrapper for KllSketch. Methods are defined as "synchronized" for multi-thread access.
// NOTES:
// 1. Iteration needs no extra locking. iterator() returns an iterator on an immutable sorted view,
//    taken at the time of the call.
// 2. No method holds the locks of two wrappers at once. merge() and equals() copy a ConcurrentKllSketch
//    operand under the operand's lock, then use the copy under the lock on "this". Any other operand must be
//    protected from concurrent modification by the caller.
//
public class ConcurrentKllSketch<T> implements QuantileSketch<T> {
    protected final KllSketch<T> sketch;

    @SuppressFBWarnings(value = "EI_EXPOSE_REP2")
    public ConcurrentKllSketch(final KllSketch<T> sketch) {
        this.sketch = sketch;
    }

    @Override
    public synchronized ConcurrentKllSketch<T> deepCopy() {
        return new ConcurrentKllSketch<>(sketch.deepCopy());
    }

    // Caller must hold the lock on "this" while using the returned sketch.
    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    public KllSketch<T> getSketch() {
        return sketch;
    }

    // Copy of the wrapped sketch, taken under the lock on "this".
    synchronized KllSketch<T> snapshot() {
        return sketch.deepCopy();
    }

    @Override
    public boolean equals(final Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof ConcurrentKllSketch)) {
            return false;
        }
        final KllSketch<?> other = ((ConcurrentKllSketch<?>) obj).snapshot();
        synchronized (this) {
            return sketch.equals(other);
        }
    }

    @Override
    public synchronized int hashCode() {
        return sketch.hashCode(); // Hash code collision between "this" and "this.sketch" is acceptable.
    }

    @Override
    public synchronized void update(final T item) {
        sketch.update(item);
    }

    // Holds the lock for the whole batch.
    @Override
    public synchronized void update(final Iterable<? extends T> items) {
        sketch.update(items);
    }

    @Override
    public synchronized void update(final T[] items) {
        sketch.update(items);
    }

    @Override
    public QuantileSketch<T> merge(final QuantileSketch<T> other) {
        if (other == this) {
            synchronized (this) {
                sketch.merge(sketch);
            }
        } else if (other instanceof ConcurrentKllSketch) {
            final KllSketch<T> copy = ((ConcurrentKllSketch<T>) other).snapshot();
            synchronized (this) {
                sketch.merge(copy);
            }
        } else {
            synchronized (this) {
                sketch.merge(other);
            }
        }
        return this;
    }

    @Override
    public synchronized boolean isEmpty() {
        return sketch.isEmpty();
    }

    @Override
    public synchronized int getK() {
        return sketch.getK();
    }

    @Override
    public synchronized long getN() {
        return sketch.getN();
    }

    @Override
    public synchronized int getNumRetained() {
        return sketch.getNumRetained();
    }

    @Override
    public synchronized boolean isEstimationMode() {
        return sketch.isEstimationMode();
    }

    @Override
    public synchronized T getMinItem() {
        return sketch.getMinItem();
    }

    @Override
    public synchronized T getMaxItem() {
        return sketch.getMaxItem();
    }

    @Override
    public synchronized T getQuantile(final double rank, final boolean inclusive) {
        return sketch.getQuantile(rank, inclusive);
    }

    @Override
    public synchronized List<T> getQuantiles(final double[] ranks, final boolean inclusive) {
        return sketch.getQuantiles(ranks, inclusive);
    }

    @Override
    public synchronized double getRank(final T item, final boolean inclusive) {
        return sketch.getRank(item, inclusive);
    }

    @Override
    public synchronized double[] getPMF(final T[] splitPoints, final boolean inclusive) {
        return sketch.getPMF(splitPoints, inclusive);
    }

    @Override
    public synchronized double[] getCDF(final T[] splitPoints, final boolean inclusive) {
        return sketch.getCDF(splitPoints, inclusive);
    }

    @Override
    public synchronized double getNormalizedRankError(final boolean pmf) {
        return sketch.getNormalizedRankError(pmf);
    }

    @Override
    public synchronized String toString(final boolean printLevels, final boolean printItems) {
        return sketch.toString(printLevels, printItems);
    }

    @Override
    public synchronized String toString() {
        return sketch.toString();
    }

    @NotNull
    @Override
    public synchronized Iterator<WeightedItem<T>> iterator() {
        return sketch.iterator();
    }
}
