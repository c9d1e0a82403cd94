// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch;

import java.util.List;
import java.util.Objects;

// Binding agnostic API of a mergeable quantiles sketch over items of type T.
//
// Ranks are normalized to [0, 1]. With inclusive == false, the rank of an item is the weight of retained items
// strictly less than it. With inclusive == true, the weight of items equal to it is included.
//
// Queries that need a value on an empty sketch return the item type's missing value (NaN for float and double),
// or throw NoSuchElementException for types that have none (int, long, string).
public interface QuantileSketch<T> extends Iterable<QuantileSketch.WeightedItem<T>> {

    // Insert a single item. Null and NaN are rejected with IllegalArgumentException.
    void update(final T item);

    // Insert items in iteration order.
    default void update(final Iterable<? extends T> items) {
        if (items == null) {
            throw new IllegalArgumentException("items must not be null");
        }
        for (final T item : items) {
            update(item);
        }
    }

    default void update(final T[] items) {
        if (items == null) {
            throw new IllegalArgumentException("items must not be null");
        }
        for (final T item : items) {
            update(item);
        }
    }

    // Merge "other" into "this". Always returns "this". Implementations should not modify "other".
    QuantileSketch<T> merge(final QuantileSketch<T> other);

    // Returns a deep copy of the sketch.
    QuantileSketch<T> deepCopy();

    boolean isEmpty();

    // Configured accuracy parameter.
    int getK();

    // Number of items ever inserted, including merged sketches.
    long getN();

    int getNumRetained();

    // True once the retained items no longer represent the stream exactly.
    boolean isEstimationMode();

    T getMinItem();

    T getMaxItem();

    T getQuantile(final double rank, final boolean inclusive);

    default T getQuantile(final double rank) {
        return getQuantile(rank, false);
    }

    // Same as calling getQuantile() on each rank. Returns an empty list when the sketch is empty.
    List<T> getQuantiles(final double[] ranks, final boolean inclusive);

    default List<T> getQuantiles(final double[] ranks) {
        return getQuantiles(ranks, false);
    }

    double getRank(final T item, final boolean inclusive);

    default double getRank(final T item) {
        return getRank(item, false);
    }

    // splitPoints must be unique and increasing. They divide the item domain into splitPoints.length + 1 intervals.
    // inclusive == false: an interval includes its left split point and excludes its right one.
    // inclusive == true: an interval excludes its left split point and includes its right one.
    // The first interval always starts at the min item and the last one always ends at the max item.
    //
    // Returns the fraction of the stream in each interval. Returns an empty array when the sketch is empty.
    double[] getPMF(final T[] splitPoints, final boolean inclusive);

    default double[] getPMF(final T[] splitPoints) {
        return getPMF(splitPoints, false);
    }

    // Cumulative form of getPMF(). The last element is always 1.
    double[] getCDF(final T[] splitPoints, final boolean inclusive);

    default double[] getCDF(final T[] splitPoints) {
        return getCDF(splitPoints, false);
    }

    // Returns the normalized rank error bound, two sided for PMF queries if "pmf" is true, single sided otherwise.
    double getNormalizedRankError(final boolean pmf);

    String toString(final boolean printLevels, final boolean printItems);

    // Iterator returns items in ascending order. Each item carries its weight, ie. the number of stream items
    // it stands for. Weights of all items add up to getN().
    class WeightedItem<T> {
        public final T item;
        public final long weight;

        public WeightedItem(final T item, final long weight) {
            this.item = item;
            this.weight = weight;
        }

        @Override
        public boolean equals(final Object obj) {
            if (!(obj instanceof WeightedItem)) {
                return false;
            }
            final WeightedItem<?> other = (WeightedItem<?>) obj;
            return weight == other.weight && Objects.equals(item, other.item);
        }

        @Override
        public int hashCode() {
            int result = Objects.hashCode(item);
            result = 31 * result + Long.hashCode(weight);
            return result;
        }

        @Override
        public String toString() {
            return "{item=" + item + ", weight=" + weight + "}";
        }
    }
}
