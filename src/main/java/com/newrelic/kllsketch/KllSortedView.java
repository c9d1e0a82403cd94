// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch;

import com.newrelic.kllsketch.QuantileSketch.WeightedItem;
import org.jetbrains.annotations.NotNull;

import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;

// All retained items of a sketch in ascending order, each paired with the cumulative weight up to and including it.
// Built by merging the sorted levels one at a time. Level zero is sorted on a private copy, so building a view
// never modifies the sketch.
//
// Immutable once built.

public class KllSortedView<T> implements Iterable<WeightedItem<T>> {
    private final Object[] items;
    private final long[] cumulativeWeights;
    private final long totalWeight;
    private final Comparator<? super T> comparator;

    KllSortedView(final Object[] sketchItems,
                  final int[] levels,
                  final int numLevels,
                  final boolean isLevelZeroSorted,
                  final Comparator<? super T> comparator) {
        this.comparator = comparator;

        final int numRetained = levels[numLevels] - levels[0];
        items = new Object[numRetained];
        cumulativeWeights = new long[numRetained];

        final Object[] tmpItems = new Object[numRetained];
        final long[] tmpWeights = new long[numRetained];

        int size = 0;
        for (int level = 0; level < numLevels; level++) {
            final int from = levels[level];
            final int length = levels[level + 1] - from;
            if (length == 0) {
                continue;
            }
            final long weight = 1L << level;

            System.arraycopy(sketchItems, from, items, size, length);
            for (int i = size; i < size + length; i++) {
                cumulativeWeights[i] = weight;
            }
            if (level == 0 && !isLevelZeroSorted) {
                KllHelper.sort(items, size, size + length, comparator); // All weights are 1 here
            }
            if (size > 0) {
                mergeRuns(size, length, tmpItems, tmpWeights);
            }
            size += length;
        }

        long subtotal = 0;
        for (int i = 0; i < numRetained; i++) {
            subtotal += cumulativeWeights[i];
            cumulativeWeights[i] = subtotal;
        }
        totalWeight = subtotal;
    }

    // Merge the sorted runs [0, lengthA) and [lengthA, lengthA + lengthB), weights still per item.
    // Ties take the item from the first run.
    private void mergeRuns(final int lengthA, final int lengthB, final Object[] tmpItems, final long[] tmpWeights) {
        final int limit = lengthA + lengthB;
        System.arraycopy(items, 0, tmpItems, 0, limit);
        System.arraycopy(cumulativeWeights, 0, tmpWeights, 0, limit);

        int a = 0;
        int b = lengthA;
        for (int c = 0; c < limit; c++) {
            final boolean takeA = b == limit || (a < lengthA && !KllHelper.lessThan(tmpItems[b], tmpItems[a], comparator));
            final int from = takeA ? a++ : b++;
            items[c] = tmpItems[from];
            cumulativeWeights[c] = tmpWeights[from];
        }
    }

    public int size() {
        return items.length;
    }

    public boolean isEmpty() {
        return items.length == 0;
    }

    public long getTotalWeight() {
        return totalWeight;
    }

    @SuppressWarnings("unchecked")
    public T getItem(final int index) {
        return (T) items[index];
    }

    public long getCumulativeWeight(final int index) {
        return cumulativeWeights[index];
    }

    // See QuantileSketch for inclusive semantics. Precondition: view not empty.
    public double getRank(final T item, final boolean inclusive) {
        checkNotEmpty();
        // Index of the first entry that does not count toward the rank
        final int index = inclusive ? upperBound(item) : lowerBound(item);
        if (index == 0) {
            return 0;
        }
        return (double) cumulativeWeights[index - 1] / totalWeight;
    }

    // Precondition: view not empty, 0 <= rank <= 1.
    public T getQuantile(final double rank, final boolean inclusive) {
        checkNotEmpty();
        final long weight = inclusive ? (long) Math.ceil(rank * totalWeight) : (long) (rank * totalWeight);
        final int index = inclusive ? firstWeightAtLeast(weight) : firstWeightAbove(weight);
        if (index == items.length) {
            return getItem(items.length - 1);
        }
        return getItem(index);
    }

    // Precondition: view not empty, split points validated by the caller.
    public double[] getCDF(final T[] splitPoints, final boolean inclusive) {
        checkNotEmpty();
        final double[] ranks = new double[splitPoints.length + 1];
        for (int i = 0; i < splitPoints.length; i++) {
            ranks[i] = getRank(splitPoints[i], inclusive);
        }
        ranks[splitPoints.length] = 1;
        return ranks;
    }

    public double[] getPMF(final T[] splitPoints, final boolean inclusive) {
        final double[] buckets = getCDF(splitPoints, inclusive);
        for (int i = splitPoints.length; i > 0; i--) {
            buckets[i] -= buckets[i - 1];
        }
        return buckets;
    }

    private void checkNotEmpty() {
        if (items.length == 0) {
            throw new NoSuchElementException("operation is undefined for an empty sketch");
        }
    }

    // First index whose item is >= "item"
    private int lowerBound(final T item) {
        int low = 0;
        int high = items.length;
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (comparator.compare(getItem(mid), item) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    // First index whose item is > "item"
    private int upperBound(final T item) {
        int low = 0;
        int high = items.length;
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (comparator.compare(item, getItem(mid)) < 0) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    private int firstWeightAtLeast(final long weight) {
        int low = 0;
        int high = cumulativeWeights.length;
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (cumulativeWeights[mid] < weight) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private int firstWeightAbove(final long weight) {
        int low = 0;
        int high = cumulativeWeights.length;
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (cumulativeWeights[mid] <= weight) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    // Returns items in ascending order with their own (not cumulative) weights.
    @Override
    @NotNull
    public Iterator<WeightedItem<T>> iterator() {
        return new Iterator<WeightedItem<T>>() {
            private int cursor = 0;

            @Override
            public boolean hasNext() {
                return cursor < items.length;
            }

            @Override
            public WeightedItem<T> next() {
                if (cursor >= items.length) {
                    throw new NoSuchElementException("KllSortedView.iterator: no more elements for next()");
                }
                final long previous = cursor == 0 ? 0 : cumulativeWeights[cursor - 1];
                final WeightedItem<T> result = new WeightedItem<>(getItem(cursor), cumulativeWeights[cursor] - previous);
                cursor++;
                return result;
            }
        };
    }
}
