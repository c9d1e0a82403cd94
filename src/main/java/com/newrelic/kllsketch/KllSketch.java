// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch;

import com.newrelic.kllsketch.item.ItemType;
import com.newrelic.kllsketch.item.ItemTypes;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Random;

// KLL quantiles sketch. See "Optimal Quantile Approximation in Streams" by Karnin, Lang and Liberty.
//
// Retained items live in one array, grouped in levels. Level i items each stand for 2^i stream items.
// Level i occupies items[levels[i]] to items[levels[i + 1] - 1]. Free space is at the bottom of the array,
// below levels[0], and level zero grows downward into it. When there is no free space left, the lowest level
// that is at or over its capacity is compacted: half of its items, picked by a single coin flip, are promoted
// to the level above. This layout is also the serialization layout, see KllSketchSerializer.
//
// Not thread safe. See ConcurrentKllSketch.

public class KllSketch<T> implements QuantileSketch<T> {
    private static final Logger LOG = LoggerFactory.getLogger(KllSketch.class);

    public static final int DEFAULT_K = 200;
    public static final int DEFAULT_M = 8; // Minimum level width
    public static final int MIN_K = DEFAULT_M;
    public static final int MAX_K = (1 << 16) - 1; // Serialized as 16 bits

    static final String EMPTY_SKETCH_MESSAGE = "operation is undefined for an empty sketch";

    private final ItemType<T> itemType;
    private final Comparator<? super T> comparator;
    private final int k;
    private int minK; // Lowest k of this and any estimation mode sketch merged into it
    private long n;
    private int numLevels;
    private int[] levels; // numLevels + 1 entries. The last one equals items.length
    private Object[] items;
    private boolean isLevelZeroSorted;

    @Nullable
    private T minItem;
    @Nullable
    private T maxItem;

    private final Random random;

    // Cached for queries. Reset by any modification. KllSortedView is immutable, so a racy read by concurrent
    // queries sees either null or a complete view.
    @Nullable
    private KllSortedView<T> sortedView;

    public KllSketch(final ItemType<T> itemType) {
        this(itemType, DEFAULT_K);
    }

    public KllSketch(final ItemType<T> itemType, final int k) {
        this(itemType, k, new Random());
    }

    // Use a seeded Random for reproducible compaction.
    public KllSketch(final ItemType<T> itemType, final int k, final Random random) {
        checkK(k);
        this.itemType = Objects.requireNonNull(itemType, "itemType");
        this.comparator = itemType.getComparator();
        this.random = Objects.requireNonNull(random, "random");
        this.k = k;
        this.minK = k;
        this.n = 0;
        this.numLevels = 1;
        this.levels = new int[]{k, k};
        this.items = new Object[k];
        this.isLevelZeroSorted = false;
    }

    // Copy constructor. The copy gets its own Random.
    public KllSketch(final KllSketch<T> other) {
        this(other, new Random());
    }

    public KllSketch(final KllSketch<T> other, final Random random) {
        this.itemType = other.itemType;
        this.comparator = other.comparator;
        this.random = Objects.requireNonNull(random, "random");
        this.k = other.k;
        this.minK = other.minK;
        this.n = other.n;
        this.numLevels = other.numLevels;
        this.levels = other.levels.clone();
        this.items = other.items.clone(); // Items are immutable values, a shallow copy is enough
        this.isLevelZeroSorted = other.isLevelZeroSorted;
        this.minItem = other.minItem;
        this.maxItem = other.maxItem;
    }

    // For deserialization only. Caller must ensure that the fields are consistent among themselves.
    @SuppressFBWarnings(value = "EI_EXPOSE_REP2")
    KllSketch(final ItemType<T> itemType,
              final int k,
              final int minK,
              final long n,
              final int numLevels,
              final int[] levels,
              final Object[] items,
              @Nullable final T minItem,
              @Nullable final T maxItem,
              final boolean isLevelZeroSorted,
              final Random random) {
        this.itemType = itemType;
        this.comparator = itemType.getComparator();
        this.random = random;
        this.k = k;
        this.minK = minK;
        this.n = n;
        this.numLevels = numLevels;
        this.levels = levels;
        this.items = items;
        this.minItem = minItem;
        this.maxItem = maxItem;
        this.isLevelZeroSorted = isLevelZeroSorted;
    }

    public static KllSketch<Float> newFloatsSketch(final int k) {
        return new KllSketch<>(ItemTypes.FLOAT, k);
    }

    public static KllSketch<Double> newDoublesSketch(final int k) {
        return new KllSketch<>(ItemTypes.DOUBLE, k);
    }

    public static KllSketch<Integer> newIntsSketch(final int k) {
        return new KllSketch<>(ItemTypes.INT, k);
    }

    static void checkK(final int k) {
        if (k < MIN_K || k > MAX_K) {
            throw new IllegalArgumentException("K must be >= " + MIN_K + " and <= " + MAX_K + ": " + k);
        }
    }

    @Override
    public KllSketch<T> deepCopy() {
        return new KllSketch<>(this);
    }

    @Override
    public void update(final T item) {
        if (!itemType.isValid(item)) {
            throw new IllegalArgumentException("Invalid " + itemType.getName() + " item: " + item);
        }
        updateMinMax(item);
        final int index = internalUpdate();
        items[index] = item;
        sortedView = null;
    }

    private void updateMinMax(final T item) {
        if (isEmpty()) {
            minItem = item;
            maxItem = item;
        } else {
            if (comparator.compare(item, minItem) < 0) {
                minItem = item;
            }
            if (comparator.compare(maxItem, item) < 0) {
                maxItem = item;
            }
        }
    }

    // Returns the slot for a new level zero item, compacting first if the array is full.
    private int internalUpdate() {
        if (levels[0] == 0) {
            compressWhileUpdating();
        }
        n++;
        isLevelZeroSorted = false;
        return --levels[0];
    }

    private void compressWhileUpdating() {
        final int level = findLevelToCompact();

        // Add the new top level right here. This grows the array, shifts the data and the level boundaries,
        // and increments numLevels.
        if (level == numLevels - 1) {
            addEmptyTopLevelToCompletelyFullSketch();
        }

        final int rawBeg = levels[level];
        final int rawLim = levels[level + 1];
        // level + 2 is safe because a new top level was added above if needed
        final int popAbove = levels[level + 2] - rawLim;
        final int rawPop = rawLim - rawBeg;
        final boolean oddPop = KllHelper.isOdd(rawPop);
        final int adjBeg = oddPop ? rawBeg + 1 : rawBeg;
        final int adjPop = oddPop ? rawPop - 1 : rawPop;
        final int halfAdjPop = adjPop / 2;
        final int freedBeg = levels[0];

        // Level zero might not be sorted. The first item of an odd population is not part of the sort.
        if (level == 0 && !isLevelZeroSorted) {
            KllHelper.sort(items, adjBeg, adjBeg + adjPop, comparator);
        }
        if (popAbove == 0) {
            KllHelper.randomlyHalveUp(items, adjBeg, adjPop, random);
        } else {
            KllHelper.randomlyHalveDown(items, adjBeg, adjPop, random);
            KllHelper.mergeSortedArrays(items, adjBeg, halfAdjPop, items, rawLim, popAbove, items, adjBeg + halfAdjPop, comparator);
        }

        levels[level + 1] -= halfAdjPop; // Level above now starts lower
        if (oddPop) {
            levels[level] = levels[level + 1] - 1; // The leftover item stays at this level
            if (levels[level] != rawBeg) {
                items[levels[level]] = items[rawBeg];
            }
        } else {
            levels[level] = levels[level + 1]; // This level is now empty
        }

        if (levels[level] != rawBeg + halfAdjPop) {
            throw new IllegalStateException("compressWhileUpdating(): compaction error at level " + level);
        }

        // Shift up the levels below, so that the freed space ends up at the bottom for level zero
        if (level > 0) {
            final int amount = rawBeg - levels[0];
            System.arraycopy(items, levels[0], items, levels[0] + halfAdjPop, amount);
            for (int lvl = 0; lvl < level; lvl++) {
                levels[lvl] += halfAdjPop;
            }
        }
        Arrays.fill(items, freedBeg, freedBeg + halfAdjPop, null);
    }

    private int findLevelToCompact() {
        int level = 0;
        while (true) {
            if (level >= numLevels) {
                throw new IllegalStateException("findLevelToCompact(): capacity calculation error");
            }
            final int pop = levels[level + 1] - levels[level];
            final int cap = KllHelper.levelCapacity(k, numLevels, level, DEFAULT_M);
            if (pop >= cap) {
                return level;
            }
            level++;
        }
    }

    private void addEmptyTopLevelToCompletelyFullSketch() {
        final int curTotalCap = levels[numLevels];

        if (levels[0] != 0) {
            throw new IllegalStateException("addEmptyTopLevel(): full sketch expected, free space " + levels[0]);
        }
        if (items.length != curTotalCap) {
            throw new IllegalStateException("addEmptyTopLevel(): capacity mismatch " + items.length + " != " + curTotalCap);
        }

        final int deltaCap = KllHelper.levelCapacity(k, numLevels + 1, 0, DEFAULT_M);
        final int newTotalCap = curTotalCap + deltaCap;

        final Object[] newItems = new Object[newTotalCap];
        System.arraycopy(items, 0, newItems, deltaCap, curTotalCap);
        items = newItems;

        final int[] newLevels = Arrays.copyOf(levels, numLevels + 2);
        for (int i = 0; i <= numLevels; i++) { // Includes the old top boundary
            newLevels[i] += deltaCap;
        }
        numLevels++;
        newLevels[numLevels] = newLevels[numLevels - 1];
        levels = newLevels;

        LOG.debug("Added level {}, capacity {} items, n={}", numLevels - 1, newTotalCap, n);
    }

    @Override
    public KllSketch<T> merge(final QuantileSketch<T> other) {
        if (other instanceof KllSketch) {
            return merge((KllSketch<T>) other);
        }
        if (other instanceof ConcurrentKllSketch) {
            return merge(((ConcurrentKllSketch<T>) other).snapshot()); // Holds the operand lock for the copy only
        }
        throw new IllegalArgumentException("KllSketch cannot merge with " + other.getClass().getName());
    }

    // Merge "other" into "this". Does not modify "other". Returns "this".
    // The sketches need not have the same k. The result keeps this k for its level capacities;
    // its error bound follows the lowest k of the estimation mode inputs (see getMinK()).
    public KllSketch<T> merge(final KllSketch<T> other) {
        if (other.itemType.getClass() != itemType.getClass()) {
            throw new IllegalArgumentException("KllSketch merge not allowed between item types "
                    + itemType.getName() + " and " + other.itemType.getName());
        }
        if (other.isEmpty()) {
            return this;
        }
        final KllSketch<T> source = other == this ? new KllSketch<>(other) : other;

        if (isEmpty()) {
            minItem = source.minItem;
            maxItem = source.maxItem;
        } else {
            if (comparator.compare(source.minItem, minItem) < 0) {
                minItem = source.minItem;
            }
            if (comparator.compare(maxItem, source.maxItem) < 0) {
                maxItem = source.maxItem;
            }
        }

        final long finalN = n + source.n;

        // Level zero of "other" goes through the regular update path
        for (int i = source.levels[0]; i < source.levels[1]; i++) {
            final int index = internalUpdate();
            items[index] = source.items[i];
        }
        if (source.numLevels >= 2) {
            mergeHigherLevels(source, finalN);
        }
        n = finalN;
        if (source.isEstimationMode()) {
            minK = Math.min(minK, source.minK);
        }
        sortedView = null;

        assertCorrectTotalWeight();
        LOG.debug("Merged sketch n={} into n={}, levels={}, retained={}", source.n, n, numLevels, getNumRetained());
        return this;
    }

    private void mergeHigherLevels(final KllSketch<T> other, final long finalN) {
        final int tmpNumItems = getNumRetained() + other.getNumRetainedAboveLevelZero();
        final Object[] workBuf = new Object[tmpNumItems];
        final int ub = KllHelper.ubOnNumLevels(finalN);
        final int[] workLevels = new int[ub + 2]; // ub + 1 is not enough
        final int[] outLevels = new int[ub + 2];

        final int provisionalNumLevels = Math.max(numLevels, other.numLevels);

        populateWorkArrays(other, workBuf, workLevels, provisionalNumLevels);

        // workBuf is both input and output here
        final KllHelper.CompressResult result = KllHelper.generalCompress(k, DEFAULT_M, provisionalNumLevels, workBuf,
                workLevels, outLevels, isLevelZeroSorted, comparator, random);

        if (result.finalNumLevels > ub) {
            throw new IllegalStateException("merge(): " + result.finalNumLevels + " levels exceed upper bound " + ub);
        }

        // Move the results back into this sketch, with the free space at the bottom
        final int freeSpaceAtBottom = result.finalCapacity - result.finalNumItems;
        items = new Object[result.finalCapacity];
        System.arraycopy(workBuf, outLevels[0], items, freeSpaceAtBottom, result.finalNumItems);

        levels = new int[result.finalNumLevels + 1];
        final int offset = freeSpaceAtBottom - outLevels[0];
        for (int lvl = 0; lvl < levels.length; lvl++) {
            levels[lvl] = outLevels[lvl] + offset;
        }
        numLevels = result.finalNumLevels;
    }

    // Level zero of "other" was already inserted into "this". Levels above are merged pairwise.
    private void populateWorkArrays(final KllSketch<T> other,
                                    final Object[] workBuf,
                                    final int[] workLevels,
                                    final int provisionalNumLevels) {
        workLevels[0] = 0;

        final int selfPopZero = safeLevelSize(0);
        System.arraycopy(items, levels[0], workBuf, workLevels[0], selfPopZero);
        workLevels[1] = selfPopZero;

        for (int lvl = 1; lvl < provisionalNumLevels; lvl++) {
            final int selfPop = safeLevelSize(lvl);
            final int otherPop = other.safeLevelSize(lvl);
            workLevels[lvl + 1] = workLevels[lvl] + selfPop + otherPop;

            if (selfPop > 0 && otherPop == 0) {
                System.arraycopy(items, levels[lvl], workBuf, workLevels[lvl], selfPop);
            } else if (selfPop == 0 && otherPop > 0) {
                System.arraycopy(other.items, other.levels[lvl], workBuf, workLevels[lvl], otherPop);
            } else if (selfPop > 0 && otherPop > 0) {
                KllHelper.mergeSortedArrays(items, levels[lvl], selfPop, other.items, other.levels[lvl], otherPop,
                        workBuf, workLevels[lvl], comparator);
            }
        }
    }

    private int safeLevelSize(final int level) {
        if (level >= numLevels) {
            return 0;
        }
        return levels[level + 1] - levels[level];
    }

    private int getNumRetainedAboveLevelZero() {
        if (numLevels == 1) {
            return 0;
        }
        return levels[numLevels] - levels[1];
    }

    private void assertCorrectTotalWeight() {
        final long totalWeight = KllHelper.sumTheSampleWeights(numLevels, levels);
        if (totalWeight != n) {
            throw new IllegalStateException("Total weight " + totalWeight + " does not match n " + n);
        }
    }

    @Override
    public boolean isEmpty() {
        return n == 0;
    }

    @Override
    public int getK() {
        return k;
    }

    public int getMinK() {
        return minK;
    }

    @Override
    public long getN() {
        return n;
    }

    @Override
    public int getNumRetained() {
        return levels[numLevels] - levels[0];
    }

    @Override
    public boolean isEstimationMode() {
        return numLevels > 1;
    }

    public int getNumLevels() {
        return numLevels;
    }

    public boolean isLevelZeroSorted() {
        return isLevelZeroSorted;
    }

    public ItemType<T> getItemType() {
        return itemType;
    }

    // Total number of item slots, used and free.
    public int getCapacity() {
        return items.length;
    }

    // For the serializer. Do not modify.
    int[] getLevels() {
        return levels;
    }

    // For the serializer. Do not modify.
    Object[] getItems() {
        return items;
    }

    @Override
    public T getMinItem() {
        if (isEmpty()) {
            return getEmptySketchItem();
        }
        return minItem;
    }

    @Override
    public T getMaxItem() {
        if (isEmpty()) {
            return getEmptySketchItem();
        }
        return maxItem;
    }

    private T getEmptySketchItem() {
        if (itemType.hasMissingItem()) {
            return itemType.getMissingItem();
        }
        throw new NoSuchElementException(EMPTY_SKETCH_MESSAGE);
    }

    // The view is rebuilt after any update or merge.
    public KllSortedView<T> getSortedView() {
        KllSortedView<T> view = sortedView;
        if (view == null) {
            view = new KllSortedView<>(items, levels, numLevels, isLevelZeroSorted, comparator);
            sortedView = view;
        }
        return view;
    }

    @Override
    public T getQuantile(final double rank, final boolean inclusive) {
        if (isEmpty()) {
            return getEmptySketchItem();
        }
        checkRank(rank);
        return getSortedView().getQuantile(rank, inclusive);
    }

    @Override
    public List<T> getQuantiles(final double[] ranks, final boolean inclusive) {
        if (isEmpty()) {
            return Collections.emptyList();
        }
        final KllSortedView<T> view = getSortedView();
        final List<T> quantiles = new ArrayList<>(ranks.length);
        for (final double rank : ranks) {
            checkRank(rank);
            quantiles.add(view.getQuantile(rank, inclusive));
        }
        return quantiles;
    }

    // Returns "numQuantiles" quantiles at evenly spaced ranks from 0 to 1, both ends included.
    public List<T> getQuantiles(final int numQuantiles, final boolean inclusive) {
        if (numQuantiles <= 0) {
            throw new IllegalArgumentException("numQuantiles must be > 0: " + numQuantiles);
        }
        if (isEmpty()) {
            return Collections.emptyList();
        }
        final double[] ranks = new double[numQuantiles];
        for (int i = 1; i < numQuantiles; i++) {
            ranks[i] = (double) i / (numQuantiles - 1);
        }
        if (numQuantiles > 1) {
            ranks[numQuantiles - 1] = 1.0;
        }
        return getQuantiles(ranks, inclusive);
    }

    private static void checkRank(final double rank) {
        if (!(rank >= 0 && rank <= 1)) { // Also rejects NaN
            throw new IllegalArgumentException("Normalized rank must be >= 0 and <= 1: " + rank);
        }
    }

    @Override
    public double getRank(final T item, final boolean inclusive) {
        if (!itemType.isValid(item)) {
            throw new IllegalArgumentException("Invalid " + itemType.getName() + " item: " + item);
        }
        if (isEmpty()) {
            if (itemType.hasMissingItem()) {
                return Double.NaN;
            }
            throw new NoSuchElementException(EMPTY_SKETCH_MESSAGE);
        }
        return getSortedView().getRank(item, inclusive);
    }

    @Override
    public double[] getPMF(final T[] splitPoints, final boolean inclusive) {
        checkSplitPoints(splitPoints);
        if (isEmpty()) {
            return new double[0];
        }
        return getSortedView().getPMF(splitPoints, inclusive);
    }

    @Override
    public double[] getCDF(final T[] splitPoints, final boolean inclusive) {
        checkSplitPoints(splitPoints);
        if (isEmpty()) {
            return new double[0];
        }
        return getSortedView().getCDF(splitPoints, inclusive);
    }

    private void checkSplitPoints(final T[] splitPoints) {
        if (splitPoints == null) {
            throw new IllegalArgumentException("splitPoints must not be null");
        }
        for (int i = 0; i < splitPoints.length; i++) {
            if (!itemType.isValid(splitPoints[i])) {
                throw new IllegalArgumentException("Invalid split point at index " + i + ": " + splitPoints[i]);
            }
            if (i > 0 && comparator.compare(splitPoints[i - 1], splitPoints[i]) >= 0) {
                throw new IllegalArgumentException("Split points must be unique and monotonically increasing: "
                        + splitPoints[i - 1] + " followed by " + splitPoints[i]);
            }
        }
    }

    @Override
    public double getNormalizedRankError(final boolean pmf) {
        return getNormalizedRankError(minK, pmf);
    }

    // Constants were derived as the best fit to the 99th percentile of empirically measured max error
    // in thousands of trials.
    public static double getNormalizedRankError(final int k, final boolean pmf) {
        return pmf
                ? 2.446 / Math.pow(k, 0.9433)
                : 2.296 / Math.pow(k, 0.9723);
    }

    // Ascending order, over all levels.
    @Override
    @NotNull
    public Iterator<WeightedItem<T>> iterator() {
        return getSortedView().iterator();
    }

    // Shortcut to KllSketchSerializer.
    public byte[] serialize() {
        return KllSketchSerializer.serializeKllSketchToBytes(this);
    }

    public static <T> KllSketch<T> deserialize(final byte[] bytes, final ItemType<T> itemType) {
        return KllSketchSerializer.deserializeKllSketch(bytes, itemType);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof KllSketch)) {
            return false;
        }
        final KllSketch<?> other = (KllSketch<?>) obj;

        // Random state is not part of equality
        return itemType.getClass() == other.itemType.getClass()
                && k == other.k
                && minK == other.minK
                && n == other.n
                && numLevels == other.numLevels
                && isLevelZeroSorted == other.isLevelZeroSorted
                && Objects.equals(minItem, other.minItem)
                && Objects.equals(maxItem, other.maxItem)
                && Arrays.equals(levels, other.levels)
                && Arrays.equals(items, levels[0], items.length, other.items, other.levels[0], other.items.length);
    }

    @Override
    public int hashCode() {
        int result = 1;
        result = 31 * result + Integer.hashCode(k);
        result = 31 * result + Integer.hashCode(minK);
        result = 31 * result + Long.hashCode(n);
        result = 31 * result + Integer.hashCode(numLevels);
        result = 31 * result + Boolean.hashCode(isLevelZeroSorted);
        result = 31 * result + Objects.hashCode(minItem);
        result = 31 * result + Objects.hashCode(maxItem);
        result = 31 * result + Arrays.hashCode(levels);
        for (int i = levels[0]; i < items.length; i++) {
            result = 31 * result + Objects.hashCode(items[i]);
        }
        return result;
    }

    @Override
    public String toString() {
        return toString(false, false);
    }

    // For diagnostics only. The format may change.
    @Override
    public String toString(final boolean printLevels, final boolean printItems) {
        final StringBuilder builder = new StringBuilder();
        builder.append("### KLL sketch summary:\n");
        builder.append("   Item type      : ").append(itemType.getName()).append('\n');
        builder.append("   K              : ").append(k).append('\n');
        builder.append("   min K          : ").append(minK).append('\n');
        builder.append("   M              : ").append(DEFAULT_M).append('\n');
        builder.append("   N              : ").append(n).append('\n');
        builder.append("   Epsilon        : ").append(formatPercent(getNormalizedRankError(false))).append('\n');
        builder.append("   Epsilon PMF    : ").append(formatPercent(getNormalizedRankError(true))).append('\n');
        builder.append("   Empty          : ").append(isEmpty()).append('\n');
        builder.append("   Estimation mode: ").append(isEstimationMode()).append('\n');
        builder.append("   Levels         : ").append(numLevels).append('\n');
        builder.append("   Sorted         : ").append(isLevelZeroSorted).append('\n');
        builder.append("   Capacity items : ").append(items.length).append('\n');
        builder.append("   Retained items : ").append(getNumRetained()).append('\n');
        if (!isEmpty()) {
            builder.append("   Min item       : ").append(minItem).append('\n');
            builder.append("   Max item       : ").append(maxItem).append('\n');
        }
        builder.append("### End sketch summary\n");

        if (printLevels) {
            builder.append("### KLL sketch levels:\n");
            builder.append("   index: nominal capacity, actual size\n");
            for (int i = 0; i < numLevels; i++) {
                builder.append("   ").append(i).append(": ")
                        .append(KllHelper.levelCapacity(k, numLevels, i, DEFAULT_M)).append(", ")
                        .append(safeLevelSize(i)).append('\n');
            }
            builder.append("### End sketch levels\n");
        }

        if (printItems) {
            builder.append("### KLL sketch data:\n");
            for (int level = 0; level < numLevels; level++) {
                if (levels[level] < levels[level + 1]) {
                    builder.append(" level ").append(level).append(":\n");
                }
                for (int i = levels[level]; i < levels[level + 1]; i++) {
                    builder.append("   ").append(items[i]).append('\n');
                }
            }
            builder.append("### End sketch data\n");
        }
        return builder.toString();
    }

    private static String formatPercent(final double fraction) {
        return String.format(Locale.ROOT, "%.3g%%", fraction * 100);
    }
}
