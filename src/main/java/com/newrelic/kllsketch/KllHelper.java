// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;

// Level capacity schedule and the array level compaction primitives shared by KllSketch update and merge.
//
// All functions work on a single Object[] holding every level, with an offsets array "levels" where level i
// occupies [levels[i], levels[i + 1]). Levels above 0 are always sorted.
//
// The capacity schedule is part of the serialization format: a serialized sketch only stores level offsets
// into an array of computeTotalCapacity() slots. Any change here breaks compatibility with other implementations.

public class KllHelper {
    public static final int MAX_DEPTH = 60;
    private static final int MAX_DEPTH_AUX = 30;

    private static final long[] POWERS_OF_THREE = new long[MAX_DEPTH_AUX + 1];

    static {
        POWERS_OF_THREE[0] = 1;
        for (int i = 1; i <= MAX_DEPTH_AUX; i++) {
            POWERS_OF_THREE[i] = POWERS_OF_THREE[i - 1] * 3;
        }
    }

    private KllHelper() {
    }

    public static boolean isOdd(final int value) {
        return (value & 1) == 1;
    }

    // Upper bound on number of levels for a stream of n items. Returns 1 for an empty stream.
    public static int ubOnNumLevels(final long n) {
        if (n == 0) {
            return 1;
        }
        return 1 + floorOfLog2(n);
    }

    // floor(log2(n)) for n >= 1
    static int floorOfLog2(final long n) {
        return Long.SIZE - 1 - Long.numberOfLeadingZeros(n);
    }

    public static int computeTotalCapacity(final int k, final int m, final int numLevels) {
        int total = 0;
        for (int height = 0; height < numLevels; height++) {
            total += levelCapacity(k, numLevels, height, m);
        }
        return total;
    }

    // Capacity of level "height" when the sketch has numLevels levels. Top level has capacity k.
    // Each level below it shrinks by a factor of 2/3, but never below minWidth.
    public static int levelCapacity(final int k, final int numLevels, final int height, final int minWidth) {
        if (height >= numLevels) {
            throw new IllegalArgumentException("height " + height + " >= numLevels " + numLevels);
        }
        final int depth = numLevels - height - 1;
        return Math.max(minWidth, intCapAux(k, depth));
    }

    // Returns round(k * (2/3)^depth) using integer arithmetic only.
    static int intCapAux(final int k, final int depth) {
        if (depth > MAX_DEPTH) {
            throw new IllegalArgumentException("depth " + depth + " > " + MAX_DEPTH);
        }
        if (depth <= MAX_DEPTH_AUX) {
            return intCapAuxAux(k, depth);
        }
        final int half = depth / 2;
        final int rest = depth - half;
        final int tmp = intCapAuxAux(k, half);
        return intCapAuxAux(tmp, rest);
    }

    static int intCapAuxAux(final int k, final int depth) {
        if (depth > MAX_DEPTH_AUX) {
            throw new IllegalArgumentException("depth " + depth + " > " + MAX_DEPTH_AUX);
        }
        final long twoK = ((long) k) << 1; // Pre-multiply by 2 for rounding
        final long tmp = (twoK << depth) / POWERS_OF_THREE[depth];
        final long result = (tmp + 1) >> 1; // Add 1 and divide by 2
        if (result > k) {
            throw new IllegalStateException("intCapAuxAux result " + result + " > k " + k);
        }
        return (int) result;
    }

    // Level i items weigh 2^i.
    public static long sumTheSampleWeights(final int numLevels, final int[] levels) {
        long total = 0;
        long weight = 1;
        for (int level = 0; level < numLevels; level++) {
            total += weight * (levels[level + 1] - levels[level]);
            weight *= 2;
        }
        return total;
    }

    static <T> void sort(final Object[] items, final int fromIndex, final int toIndex, final Comparator<? super T> comparator) {
        @SuppressWarnings("unchecked") final T[] typed = (T[]) items;
        Arrays.sort(typed, fromIndex, toIndex, comparator);
    }

    // Keeps every other item of [start, start + length), starting at a random offset of 0 or 1,
    // and packs the survivors into the lower half of the range.
    static void randomlyHalveDown(final Object[] buf, final int start, final int length, final Random random) {
        if (isOdd(length)) {
            throw new IllegalArgumentException("length must be even: " + length);
        }
        final int halfLength = length / 2;
        final int offset = random.nextBoolean() ? 1 : 0;
        int j = start + offset;
        for (int i = start; i < start + halfLength; i++) {
            buf[i] = buf[j];
            j += 2;
        }
    }

    // Same as randomlyHalveDown(), but packs the survivors into the upper half of the range.
    static void randomlyHalveUp(final Object[] buf, final int start, final int length, final Random random) {
        if (isOdd(length)) {
            throw new IllegalArgumentException("length must be even: " + length);
        }
        final int halfLength = length / 2;
        final int offset = random.nextBoolean() ? 1 : 0;
        int j = start + length - 1 - offset;
        for (int i = start + length - 1; i >= start + halfLength; i--) {
            buf[i] = buf[j];
            j -= 2;
        }
    }

    // Merges sorted runs a and b into c. Ties take from b first.
    // The buffers may be the same array, as long as writes to c never overtake unread items of a or b.
    static <T> void mergeSortedArrays(final Object[] bufA, final int startA, final int lenA,
                                      final Object[] bufB, final int startB, final int lenB,
                                      final Object[] bufC, final int startC,
                                      final Comparator<? super T> comparator) {
        final int limA = startA + lenA;
        final int limB = startB + lenB;
        final int limC = startC + lenA + lenB;

        int a = startA;
        int b = startB;

        for (int c = startC; c < limC; c++) {
            if (a == limA) {
                bufC[c] = bufB[b];
                b++;
            } else if (b == limB) {
                bufC[c] = bufA[a];
                a++;
            } else if (lessThan(bufA[a], bufB[b], comparator)) {
                bufC[c] = bufA[a];
                a++;
            } else {
                bufC[c] = bufB[b];
                b++;
            }
        }
        if (a != limA || b != limB) {
            throw new IllegalStateException("mergeSortedArrays(): inputs not fully consumed");
        }
    }

    @SuppressWarnings("unchecked")
    static <T> boolean lessThan(final Object a, final Object b, final Comparator<? super T> comparator) {
        return comparator.compare((T) a, (T) b) < 0;
    }

    static class CompressResult {
        final int finalNumLevels;
        final int finalCapacity;
        final int finalNumItems;

        CompressResult(final int finalNumLevels, final int finalCapacity, final int finalNumItems) {
            this.finalNumLevels = finalNumLevels;
            this.finalCapacity = finalCapacity;
            this.finalNumItems = finalNumItems;
        }
    }

    // Compacts levels bottom up until the whole structure fits the capacity of its (possibly increased)
    // number of levels. Used after a merge, where several levels may be over capacity at once.
    //
    // For each level:
    //   If the sketch is not over capacity, or the level is under its own capacity, move it down as is.
    //   Otherwise, keep the first item of an odd population at this level, then halve the rest.
    //     If the level above is empty, halve up. Else halve down, then merge into the level above.
    //   Compacting the top level adds a level, which raises the total capacity.
    //
    // "items" is used both as input and output. inLevels must have room for numLevelsIn + 2 entries,
    // outLevels for the final number of levels + 1. Level zero need not be sorted; it is sorted before compaction.
    static <T> CompressResult generalCompress(final int k,
                                              final int m,
                                              final int numLevelsIn,
                                              final Object[] items,
                                              final int[] inLevels,
                                              final int[] outLevels,
                                              final boolean isLevelZeroSorted,
                                              final Comparator<? super T> comparator,
                                              final Random random) {
        if (numLevelsIn == 0) {
            throw new IllegalArgumentException("numLevelsIn must be > 0");
        }
        final int startingItemCount = inLevels[numLevelsIn] - inLevels[0];
        int currentNumLevels = numLevelsIn;
        int currentItemCount = startingItemCount; // Decreases with each compaction
        int targetItemCount = computeTotalCapacity(k, m, currentNumLevels); // Increases if we add levels
        boolean doneYet = false;
        outLevels[0] = 0;
        int currentLevel = 0;

        while (!doneYet) {
            // If we are at the current top level, add an empty level above it for convenience,
            // but do not increment numLevels until later.
            if (currentLevel == currentNumLevels - 1) {
                inLevels[currentLevel + 2] = inLevels[currentLevel + 1];
            }

            final int rawBeg = inLevels[currentLevel];
            final int rawLim = inLevels[currentLevel + 1];
            final int rawPop = rawLim - rawBeg;

            if (currentItemCount < targetItemCount || rawPop < levelCapacity(k, currentNumLevels, currentLevel, m)) {
                // Move level over as is. Data never moves upwards.
                if (rawBeg < outLevels[currentLevel]) {
                    throw new IllegalStateException("generalCompress(): wrong move at level " + currentLevel);
                }
                if (rawBeg != outLevels[currentLevel]) {
                    System.arraycopy(items, rawBeg, items, outLevels[currentLevel], rawPop);
                }
                outLevels[currentLevel + 1] = outLevels[currentLevel] + rawPop;
            } else {
                // The sketch is too full AND this level is too full, so we compact it.
                final int popAbove = inLevels[currentLevel + 2] - rawLim;
                final boolean oddPop = isOdd(rawPop);
                final int adjBeg = oddPop ? rawBeg + 1 : rawBeg;
                final int adjPop = oddPop ? rawPop - 1 : rawPop;
                final int halfAdjPop = adjPop / 2;

                if (oddPop) { // Move one item over
                    items[outLevels[currentLevel]] = items[rawBeg];
                    outLevels[currentLevel + 1] = outLevels[currentLevel] + 1;
                } else {
                    outLevels[currentLevel + 1] = outLevels[currentLevel];
                }

                if (currentLevel == 0 && !isLevelZeroSorted) {
                    sort(items, adjBeg, adjBeg + adjPop, comparator);
                }

                if (popAbove == 0) {
                    randomlyHalveUp(items, adjBeg, adjPop, random);
                } else {
                    randomlyHalveDown(items, adjBeg, adjPop, random);
                    mergeSortedArrays(items, adjBeg, halfAdjPop, items, rawLim, popAbove, items, adjBeg + halfAdjPop, comparator);
                }

                currentItemCount -= halfAdjPop;

                // Adjust the boundary of the level above
                inLevels[currentLevel + 1] = inLevels[currentLevel + 1] - halfAdjPop;

                // Compacting the old top level adds a level, and the capacity of the new bottom level
                if (currentLevel == currentNumLevels - 1) {
                    currentNumLevels++;
                    targetItemCount += levelCapacity(k, currentNumLevels, 0, m);
                }
            }

            if (currentLevel == currentNumLevels - 1) {
                doneYet = true;
            }
            currentLevel++;
        }

        if (outLevels[currentNumLevels] - outLevels[0] != currentItemCount) {
            throw new IllegalStateException("generalCompress(): inconsistent item count " + currentItemCount);
        }
        Arrays.fill(items, currentItemCount, startingItemCount, null);
        return new CompressResult(currentNumLevels, targetItemCount, currentItemCount);
    }
}
