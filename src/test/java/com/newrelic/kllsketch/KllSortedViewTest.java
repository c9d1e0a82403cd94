// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch;

import com.newrelic.kllsketch.QuantileSketch.WeightedItem;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class KllSortedViewTest {
    private static final Comparator<Integer> INT_ORDER = Comparator.naturalOrder();

    // Level 0 (weight 1, unsorted): 5, 1, 3
    // Level 1 (weight 2): 2, 4
    // Level 2 (weight 4): 3
    // Slots 0 and 1 are free space.
    private static KllSortedView<Integer> makeView() {
        final Object[] items = {null, null, 5, 1, 3, 2, 4, 3};
        final int[] levels = {2, 5, 7, 8};
        return new KllSortedView<>(items, levels, 3, false, INT_ORDER);
    }

    @Test
    public void testSortedItemsAndWeights() {
        final KllSortedView<Integer> view = makeView();
        assertEquals(6, view.size());
        assertEquals(11, view.getTotalWeight());

        final List<Integer> items = new ArrayList<>();
        final List<Long> weights = new ArrayList<>();
        for (int i = 0; i < view.size(); i++) {
            items.add(view.getItem(i));
            weights.add(view.getCumulativeWeight(i));
        }
        // Equal items keep the lower level first
        assertEquals(Arrays.asList(1, 2, 3, 3, 4, 5), items);
        assertEquals(Arrays.asList(1L, 3L, 4L, 8L, 10L, 11L), weights);

        final List<WeightedItem<Integer>> entries = new ArrayList<>();
        view.forEach(entries::add);
        assertEquals(Arrays.asList(
                new WeightedItem<>(1, 1),
                new WeightedItem<>(2, 2),
                new WeightedItem<>(3, 1),
                new WeightedItem<>(3, 4),
                new WeightedItem<>(4, 2),
                new WeightedItem<>(5, 1)), entries);
    }

    @Test
    public void testDoesNotModifyInput() {
        final Object[] items = {5, 1, 3};
        final int[] levels = {0, 3};
        final KllSortedView<Integer> view = new KllSortedView<>(items, levels, 1, false, INT_ORDER);
        assertArrayEquals(new Object[]{5, 1, 3}, items);
        assertEquals(Integer.valueOf(1), view.getItem(0));
    }

    @Test
    public void testRank() {
        final KllSortedView<Integer> view = makeView();
        assertEquals(0, view.getRank(0, true), 0);
        assertEquals(0, view.getRank(1, false), 0);
        assertEquals(1.0 / 11, view.getRank(1, true), 0);
        assertEquals(3.0 / 11, view.getRank(3, false), 0);
        assertEquals(8.0 / 11, view.getRank(3, true), 0);
        assertEquals(10.0 / 11, view.getRank(5, false), 0);
        assertEquals(1, view.getRank(5, true), 0);
        assertEquals(1, view.getRank(6, false), 0);
    }

    @Test
    public void testQuantile() {
        final KllSortedView<Integer> view = makeView();
        // Exclusive: first item whose cumulative weight exceeds floor(rank * total)
        assertEquals(Integer.valueOf(1), view.getQuantile(0, false));
        assertEquals(Integer.valueOf(3), view.getQuantile(0.5, false)); // 5 -> index 3
        assertEquals(Integer.valueOf(5), view.getQuantile(1, false));
        // Inclusive: first item whose cumulative weight reaches ceil(rank * total)
        assertEquals(Integer.valueOf(1), view.getQuantile(0, true));
        assertEquals(Integer.valueOf(3), view.getQuantile(0.3, true)); // 4 -> index 2
        assertEquals(Integer.valueOf(2), view.getQuantile(0.25, true)); // 3 -> index 1
        assertEquals(Integer.valueOf(5), view.getQuantile(1, true));
    }

    @Test
    public void testCdfAndPmf() {
        final KllSortedView<Integer> view = makeView();
        final Integer[] splitPoints = {2, 4};
        assertArrayEquals(new double[]{1.0 / 11, 8.0 / 11, 1}, view.getCDF(splitPoints, false), 1e-12);
        assertArrayEquals(new double[]{3.0 / 11, 10.0 / 11, 1}, view.getCDF(splitPoints, true), 1e-12);
        assertArrayEquals(new double[]{1.0 / 11, 7.0 / 11, 3.0 / 11}, view.getPMF(splitPoints, false), 1e-12);

        double sum = 0;
        for (double mass : view.getPMF(splitPoints, true)) {
            assertTrue(mass >= 0);
            sum += mass;
        }
        assertEquals(1, sum, 1e-12);
    }

    @Test
    public void testEmpty() {
        final KllSortedView<Integer> view = new KllSortedView<>(new Object[8], new int[]{8, 8}, 1, false, INT_ORDER);
        assertTrue(view.isEmpty());
        assertEquals(0, view.getTotalWeight());
        assertTrue(!view.iterator().hasNext());
        try {
            view.getQuantile(0.5, false);
            fail("Should have thrown");
        } catch (NoSuchElementException e) {
            // Expected
        }
        try {
            view.getRank(1, true);
            fail("Should have thrown");
        } catch (NoSuchElementException e) {
            // Expected
        }
    }
}
