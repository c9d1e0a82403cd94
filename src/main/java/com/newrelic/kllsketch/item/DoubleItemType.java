// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch.item;

import java.nio.ByteBuffer;
import java.util.Comparator;

public class DoubleItemType implements ItemType<Double> {
    // Primitive "<" order, as other KLL implementations use: -0.0 and 0.0 are equal.
    private static final Comparator<Double> ORDER = (a, b) -> a < b ? -1 : (b < a ? 1 : 0);

    @Override
    public Comparator<? super Double> getComparator() {
        return ORDER;
    }

    @Override
    public boolean isValid(final Double item) {
        return item != null && !item.isNaN();
    }

    @Override
    public boolean hasMissingItem() {
        return true;
    }

    @Override
    public Double getMissingItem() {
        return Double.NaN;
    }

    @Override
    public int getFixedSerializedSize() {
        return Double.BYTES;
    }

    @Override
    public int getSerializedSize(final Double item) {
        return Double.BYTES;
    }

    @Override
    public void serialize(final ByteBuffer buffer, final Double item) {
        buffer.putDouble(item);
    }

    @Override
    public Double deserialize(final ByteBuffer buffer) {
        final double value = buffer.getDouble();
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("NaN is not a valid double item");
        }
        return value;
    }

    @Override
    public String getName() {
        return "double";
    }

    @Override
    public String toString() {
        return getName();
    }
}
