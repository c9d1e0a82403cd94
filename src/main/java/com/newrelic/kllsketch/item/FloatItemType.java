// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch.item;

import java.nio.ByteBuffer;
import java.util.Comparator;

public class FloatItemType implements ItemType<Float> {
    // Primitive "<" order, as other KLL implementations use: -0.0 and 0.0 are equal.
    private static final Comparator<Float> ORDER = (a, b) -> a < b ? -1 : (b < a ? 1 : 0);

    @Override
    public Comparator<? super Float> getComparator() {
        return ORDER;
    }

    @Override
    public boolean isValid(final Float item) {
        return item != null && !item.isNaN();
    }

    @Override
    public boolean hasMissingItem() {
        return true;
    }

    @Override
    public Float getMissingItem() {
        return Float.NaN;
    }

    @Override
    public int getFixedSerializedSize() {
        return Float.BYTES;
    }

    @Override
    public int getSerializedSize(final Float item) {
        return Float.BYTES;
    }

    @Override
    public void serialize(final ByteBuffer buffer, final Float item) {
        buffer.putFloat(item);
    }

    @Override
    public Float deserialize(final ByteBuffer buffer) {
        final float value = buffer.getFloat();
        if (Float.isNaN(value)) {
            throw new IllegalArgumentException("NaN is not a valid float item");
        }
        return value;
    }

    @Override
    public String getName() {
        return "float";
    }

    @Override
    public String toString() {
        return getName();
    }
}
