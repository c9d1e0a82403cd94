// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch.item;

import java.nio.ByteBuffer;
import java.util.Comparator;

// Integers have no "missing" value. Queries on an empty sketch throw.
public class IntItemType implements ItemType<Integer> {
    @Override
    public Comparator<? super Integer> getComparator() {
        return Comparator.naturalOrder();
    }

    @Override
    public boolean isValid(final Integer item) {
        return item != null;
    }

    @Override
    public boolean hasMissingItem() {
        return false;
    }

    @Override
    public Integer getMissingItem() {
        throw new UnsupportedOperationException("int items have no missing value");
    }

    @Override
    public int getFixedSerializedSize() {
        return Integer.BYTES;
    }

    @Override
    public int getSerializedSize(final Integer item) {
        return Integer.BYTES;
    }

    @Override
    public void serialize(final ByteBuffer buffer, final Integer item) {
        buffer.putInt(item);
    }

    @Override
    public Integer deserialize(final ByteBuffer buffer) {
        return buffer.getInt();
    }

    @Override
    public String getName() {
        return "int";
    }

    @Override
    public String toString() {
        return getName();
    }
}
