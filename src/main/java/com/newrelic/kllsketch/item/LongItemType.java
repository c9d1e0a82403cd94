// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch.item;

import java.nio.ByteBuffer;
import java.util.Comparator;

public class LongItemType implements ItemType<Long> {
    @Override
    public Comparator<? super Long> getComparator() {
        return Comparator.naturalOrder();
    }

    @Override
    public boolean isValid(final Long item) {
        return item != null;
    }

    @Override
    public boolean hasMissingItem() {
        return false;
    }

    @Override
    public Long getMissingItem() {
        throw new UnsupportedOperationException("long items have no missing value");
    }

    @Override
    public int getFixedSerializedSize() {
        return Long.BYTES;
    }

    @Override
    public int getSerializedSize(final Long item) {
        return Long.BYTES;
    }

    @Override
    public void serialize(final ByteBuffer buffer, final Long item) {
        buffer.putLong(item);
    }

    @Override
    public Long deserialize(final ByteBuffer buffer) {
        return buffer.getLong();
    }

    @Override
    public String getName() {
        return "long";
    }

    @Override
    public String toString() {
        return getName();
    }
}
