// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch.item;

import java.nio.ByteBuffer;
import java.util.Comparator;

// Value traits for items held by a KllSketch: ordering, the "no value" sentinel, and wire encoding.
// The wire encoding must match other KLL implementations, so all multi-byte values are little endian.
// Callers of serialize() and deserialize() set the buffer byte order; implementations must not change it.

public interface ItemType<T> {
    // Returned by getFixedSerializedSize() for variable width types.
    int VARIABLE_SIZE = -1;

    Comparator<? super T> getComparator();

    // Items that cannot be ordered (null, NaN) are rejected by update() and by queries.
    boolean isValid(final T item);

    // Types with a natural "missing" value (NaN for floating point) return it from queries on an empty sketch.
    // Other types cause those queries to throw NoSuchElementException.
    boolean hasMissingItem();

    // Only meaningful when hasMissingItem() is true.
    T getMissingItem();

    // Number of bytes per item, or VARIABLE_SIZE.
    int getFixedSerializedSize();

    int getSerializedSize(final T item);

    void serialize(final ByteBuffer buffer, final T item);

    // Implementations throw IllegalArgumentException for encodings that do not decode into a valid item.
    T deserialize(final ByteBuffer buffer);

    // Readable name for messages and toString().
    String getName();
}
