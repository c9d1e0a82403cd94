// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch;

import com.newrelic.kllsketch.item.ItemType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Random;

// Not implemented as member functions of KllSketch so that other serializers can be written with the same access.
//
// This is the standard KLL binary format, shared with the other DataSketches KLL implementations.
// Sketches written here can be read there and vice versa. The format is little endian.
//
// It uses a 2 pass method: the 1st pass computes the exact buffer size,
// the 2nd pass writes to the buffer.
//
// Layout:
//   Byte 0:     preamble ints. 2 for empty and single item sketches, 5 otherwise
//   Byte 1:     serial version. 1 for empty and full sketches, 2 for single item sketches
//   Byte 2:     family id, 15 for KLL
//   Byte 3:     flags. Bit 0: empty, bit 1: level zero sorted, bit 2: single item
//   Byte 4-5:   k
//   Byte 6:     m, always 8
//   Byte 7:     unused
// Empty sketches end here. Single item sketches continue with the item. Other sketches continue with:
//   Byte 8-15:  n
//   Byte 16-17: min k
//   Byte 18:    number of levels
//   Byte 19:    unused
//   Byte 20-:   level offsets, 4 bytes each, one per level. The top level end offset is not written,
//               because it is the total capacity computed from k and the number of levels.
//   Then min item, max item, and the retained items from the level zero offset to the end.

public class KllSketchSerializer {
    private static final Logger LOG = LoggerFactory.getLogger(KllSketchSerializer.class);

    static final int PREAMBLE_INTS_SHORT = 2; // Empty or single item
    static final int PREAMBLE_INTS_FULL = 5;
    static final int SERIAL_VERSION_EMPTY_FULL = 1;
    static final int SERIAL_VERSION_SINGLE = 2;
    static final int FAMILY_ID = 15;

    static final int EMPTY_BIT_MASK = 1;
    static final int LEVEL_ZERO_SORTED_BIT_MASK = 2;
    static final int SINGLE_ITEM_BIT_MASK = 4;

    static final int PREAMBLE_SIZE_SHORT = 8;
    static final int DATA_START = 20;

    // Level capacities are defined for up to this many levels. See KllHelper.intCapAux().
    static final int MAX_NUM_LEVELS = KllHelper.MAX_DEPTH + 1;

    public static <T> ByteBuffer serializeKllSketch(final KllSketch<T> sketch) {
        final ByteBuffer buffer = ByteBuffer.allocate(getKllSketchSerializeBufferSize(sketch));
        serializeKllSketch(sketch, buffer);
        buffer.flip(); // Flip position to 0 to be reader ready.
        return buffer;
    }

    public static <T> byte[] serializeKllSketchToBytes(final KllSketch<T> sketch) {
        return serializeKllSketch(sketch).array();
    }

    // Accepts KllSketch and ConcurrentKllSketch.
    public static <T> ByteBuffer serializeQuantileSketch(final QuantileSketch<T> sketch) {
        if (sketch instanceof KllSketch) {
            return serializeKllSketch((KllSketch<T>) sketch);
        } else if (sketch instanceof ConcurrentKllSketch) {
            final ConcurrentKllSketch<T> concurrent = (ConcurrentKllSketch<T>) sketch;
            synchronized (concurrent) {
                return serializeKllSketch(concurrent.getSketch());
            }
        } else {
            throw new IllegalArgumentException("Unknown QuantileSketch class " + sketch.getClass().getName());
        }
    }

    // Writes at the buffer's current position. Byte order of the buffer is restored on return.
    public static <T> void serializeKllSketch(final KllSketch<T> sketch, final ByteBuffer buffer) {
        final ByteOrder savedOrder = buffer.order();
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        try {
            writeKllSketch(sketch, buffer);
        } finally {
            buffer.order(savedOrder);
        }
    }

    private static <T> void writeKllSketch(final KllSketch<T> sketch, final ByteBuffer buffer) {
        final ItemType<T> itemType = sketch.getItemType();
        final boolean isEmpty = sketch.isEmpty();
        final boolean isSingleItem = sketch.getN() == 1;

        buffer.put((byte) (isEmpty || isSingleItem ? PREAMBLE_INTS_SHORT : PREAMBLE_INTS_FULL));
        buffer.put((byte) (isSingleItem ? SERIAL_VERSION_SINGLE : SERIAL_VERSION_EMPTY_FULL));
        buffer.put((byte) FAMILY_ID);
        buffer.put((byte) ((isEmpty ? EMPTY_BIT_MASK : 0)
                | (sketch.isLevelZeroSorted() ? LEVEL_ZERO_SORTED_BIT_MASK : 0)
                | (isSingleItem ? SINGLE_ITEM_BIT_MASK : 0)));
        buffer.putShort((short) sketch.getK());
        buffer.put((byte) KllSketch.DEFAULT_M);
        buffer.put((byte) 0); // Unused

        if (isEmpty) {
            return;
        }

        final int numLevels = sketch.getNumLevels();
        final int[] levels = sketch.getLevels();
        final Object[] items = sketch.getItems();

        if (!isSingleItem) {
            buffer.putLong(sketch.getN());
            buffer.putShort((short) sketch.getMinK());
            buffer.put((byte) numLevels);
            buffer.put((byte) 0); // Unused
            for (int level = 0; level < numLevels; level++) {
                buffer.putInt(levels[level]);
            }
            itemType.serialize(buffer, sketch.getMinItem());
            itemType.serialize(buffer, sketch.getMaxItem());
        }

        for (int i = levels[0]; i < levels[numLevels]; i++) {
            itemType.serialize(buffer, getItem(items, i));
        }
    }

    public static <T> int getKllSketchSerializeBufferSize(final KllSketch<T> sketch) {
        if (sketch.isEmpty()) {
            return PREAMBLE_SIZE_SHORT;
        }
        final ItemType<T> itemType = sketch.getItemType();
        final int numLevels = sketch.getNumLevels();
        final int[] levels = sketch.getLevels();
        final Object[] items = sketch.getItems();

        int size;
        if (sketch.getN() == 1) {
            size = PREAMBLE_SIZE_SHORT;
        } else {
            size = DATA_START
                    + Integer.BYTES * numLevels // Level offsets
                    + itemType.getSerializedSize(sketch.getMinItem())
                    + itemType.getSerializedSize(sketch.getMaxItem());
        }

        final int fixedSize = itemType.getFixedSerializedSize();
        if (fixedSize != ItemType.VARIABLE_SIZE) {
            size += fixedSize * sketch.getNumRetained();
        } else {
            for (int i = levels[0]; i < levels[numLevels]; i++) {
                size += itemType.getSerializedSize(getItem(items, i));
            }
        }
        return size;
    }

    // Upper bound of the serialized size of a sketch with the given k and n, for fixed width items.
    public static long getMaxSerializedSizeBytes(final int k, final long n, final int itemSize) {
        KllSketch.checkK(k);
        final int numLevels = KllHelper.ubOnNumLevels(n);
        final int maxNumRetained = KllHelper.computeTotalCapacity(k, KllSketch.DEFAULT_M, numLevels);
        // The top level end offset is not serialized
        return DATA_START + (long) numLevels * Integer.BYTES + (long) (maxNumRetained + 2) * itemSize;
    }

    public static <T> KllSketch<T> deserializeKllSketch(final byte[] bytes, final ItemType<T> itemType) {
        return deserializeKllSketch(ByteBuffer.wrap(bytes), itemType);
    }

    public static <T> KllSketch<T> deserializeKllSketch(final ByteBuffer buffer, final ItemType<T> itemType) {
        return deserializeKllSketch(buffer, itemType, new Random());
    }

    // Reads from the buffer's current position and advances it past the sketch.
    // Throws KllFormatException on corrupt or truncated input. Nothing is built until all checks pass.
    public static <T> KllSketch<T> deserializeKllSketch(final ByteBuffer buffer, final ItemType<T> itemType, final Random random) {
        final ByteOrder savedOrder = buffer.order();
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        try {
            return readKllSketch(buffer, itemType, random);
        } catch (BufferUnderflowException e) {
            throw new KllFormatException("Truncated KLL sketch, buffer limit " + buffer.limit(), e);
        } catch (KllFormatException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new KllFormatException("Corrupt KLL sketch: " + e.getMessage(), e); // Bad item encoding
        } finally {
            buffer.order(savedOrder);
        }
    }

    private static <T> KllSketch<T> readKllSketch(final ByteBuffer buffer, final ItemType<T> itemType, final Random random) {
        final int preambleInts = Byte.toUnsignedInt(buffer.get());
        final int serialVersion = Byte.toUnsignedInt(buffer.get());
        final int familyId = Byte.toUnsignedInt(buffer.get());
        final int flags = Byte.toUnsignedInt(buffer.get());
        final int k = Short.toUnsignedInt(buffer.getShort());
        final int m = Byte.toUnsignedInt(buffer.get());
        buffer.get(); // Unused

        if (m != KllSketch.DEFAULT_M) {
            throw new KllFormatException("Possible corruption: M must be " + KllSketch.DEFAULT_M + ": " + m);
        }
        checkPreambleInts(preambleInts, flags);
        checkSerialVersion(serialVersion);
        if (familyId != FAMILY_ID) {
            throw new KllFormatException("Possible corruption: family mismatch: expected " + FAMILY_ID + ", got " + familyId);
        }
        if (k < KllSketch.MIN_K) {
            throw new KllFormatException("Possible corruption: K must be >= " + KllSketch.MIN_K + ": " + k);
        }

        final boolean isEmpty = (flags & EMPTY_BIT_MASK) != 0;
        if (isEmpty) {
            return new KllSketch<>(itemType, k, random);
        }

        final boolean isSingleItem = (flags & SINGLE_ITEM_BIT_MASK) != 0;
        final long n;
        final int minK;
        final int numLevels;

        if (isSingleItem) {
            n = 1;
            minK = k;
            numLevels = 1;
        } else {
            n = buffer.getLong();
            minK = Short.toUnsignedInt(buffer.getShort());
            numLevels = Byte.toUnsignedInt(buffer.get());
            buffer.get(); // Unused

            if (n <= 0) { // Also rejects values above Long.MAX_VALUE
                throw new KllFormatException("Possible corruption: N must be > 0 in a non empty sketch: " + Long.toUnsignedString(n));
            }
            if (minK < KllSketch.MIN_K || minK > k) {
                throw new KllFormatException("Possible corruption: min K must be >= " + KllSketch.MIN_K + " and <= K " + k + ": " + minK);
            }
            if (numLevels < 1 || numLevels > MAX_NUM_LEVELS) {
                throw new KllFormatException("Possible corruption: number of levels must be >= 1 and <= " + MAX_NUM_LEVELS + ": " + numLevels);
            }
        }

        final int capacity = KllHelper.computeTotalCapacity(k, KllSketch.DEFAULT_M, numLevels);
        final int[] levels = new int[numLevels + 1];
        if (isSingleItem) {
            levels[0] = capacity - 1;
        } else {
            for (int level = 0; level < numLevels; level++) {
                levels[level] = buffer.getInt();
            }
        }
        levels[numLevels] = capacity;
        checkLevels(levels, numLevels);

        T minItem = null;
        T maxItem = null;
        if (!isSingleItem) {
            minItem = itemType.deserialize(buffer);
            maxItem = itemType.deserialize(buffer);
        }

        final Object[] items = new Object[capacity];
        for (int i = levels[0]; i < capacity; i++) {
            items[i] = itemType.deserialize(buffer);
        }

        if (isSingleItem) {
            minItem = getItem(items, levels[0]);
            maxItem = minItem;
        }
        if (itemType.getComparator().compare(minItem, maxItem) > 0) {
            throw new KllFormatException("Possible corruption: min item " + minItem + " > max item " + maxItem);
        }

        final long totalWeight = KllHelper.sumTheSampleWeights(numLevels, levels);
        if (totalWeight != n) {
            throw new KllFormatException("Possible corruption: total weight of levels " + totalWeight + " does not match N " + n);
        }

        final boolean isLevelZeroSorted = (flags & LEVEL_ZERO_SORTED_BIT_MASK) != 0;

        LOG.debug("Deserialized KLL sketch: k={}, minK={}, n={}, levels={}, retained={}",
                k, minK, n, numLevels, capacity - levels[0]);

        return new KllSketch<>(itemType, k, minK, n, numLevels, levels, items, minItem, maxItem, isLevelZeroSorted, random);
    }

    private static void checkPreambleInts(final int preambleInts, final int flags) {
        final boolean isEmpty = (flags & EMPTY_BIT_MASK) != 0;
        final boolean isSingleItem = (flags & SINGLE_ITEM_BIT_MASK) != 0;
        if (isEmpty || isSingleItem) {
            if (preambleInts != PREAMBLE_INTS_SHORT) {
                throw new KllFormatException("Possible corruption: preamble ints must be " + PREAMBLE_INTS_SHORT
                        + " for an empty or single item sketch: " + preambleInts);
            }
        } else {
            if (preambleInts != PREAMBLE_INTS_FULL) {
                throw new KllFormatException("Possible corruption: preamble ints must be " + PREAMBLE_INTS_FULL
                        + " for a sketch with more than one item: " + preambleInts);
            }
        }
    }

    private static void checkSerialVersion(final int serialVersion) {
        if (serialVersion != SERIAL_VERSION_EMPTY_FULL && serialVersion != SERIAL_VERSION_SINGLE) {
            throw new KllFormatException("Possible corruption: serial version mismatch: expected "
                    + SERIAL_VERSION_EMPTY_FULL + " or " + SERIAL_VERSION_SINGLE + ", got " + serialVersion);
        }
    }

    // Offsets must be non decreasing, from 0 up to the total capacity.
    private static void checkLevels(final int[] levels, final int numLevels) {
        if (levels[0] < 0) {
            throw new KllFormatException("Possible corruption: negative level zero offset " + Integer.toUnsignedString(levels[0]));
        }
        for (int level = 0; level < numLevels; level++) {
            if (levels[level] > levels[level + 1]) {
                throw new KllFormatException("Possible corruption: level " + level + " offset " + Integer.toUnsignedString(levels[level])
                        + " exceeds next offset " + levels[level + 1]);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T getItem(final Object[] items, final int index) {
        return (T) items[index];
    }
}
