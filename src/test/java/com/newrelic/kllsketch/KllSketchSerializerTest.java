// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch;

import com.newrelic.kllsketch.item.ItemType;
import com.newrelic.kllsketch.item.ItemTypes;
import org.junit.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Random;

import static com.newrelic.kllsketch.KllSketchTest.verifyInvariants;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class KllSketchSerializerTest {
    // Serializes, checks the size, deserializes, checks the readback, and returns the readback.
    public static <T> KllSketch<T> verifySerialization(final KllSketch<T> sketch, final int expectedSize) {
        final ByteBuffer buffer = KllSketchSerializer.serializeKllSketch(sketch);
        assertEquals(expectedSize, buffer.limit());
        return verifyReadback(sketch, buffer);
    }

    public static <T> KllSketch<T> verifySerialization(final KllSketch<T> sketch) {
        final ByteBuffer buffer = KllSketchSerializer.serializeKllSketch(sketch);
        assertEquals(KllSketchSerializer.getKllSketchSerializeBufferSize(sketch), buffer.limit());
        return verifyReadback(sketch, buffer);
    }

    private static <T> KllSketch<T> verifyReadback(final KllSketch<T> sketch, final ByteBuffer buffer) {
        final KllSketch<T> readback = KllSketchSerializer.deserializeKllSketch(buffer, sketch.getItemType());
        assertEquals(buffer.limit(), buffer.position()); // Fully consumed
        assertEquals(sketch, readback);
        assertEquals(sketch.hashCode(), readback.hashCode());
        assertEquals(sketch.getK(), readback.getK());
        assertEquals(sketch.getMinK(), readback.getMinK());
        assertEquals(sketch.getN(), readback.getN());
        assertEquals(sketch.getNumRetained(), readback.getNumRetained());
        assertEquals(sketch.isEstimationMode(), readback.isEstimationMode());
        verifyInvariants(readback);

        // Queries agree
        if (!sketch.isEmpty()) {
            assertEquals(sketch.getMinItem(), readback.getMinItem());
            assertEquals(sketch.getMaxItem(), readback.getMaxItem());
            for (double rank = 0; rank <= 1; rank += 0.125) {
                assertEquals(sketch.getQuantile(rank, false), readback.getQuantile(rank, false));
                assertEquals(sketch.getQuantile(rank, true), readback.getQuantile(rank, true));
            }
        }

        // Readback bytes are identical
        assertArrayEquals(sketch.serialize(), readback.serialize());
        return readback;
    }

    private static byte[] toBytes(final int... values) {
        final byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            bytes[i] = (byte) values[i];
        }
        return bytes;
    }

    @Test
    public void testEmptyBytes() {
        final KllSketch<Float> sketch = KllSketch.newFloatsSketch(200);
        assertArrayEquals(toBytes(2, 1, 15, 1, 200, 0, 8, 0), sketch.serialize());
        final KllSketch<Float> readback = verifySerialization(sketch, 8);
        assertTrue(readback.isEmpty());
        assertEquals(200, readback.getK());

        // k above 255 uses both bytes
        assertArrayEquals(toBytes(2, 1, 15, 1, 0xe8, 0x03, 8, 0), KllSketch.newIntsSketch(1000).serialize());
    }

    @Test
    public void testSingleItemBytes() {
        final KllSketch<Float> sketch = KllSketch.newFloatsSketch(200);
        sketch.update(1f);
        // 1.0f is 0x3f800000
        assertArrayEquals(toBytes(2, 2, 15, 4, 200, 0, 8, 0, 0, 0, 0x80, 0x3f), sketch.serialize());
        final KllSketch<Float> readback = verifySerialization(sketch, 12);
        assertEquals(1, readback.getN());
        assertEquals(1f, readback.getMinItem(), 0);
        assertEquals(1f, readback.getMaxItem(), 0);

        // Readback can continue to take updates
        readback.update(2f);
        assertEquals(2, readback.getN());
        assertEquals(2f, readback.getMaxItem(), 0);
    }

    @Test
    public void testFullBytes() {
        final KllSketch<Float> sketch = KllSketchTest.makeSequentialSketch(200, 10, new Random(1));
        final byte[] expected = toBytes(
                5, 1, 15, 0, 200, 0, 8, 0, // Preamble
                10, 0, 0, 0, 0, 0, 0, 0, // N
                200, 0, 1, 0, // min K, number of levels, unused
                190, 0, 0, 0, // Level zero offset
                0, 0, 0x80, 0x3f, // Min 1.0f
                0, 0, 0x20, 0x41, // Max 10.0f
                // Level zero is filled from the top down, so the newest item comes first.
                0, 0, 0x20, 0x41, // 10
                0, 0, 0x10, 0x41, // 9
                0, 0, 0x00, 0x41, // 8
                0, 0, 0xe0, 0x40, // 7
                0, 0, 0xc0, 0x40, // 6
                0, 0, 0xa0, 0x40, // 5
                0, 0, 0x80, 0x40, // 4
                0, 0, 0x40, 0x40, // 3
                0, 0, 0x00, 0x40, // 2
                0, 0, 0x80, 0x3f  // 1
        );
        assertArrayEquals(expected, sketch.serialize());
        verifySerialization(sketch, 72);

        // Bytes from another writer decode to the same sketch
        final KllSketch<Float> readback = KllSketch.deserialize(expected, ItemTypes.FLOAT);
        assertEquals(10, readback.getN());
        assertEquals(0.4, readback.getRank(5f), 0);
        assertEquals(6f, readback.getQuantile(0.5), 0);
    }

    @Test
    public void testLevelZeroSortedFlag() {
        final KllSketch<Float> sketch = KllSketchTest.makeSequentialSketch(8, 9, new Random(2));
        // Compaction sorted level 0, then one more item was added
        assertFalse(sketch.isLevelZeroSorted());

        final byte[] bytes = sketch.serialize();
        bytes[3] |= KllSketchSerializer.LEVEL_ZERO_SORTED_BIT_MASK;
        final KllSketch<Float> readback = KllSketch.deserialize(bytes, ItemTypes.FLOAT);
        assertTrue(readback.isLevelZeroSorted());
        assertEquals(2, readback.getNumLevels());
    }

    @Test
    public void testRoundTrips() {
        final Random random = new Random(3);
        for (int n : new int[]{0, 1, 2, 10, 100, 1000, 10_000, 100_000}) {
            for (int k : new int[]{8, 200, 1000}) {
                final KllSketch<Double> sketch = new KllSketch<>(ItemTypes.DOUBLE, k, new Random(n + k));
                for (int i = 0; i < n; i++) {
                    sketch.update(random.nextGaussian());
                }
                final KllSketch<Double> readback = verifySerialization(sketch);
                assertEquals(n > k, readback.isEstimationMode());

                // Readback is fully functional
                readback.update(0.0);
                readback.merge(sketch);
                assertEquals(2L * n + 1, readback.getN());
                verifyInvariants(readback);
            }
        }
    }

    @Test
    public void testMillionItems() {
        final int n = 1_000_000;
        final KllSketch<Float> sketch = new KllSketch<>(ItemTypes.FLOAT, KllSketch.DEFAULT_K, new Random(4));
        for (int i = 1; i <= n; i++) {
            sketch.update((float) i);
        }
        final KllSketch<Float> readback = verifySerialization(sketch);
        assertFalse(readback.isEmpty());
        assertTrue(readback.isEstimationMode());
        assertEquals(n, readback.getN());
        assertEquals(1f, readback.getMinItem(), 0);
        assertEquals((float) n, readback.getMaxItem(), 0);
        assertThat((long) sketch.serialize().length,
                lessThanOrEqualTo(KllSketchSerializer.getMaxSerializedSizeBytes(KllSketch.DEFAULT_K, n, Float.BYTES)));
    }

    @Test
    public void testMergedSketch() {
        final KllSketch<Integer> sketch1 = new KllSketch<>(ItemTypes.INT, 200, new Random(5));
        final KllSketch<Integer> sketch2 = new KllSketch<>(ItemTypes.INT, 64, new Random(6));
        for (int i = 0; i < 5000; i++) {
            sketch1.update(i);
            sketch2.update(-i);
        }
        sketch1.merge(sketch2);
        final KllSketch<Integer> readback = verifySerialization(sketch1);
        assertEquals(64, readback.getMinK());
        assertEquals(200, readback.getK());
    }

    @Test
    public void testOtherItemTypes() {
        final KllSketch<Long> longs = new KllSketch<>(ItemTypes.LONG, 50, new Random(7));
        final KllSketch<String> strings = new KllSketch<>(ItemTypes.STRING, 50, new Random(8));
        for (long i = 0; i < 2000; i++) {
            longs.update(i * 1_000_000_000_000L);
            strings.update(Long.toHexString(i * 7919));
        }
        verifySerialization(longs);
        verifySerialization(strings);

        final KllSketch<String> single = new KllSketch<>(ItemTypes.STRING);
        single.update("été");
        // 4 byte length, then 5 bytes of UTF-8
        final KllSketch<String> readback = verifySerialization(single, 8 + 4 + 5);
        assertEquals("été", readback.getMinItem());
    }

    @Test
    public void testBufferPositionAndOrder() {
        final KllSketch<Float> sketch = KllSketchTest.makeSequentialSketch(200, 500, new Random(9));
        final int size = KllSketchSerializer.getKllSketchSerializeBufferSize(sketch);
        final ByteBuffer buffer = ByteBuffer.allocate(size + 10).order(ByteOrder.BIG_ENDIAN);
        buffer.position(3);
        KllSketchSerializer.serializeKllSketch(sketch, buffer);
        assertEquals(3 + size, buffer.position());
        assertSame(ByteOrder.BIG_ENDIAN, buffer.order());

        buffer.position(3);
        final KllSketch<Float> readback = KllSketchSerializer.deserializeKllSketch(buffer, ItemTypes.FLOAT);
        assertEquals(3 + size, buffer.position());
        assertSame(ByteOrder.BIG_ENDIAN, buffer.order());
        assertEquals(sketch, readback);
    }

    @Test
    public void testSerializeConcurrentSketch() {
        final ConcurrentKllSketch<Float> concurrent = new ConcurrentKllSketch<>(KllSketchTest.makeSequentialSketch(200, 300, new Random(10)));
        final ByteBuffer buffer = KllSketchSerializer.serializeQuantileSketch(concurrent);
        assertEquals(concurrent.getSketch(), KllSketchSerializer.deserializeKllSketch(buffer, ItemTypes.FLOAT));
    }

    private static void verifyCorruption(final byte[] bytes, final ItemType<?> itemType, final String expectedMessage) {
        try {
            KllSketchSerializer.deserializeKllSketch(bytes, itemType);
            fail("Should have thrown for " + Arrays.toString(bytes));
        } catch (KllFormatException e) {
            assertThat(e.getMessage(), containsString(expectedMessage));
        }
    }

    @Test
    public void testTruncated() {
        final byte[] full = KllSketchTest.makeSequentialSketch(200, 10, new Random(11)).serialize();
        for (int length : new int[]{0, 1, 7, 8, 19, 20, 23, 24, 31, 32, 71}) {
            verifyCorruption(Arrays.copyOf(full, length), ItemTypes.FLOAT, "Truncated");
        }

        final KllSketch<String> strings = new KllSketch<>(ItemTypes.STRING);
        strings.update("abc");
        strings.update("def");
        final byte[] stringBytes = strings.serialize();
        // The last string length runs past the end
        verifyCorruption(Arrays.copyOf(stringBytes, stringBytes.length - 1), ItemTypes.STRING, "Corrupt");

        // Invalid UTF-8 in the last item. Level zero is written newest first, so that is "abc", now 0x61 0x62 0xff
        final byte[] badUtf8 = stringBytes.clone();
        badUtf8[badUtf8.length - 1] = (byte) 0xff;
        verifyCorruption(badUtf8, ItemTypes.STRING, "Corrupt");
    }

    @Test
    public void testCorruptPreamble() {
        final byte[] full = KllSketchTest.makeSequentialSketch(200, 10, new Random(12)).serialize();

        byte[] bytes = full.clone();
        bytes[2] = 16;
        verifyCorruption(bytes, ItemTypes.FLOAT, "family");

        bytes = full.clone();
        bytes[1] = 3;
        verifyCorruption(bytes, ItemTypes.FLOAT, "serial version");

        bytes = full.clone();
        bytes[0] = 2;
        verifyCorruption(bytes, ItemTypes.FLOAT, "preamble ints");

        bytes = full.clone();
        bytes[3] = KllSketchSerializer.SINGLE_ITEM_BIT_MASK; // Single item flag with the full preamble
        verifyCorruption(bytes, ItemTypes.FLOAT, "preamble ints");

        bytes = full.clone();
        bytes[6] = 4;
        verifyCorruption(bytes, ItemTypes.FLOAT, "M must be");

        bytes = full.clone();
        bytes[4] = 7; // k = 7
        verifyCorruption(bytes, ItemTypes.FLOAT, "K must be");

        bytes = full.clone();
        bytes[16] = 8;
        bytes[17] = 1; // min K = 264 > K
        verifyCorruption(bytes, ItemTypes.FLOAT, "min K");

        bytes = full.clone();
        bytes[18] = 0; // No levels
        verifyCorruption(bytes, ItemTypes.FLOAT, "number of levels");

        bytes = full.clone();
        bytes[18] = 62;
        verifyCorruption(bytes, ItemTypes.FLOAT, "number of levels");

        bytes = full.clone();
        Arrays.fill(bytes, 8, 16, (byte) 0); // N = 0 without the empty flag
        verifyCorruption(bytes, ItemTypes.FLOAT, "N must be");
    }

    @Test
    public void testCorruptBody() {
        final byte[] full = KllSketchTest.makeSequentialSketch(200, 10, new Random(13)).serialize();

        byte[] bytes = full.clone();
        bytes[8] = 11; // N does not match the level weights
        verifyCorruption(bytes, ItemTypes.FLOAT, "total weight");

        bytes = full.clone();
        bytes[20] = (byte) 201; // Level zero offset past the capacity
        verifyCorruption(bytes, ItemTypes.FLOAT, "offset");

        bytes = full.clone();
        bytes[23] = (byte) 0x80; // Negative level zero offset
        verifyCorruption(bytes, ItemTypes.FLOAT, "negative");

        bytes = full.clone();
        // Swap min (1.0f) and max (10.0f)
        System.arraycopy(full, 28, bytes, 24, 4);
        System.arraycopy(full, 24, bytes, 28, 4);
        verifyCorruption(bytes, ItemTypes.FLOAT, "min item");

        bytes = full.clone();
        // NaN as an item
        bytes[34] = (byte) 0xc0;
        bytes[35] = (byte) 0x7f;
        verifyCorruption(bytes, ItemTypes.FLOAT, "Corrupt");
    }

    @Test
    public void testMaxSerializedSize() {
        assertEquals(20 + 4 + 4 * (200 + 2), KllSketchSerializer.getMaxSerializedSizeBytes(200, 1, 4));
        final long size = KllSketchSerializer.getMaxSerializedSizeBytes(200, 1L << 40, 8);
        assertThat(size, lessThanOrEqualTo(20 + 41 * 4 + 8L * (KllHelper.computeTotalCapacity(200, 8, 41) + 2)));
        try {
            KllSketchSerializer.getMaxSerializedSizeBytes(4, 100, 4);
            fail("Should have thrown");
        } catch (IllegalArgumentException e) {
            // Expected
        }
    }
}
