// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch.item;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;

// Each string is written as a 4 byte length followed by its UTF-8 bytes.
// Strings are ordered by String.compareTo(), ie. by UTF-16 code units.

public class StringItemType implements ItemType<String> {
    @Override
    public Comparator<? super String> getComparator() {
        return Comparator.naturalOrder();
    }

    @Override
    public boolean isValid(final String item) {
        return item != null;
    }

    @Override
    public boolean hasMissingItem() {
        return false;
    }

    @Override
    public String getMissingItem() {
        throw new UnsupportedOperationException("string items have no missing value");
    }

    @Override
    public int getFixedSerializedSize() {
        return VARIABLE_SIZE;
    }

    @Override
    public int getSerializedSize(final String item) {
        return Integer.BYTES + item.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public void serialize(final ByteBuffer buffer, final String item) {
        final byte[] bytes = item.getBytes(StandardCharsets.UTF_8);
        buffer.putInt(bytes.length);
        buffer.put(bytes);
    }

    @Override
    public String deserialize(final ByteBuffer buffer) {
        final int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining()) {
            throw new IllegalArgumentException("Invalid string length " + length + ", remaining bytes " + buffer.remaining());
        }
        final byte[] bytes = new byte[length];
        buffer.get(bytes);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Invalid UTF-8 string of length " + length, e);
        }
    }

    @Override
    public String getName() {
        return "string";
    }

    @Override
    public String toString() {
        return getName();
    }
}
