// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch.item;

// Shared, stateless instances of the supported item types.
public final class ItemTypes {
    public static final ItemType<Float> FLOAT = new FloatItemType();
    public static final ItemType<Double> DOUBLE = new DoubleItemType();
    public static final ItemType<Integer> INT = new IntItemType();
    public static final ItemType<Long> LONG = new LongItemType();
    public static final ItemType<String> STRING = new StringItemType();

    private ItemTypes() {
    }
}
