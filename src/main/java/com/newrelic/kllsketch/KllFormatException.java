// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the KllSketch project.

package com.newrelic.kllsketch;

// Thrown when a serialized sketch is truncated, corrupt, or of an unsupported format version.
public class KllFormatException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public KllFormatException(final String message) {
        super(message);
    }

    public KllFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
