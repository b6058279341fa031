/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Aurora.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.aurora.gff.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * A resource reference: a short name of another resource, stored in a fixed 16-byte slot.
 *
 * <p>Only the first {@code text().length()} bytes of the slot carry the name. The rest is padding which is kept
 * byte-for-byte so that a decoded reference re-encodes to the same slot contents.
 *
 * @author hal.hildebrand
 */
public final class ResRef {
    public static final int MAX_LENGTH = 16;

    private static final ResRef BLANK = of("");

    private final String text;
    private final byte[] padding;

    /**
     * @param text    the name, at most {@value #MAX_LENGTH} characters
     * @param padding the slot bytes following the name; {@code text.length() + padding.length} must be
     *                {@value #MAX_LENGTH}
     */
    public ResRef(String text, byte[] padding) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(padding, "padding");
        if (text.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ResRef longer than " + MAX_LENGTH + " characters: " + text);
        }
        if (text.length() + padding.length != MAX_LENGTH) {
            throw new IllegalArgumentException(
            "ResRef slot must be " + MAX_LENGTH + " bytes, got " + (text.length() + padding.length));
        }
        this.text = text;
        this.padding = padding.clone();
    }

    /**
     * A reference with zero fill after the name.
     */
    public static ResRef of(String text) {
        Objects.requireNonNull(text, "text");
        return new ResRef(text, new byte[Math.max(0, MAX_LENGTH - text.length())]);
    }

    public static ResRef blank() {
        return BLANK;
    }

    public String text() {
        return text;
    }

    public byte[] padding() {
        return padding.clone();
    }

    public boolean isBlank() {
        return text.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResRef other)) {
            return false;
        }
        return text.equals(other.text) && Arrays.equals(padding, other.padding);
    }

    @Override
    public int hashCode() {
        return 31 * text.hashCode() + Arrays.hashCode(padding);
    }

    @Override
    public String toString() {
        return text;
    }
}
