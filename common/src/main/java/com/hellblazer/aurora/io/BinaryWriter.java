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
package com.hellblazer.aurora.io;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Growable little-endian output buffer.
 *
 * <p>Writes append at {@link #position()}; {@link #putU32(int, long)} patches a value already written, which
 * is how callers back-fill sizes that are only known after the payload.
 *
 * @author hal.hildebrand
 */
public final class BinaryWriter {
    private static final int DEFAULT_CAPACITY = 256;

    private ByteBuffer buffer;

    public BinaryWriter() {
        this(DEFAULT_CAPACITY);
    }

    public BinaryWriter(int initialCapacity) {
        buffer = ByteBuffer.allocate(Math.max(initialCapacity, 16)).order(BinaryReader.BYTE_ORDER);
    }

    /**
     * Strict US-ASCII encoding of {@code text}.
     *
     * @throws CharacterCodingException if {@code text} has a character above 0x7F
     */
    public static byte[] asciiBytes(String text) throws CharacterCodingException {
        return encode(StandardCharsets.US_ASCII, text);
    }

    /**
     * Strict UTF-8 encoding of {@code text}.
     *
     * @throws CharacterCodingException if {@code text} holds an unpaired surrogate
     */
    public static byte[] utf8Bytes(String text) throws CharacterCodingException {
        return encode(StandardCharsets.UTF_8, text);
    }

    public int position() {
        return buffer.position();
    }

    public BinaryWriter writeU8(int value) {
        ensureCapacity(1);
        buffer.put((byte) value);
        return this;
    }

    public BinaryWriter writeU16(int value) {
        ensureCapacity(2);
        buffer.putShort((short) value);
        return this;
    }

    public BinaryWriter writeU32(long value) {
        ensureCapacity(4);
        buffer.putInt((int) value);
        return this;
    }

    public BinaryWriter writeI32(int value) {
        ensureCapacity(4);
        buffer.putInt(value);
        return this;
    }

    public BinaryWriter writeI64(long value) {
        ensureCapacity(8);
        buffer.putLong(value);
        return this;
    }

    public BinaryWriter writeF32(float value) {
        ensureCapacity(4);
        buffer.putFloat(value);
        return this;
    }

    public BinaryWriter writeF64(double value) {
        ensureCapacity(8);
        buffer.putDouble(value);
        return this;
    }

    public BinaryWriter writeBytes(byte[] value) {
        ensureCapacity(value.length);
        buffer.put(value);
        return this;
    }

    /**
     * Write {@code value} into a field of exactly {@code width} bytes, NUL-padding the remainder.
     *
     * @throws IllegalArgumentException if {@code value} is longer than {@code width}
     */
    public BinaryWriter writePadded(byte[] value, int width) {
        if (value.length > width) {
            throw new IllegalArgumentException("Value of " + value.length + " bytes exceeds field width " + width);
        }
        writeBytes(value);
        ensureCapacity(width - value.length);
        for (int i = value.length; i < width; i++) {
            buffer.put((byte) 0);
        }
        return this;
    }

    /**
     * Append everything written to {@code other} so far.
     */
    public BinaryWriter writeAll(BinaryWriter other) {
        return writeBytes(other.toByteArray());
    }

    /**
     * Overwrite four bytes at an earlier {@code position} without moving the write position.
     */
    public BinaryWriter putU32(int position, long value) {
        if (position < 0 || position + 4 > buffer.position()) {
            throw new IndexOutOfBoundsException("Patch at " + position + " outside written range " + buffer.position());
        }
        buffer.putInt(position, (int) value);
        return this;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buffer.array(), buffer.position());
    }

    private void ensureCapacity(int extra) {
        if (buffer.remaining() >= extra) {
            return;
        }
        int required = buffer.position() + extra;
        int capacity = Math.max(required, buffer.capacity() * 2);
        var grown = ByteBuffer.allocate(capacity).order(BinaryReader.BYTE_ORDER);
        buffer.flip();
        grown.put(buffer);
        buffer = grown;
    }

    private static byte[] encode(Charset charset, String text) throws CharacterCodingException {
        var encoder = charset.newEncoder()
                             .onMalformedInput(CodingErrorAction.REPORT)
                             .onUnmappableCharacter(CodingErrorAction.REPORT);
        var encoded = encoder.encode(CharBuffer.wrap(text));
        var bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        return bytes;
    }
}
