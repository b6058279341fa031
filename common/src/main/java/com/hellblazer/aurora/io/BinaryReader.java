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
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Positioned, read-only access to a little-endian byte buffer.
 *
 * <p>All reads are absolute: the reader carries no cursor, so one instance may be shared by any number of
 * resolvers walking the same buffer. Reads outside the buffer throw {@link IndexOutOfBoundsException}; callers
 * that must report format errors check {@link #contains(long, long)} first.
 *
 * <p>Unsigned 32-bit values are returned as {@code long} so offsets and counts never go negative.
 *
 * @author hal.hildebrand
 */
public final class BinaryReader {

    /**
     * Byte order of every Aurora binary format.
     */
    public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    private final ByteBuffer buffer;

    private BinaryReader(ByteBuffer buffer) {
        this.buffer = buffer;
    }

    /**
     * Wrap a byte array. The array is not copied; it must not change while the reader is in use.
     */
    public static BinaryReader wrap(byte[] data) {
        return new BinaryReader(ByteBuffer.wrap(data).order(BYTE_ORDER));
    }

    public int length() {
        return buffer.capacity();
    }

    /**
     * @return true if {@code [offset, offset + count)} lies entirely inside the buffer
     */
    public boolean contains(long offset, long count) {
        return offset >= 0 && count >= 0 && offset + count <= buffer.capacity();
    }

    public int u8(int position) {
        return buffer.get(position) & 0xFF;
    }

    public byte i8(int position) {
        return buffer.get(position);
    }

    public int u16(int position) {
        return buffer.getShort(position) & 0xFFFF;
    }

    public short i16(int position) {
        return buffer.getShort(position);
    }

    public long u32(int position) {
        return buffer.getInt(position) & 0xFFFFFFFFL;
    }

    public int i32(int position) {
        return buffer.getInt(position);
    }

    public long i64(int position) {
        return buffer.getLong(position);
    }

    public float f32(int position) {
        return buffer.getFloat(position);
    }

    public double f64(int position) {
        return buffer.getDouble(position);
    }

    /**
     * Copy {@code count} bytes starting at {@code position}. The result shares nothing with the buffer.
     */
    public byte[] bytes(int position, int count) {
        var result = new byte[count];
        buffer.get(position, result, 0, count);
        return result;
    }

    /**
     * Decode {@code count} bytes as strict US-ASCII.
     *
     * @throws CharacterCodingException if any byte is outside 0x00-0x7F
     */
    public String ascii(int position, int count) throws CharacterCodingException {
        return decode(StandardCharsets.US_ASCII, position, count);
    }

    /**
     * Decode a fixed-width, NUL-padded ASCII field, dropping the trailing NULs.
     *
     * @throws CharacterCodingException if any byte is outside 0x00-0x7F
     */
    public String fixedAscii(int position, int width) throws CharacterCodingException {
        int end = width;
        while (end > 0 && buffer.get(position + end - 1) == 0) {
            end--;
        }
        return ascii(position, end);
    }

    /**
     * Decode {@code count} bytes as strict UTF-8.
     *
     * @throws CharacterCodingException on malformed or unmappable input
     */
    public String utf8(int position, int count) throws CharacterCodingException {
        return decode(StandardCharsets.UTF_8, position, count);
    }

    private String decode(Charset charset, int position, int count) throws CharacterCodingException {
        var decoder = charset.newDecoder()
                             .onMalformedInput(CodingErrorAction.REPORT)
                             .onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(buffer.slice(position, count)).toString();
    }
}
