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
package com.hellblazer.aurora.gff.io;

import com.hellblazer.aurora.gff.io.GffException.EncodingException;
import com.hellblazer.aurora.gff.io.GffException.MalformedHeaderException;
import com.hellblazer.aurora.io.BinaryReader;
import com.hellblazer.aurora.io.BinaryWriter;

import java.nio.charset.CharacterCodingException;

/**
 * The fixed 56-byte GFF header: two tags and six (offset, count) section descriptors.
 *
 * @author hal.hildebrand
 */
public record GffHeader(String fileType, String fileVersion, Section structs, Section fields, Section labels,
                        Section fieldData, Section fieldIndices, Section listIndices) {

    /**
     * One section descriptor, both values unsigned 32-bit.
     *
     * @param offset    absolute byte offset of the section
     * @param count     number of entries, or of bytes for the blob sections
     * @param entrySize bytes per counted unit
     */
    public record Section(String name, long offset, long count, int entrySize) {

        public long byteLength() {
            return count * entrySize;
        }

        /**
         * Exclusive end offset of the section.
         */
        public long end() {
            return offset + byteLength();
        }

        public boolean isEmpty() {
            return count == 0;
        }

        @Override
        public String toString() {
            return String.format("%s@%d[%d]", name, offset, count);
        }
    }

    /**
     * Parse and bounds-check the header of {@code reader}'s buffer.
     *
     * @throws MalformedHeaderException if the buffer is shorter than a header, a tag is not printable ASCII, the
     *                                  struct table is empty, or a non-empty section does not fit in the buffer
     */
    public static GffHeader read(BinaryReader reader) {
        if (reader.length() < GffFileFormat.HEADER_SIZE) {
            throw new MalformedHeaderException(
            "Buffer of " + reader.length() + " bytes is shorter than the " + GffFileFormat.HEADER_SIZE + "-byte header");
        }

        var fileType = readTag(reader, 0, "file type");
        var fileVersion = readTag(reader, 4, "file version");

        var header = new GffHeader(fileType, fileVersion,
                                   section(reader, 8, "structs", GffFileFormat.STRUCT_ENTRY_SIZE),
                                   section(reader, 16, "fields", GffFileFormat.FIELD_ENTRY_SIZE),
                                   section(reader, 24, "labels", GffFileFormat.LABEL_SIZE),
                                   section(reader, 32, "fieldData", 1),
                                   section(reader, 40, "fieldIndices", 1),
                                   section(reader, 48, "listIndices", 1));

        if (header.structs.isEmpty()) {
            throw new MalformedHeaderException("Struct table is empty, the root struct must exist");
        }
        for (var section : header.sections()) {
            // Empty sections may carry any offset.
            if (!section.isEmpty() && !reader.contains(section.offset(), section.byteLength())) {
                throw new MalformedHeaderException(
                String.format("Section %s ends at %d, past buffer end %d", section, section.end(), reader.length()));
            }
        }
        return header;
    }

    private static String readTag(BinaryReader reader, int position, String what) {
        String tag;
        try {
            tag = reader.ascii(position, GffFileFormat.TAG_SIZE);
        } catch (CharacterCodingException e) {
            throw new MalformedHeaderException("GFF " + what + " is not ASCII");
        }
        if (!GffFileFormat.isValidTag(tag)) {
            throw new MalformedHeaderException("GFF " + what + " is not printable ASCII: '" + tag + "'");
        }
        return tag;
    }

    private static Section section(BinaryReader reader, int position, String name, int entrySize) {
        return new Section(name, reader.u32(position), reader.u32(position + 4), entrySize);
    }

    public Section[] sections() {
        return new Section[] { structs, fields, labels, fieldData, fieldIndices, listIndices };
    }

    /**
     * Write the 56 header bytes.
     *
     * @throws EncodingException if either tag is not four printable ASCII characters
     */
    public void writeTo(BinaryWriter writer) {
        writeTag(writer, fileType, "file type");
        writeTag(writer, fileVersion, "file version");
        for (var section : sections()) {
            writer.writeU32(section.offset());
            writer.writeU32(section.count());
        }
    }

    private static void writeTag(BinaryWriter writer, String tag, String what) {
        if (!GffFileFormat.isValidTag(tag)) {
            throw new EncodingException("GFF " + what + " must be 4 printable ASCII characters: '" + tag + "'");
        }
        try {
            writer.writeBytes(BinaryWriter.asciiBytes(tag));
        } catch (CharacterCodingException e) {
            throw new EncodingException("GFF " + what + " is not ASCII: '" + tag + "'", e);
        }
    }

    @Override
    public String toString() {
        return String.format("GffHeader['%s' %s, %s, %s, %s, %s, %s, %s]", fileType, fileVersion, structs, fields,
                             labels, fieldData, fieldIndices, listIndices);
    }
}
