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

import com.hellblazer.aurora.gff.core.Gff;
import com.hellblazer.aurora.gff.core.GffFieldType;
import com.hellblazer.aurora.gff.core.GffFieldValue;
import com.hellblazer.aurora.gff.core.GffFieldValue.*;
import com.hellblazer.aurora.gff.core.GffStruct;
import com.hellblazer.aurora.gff.core.LocalizedString;
import com.hellblazer.aurora.gff.core.ResRef;
import com.hellblazer.aurora.gff.io.GffCodecConfig.UnknownFieldTypePolicy;
import com.hellblazer.aurora.gff.io.GffException.*;
import com.hellblazer.aurora.io.BinaryReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3f;
import javax.vecmath.Vector4f;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.OptionalInt;

/**
 * Read-only view of the tables of one GFF buffer, resolving structs into trees on demand.
 *
 * <p>Only the header is validated when the view is opened. Table entries, labels and payloads are checked when a
 * resolution first touches them, so resolving one struct costs nothing for the rest of the file. Every tree
 * returned is fully owned: it shares no state with the buffer or with other trees.
 *
 * <p>The view keeps a reference to the buffer it was opened on; the buffer must not change while the view is in
 * use. Views are immutable and may be shared between threads.
 *
 * @author hal.hildebrand
 */
public final class GffTableView {
    private static final Logger log = LoggerFactory.getLogger(GffTableView.class);

    private final BinaryReader   reader;
    private final GffHeader      header;
    private final GffCodecConfig config;

    private GffTableView(BinaryReader reader, GffHeader header, GffCodecConfig config) {
        this.reader = reader;
        this.header = header;
        this.config = config;
    }

    /**
     * Open a view over {@code data}, validating the header.
     *
     * @throws MalformedHeaderException if the header is malformed or its version is not accepted by
     *                                  {@code config}
     */
    public static GffTableView open(byte[] data, GffCodecConfig config) {
        var reader = BinaryReader.wrap(data);
        var header = GffHeader.read(reader);
        if (!config.acceptsVersion(header.fileVersion())) {
            throw new MalformedHeaderException(
            "GFF version '" + header.fileVersion() + "' unsupported, accepted: " + config.getAcceptedVersions());
        }
        log.debug("Read header: {}", header);
        return new GffTableView(reader, header, config);
    }

    /**
     * A struct table entry.
     *
     * @param structId     opaque id
     * @param dataOrOffset field index, field-indices byte offset, or unused, depending on {@code fieldCount}
     * @param fieldCount   number of fields
     */
    public record StructEntry(int structId, long dataOrOffset, long fieldCount) {
    }

    /**
     * A field table entry.
     *
     * @param fieldType    raw type tag
     * @param labelIndex   index into the label table
     * @param dataOrOffset raw 4-byte data slot, meaning depends on the type
     */
    public record FieldEntry(long fieldType, long labelIndex, int dataOrOffset) {

        public long offset() {
            return Integer.toUnsignedLong(dataOrOffset);
        }
    }

    public GffHeader header() {
        return header;
    }

    public int structCount() {
        return (int) header.structs().count();
    }

    public int fieldCount() {
        return (int) header.fields().count();
    }

    public int labelCount() {
        return (int) header.labels().count();
    }

    public StructEntry structEntry(long index) {
        var section = header.structs();
        if (index < 0 || index >= section.count()) {
            throw new InvalidStructIndexException(index, section.count());
        }
        int position = (int) (section.offset() + index * GffFileFormat.STRUCT_ENTRY_SIZE);
        return new StructEntry(reader.i32(position), reader.u32(position + 4), reader.u32(position + 8));
    }

    public FieldEntry fieldEntry(long index) {
        var section = header.fields();
        if (index < 0 || index >= section.count()) {
            throw new InvalidFieldIndexException(index, section.count());
        }
        int position = (int) (section.offset() + index * GffFileFormat.FIELD_ENTRY_SIZE);
        return new FieldEntry(reader.u32(position), reader.u32(position + 4), reader.i32(position + 8));
    }

    public String label(long index) {
        var section = header.labels();
        if (index < 0 || index >= section.count()) {
            throw new InvalidLabelIndexException(index, section.count());
        }
        int position = (int) (section.offset() + index * GffFileFormat.LABEL_SIZE);
        try {
            return reader.fixedAscii(position, GffFileFormat.LABEL_SIZE);
        } catch (CharacterCodingException e) {
            throw new EncodingException("Label " + index + " is not ASCII", e);
        }
    }

    /**
     * The whole document: header tags plus the tree under struct 0.
     */
    public Gff toGff() {
        return new Gff(header.fileType(), header.fileVersion(), resolveRoot());
    }

    public GffStruct resolveRoot() {
        return resolveStruct(0);
    }

    /**
     * Resolve the struct at {@code index} and everything below it.
     *
     * <p>Within one resolution every struct index is materialized at most once, so the tree built is never larger
     * than the struct table. An index reached again from its own descendants raises
     * {@link CyclicStructReferenceException}; an index reached again from anywhere else raises
     * {@link SharedStructReferenceException}.
     */
    public GffStruct resolveStruct(long index) {
        return new Resolution().run(index);
    }

    private long[] fieldIndices(StructEntry entry) {
        if (entry.fieldCount() == 0) {
            return new long[0];
        }
        if (entry.fieldCount() == 1) {
            return new long[] { entry.dataOrOffset() };
        }

        int position = blob(header.fieldIndices(), entry.dataOrOffset(),
                            entry.fieldCount() * GffFileFormat.INDEX_SIZE);
        var indices = new long[(int) entry.fieldCount()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = reader.u32(position + i * GffFileFormat.INDEX_SIZE);
        }
        return indices;
    }

    /**
     * One struct being filled in: its table slot, its node and the fields still to resolve.
     */
    private static final class Frame {
        private final int                  slot;
        private final GffStruct            node;
        private final long[]               fieldIndices;
        // Child structs scheduled by the last resolved field, entered before the next field.
        private final ArrayDeque<Pending> pending = new ArrayDeque<>();
        private       int                  next;

        private Frame(int slot, GffStruct node, long[] fieldIndices) {
            this.slot = slot;
            this.node = node;
            this.fieldIndices = fieldIndices;
        }
    }

    private record Pending(int slot, GffStruct node) {
    }

    /**
     * Depth-first resolution state of one call, kept on an explicit stack so nesting depth is bounded by the
     * struct table rather than the thread stack.
     */
    private final class Resolution {
        // Slots of the frames currently on the stack.
        private final BitSet           path    = new BitSet();
        // Slots already scheduled during this call.
        private final BitSet           claimed = new BitSet();
        private final ArrayDeque<Frame> stack  = new ArrayDeque<>();

        private GffStruct run(long index) {
            var root = new GffStruct();
            enter(new Pending(claim(index), root));

            while (!stack.isEmpty()) {
                var frame = stack.peek();
                if (!frame.pending.isEmpty()) {
                    enter(frame.pending.poll());
                } else if (frame.next < frame.fieldIndices.length) {
                    resolveNextField(frame);
                } else {
                    path.clear(frame.slot);
                    stack.pop();
                }
            }
            return root;
        }

        private void enter(Pending pending) {
            var entry = structEntry(pending.slot());
            pending.node().setStructId(entry.structId());
            path.set(pending.slot());
            stack.push(new Frame(pending.slot(), pending.node(), fieldIndices(entry)));
        }

        /**
         * Validate {@code index} and reserve it for this call.
         */
        private int claim(long index) {
            var count = header.structs().count();
            if (index < 0 || index >= count) {
                throw new InvalidStructIndexException(index, count);
            }
            int slot = (int) index;
            if (path.get(slot)) {
                throw new CyclicStructReferenceException(
                "Struct " + index + " references itself through its descendants");
            }
            if (claimed.get(slot)) {
                throw new SharedStructReferenceException(index);
            }
            claimed.set(slot);
            return slot;
        }

        private void resolveNextField(Frame frame) {
            long fieldIndex = frame.fieldIndices[frame.next++];
            var field = fieldEntry(fieldIndex);
            var label = label(field.labelIndex());
            if (frame.node.exists(label)) {
                throw new DuplicateLabelException(label, frame.slot);
            }
            frame.node.set(label, resolveField(fieldIndex, field, frame));
        }

        private GffFieldValue resolveField(long fieldIndex, FieldEntry field, Frame frame) {
            var type = GffFieldType.fromCode(field.fieldType());
            if (type.isEmpty()) {
                if (config.getUnknownFieldTypePolicy() == UnknownFieldTypePolicy.PRESERVE_OPAQUE) {
                    return new OpaqueValue((int) field.fieldType(), field.dataOrOffset());
                }
                throw new UnknownFieldTypeException(field.fieldType(), fieldIndex);
            }

            int raw = field.dataOrOffset();
            return switch (type.get()) {
                case UINT8 -> new UInt8Value(raw & 0xFF);
                case INT8 -> new Int8Value((byte) raw);
                case UINT16 -> new UInt16Value(raw & 0xFFFF);
                case INT16 -> new Int16Value((short) raw);
                case UINT32 -> new UInt32Value(Integer.toUnsignedLong(raw));
                case INT32 -> new Int32Value(raw);
                case SINGLE -> new SingleValue(Float.intBitsToFloat(raw));
                case UINT64 -> new UInt64Value(reader.i64(fieldData(field.offset(), 8)));
                case INT64 -> new Int64Value(reader.i64(fieldData(field.offset(), 8)));
                case DOUBLE -> new DoubleValue(reader.f64(fieldData(field.offset(), 8)));
                case STRING -> new StringValue(readString(field.offset()));
                case RESREF -> new ResRefValue(readResRef(field.offset()));
                case LOCALIZED_STRING -> new LocStringValue(readLocalizedString(field.offset()));
                case BINARY -> new BinaryValue(readBinary(field.offset()));
                case VECTOR3 -> {
                    int position = fieldData(field.offset(), 12);
                    yield new Vector3Value(
                    new Vector3f(reader.f32(position), reader.f32(position + 4), reader.f32(position + 8)));
                }
                case VECTOR4 -> {
                    int position = fieldData(field.offset(), 16);
                    yield new Vector4Value(
                    new Vector4f(reader.f32(position), reader.f32(position + 4), reader.f32(position + 8),
                                 reader.f32(position + 12)));
                }
                case STRUCT -> new StructValue(schedule(field.offset(), frame));
                case LIST -> new ListValue(scheduleList(field.offset(), frame));
            };
        }

        /**
         * Claim a child struct and queue it on {@code frame}; its fields are filled in when it is entered.
         */
        private GffStruct schedule(long index, Frame frame) {
            var child = new GffStruct();
            frame.pending.add(new Pending(claim(index), child));
            return child;
        }

        private List<GffStruct> scheduleList(long offset, Frame frame) {
            var section = header.listIndices();
            long count = reader.u32(blob(section, offset, GffFileFormat.INDEX_SIZE));
            int position = blob(section, offset + GffFileFormat.INDEX_SIZE, count * GffFileFormat.INDEX_SIZE);

            var elements = new ArrayList<GffStruct>((int) count);
            for (int i = 0; i < count; i++) {
                elements.add(schedule(reader.u32(position + i * GffFileFormat.INDEX_SIZE), frame));
            }
            return elements;
        }
    }

    private String readString(long offset) {
        long length = reader.u32(fieldData(offset, 4));
        int position = fieldData(offset + 4, length);
        try {
            return reader.utf8(position, (int) length);
        } catch (CharacterCodingException e) {
            throw new EncodingException("String at field data offset " + offset + " is not valid UTF-8", e);
        }
    }

    private byte[] readBinary(long offset) {
        long length = reader.u32(fieldData(offset, 4));
        return reader.bytes(fieldData(offset + 4, length), (int) length);
    }

    private ResRef readResRef(long offset) {
        int position = fieldData(offset, 1 + GffFileFormat.RESREF_SLOT_SIZE);
        int length = reader.u8(position);
        if (length > GffFileFormat.RESREF_SLOT_SIZE) {
            throw new TruncatedFieldDataException(
            "ResRef at field data offset " + offset + " declares " + length + " bytes in a "
            + GffFileFormat.RESREF_SLOT_SIZE + "-byte slot");
        }
        try {
            var text = reader.ascii(position + 1, length);
            var padding = reader.bytes(position + 1 + length, GffFileFormat.RESREF_SLOT_SIZE - length);
            return new ResRef(text, padding);
        } catch (CharacterCodingException e) {
            throw new EncodingException("ResRef at field data offset " + offset + " is not ASCII", e);
        }
    }

    private LocalizedString readLocalizedString(long offset) {
        int position = fieldData(offset, 4 + GffFileFormat.LOCSTRING_PREFIX_SIZE);
        long totalSize = reader.u32(position);
        if (totalSize < GffFileFormat.LOCSTRING_PREFIX_SIZE) {
            throw new TruncatedFieldDataException(
            "Localized string at field data offset " + offset + " declares total size " + totalSize
            + ", smaller than its " + GffFileFormat.LOCSTRING_PREFIX_SIZE + "-byte prefix");
        }
        // Substrings may not reach past the declared total size either.
        fieldData(offset + 4, totalSize);
        long end = offset + 4 + totalSize;

        long stringRef = reader.u32(position + 4);
        long substringCount = reader.u32(position + 8);

        var substrings = new ArrayList<LocalizedString.Substring>();
        long cursor = offset + 4 + GffFileFormat.LOCSTRING_PREFIX_SIZE;
        for (long i = 0; i < substringCount; i++) {
            int entry = bounded(cursor, 8, end);
            int stringId = reader.i32(entry);
            long length = reader.u32(entry + 4);
            int text = bounded(cursor + 8, length, end);
            try {
                substrings.add(new LocalizedString.Substring(stringId, reader.utf8(text, (int) length)));
            } catch (CharacterCodingException e) {
                throw new EncodingException("Localized substring at field data offset " + cursor + " is not valid UTF-8",
                                            e);
            }
            cursor += 8 + length;
        }

        var ref = stringRef == GffFileFormat.NO_STRING_REF ? OptionalInt.empty() : OptionalInt.of((int) stringRef);
        return new LocalizedString(ref, substrings);
    }

    /**
     * Absolute buffer position of a field-data payload, checked against the field-data section.
     */
    private int fieldData(long offset, long length) {
        return blob(header.fieldData(), offset, length);
    }

    private int bounded(long offset, long length, long limit) {
        if (offset + length > limit) {
            throw new TruncatedFieldDataException("localized string", offset, length, limit);
        }
        return fieldData(offset, length);
    }

    private int blob(GffHeader.Section section, long offset, long length) {
        if (offset < 0 || length < 0 || offset + length > section.byteLength()) {
            throw new TruncatedFieldDataException(section.name(), offset, length, section.byteLength());
        }
        return (int) (section.offset() + offset);
    }
}
