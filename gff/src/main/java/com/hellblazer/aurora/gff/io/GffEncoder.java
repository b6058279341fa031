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

import com.hellblazer.aurora.common.IntArrayList;
import com.hellblazer.aurora.gff.core.Gff;
import com.hellblazer.aurora.gff.core.GffFieldValue;
import com.hellblazer.aurora.gff.core.GffFieldValue.*;
import com.hellblazer.aurora.gff.core.GffStruct;
import com.hellblazer.aurora.gff.core.LocalizedString;
import com.hellblazer.aurora.gff.core.ResRef;
import com.hellblazer.aurora.gff.io.GffException.CyclicStructReferenceException;
import com.hellblazer.aurora.gff.io.GffException.EncodingException;
import com.hellblazer.aurora.io.BinaryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.CharacterCodingException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lays out one {@link Gff} tree as a GFF buffer.
 *
 * <p>Pass one walks the tree depth-first, pre-order, giving every struct occurrence its own struct table slot
 * (the root lands in slot 0, identical subtrees are not shared) and numbering labels in first-seen order. Pass two
 * visits the slots in order and appends each struct's fields, payloads and index runs to per-section writers.
 * The sections are then concatenated behind the header in canonical order.
 *
 * <p>An encoder holds the state of a single call and is discarded afterwards.
 *
 * @author hal.hildebrand
 */
final class GffEncoder {
    private static final Logger log = LoggerFactory.getLogger(GffEncoder.class);

    private final List<GffStruct>      structs      = new ArrayList<>();
    // Struct slots of each struct's STRUCT and LIST children, in field order.
    private final List<IntArrayList>   childSlots   = new ArrayList<>();
    private final Map<String, Integer> labels       = new LinkedHashMap<>();
    private final Set<GffStruct>       currentPath  = Collections.newSetFromMap(new IdentityHashMap<>());

    private final BinaryWriter structTable  = new BinaryWriter();
    private final BinaryWriter fieldTable   = new BinaryWriter();
    private final BinaryWriter labelTable   = new BinaryWriter();
    private final BinaryWriter fieldData    = new BinaryWriter();
    private final BinaryWriter fieldIndices = new BinaryWriter();
    private final BinaryWriter listIndices  = new BinaryWriter();
    private       int          fieldCount;

    byte[] encode(Gff gff) {
        assignSlots(gff.root());
        for (int slot = 0; slot < structs.size(); slot++) {
            writeStruct(structs.get(slot), childSlots.get(slot));
        }
        writeLabels();

        long offset = GffFileFormat.HEADER_SIZE;
        var structSection = section("structs", offset, structs.size(), GffFileFormat.STRUCT_ENTRY_SIZE);
        var fieldSection = section("fields", structSection.end(), fieldCount, GffFileFormat.FIELD_ENTRY_SIZE);
        var labelSection = section("labels", fieldSection.end(), labels.size(), GffFileFormat.LABEL_SIZE);
        var dataSection = section("fieldData", labelSection.end(), fieldData.position(), 1);
        var fieldIndexSection = section("fieldIndices", dataSection.end(), fieldIndices.position(), 1);
        var listIndexSection = section("listIndices", fieldIndexSection.end(), listIndices.position(), 1);

        var header = new GffHeader(gff.fileType(), gff.fileVersion(), structSection, fieldSection, labelSection,
                                   dataSection, fieldIndexSection, listIndexSection);
        log.debug("Encoding {}", header);

        var out = new BinaryWriter((int) listIndexSection.end());
        header.writeTo(out);
        out.writeAll(structTable)
           .writeAll(fieldTable)
           .writeAll(labelTable)
           .writeAll(fieldData)
           .writeAll(fieldIndices)
           .writeAll(listIndices);
        return out.toByteArray();
    }

    private static GffHeader.Section section(String name, long offset, long count, int entrySize) {
        return new GffHeader.Section(name, offset, count, entrySize);
    }

    /**
     * A struct whose fields pass one is walking.
     */
    private static final class Visit {
        private final GffStruct                                   struct;
        private final IntArrayList                                children;
        private final Iterator<Map.Entry<String, GffFieldValue>> fields;
        // Children of the last field, visited before the next field.
        private final ArrayDeque<GffStruct>                       pending = new ArrayDeque<>();

        private Visit(GffStruct struct, IntArrayList children) {
            this.struct = struct;
            this.children = children;
            this.fields = struct.iterator();
        }
    }

    /**
     * Pass one: pre-order slot assignment and label numbering, on an explicit stack.
     */
    private void assignSlots(GffStruct root) {
        var stack = new ArrayDeque<Visit>();
        stack.push(enter(root));

        while (!stack.isEmpty()) {
            var visit = stack.peek();
            if (!visit.pending.isEmpty()) {
                visit.children.addInt(structs.size());
                stack.push(enter(visit.pending.poll()));
            } else if (visit.fields.hasNext()) {
                var field = visit.fields.next();
                labels.putIfAbsent(field.getKey(), labels.size());
                var value = field.getValue();
                if (value instanceof StructValue child) {
                    visit.pending.add(child.value());
                } else if (value instanceof ListValue list) {
                    visit.pending.addAll(list.value());
                }
            } else {
                currentPath.remove(visit.struct);
                stack.pop();
            }
        }
    }

    /**
     * Give {@code struct} the next slot.
     */
    private Visit enter(GffStruct struct) {
        if (!currentPath.add(struct)) {
            throw new CyclicStructReferenceException("Struct " + struct.getStructId() + " contains itself");
        }
        structs.add(struct);
        var children = new IntArrayList();
        childSlots.add(children);
        return new Visit(struct, children);
    }

    /**
     * Pass two: one struct table entry plus its fields.
     */
    private void writeStruct(GffStruct struct, IntArrayList children) {
        var ownFields = new IntArrayList(struct.size());
        int child = 0;
        for (var field : struct) {
            ownFields.addInt(fieldCount++);
            child = writeField(field.getKey(), field.getValue(), children, child);
        }

        structTable.writeI32(struct.getStructId());
        if (ownFields.size() == 1) {
            structTable.writeU32(ownFields.getInt(0));
        } else if (ownFields.size() > 1) {
            structTable.writeU32(fieldIndices.position());
            for (int i = 0; i < ownFields.size(); i++) {
                fieldIndices.writeU32(ownFields.getInt(i));
            }
        } else {
            structTable.writeU32(0);
        }
        structTable.writeU32(ownFields.size());
    }

    /**
     * @return the index of the next unconsumed entry in {@code children}
     */
    private int writeField(String label, GffFieldValue value, IntArrayList children, int child) {
        fieldTable.writeU32(Integer.toUnsignedLong(value.typeCode()));
        fieldTable.writeU32(labels.get(label));

        if (value instanceof OpaqueValue opaque) {
            fieldTable.writeI32(opaque.rawData());
            return child;
        }

        switch (value.type()) {
            case UINT8 -> fieldTable.writeU32(((UInt8Value) value).value());
            case INT8 -> fieldTable.writeI32(((Int8Value) value).value());
            case UINT16 -> fieldTable.writeU32(((UInt16Value) value).value());
            case INT16 -> fieldTable.writeI32(((Int16Value) value).value());
            case UINT32 -> fieldTable.writeU32(((UInt32Value) value).value());
            case INT32 -> fieldTable.writeI32(((Int32Value) value).value());
            case SINGLE -> fieldTable.writeF32(((SingleValue) value).value());
            case UINT64 -> {
                fieldTable.writeU32(fieldData.position());
                fieldData.writeI64(((UInt64Value) value).value());
            }
            case INT64 -> {
                fieldTable.writeU32(fieldData.position());
                fieldData.writeI64(((Int64Value) value).value());
            }
            case DOUBLE -> {
                fieldTable.writeU32(fieldData.position());
                fieldData.writeF64(((DoubleValue) value).value());
            }
            case STRING -> {
                fieldTable.writeU32(fieldData.position());
                var bytes = utf8(((StringValue) value).value(), label);
                fieldData.writeU32(bytes.length).writeBytes(bytes);
            }
            case RESREF -> {
                fieldTable.writeU32(fieldData.position());
                writeResRef(((ResRefValue) value).value(), label);
            }
            case LOCALIZED_STRING -> {
                fieldTable.writeU32(fieldData.position());
                writeLocalizedString(((LocStringValue) value).value(), label);
            }
            case BINARY -> {
                fieldTable.writeU32(fieldData.position());
                var bytes = ((BinaryValue) value).value();
                fieldData.writeU32(bytes.length).writeBytes(bytes);
            }
            case VECTOR3 -> {
                fieldTable.writeU32(fieldData.position());
                var v = ((Vector3Value) value).value();
                fieldData.writeF32(v.x).writeF32(v.y).writeF32(v.z);
            }
            case VECTOR4 -> {
                fieldTable.writeU32(fieldData.position());
                var v = ((Vector4Value) value).value();
                fieldData.writeF32(v.x).writeF32(v.y).writeF32(v.z).writeF32(v.w);
            }
            case STRUCT -> fieldTable.writeU32(children.getInt(child++));
            case LIST -> {
                var elements = ((ListValue) value).value();
                fieldTable.writeU32(listIndices.position());
                listIndices.writeU32(elements.size());
                for (int i = 0; i < elements.size(); i++) {
                    listIndices.writeU32(children.getInt(child++));
                }
            }
        }
        return child;
    }

    private void writeResRef(ResRef resRef, String label) {
        byte[] text;
        try {
            text = BinaryWriter.asciiBytes(resRef.text());
        } catch (CharacterCodingException e) {
            throw new EncodingException("ResRef of field '" + label + "' is not ASCII: " + resRef.text(), e);
        }
        fieldData.writeU8(text.length).writeBytes(text).writeBytes(resRef.padding());
    }

    private void writeLocalizedString(LocalizedString value, String label) {
        int start = fieldData.position();
        fieldData.writeU32(0);
        fieldData.writeU32(value.stringRef().isPresent()
                           ? Integer.toUnsignedLong(value.stringRef().getAsInt())
                           : GffFileFormat.NO_STRING_REF);
        fieldData.writeU32(value.substrings().size());
        for (var substring : value.substrings()) {
            var bytes = utf8(substring.text(), label);
            fieldData.writeI32(substring.stringId()).writeU32(bytes.length).writeBytes(bytes);
        }
        // Total size counts everything after the size word itself.
        fieldData.putU32(start, fieldData.position() - start - 4);
    }

    private void writeLabels() {
        for (var label : labels.keySet()) {
            byte[] bytes;
            try {
                bytes = BinaryWriter.asciiBytes(label);
            } catch (CharacterCodingException e) {
                throw new EncodingException("Label is not ASCII: " + label, e);
            }
            if (label.indexOf('\0') >= 0) {
                throw new EncodingException("Label contains NUL: " + label.replace("\0", "\\0"));
            }
            if (bytes.length > GffFileFormat.LABEL_SIZE) {
                throw new EncodingException(
                "Label longer than " + GffFileFormat.LABEL_SIZE + " characters: " + label);
            }
            labelTable.writePadded(bytes, GffFileFormat.LABEL_SIZE);
        }
    }

    private static byte[] utf8(String text, String label) {
        try {
            return BinaryWriter.utf8Bytes(text);
        } catch (CharacterCodingException e) {
            throw new EncodingException("Text of field '" + label + "' is not encodable as UTF-8", e);
        }
    }
}
