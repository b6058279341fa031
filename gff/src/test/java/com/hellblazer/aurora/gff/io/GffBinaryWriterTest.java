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
import com.hellblazer.aurora.gff.core.GffContent;
import com.hellblazer.aurora.gff.core.GffFieldValue.OpaqueValue;
import com.hellblazer.aurora.gff.core.GffStruct;
import com.hellblazer.aurora.gff.core.LocalizedString;
import com.hellblazer.aurora.gff.core.ResRef;
import com.hellblazer.aurora.gff.io.GffException.CyclicStructReferenceException;
import com.hellblazer.aurora.gff.io.GffException.EncodingException;
import com.hellblazer.aurora.io.BinaryReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.hellblazer.aurora.gff.io.GffTestFiles.builder;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Canonical layout produced by the encoder.
 *
 * @author hal.hildebrand
 */
public class GffBinaryWriterTest {

    private GffBinaryWriter writer;
    private GffBinaryReader reader;

    private static Gff document(GffStruct root) {
        return new Gff("GFF ", Gff.DEFAULT_VERSION, root);
    }

    private static byte[] section(byte[] data, GffHeader.Section section) {
        return Arrays.copyOfRange(data, (int) section.offset(), (int) section.end());
    }

    @BeforeEach
    public void setUp() {
        writer = new GffBinaryWriter();
        reader = new GffBinaryReader();
    }

    @Test
    public void testEmptyRoot() {
        var bytes = writer.write(Gff.of(GffContent.UTT));
        assertEquals(GffFileFormat.HEADER_SIZE + GffFileFormat.STRUCT_ENTRY_SIZE, bytes.length);

        var view = reader.open(bytes);
        assertEquals("UTT ", view.header().fileType());
        assertEquals(new GffTableView.StructEntry(-1, 0, 0), view.structEntry(0));
    }

    @Test
    public void testSectionsBumpAllocatedInCanonicalOrder() {
        var root = new GffStruct().setString("Tag", "x")
                                  .setInt32("A", 1)
                                  .setList("L", List.of(new GffStruct(1), new GffStruct(2)));
        var bytes = writer.write(document(root));
        var header = GffHeader.read(BinaryReader.wrap(bytes));

        long expected = GffFileFormat.HEADER_SIZE;
        for (var section : header.sections()) {
            assertEquals(expected, section.offset(), section.name());
            expected = section.end();
        }
        assertEquals(bytes.length, expected);
        assertEquals(3, header.structs().count());
        assertEquals(3, header.fields().count());
        assertEquals(12, header.fieldIndices().count());
        assertEquals(12, header.listIndices().count());
    }

    @Test
    public void testReencodeIsByteIdentical() {
        var scalar = builder().struct(-1, 0, 1).field(4, 0, 42).label("Value").build();
        assertArrayEquals(scalar, writer.write(reader.read(scalar)));

        var list = builder().struct(-1, 0, 1)
                            .struct(10, 0, 0)
                            .struct(20, 0, 0)
                            .field(15, 0, 0)
                            .label("Entries")
                            .list(1, 2)
                            .build();
        assertArrayEquals(list, writer.write(reader.read(list)));
    }

    @Test
    public void testStringPayloadBytes() {
        var b = builder().struct(-1, 0, 1).field(10, 0, 0).label("Tag");
        b.fieldData().writeU32(5).writeBytes("hello".getBytes(StandardCharsets.US_ASCII));
        var original = b.build();

        var encoded = writer.write(reader.read(original));
        var originalPayload = section(original, GffHeader.read(BinaryReader.wrap(original)).fieldData());
        var encodedPayload = section(encoded, GffHeader.read(BinaryReader.wrap(encoded)).fieldData());
        assertArrayEquals(new byte[] { 5, 0, 0, 0, 'h', 'e', 'l', 'l', 'o' }, encodedPayload);
        assertArrayEquals(originalPayload, encodedPayload);
    }

    @Test
    public void testLabelsInFirstSeenPreOrder() {
        var child = new GffStruct(1).setInt32("A", 1).setInt32("B", 2);
        var element = new GffStruct(2).setInt32("D", 4).setInt32("A", 5);
        var root = new GffStruct().setInt32("B", 0).setStruct("Child", child).setList("C", List.of(element));

        var view = reader.open(writer.write(document(root)));
        var labels = new ArrayList<String>();
        for (int i = 0; i < view.labelCount(); i++) {
            labels.add(view.label(i));
        }
        assertEquals(List.of("B", "Child", "A", "C", "D"), labels);
    }

    @Test
    public void testStructSlotsInPreOrder() {
        var grandChild = new GffStruct(11);
        var child = new GffStruct(10).setStruct("G", grandChild);
        var root = new GffStruct(-1).setStruct("C", child).setList("L", List.of(new GffStruct(20), new GffStruct(21)));

        var view = reader.open(writer.write(document(root)));
        assertEquals(5, view.structCount());
        int[] ids = new int[5];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = view.structEntry(i).structId();
        }
        assertArrayEquals(new int[] { -1, 10, 11, 20, 21 }, ids);
    }

    @Test
    public void testStructEntryShapes() {
        var root = new GffStruct().setStruct("One", new GffStruct(1).setUInt8("X", 7))
                                  .setStruct("None", new GffStruct(2))
                                  .setStruct("Two", new GffStruct(3).setUInt8("X", 1).setUInt8("Y", 2));
        var view = reader.open(writer.write(document(root)));

        var one = view.structEntry(1);
        assertEquals(1, one.fieldCount());
        assertEquals("X", view.label(view.fieldEntry(one.dataOrOffset()).labelIndex()));

        assertEquals(new GffTableView.StructEntry(2, 0, 0), view.structEntry(2));

        var two = view.structEntry(3);
        assertEquals(2, two.fieldCount());
        // Root's three field indices come first.
        assertEquals(12, two.dataOrOffset());
    }

    @Test
    public void testNoStructSharing() {
        var twin = new GffStruct(5).setInt32("V", 1);
        var root = new GffStruct().setStruct("Left", twin).setStruct("Right", twin);
        var bytes = writer.write(document(root));

        var view = reader.open(bytes);
        assertEquals(3, view.structCount());
        var decoded = view.resolveRoot();
        assertEquals(decoded.getStruct("Left"), decoded.getStruct("Right"));
    }

    @Test
    public void testInlineEncoding() {
        var root = new GffStruct().setInt8("I8", (byte) -1)
                                  .setUInt8("U8", 255)
                                  .setInt16("I16", (short) -2)
                                  .setSingle("F", 1.5f);
        var view = reader.open(writer.write(document(root)));
        assertEquals(-1, view.fieldEntry(0).dataOrOffset());
        assertEquals(255, view.fieldEntry(1).dataOrOffset());
        assertEquals(-2, view.fieldEntry(2).dataOrOffset());
        assertEquals(Float.floatToRawIntBits(1.5f), view.fieldEntry(3).dataOrOffset());
    }

    @Test
    public void testNoReferenceSentinel() {
        var root = new GffStruct().setLocString("Name", LocalizedString.invalid().with(0, 0, "hi"));
        var bytes = writer.write(document(root));
        var fieldData = section(bytes, GffHeader.read(BinaryReader.wrap(bytes)).fieldData());

        var payload = BinaryReader.wrap(fieldData);
        assertEquals(18, payload.u32(0));
        assertEquals(GffFileFormat.NO_STRING_REF, payload.u32(4));
        assertEquals(1, payload.u32(8));
        assertEquals(fieldData.length, 4 + payload.u32(0));

        assertTrue(reader.readRoot(bytes).getLocString("Name").stringRef().isEmpty());
    }

    @Test
    public void testResRefSlot() {
        var padding = new byte[12];
        Arrays.fill(padding, (byte) 0x7F);
        var root = new GffStruct().setResRef("R", new ResRef("door", padding));
        var bytes = writer.write(document(root));
        var fieldData = section(bytes, GffHeader.read(BinaryReader.wrap(bytes)).fieldData());

        assertEquals(1 + GffFileFormat.RESREF_SLOT_SIZE, fieldData.length);
        assertEquals(4, fieldData[0]);
        assertEquals((byte) 0x7F, fieldData[16]);
    }

    @Test
    public void testOpaqueFieldWrittenVerbatim() {
        var root = new GffStruct().set("Future", new OpaqueValue(99, 1234));
        var view = reader.open(writer.write(document(root)));
        assertEquals(new GffTableView.FieldEntry(99, 0, 1234), view.fieldEntry(0));
    }

    @Test
    public void testDeterministic() {
        var root = new GffStruct().setString("S", "abc").setList("L", List.of(new GffStruct(1).setDouble("D", 2)));
        assertArrayEquals(writer.write(document(root)), writer.write(document(root)));
    }

    @Test
    public void testCycleRejected() {
        var a = new GffStruct(1);
        var b = new GffStruct(2).setStruct("Back", a);
        a.setStruct("Next", b);
        assertThrows(CyclicStructReferenceException.class, () -> writer.write(document(a)));

        var self = new GffStruct(3);
        self.setList("Self", List.of(self));
        assertThrows(CyclicStructReferenceException.class, () -> writer.write(document(self)));
    }

    @Test
    public void testBadLabels() {
        var tooLong = new GffStruct().setInt32("SeventeenCharsXYZ", 1);
        assertThrows(EncodingException.class, () -> writer.write(document(tooLong)));

        var nonAscii = new GffStruct().setInt32("Näme", 1);
        assertThrows(EncodingException.class, () -> writer.write(document(nonAscii)));

        var embeddedNul = new GffStruct().setInt32("A", 1).setInt32("A\0", 2);
        assertThrows(EncodingException.class, () -> writer.write(document(embeddedNul)));

        var sixteen = new GffStruct().setInt32("SixteenCharsXYZW", 1);
        assertEquals(1, reader.readRoot(writer.write(document(sixteen))).getInt32("SixteenCharsXYZW", 0));
    }

    @Test
    public void testBadTags() {
        var root = new GffStruct();
        assertThrows(EncodingException.class, () -> writer.write(new Gff("UTTT ", "V3.2", root)));
        assertThrows(EncodingException.class, () -> writer.write(new Gff("UTT ", "V3.é", root)));
    }

    @Test
    public void testNonAsciiResRef() {
        var root = new GffStruct().setResRef("R", ResRef.of("döor"));
        assertThrows(EncodingException.class, () -> writer.write(document(root)));
    }
}
