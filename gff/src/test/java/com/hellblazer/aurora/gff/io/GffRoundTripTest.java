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
import com.hellblazer.aurora.gff.core.GffComparator;
import com.hellblazer.aurora.gff.core.GffContent;
import com.hellblazer.aurora.gff.core.GffFieldType;
import com.hellblazer.aurora.gff.core.GffFieldValue.OpaqueValue;
import com.hellblazer.aurora.gff.core.GffStruct;
import com.hellblazer.aurora.gff.core.LocalizedString;
import com.hellblazer.aurora.gff.core.ResRef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.vecmath.Vector3f;
import javax.vecmath.Vector4f;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Encode then decode whole documents.
 *
 * @author hal.hildebrand
 */
public class GffRoundTripTest {

    private final GffBinaryWriter writer = new GffBinaryWriter();
    private final GffBinaryReader reader = new GffBinaryReader();

    @TempDir
    Path tempDir;

    /**
     * A trigger-like template using every field type.
     */
    static Gff sampleDocument() {
        var name = LocalizedString.fromStringRef(4321).with(0, 0, "Trap").with(2, 1, "Falle");

        var point = new GffStruct(3).setVector3("Point", new Vector3f(1.25f, -2.5f, 0f));
        var geometry = List.of(point, new GffStruct(3).setVector3("Point", new Vector3f(4f, 5f, 6f)));

        var script = new GffStruct(7).setString("Script", "on_enter").setInt32("Priority", -2);

        var root = new GffStruct()
        .setUInt8("Type", 200)
        .setInt8("Faction", (byte) -5)
        .setUInt16("Cost", 65535)
        .setInt16("Modifier", Short.MIN_VALUE)
        .setUInt32("Flags", 0xFFFFFFFFL)
        .setInt32("HP", Integer.MIN_VALUE)
        .setUInt64("Checksum", -1L)
        .setInt64("Timestamp", Long.MIN_VALUE)
        .setSingle("Scale", 0.75f)
        .setDouble("Radius", Math.PI)
        .setString("Tag", "trap_001 ü")
        .setResRef("TemplateResRef", ResRef.of("trap_001"))
        .setLocString("LocalizedName", name)
        .setBinary("Blob", new byte[] { 0, 1, 2, (byte) 0xFF })
        .setStruct("OnEnter", script)
        .setList("Geometry", geometry)
        .setVector4("Orientation", new Vector4f(0f, 0f, 0.7071f, 0.7071f))
        .setVector3("Position", new Vector3f(10f, 20f, 30f))
        .setList("Empty", List.of());
        return new Gff(GffContent.UTT.fourCC(), Gff.DEFAULT_VERSION, root);
    }

    @Test
    public void testEveryFieldType() {
        var original = sampleDocument();
        var decoded = reader.read(writer.write(original));

        assertEquals(original, decoded);
        assertEquals(original.root().labels(), decoded.root().labels());

        var types = EnumSet.noneOf(GffFieldType.class);
        for (var field : decoded.root()) {
            types.add(field.getValue().type());
        }
        assertEquals(EnumSet.allOf(GffFieldType.class), types);
    }

    @Test
    public void testTypedAccessAfterDecode() {
        var root = reader.readRoot(writer.write(sampleDocument()));
        assertEquals(200, root.getUInt8("Type", 0));
        assertEquals(0xFFFFFFFFL, root.getUInt32("Flags", 0));
        assertEquals("trap_001 ü", root.getString("Tag", null));
        assertEquals("trap_001", root.getResRef("TemplateResRef").text());
        assertEquals(OptionalInt.of(4321), root.getLocString("LocalizedName").stringRef());
        assertEquals("Falle", root.getLocString("LocalizedName").get(2, 1).orElseThrow());
        assertEquals(7, root.getStruct("OnEnter").orElseThrow().getStructId());
        assertEquals(-2, root.getStruct("OnEnter").orElseThrow().getInt32("Priority", 0));
        assertEquals(new Vector3f(4f, 5f, 6f), root.getList("Geometry").get(1).getVector3("Point", null));
        assertTrue(root.getList("Empty").isEmpty());
    }

    @Test
    public void testDeepNesting() {
        var root = new GffStruct();
        var current = root;
        for (int depth = 0; depth < 200; depth++) {
            var child = new GffStruct(depth).setInt32("Depth", depth);
            current.setStruct("Child", child);
            current = child;
        }
        var decoded = reader.readRoot(writer.write(new Gff("GFF ", "V3.2", root)));
        assertEquals(root, decoded);
    }

    @Test
    public void testVeryDeepChain() throws IOException {
        int depth = 20_000;
        var root = new GffStruct(-1);
        var current = root;
        for (int i = 0; i < depth; i++) {
            var child = new GffStruct(i).setInt32("Depth", i);
            current.setStruct("Child", child);
            current = child;
        }
        var file = tempDir.resolve("chain.gff");
        writer.write(new Gff("GFF ", "V3.2", root), file);

        // Walked by hand; struct equality recurses.
        var node = reader.read(file).root().getStruct("Child");
        int levels = 0;
        while (node.isPresent()) {
            assertEquals(levels, node.get().getStructId());
            assertEquals(levels, node.get().getInt32("Depth", -1));
            levels++;
            node = node.get().getStruct("Child");
        }
        assertEquals(depth, levels);
    }

    @Test
    public void testOpaqueSurvivesLenientRoundTrip() {
        var lenient = new GffBinaryReader(GffCodecConfig.lenientConfig());
        var root = new GffStruct().setInt32("Known", 1).set("Future", new OpaqueValue(18, 0xBEEF));
        var decoded = lenient.readRoot(writer.write(new Gff("GFF ", "V3.2", root)));
        assertEquals(root, decoded);
    }

    @Test
    public void testReencodeIsStable() {
        var first = writer.write(sampleDocument());
        var second = writer.write(reader.read(first));
        assertArrayEquals(first, second);
    }

    @Test
    public void testComparatorAgreesAfterRoundTrip() {
        var original = sampleDocument();
        var decoded = reader.read(writer.write(original));
        assertTrue(new GffComparator().matches(original.root(), decoded.root()));
    }

    @Test
    public void testFiles() throws IOException {
        var file = tempDir.resolve("trap.utt");
        var original = sampleDocument();
        writer.write(original, file);
        assertEquals(writer.write(original).length, Files.size(file));

        var decoded = reader.read(file);
        assertEquals(original, decoded);
        assertEquals(GffContent.UTT, decoded.content().orElseThrow());

        // Overwrite with a smaller document; the file must shrink.
        writer.write(Gff.of(GffContent.UTT), file);
        assertTrue(reader.read(file).root().isEmpty());
        assertEquals(GffFileFormat.HEADER_SIZE + GffFileFormat.STRUCT_ENTRY_SIZE, Files.size(file));
    }

    @Test
    public void testMissingFile() {
        assertThrows(IOException.class, () -> reader.read(tempDir.resolve("absent.utt")));
    }
}
