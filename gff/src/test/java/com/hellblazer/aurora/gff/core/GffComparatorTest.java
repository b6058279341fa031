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

import com.hellblazer.aurora.gff.core.GffComparator.Kind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GffComparatorTest {

    private GffComparator comparator;
    private GffStruct     expected;

    @BeforeEach
    public void setUp() {
        comparator = new GffComparator();
        expected = new GffStruct(-1).setString("Tag", "door")
                                    .setSingle("Scale", 1.0f)
                                    .setStruct("Script", new GffStruct(2).setString("OnOpen", "open"))
                                    .setList("Items", List.of(new GffStruct(0).setInt32("Count", 1)));
    }

    private GffStruct copy() {
        return new GffStruct(-1).setString("Tag", "door")
                                .setSingle("Scale", 1.0f)
                                .setStruct("Script", new GffStruct(2).setString("OnOpen", "open"))
                                .setList("Items", List.of(new GffStruct(0).setInt32("Count", 1)));
    }

    @Test
    public void testIdentical() {
        assertTrue(comparator.compare(expected, copy()).isEmpty());
        assertTrue(comparator.matches(expected, copy()));
    }

    @Test
    public void testFieldOrderIgnored() {
        var reordered = new GffStruct(-1).setList("Items", List.of(new GffStruct(0).setInt32("Count", 1)))
                                         .setStruct("Script", new GffStruct(2).setString("OnOpen", "open"))
                                         .setSingle("Scale", 1.0f)
                                         .setString("Tag", "door");
        assertTrue(comparator.matches(expected, reordered));
        assertNotEquals(expected, reordered);
    }

    @Test
    public void testFloatTolerance() {
        var close = copy().setSingle("Scale", 1.00001f);
        assertTrue(comparator.matches(expected, close));

        var far = copy().setSingle("Scale", 1.1f);
        var differences = comparator.compare(expected, far);
        assertEquals(1, differences.size());
        assertEquals(Kind.VALUE, differences.get(0).kind());
        assertEquals("GffRoot/Scale", differences.get(0).path());
    }

    @Test
    public void testNestedPaths() {
        var actual = copy();
        actual.getStruct("Script").orElseThrow().setString("OnOpen", "other");
        actual.getList("Items").get(0).setInt32("Count", 2);

        var differences = comparator.compare(expected, actual);
        assertEquals(List.of(new GffComparator.Difference("GffRoot/Script/OnOpen", Kind.VALUE,
                                                          "StringValue[value=open] -> StringValue[value=other]"),
                             new GffComparator.Difference("GffRoot/Items/0/Count", Kind.VALUE,
                                                          "Int32Value[value=1] -> Int32Value[value=2]")),
                     differences);
    }

    @Test
    public void testMissingExtraAndType() {
        var actual = copy();
        actual.remove("Tag");
        actual.setInt32("Extra", 1);
        actual.setUInt8("Scale", 1);

        var kinds = comparator.compare(expected, actual).stream().map(GffComparator.Difference::kind).toList();
        assertEquals(List.of(Kind.MISSING_FIELD, Kind.FIELD_TYPE, Kind.EXTRA_FIELD), kinds);
    }

    @Test
    public void testStructIdAndListLength() {
        var actual = copy();
        actual.setStructId(3);
        actual.setList("Items", List.of());

        var kinds = comparator.compare(expected, actual).stream().map(GffComparator.Difference::kind).toList();
        assertEquals(List.of(Kind.STRUCT_ID, Kind.LIST_LENGTH), kinds);
    }

    @Test
    public void testIgnoredLabels() {
        var actual = copy().setString("Tag", "gate");
        assertFalse(comparator.matches(expected, actual));
        assertTrue(new GffComparator(Set.of("Tag")).matches(expected, actual));
    }
}
