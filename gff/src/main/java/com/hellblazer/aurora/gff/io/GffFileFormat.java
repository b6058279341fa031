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

import java.util.Set;

/**
 * File format definitions for the GFF container.
 *
 * <p><b>Canonical layout</b> (as written; readers honor whatever offsets the header declares):
 * <pre>
 * [Header: 56 bytes]
 *   fileType(4) + fileVersion(4) +
 *   (offset(4), count(4)) for structs, fields, labels, fieldData, fieldIndices, listIndices
 * [Structs: structCount * 12 bytes]      structId(i32) + dataOrOffset(u32) + fieldCount(u32)
 * [Fields: fieldCount * 12 bytes]        fieldType(u32) + labelIndex(u32) + dataOrOffset(u32)
 * [Labels: labelCount * 16 bytes]        NUL-padded ASCII
 * [FieldData: fieldDataCount bytes]
 * [FieldIndices: fieldIndicesCount bytes]  runs of u32 field indices
 * [ListIndices: listIndicesCount bytes]    per list: count(u32) + count * structIndex(u32)
 * </pre>
 *
 * <p>The counts of the three blob sections are byte counts; the other three are entry counts.
 *
 * @author hal.hildebrand
 */
public final class GffFileFormat {

    public static final int HEADER_SIZE       = 56;
    public static final int TAG_SIZE          = 4;
    public static final int STRUCT_ENTRY_SIZE = 12;
    public static final int FIELD_ENTRY_SIZE  = 12;
    public static final int LABEL_SIZE        = 16;
    public static final int INDEX_SIZE        = 4;
    public static final int RESREF_SLOT_SIZE  = 16;

    /**
     * Localized string reference meaning "no entry in the external string table".
     */
    public static final long NO_STRING_REF = 0xFFFFFFFFL;

    /**
     * Bytes of a localized string payload after its total-size word: string ref + substring count.
     */
    public static final int LOCSTRING_PREFIX_SIZE = 8;

    /**
     * Version tags written by the Aurora engine family.
     */
    public static final Set<String> KNOWN_VERSIONS = Set.of("V3.2", "V3.3", "V4.0", "V4.1");

    private GffFileFormat() {
        // Utility class
    }

    /**
     * @return true if {@code tag} is exactly four printable ASCII characters
     */
    public static boolean isValidTag(String tag) {
        if (tag == null || tag.length() != TAG_SIZE) {
            return false;
        }
        for (int i = 0; i < TAG_SIZE; i++) {
            char c = tag.charAt(i);
            if (c < 0x20 || c > 0x7E) {
                return false;
            }
        }
        return true;
    }
}
