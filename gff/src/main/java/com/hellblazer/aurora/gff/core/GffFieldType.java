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

import java.util.Optional;

/**
 * Wire-level field type tags of the GFF container.
 *
 * <p>The numeric codes are part of the file format and must never be reordered. Each type also declares where
 * its value lives, which is all the codec needs to dispatch a field entry:
 * <ul>
 *   <li>{@link Storage#INLINE} - the value itself occupies the entry's 4-byte data slot</li>
 *   <li>{@link Storage#FIELD_DATA} - the slot is a byte offset into the field-data section</li>
 *   <li>{@link Storage#STRUCT_INDEX} - the slot is an index into the struct table</li>
 *   <li>{@link Storage#LIST_INDICES} - the slot is a byte offset into the list-indices section</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public enum GffFieldType {
    UINT8(0, Storage.INLINE),
    INT8(1, Storage.INLINE),
    UINT16(2, Storage.INLINE),
    INT16(3, Storage.INLINE),
    UINT32(4, Storage.INLINE),
    INT32(5, Storage.INLINE),
    UINT64(6, Storage.FIELD_DATA),
    INT64(7, Storage.FIELD_DATA),
    SINGLE(8, Storage.INLINE),
    DOUBLE(9, Storage.FIELD_DATA),
    STRING(10, Storage.FIELD_DATA),
    RESREF(11, Storage.FIELD_DATA),
    LOCALIZED_STRING(12, Storage.FIELD_DATA),
    BINARY(13, Storage.FIELD_DATA),
    STRUCT(14, Storage.STRUCT_INDEX),
    LIST(15, Storage.LIST_INDICES),
    VECTOR4(16, Storage.FIELD_DATA),
    VECTOR3(17, Storage.FIELD_DATA);

    public enum Storage {
        INLINE, FIELD_DATA, STRUCT_INDEX, LIST_INDICES
    }

    private static final GffFieldType[] BY_CODE = values();

    private final int     code;
    private final Storage storage;

    GffFieldType(int code, Storage storage) {
        this.code = code;
        this.storage = storage;
    }

    /**
     * Look up a type by its wire code.
     *
     * @param code unsigned 32-bit type tag as read from a field entry
     * @return the type, or empty if the code is outside 0-17
     */
    public static Optional<GffFieldType> fromCode(long code) {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.of(BY_CODE[(int) code]);
    }

    public int code() {
        return code;
    }

    public Storage storage() {
        return storage;
    }

    public boolean isSimple() {
        return storage == Storage.INLINE;
    }

    public boolean isComplex() {
        return storage == Storage.FIELD_DATA;
    }

    public boolean isStruct() {
        return storage == Storage.STRUCT_INDEX;
    }

    public boolean isList() {
        return storage == Storage.LIST_INDICES;
    }
}
