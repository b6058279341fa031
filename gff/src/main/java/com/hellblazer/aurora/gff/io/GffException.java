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

/**
 * Sealed exception hierarchy for GFF decoding and encoding.
 * <p>
 * Every condition is raised at the point where the offending table entry or payload is first used, and no
 * partially built tree or buffer is ever returned alongside one of these.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link MalformedHeaderException} - bad tag, or a section that does not fit in the buffer</li>
 * <li>{@link TruncatedFieldDataException} - a payload or index run overruns its section</li>
 * <li>{@link InvalidStructIndexException} - struct index beyond the struct table</li>
 * <li>{@link InvalidLabelIndexException} - label index beyond the label table</li>
 * <li>{@link InvalidFieldIndexException} - field index beyond the field table</li>
 * <li>{@link UnknownFieldTypeException} - field type tag outside 0-17</li>
 * <li>{@link CyclicStructReferenceException} - a struct reachable from itself</li>
 * <li>{@link SharedStructReferenceException} - one struct table entry referenced from two places</li>
 * <li>{@link DuplicateLabelException} - two fields of one struct share a label</li>
 * <li>{@link EncodingException} - text that is not representable where ASCII or UTF-8 is required</li>
 * </ul>
 */
public sealed class GffException extends RuntimeException
    permits GffException.MalformedHeaderException,
            GffException.TruncatedFieldDataException,
            GffException.InvalidStructIndexException,
            GffException.InvalidLabelIndexException,
            GffException.InvalidFieldIndexException,
            GffException.UnknownFieldTypeException,
            GffException.CyclicStructReferenceException,
            GffException.SharedStructReferenceException,
            GffException.DuplicateLabelException,
            GffException.EncodingException {

    public GffException(String message) {
        super(message);
    }

    public GffException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when the header tags are not printable ASCII, the version is not accepted, the root struct is
     * missing, or a table does not fit inside the buffer.
     */
    public static final class MalformedHeaderException extends GffException {

        public MalformedHeaderException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a payload's declared length, or an index run, reaches past the end of the section that holds
     * it, even if it would still be inside the file.
     */
    public static final class TruncatedFieldDataException extends GffException {

        public TruncatedFieldDataException(String message) {
            super(message);
        }

        public TruncatedFieldDataException(String section, long start, long length, long sectionEnd) {
            super(String.format("%s payload [%d, %d) overruns section end %d", section, start, start + length,
                                sectionEnd));
        }
    }

    public static final class InvalidStructIndexException extends GffException {
        private final long index;
        private final long count;

        public InvalidStructIndexException(long index, long count) {
            super(String.format("Struct index %d outside struct table of %d entries", index, count));
            this.index = index;
            this.count = count;
        }

        public long getIndex() {
            return index;
        }

        public long getCount() {
            return count;
        }
    }

    public static final class InvalidLabelIndexException extends GffException {
        private final long index;
        private final long count;

        public InvalidLabelIndexException(long index, long count) {
            super(String.format("Label index %d outside label table of %d entries", index, count));
            this.index = index;
            this.count = count;
        }

        public long getIndex() {
            return index;
        }

        public long getCount() {
            return count;
        }
    }

    public static final class InvalidFieldIndexException extends GffException {
        private final long index;
        private final long count;

        public InvalidFieldIndexException(long index, long count) {
            super(String.format("Field index %d outside field table of %d entries", index, count));
            this.index = index;
            this.count = count;
        }

        public long getIndex() {
            return index;
        }

        public long getCount() {
            return count;
        }
    }

    public static final class UnknownFieldTypeException extends GffException {
        private final long typeCode;

        public UnknownFieldTypeException(long typeCode, long fieldIndex) {
            super(String.format("Unknown field type %d in field %d", typeCode, fieldIndex));
            this.typeCode = typeCode;
        }

        public long getTypeCode() {
            return typeCode;
        }
    }

    /**
     * Thrown when a struct is reached again while it is still being resolved (decode) or written (encode).
     */
    public static final class CyclicStructReferenceException extends GffException {

        public CyclicStructReferenceException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a struct table entry is reached a second time during one decode. Each struct occurrence owns
     * its own entry, so a second reference would expand the same subtree again.
     */
    public static final class SharedStructReferenceException extends GffException {
        private final long structIndex;

        public SharedStructReferenceException(long structIndex) {
            super(String.format("Struct %d is referenced more than once", structIndex));
            this.structIndex = structIndex;
        }

        public long getStructIndex() {
            return structIndex;
        }
    }

    public static final class DuplicateLabelException extends GffException {

        public DuplicateLabelException(String label, long structIndex) {
            super(String.format("Label '%s' appears twice in struct %d", label, structIndex));
        }
    }

    public static final class EncodingException extends GffException {

        public EncodingException(String message) {
            super(message);
        }

        public EncodingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
