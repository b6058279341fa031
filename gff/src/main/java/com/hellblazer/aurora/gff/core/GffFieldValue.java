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

import javax.vecmath.Vector3f;
import javax.vecmath.Vector4f;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * The value of one GFF field: one record per wire field type, plus {@link OpaqueValue} for fields whose type tag
 * is not part of the format and which a lenient decode chose to keep.
 *
 * <p>Values are compared structurally. Mutable payloads (byte arrays, vecmath tuples) are copied on the way in and
 * on the way out, so a value never aliases caller or buffer state.
 *
 * @author hal.hildebrand
 */
public sealed interface GffFieldValue
permits GffFieldValue.UInt8Value, GffFieldValue.Int8Value, GffFieldValue.UInt16Value, GffFieldValue.Int16Value,
        GffFieldValue.UInt32Value, GffFieldValue.Int32Value, GffFieldValue.UInt64Value, GffFieldValue.Int64Value,
        GffFieldValue.SingleValue, GffFieldValue.DoubleValue, GffFieldValue.StringValue, GffFieldValue.ResRefValue,
        GffFieldValue.LocStringValue, GffFieldValue.BinaryValue, GffFieldValue.StructValue, GffFieldValue.ListValue,
        GffFieldValue.Vector4Value, GffFieldValue.Vector3Value, GffFieldValue.OpaqueValue {

    /**
     * @return the field type, or null for an {@link OpaqueValue}
     */
    GffFieldType type();

    /**
     * @return the wire type code written for this value
     */
    default int typeCode() {
        return type().code();
    }

    record UInt8Value(int value) implements GffFieldValue {
        public UInt8Value {
            if (value < 0 || value > 0xFF) {
                throw new IllegalArgumentException("uint8 out of range: " + value);
            }
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.UINT8;
        }
    }

    record Int8Value(byte value) implements GffFieldValue {
        @Override
        public GffFieldType type() {
            return GffFieldType.INT8;
        }
    }

    record UInt16Value(int value) implements GffFieldValue {
        public UInt16Value {
            if (value < 0 || value > 0xFFFF) {
                throw new IllegalArgumentException("uint16 out of range: " + value);
            }
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.UINT16;
        }
    }

    record Int16Value(short value) implements GffFieldValue {
        @Override
        public GffFieldType type() {
            return GffFieldType.INT16;
        }
    }

    record UInt32Value(long value) implements GffFieldValue {
        public UInt32Value {
            if (value < 0 || value > 0xFFFFFFFFL) {
                throw new IllegalArgumentException("uint32 out of range: " + value);
            }
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.UINT32;
        }
    }

    record Int32Value(int value) implements GffFieldValue {
        @Override
        public GffFieldType type() {
            return GffFieldType.INT32;
        }
    }

    /**
     * @param value the 64 raw bits, read as unsigned
     */
    record UInt64Value(long value) implements GffFieldValue {
        @Override
        public GffFieldType type() {
            return GffFieldType.UINT64;
        }

        @Override
        public String toString() {
            return "UInt64Value[value=" + Long.toUnsignedString(value) + "]";
        }
    }

    record Int64Value(long value) implements GffFieldValue {
        @Override
        public GffFieldType type() {
            return GffFieldType.INT64;
        }
    }

    record SingleValue(float value) implements GffFieldValue {
        @Override
        public GffFieldType type() {
            return GffFieldType.SINGLE;
        }
    }

    record DoubleValue(double value) implements GffFieldValue {
        @Override
        public GffFieldType type() {
            return GffFieldType.DOUBLE;
        }
    }

    record StringValue(String value) implements GffFieldValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.STRING;
        }
    }

    record ResRefValue(ResRef value) implements GffFieldValue {
        public ResRefValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.RESREF;
        }
    }

    record LocStringValue(LocalizedString value) implements GffFieldValue {
        public LocStringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.LOCALIZED_STRING;
        }
    }

    record BinaryValue(byte[] value) implements GffFieldValue {
        public BinaryValue {
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        public int length() {
            return value.length;
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.BINARY;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof BinaryValue other && Arrays.equals(value, other.value));
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BinaryValue[" + HexFormat.of().formatHex(value) + "]";
        }
    }

    record StructValue(GffStruct value) implements GffFieldValue {
        public StructValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.STRUCT;
        }
    }

    record ListValue(List<GffStruct> value) implements GffFieldValue {
        public ListValue {
            value = List.copyOf(value);
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.LIST;
        }
    }

    record Vector4Value(Vector4f value) implements GffFieldValue {
        public Vector4Value {
            value = new Vector4f(Objects.requireNonNull(value, "value"));
        }

        @Override
        public Vector4f value() {
            return new Vector4f(value);
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.VECTOR4;
        }
    }

    record Vector3Value(Vector3f value) implements GffFieldValue {
        public Vector3Value {
            value = new Vector3f(Objects.requireNonNull(value, "value"));
        }

        @Override
        public Vector3f value() {
            return new Vector3f(value);
        }

        @Override
        public GffFieldType type() {
            return GffFieldType.VECTOR3;
        }
    }

    /**
     * A field whose type tag is outside the format's enum, kept verbatim.
     *
     * @param typeCode the raw type tag
     * @param rawData  the raw 4-byte data slot; what it addresses is unknown
     */
    record OpaqueValue(int typeCode, int rawData) implements GffFieldValue {
        public OpaqueValue {
            if (GffFieldType.fromCode(Integer.toUnsignedLong(typeCode)).isPresent()) {
                throw new IllegalArgumentException("type code " + typeCode + " is a known field type");
            }
        }

        @Override
        public GffFieldType type() {
            return null;
        }
    }
}
