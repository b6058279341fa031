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

import com.hellblazer.aurora.gff.core.GffFieldValue.*;

import javax.vecmath.Vector3f;
import javax.vecmath.Vector4f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A node of the GFF tree: an opaque struct id and an ordered mapping from label to field value.
 *
 * <p>Field order is declaration order. It is what the decoder produced or the order in which fields were first
 * set, and it is significant: two structs are equal only if they hold the same fields in the same order.
 * Replacing the value of an existing label keeps its position.
 *
 * <p>The typed getters return the supplied default when the label is absent or holds a different type.
 *
 * @author hal.hildebrand
 */
public final class GffStruct implements Iterable<Map.Entry<String, GffFieldValue>> {

    /**
     * Struct id conventionally carried by the root struct.
     */
    public static final int ROOT_STRUCT_ID = -1;

    private final Map<String, GffFieldValue> fields = new LinkedHashMap<>();
    private       int                        structId;

    public GffStruct() {
        this(0);
    }

    public GffStruct(int structId) {
        this.structId = structId;
    }

    public int getStructId() {
        return structId;
    }

    public void setStructId(int structId) {
        this.structId = structId;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public boolean exists(String label) {
        return fields.containsKey(label);
    }

    public Optional<GffFieldValue> get(String label) {
        return Optional.ofNullable(fields.get(label));
    }

    /**
     * @return the type of the field, empty if absent or opaque
     */
    public Optional<GffFieldType> fieldType(String label) {
        return get(label).map(GffFieldValue::type);
    }

    /**
     * @return labels in declaration order
     */
    public List<String> labels() {
        return List.copyOf(fields.keySet());
    }

    public GffStruct set(String label, GffFieldValue value) {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(value, "value");
        fields.put(label, value);
        return this;
    }

    public Optional<GffFieldValue> remove(String label) {
        return Optional.ofNullable(fields.remove(label));
    }

    @Override
    public Iterator<Map.Entry<String, GffFieldValue>> iterator() {
        return Collections.unmodifiableMap(fields).entrySet().iterator();
    }

    // === Typed setters ===

    public GffStruct setUInt8(String label, int value) {
        return set(label, new UInt8Value(value));
    }

    public GffStruct setInt8(String label, byte value) {
        return set(label, new Int8Value(value));
    }

    public GffStruct setUInt16(String label, int value) {
        return set(label, new UInt16Value(value));
    }

    public GffStruct setInt16(String label, short value) {
        return set(label, new Int16Value(value));
    }

    public GffStruct setUInt32(String label, long value) {
        return set(label, new UInt32Value(value));
    }

    public GffStruct setInt32(String label, int value) {
        return set(label, new Int32Value(value));
    }

    public GffStruct setUInt64(String label, long value) {
        return set(label, new UInt64Value(value));
    }

    public GffStruct setInt64(String label, long value) {
        return set(label, new Int64Value(value));
    }

    public GffStruct setSingle(String label, float value) {
        return set(label, new SingleValue(value));
    }

    public GffStruct setDouble(String label, double value) {
        return set(label, new DoubleValue(value));
    }

    public GffStruct setString(String label, String value) {
        return set(label, new StringValue(value));
    }

    public GffStruct setResRef(String label, ResRef value) {
        return set(label, new ResRefValue(value));
    }

    public GffStruct setLocString(String label, LocalizedString value) {
        return set(label, new LocStringValue(value));
    }

    public GffStruct setBinary(String label, byte[] value) {
        return set(label, new BinaryValue(value));
    }

    public GffStruct setStruct(String label, GffStruct value) {
        return set(label, new StructValue(value));
    }

    public GffStruct setList(String label, List<GffStruct> value) {
        return set(label, new ListValue(value));
    }

    public GffStruct setVector3(String label, Vector3f value) {
        return set(label, new Vector3Value(value));
    }

    public GffStruct setVector4(String label, Vector4f value) {
        return set(label, new Vector4Value(value));
    }

    // === Typed getters ===

    public int getUInt8(String label, int defaultValue) {
        return acquire(label, UInt8Value.class, UInt8Value::value, defaultValue);
    }

    public byte getInt8(String label, byte defaultValue) {
        return acquire(label, Int8Value.class, Int8Value::value, defaultValue);
    }

    public int getUInt16(String label, int defaultValue) {
        return acquire(label, UInt16Value.class, UInt16Value::value, defaultValue);
    }

    public short getInt16(String label, short defaultValue) {
        return acquire(label, Int16Value.class, Int16Value::value, defaultValue);
    }

    public long getUInt32(String label, long defaultValue) {
        return acquire(label, UInt32Value.class, UInt32Value::value, defaultValue);
    }

    public int getInt32(String label, int defaultValue) {
        return acquire(label, Int32Value.class, Int32Value::value, defaultValue);
    }

    public long getUInt64(String label, long defaultValue) {
        return acquire(label, UInt64Value.class, UInt64Value::value, defaultValue);
    }

    public long getInt64(String label, long defaultValue) {
        return acquire(label, Int64Value.class, Int64Value::value, defaultValue);
    }

    public float getSingle(String label, float defaultValue) {
        return acquire(label, SingleValue.class, SingleValue::value, defaultValue);
    }

    public double getDouble(String label, double defaultValue) {
        return acquire(label, DoubleValue.class, DoubleValue::value, defaultValue);
    }

    public String getString(String label, String defaultValue) {
        return acquire(label, StringValue.class, StringValue::value, defaultValue);
    }

    public ResRef getResRef(String label) {
        return acquire(label, ResRefValue.class, ResRefValue::value, ResRef.blank());
    }

    public LocalizedString getLocString(String label) {
        return acquire(label, LocStringValue.class, LocStringValue::value, LocalizedString.invalid());
    }

    public byte[] getBinary(String label) {
        return acquire(label, BinaryValue.class, BinaryValue::value, new byte[0]);
    }

    public Optional<GffStruct> getStruct(String label) {
        return Optional.ofNullable(acquire(label, StructValue.class, StructValue::value, null));
    }

    public List<GffStruct> getList(String label) {
        return acquire(label, ListValue.class, ListValue::value, List.of());
    }

    public Vector3f getVector3(String label, Vector3f defaultValue) {
        return acquire(label, Vector3Value.class, Vector3Value::value, defaultValue);
    }

    public Vector4f getVector4(String label, Vector4f defaultValue) {
        return acquire(label, Vector4Value.class, Vector4Value::value, defaultValue);
    }

    private <V extends GffFieldValue, T> T acquire(String label, Class<V> type, Function<V, T> unwrap,
                                                   T defaultValue) {
        var value = fields.get(label);
        if (type.isInstance(value)) {
            return unwrap.apply(type.cast(value));
        }
        return defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GffStruct other)) {
            return false;
        }
        return structId == other.structId && new ArrayList<>(fields.entrySet()).equals(
        new ArrayList<>(other.fields.entrySet()));
    }

    @Override
    public int hashCode() {
        return 31 * structId + fields.hashCode();
    }

    @Override
    public String toString() {
        return "GffStruct[id=" + structId + ", fields=" + fields + "]";
    }
}
