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

import com.hellblazer.aurora.gff.core.GffFieldValue.ListValue;
import com.hellblazer.aurora.gff.core.GffFieldValue.SingleValue;
import com.hellblazer.aurora.gff.core.GffFieldValue.StructValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural diff of two GFF trees.
 *
 * <p>Unlike {@link GffStruct#equals(Object)}, fields are matched by label, so reordering alone is not a difference.
 * Every difference is reported with a {@code /}-separated path from {@value #ROOT_PATH} and logged at debug.
 * Single-precision values closer than {@value #FLOAT_TOLERANCE} compare equal.
 *
 * @author hal.hildebrand
 */
public class GffComparator {
    public static final String ROOT_PATH       = "GffRoot";
    public static final float  FLOAT_TOLERANCE = 0.0001f;

    private static final Logger log = LoggerFactory.getLogger(GffComparator.class);

    private final Set<String> ignoredLabels;

    public GffComparator() {
        this(Set.of());
    }

    /**
     * @param ignoredLabels labels skipped at every level, e.g. editor bookkeeping fields
     */
    public GffComparator(Set<String> ignoredLabels) {
        this.ignoredLabels = Set.copyOf(ignoredLabels);
    }

    public enum Kind {
        STRUCT_ID, MISSING_FIELD, EXTRA_FIELD, FIELD_TYPE, VALUE, LIST_LENGTH
    }

    public record Difference(String path, Kind kind, String detail) {
    }

    /**
     * @return every difference between {@code expected} and {@code actual}; empty if they match
     */
    public List<Difference> compare(GffStruct expected, GffStruct actual) {
        var differences = new ArrayList<Difference>();
        compareStructs(expected, actual, ROOT_PATH, differences);
        return differences;
    }

    public boolean matches(GffStruct expected, GffStruct actual) {
        return compare(expected, actual).isEmpty();
    }

    private void compareStructs(GffStruct expected, GffStruct actual, String path, List<Difference> differences) {
        if (expected.getStructId() != actual.getStructId()) {
            report(differences, path, Kind.STRUCT_ID, expected.getStructId() + " -> " + actual.getStructId());
        }

        var labels = new LinkedHashSet<String>(expected.labels());
        labels.addAll(actual.labels());
        labels.removeAll(ignoredLabels);

        for (var label : labels) {
            var childPath = path + "/" + label;
            var oldValue = expected.get(label);
            var newValue = actual.get(label);

            if (newValue.isEmpty()) {
                report(differences, childPath, Kind.MISSING_FIELD, String.valueOf(oldValue.get()));
                continue;
            }
            if (oldValue.isEmpty()) {
                report(differences, childPath, Kind.EXTRA_FIELD, String.valueOf(newValue.get()));
                continue;
            }
            compareValues(oldValue.get(), newValue.get(), childPath, differences);
        }
    }

    private void compareValues(GffFieldValue expected, GffFieldValue actual, String path,
                               List<Difference> differences) {
        if (expected.typeCode() != actual.typeCode()) {
            report(differences, path, Kind.FIELD_TYPE, expected.type() + " -> " + actual.type());
            return;
        }

        if (expected instanceof StructValue oldStruct && actual instanceof StructValue newStruct) {
            compareStructs(oldStruct.value(), newStruct.value(), path, differences);
        } else if (expected instanceof ListValue oldList && actual instanceof ListValue newList) {
            compareLists(oldList.value(), newList.value(), path, differences);
        } else if (expected instanceof SingleValue oldSingle && actual instanceof SingleValue newSingle) {
            if (Math.abs(oldSingle.value() - newSingle.value()) >= FLOAT_TOLERANCE) {
                report(differences, path, Kind.VALUE, oldSingle.value() + " -> " + newSingle.value());
            }
        } else if (!Objects.equals(expected, actual)) {
            report(differences, path, Kind.VALUE, expected + " -> " + actual);
        }
    }

    private void compareLists(List<GffStruct> expected, List<GffStruct> actual, String path,
                              List<Difference> differences) {
        if (expected.size() != actual.size()) {
            report(differences, path, Kind.LIST_LENGTH, expected.size() + " -> " + actual.size());
        }
        int common = Math.min(expected.size(), actual.size());
        for (int i = 0; i < common; i++) {
            compareStructs(expected.get(i), actual.get(i), path + "/" + i, differences);
        }
    }

    private void report(List<Difference> differences, String path, Kind kind, String detail) {
        log.debug("{} at '{}': {}", kind, path, detail);
        differences.add(new Difference(path, kind, detail));
    }
}
