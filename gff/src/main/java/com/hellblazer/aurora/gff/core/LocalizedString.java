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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A string with per-language, per-gender variants and an optional reference into an external string table.
 *
 * <p>On disk the absence of a string table reference is the sentinel {@code 0xFFFFFFFF}; here it is an empty
 * {@link OptionalInt}. A present reference is an unsigned 32-bit value held in an {@code int}, so the sentinel
 * itself can never be a present reference.
 *
 * <p>Instances are immutable; the {@code with} methods return copies.
 *
 * @author hal.hildebrand
 */
public final class LocalizedString {
    private static final LocalizedString INVALID = new LocalizedString(OptionalInt.empty(), List.of());

    private final OptionalInt     stringRef;
    private final List<Substring> substrings;

    public LocalizedString(OptionalInt stringRef, List<Substring> substrings) {
        Objects.requireNonNull(stringRef, "stringRef");
        Objects.requireNonNull(substrings, "substrings");
        if (stringRef.isPresent() && stringRef.getAsInt() == -1) {
            throw new IllegalArgumentException("0xFFFFFFFF is the no-reference sentinel, use OptionalInt.empty()");
        }
        this.stringRef = stringRef;
        this.substrings = List.copyOf(substrings);
    }

    /**
     * No string table reference and no substrings.
     */
    public static LocalizedString invalid() {
        return INVALID;
    }

    public static LocalizedString fromStringRef(int stringRef) {
        return new LocalizedString(OptionalInt.of(stringRef), List.of());
    }

    public OptionalInt stringRef() {
        return stringRef;
    }

    public List<Substring> substrings() {
        return substrings;
    }

    /**
     * Text of the first substring tagged with the given language and gender.
     */
    public Optional<String> get(int languageId, int genderId) {
        return substrings.stream()
                         .filter(s -> s.languageId() == languageId && s.genderId() == genderId)
                         .map(Substring::text)
                         .findFirst();
    }

    /**
     * Copy with the substring for {@code languageId}/{@code genderId} replaced, or appended if absent.
     */
    public LocalizedString with(int languageId, int genderId, String text) {
        var replacement = Substring.of(languageId, genderId, text);
        var copy = new ArrayList<Substring>(substrings.size() + 1);
        boolean replaced = false;
        for (var s : substrings) {
            if (!replaced && s.languageId() == languageId && s.genderId() == genderId) {
                copy.add(replacement);
                replaced = true;
            } else {
                copy.add(s);
            }
        }
        if (!replaced) {
            copy.add(replacement);
        }
        return new LocalizedString(stringRef, copy);
    }

    public LocalizedString withStringRef(OptionalInt stringRef) {
        return new LocalizedString(stringRef, substrings);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocalizedString other)) {
            return false;
        }
        return stringRef.equals(other.stringRef) && substrings.equals(other.substrings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stringRef, substrings);
    }

    @Override
    public String toString() {
        var ref = stringRef.isPresent() ? Integer.toUnsignedString(stringRef.getAsInt()) : "none";
        return "LocalizedString[ref=" + ref + ", " + substrings + "]";
    }

    /**
     * One language/gender variant. {@code stringId} is kept whole so bits outside the language and gender bytes
     * survive a round trip.
     *
     * @param stringId packed id: language in bits 8-15, gender in bits 0-7
     * @param text     the variant text
     */
    public record Substring(int stringId, String text) {

        public Substring {
            Objects.requireNonNull(text, "text");
        }

        public static Substring of(int languageId, int genderId, String text) {
            if (languageId < 0 || languageId > 0xFF || genderId < 0 || genderId > 0xFF) {
                throw new IllegalArgumentException("language and gender ids are single bytes: " + languageId + "/" + genderId);
            }
            return new Substring((languageId << 8) | genderId, text);
        }

        public int languageId() {
            return (stringId >> 8) & 0xFF;
        }

        public int genderId() {
            return stringId & 0xFF;
        }
    }
}
