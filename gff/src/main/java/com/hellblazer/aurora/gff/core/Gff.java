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

import java.util.Objects;
import java.util.Optional;

/**
 * A decoded GFF document: the two header tags plus the root struct.
 *
 * <p>Everything else in a GFF file (tables, offsets, label indices) is write-time bookkeeping and does not survive
 * into this model.
 *
 * @param fileType    4-character file type tag, e.g. {@code "UTT "}
 * @param fileVersion 4-character version tag, e.g. {@code "V3.2"}
 * @param root        root struct, always written at struct index 0
 * @author hal.hildebrand
 */
public record Gff(String fileType, String fileVersion, GffStruct root) {

    public static final String DEFAULT_VERSION = "V3.2";

    public Gff {
        Objects.requireNonNull(fileType, "fileType");
        Objects.requireNonNull(fileVersion, "fileVersion");
        Objects.requireNonNull(root, "root");
    }

    /**
     * An empty document of the given content type at the default version.
     */
    public static Gff of(GffContent content) {
        return new Gff(content.fourCC(), DEFAULT_VERSION, new GffStruct(GffStruct.ROOT_STRUCT_ID));
    }

    public Optional<GffContent> content() {
        return GffContent.fromFourCC(fileType);
    }
}
