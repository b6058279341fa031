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
 * Known resource types built on the GFF container, keyed by the 4-byte file type tag.
 *
 * <p>The codec never requires a file to use one of these tags; any printable tag is a valid container. This table
 * only lets callers recognize what they decoded.
 *
 * @author hal.hildebrand
 */
public enum GffContent {
    GFF("GFF "),
    ARE("ARE "),
    BIC("BIC "),
    DLG("DLG "),
    FAC("FAC "),
    GIT("GIT "),
    GUI("GUI "),
    IFO("IFO "),
    ITP("ITP "),
    JRL("JRL "),
    NFO("NFO "),
    PTH("PTH "),
    UTC("UTC "),
    UTD("UTD "),
    UTE("UTE "),
    UTI("UTI "),
    UTM("UTM "),
    UTP("UTP "),
    UTS("UTS "),
    UTT("UTT "),
    UTW("UTW ");

    private final String fourCC;

    GffContent(String fourCC) {
        this.fourCC = fourCC;
    }

    public static Optional<GffContent> fromFourCC(String tag) {
        for (var content : values()) {
            if (content.fourCC.equals(tag)) {
                return Optional.of(content);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the 4-character, space-padded file type tag
     */
    public String fourCC() {
        return fourCC;
    }
}
