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

import com.hellblazer.aurora.gff.core.Gff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Encodes {@link Gff} documents into canonical GFF buffers and files.
 *
 * <p>Sections are written in the order header, structs, fields, labels, field data, field indices, list indices.
 * Struct slots are assigned depth-first, pre-order, with the root in slot 0; labels are numbered in the order they
 * are first met on that walk. The same document always encodes to the same bytes.
 *
 * @author hal.hildebrand
 */
public class GffBinaryWriter {
    private static final Logger log = LoggerFactory.getLogger(GffBinaryWriter.class);

    /**
     * Encode {@code gff}.
     *
     * @throws GffException.EncodingException              if a tag, label, resref or text cannot be represented
     * @throws GffException.CyclicStructReferenceException if a struct contains itself
     */
    public byte[] write(Gff gff) {
        return new GffEncoder().encode(gff);
    }

    /**
     * Encode {@code gff} into {@code outputFile}, replacing any existing content.
     */
    public void write(Gff gff, Path outputFile) throws IOException {
        var bytes = write(gff);
        try (var channel = FileChannel.open(outputFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                                            StandardOpenOption.TRUNCATE_EXISTING)) {
            var buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }
        log.info("Wrote GFF {} {} to {}: {} bytes", gff.fileType(), gff.fileVersion(), outputFile, bytes.length);
    }
}
