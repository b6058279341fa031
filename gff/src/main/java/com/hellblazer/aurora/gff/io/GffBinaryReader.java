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
import com.hellblazer.aurora.gff.core.GffStruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Decodes GFF buffers and files into {@link Gff} documents.
 *
 * <p>Decoding never mutates the input and never returns a partial tree: any structural problem surfaces as a
 * {@link GffException}. For lazy access to individual structs use {@link #open(byte[])}.
 *
 * @author hal.hildebrand
 */
public class GffBinaryReader {
    private static final Logger log = LoggerFactory.getLogger(GffBinaryReader.class);

    private final GffCodecConfig config;

    public GffBinaryReader() {
        this(GffCodecConfig.defaultConfig());
    }

    public GffBinaryReader(GffCodecConfig config) {
        this.config = config;
        log.debug("GffBinaryReader created: {}", config);
    }

    public GffCodecConfig getConfig() {
        return config;
    }

    /**
     * Open a lazy view over {@code data}. Only the header is validated.
     */
    public GffTableView open(byte[] data) {
        return GffTableView.open(data, config);
    }

    /**
     * Decode the complete document held in {@code data}.
     */
    public Gff read(byte[] data) {
        return open(data).toGff();
    }

    /**
     * Decode only the root struct tree of {@code data}.
     */
    public GffStruct readRoot(byte[] data) {
        return open(data).resolveRoot();
    }

    /**
     * Decode a GFF file.
     *
     * @param inputFile the file to read
     * @throws IOException if the file cannot be read or is larger than 2 GiB
     */
    public Gff read(Path inputFile) throws IOException {
        byte[] data;
        try (var channel = FileChannel.open(inputFile, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size > Integer.MAX_VALUE) {
                throw new IOException("GFF file too large: " + inputFile + " (" + size + " bytes)");
            }
            var buffer = ByteBuffer.allocate((int) size);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    throw new IOException("Unexpected end of file reading " + inputFile);
                }
            }
            data = buffer.array();
        }

        var gff = read(data);
        log.info("Read GFF {} {} from {}: {} bytes, {} root fields", gff.fileType(), gff.fileVersion(), inputFile,
                 data.length, gff.root().size());
        return gff;
    }
}
