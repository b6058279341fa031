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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decode policy for the GFF codec.
 *
 * <p>Use one of the presets, a {@link Builder}, or a JSON document:
 * <pre>
 * {
 *   "unknownFieldTypePolicy": "PRESERVE_OPAQUE",
 *   "acceptedVersions": ["V3.2", "V3.3"]
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class GffCodecConfig {
    private static final Logger       log              = LoggerFactory.getLogger(GffCodecConfig.class);
    private static final ObjectMapper objectMapper     = new ObjectMapper();
    private static final String       CONFIG_RESOURCE  = "/gff-codec.json";

    /**
     * What to do with a field whose type tag is outside 0-17.
     */
    public enum UnknownFieldTypePolicy {
        /** Raise {@link GffException.UnknownFieldTypeException}. */
        FAIL,
        /** Keep the raw tag and data slot as an opaque value and write them back unchanged. */
        PRESERVE_OPAQUE
    }

    private final UnknownFieldTypePolicy unknownFieldTypePolicy;
    private final Set<String>            acceptedVersions;

    private GffCodecConfig(Builder builder) {
        this.unknownFieldTypePolicy = builder.unknownFieldTypePolicy;
        this.acceptedVersions = Set.copyOf(builder.acceptedVersions);
    }

    /**
     * Fail on unknown field types, accept any printable version tag.
     */
    public static GffCodecConfig defaultConfig() {
        return new Builder().build();
    }

    /**
     * Preserve unknown field types, accept any printable version tag.
     */
    public static GffCodecConfig lenientConfig() {
        return new Builder().withUnknownFieldTypePolicy(UnknownFieldTypePolicy.PRESERVE_OPAQUE).build();
    }

    /**
     * Fail on unknown field types and on any version outside {@link GffFileFormat#KNOWN_VERSIONS}.
     */
    public static GffCodecConfig strictConfig() {
        return new Builder().withAcceptedVersions(GffFileFormat.KNOWN_VERSIONS).build();
    }

    /**
     * Parse a configuration document. Absent properties keep their defaults.
     *
     * @throws IOException if the document is not valid JSON or names an unknown policy or a bad version tag
     */
    public static GffCodecConfig fromJson(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        if (root == null || !root.isObject()) {
            throw new IOException("GFF codec configuration must be a JSON object");
        }

        var builder = new Builder();
        try {
            if (root.has("unknownFieldTypePolicy")) {
                builder.withUnknownFieldTypePolicy(
                UnknownFieldTypePolicy.valueOf(root.get("unknownFieldTypePolicy").asText().toUpperCase()));
            }
            var versions = root.get("acceptedVersions");
            if (versions != null && versions.isArray()) {
                var accepted = new LinkedHashSet<String>();
                for (var node : versions) {
                    accepted.add(node.asText());
                }
                builder.withAcceptedVersions(accepted);
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid GFF codec configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Load {@value #CONFIG_RESOURCE} from the classpath, falling back to {@link #defaultConfig()} if it is
     * missing or unreadable.
     */
    public static GffCodecConfig load() {
        try (var is = GffCodecConfig.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                log.debug("Codec configuration not found: {}", CONFIG_RESOURCE);
                return defaultConfig();
            }
            var config = fromJson(is);
            log.debug("Loaded codec configuration: {}", config);
            return config;
        } catch (IOException e) {
            log.warn("Failed to load codec configuration {}: {}", CONFIG_RESOURCE, e.getMessage());
            return defaultConfig();
        }
    }

    public UnknownFieldTypePolicy getUnknownFieldTypePolicy() {
        return unknownFieldTypePolicy;
    }

    /**
     * @return accepted version tags; empty means any printable tag
     */
    public Set<String> getAcceptedVersions() {
        return acceptedVersions;
    }

    public boolean acceptsVersion(String version) {
        return acceptedVersions.isEmpty() || acceptedVersions.contains(version);
    }

    @Override
    public String toString() {
        return String.format("GffCodecConfig[unknownFieldTypes=%s, versions=%s]", unknownFieldTypePolicy,
                             acceptedVersions.isEmpty() ? "any" : acceptedVersions);
    }

    public static class Builder {
        private UnknownFieldTypePolicy unknownFieldTypePolicy = UnknownFieldTypePolicy.FAIL;
        private Set<String>            acceptedVersions       = Set.of();

        public Builder withUnknownFieldTypePolicy(UnknownFieldTypePolicy policy) {
            this.unknownFieldTypePolicy = policy;
            return this;
        }

        public Builder withAcceptedVersions(Collection<String> versions) {
            this.acceptedVersions = new LinkedHashSet<>(versions);
            return this;
        }

        public Builder withAcceptedVersions(String... versions) {
            return withAcceptedVersions(Arrays.asList(versions));
        }

        public GffCodecConfig build() {
            if (unknownFieldTypePolicy == null) {
                throw new IllegalArgumentException("Unknown field type policy is required");
            }
            for (var version : acceptedVersions) {
                if (!GffFileFormat.isValidTag(version)) {
                    throw new IllegalArgumentException("Version tag must be 4 printable ASCII characters: '" + version + "'");
                }
            }
            return new GffCodecConfig(this);
        }
    }
}
