/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Delve.
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
package com.hellblazer.delve.dungeon.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON form of {@link FloorSnapshot}. Entities are tagged with a {@code kind} property; ids are plain numbers.
 *
 * @author hal.hildebrand
 */
public class FloorSnapshotCodec {
    private static final Logger log = LoggerFactory.getLogger(FloorSnapshotCodec.class);

    private final ObjectMapper mapper;

    public FloorSnapshotCodec() {
        this(new ObjectMapper());
    }

    public FloorSnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public String write(FloorSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize floor snapshot", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid snapshot
     */
    public FloorSnapshot read(String json) {
        try {
            return mapper.readValue(json, FloorSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed floor snapshot: " + e.getOriginalMessage(), e);
        }
    }

    public void write(FloorSnapshot snapshot, Path file) {
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), snapshot);
            log.debug("Wrote floor snapshot to {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write floor snapshot to " + file, e);
        }
    }

    public FloorSnapshot read(Path file) {
        try {
            return read(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read floor snapshot from " + file, e);
        }
    }
}
