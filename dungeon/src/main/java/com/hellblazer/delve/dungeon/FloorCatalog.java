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
package com.hellblazer.delve.dungeon;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.delve.combat.mob.MobId;
import com.hellblazer.delve.combat.mob.MobRegistry;
import com.hellblazer.delve.dungeon.spawn.SpawnTable;
import com.hellblazer.delve.geometry.GridSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Named floor types and the spawn tables they produce, read once from {@code floors.json}.
 *
 * @author hal.hildebrand
 */
public final class FloorCatalog {
    private static final Logger log             = LoggerFactory.getLogger(FloorCatalog.class);
    private static final String FLOORS_RESOURCE = "/floors.json";

    private final Map<String, FloorDefinition> floors;
    private final FloorConfig                  config;
    private final Function<MobId, GridSize>    mobSizes;

    public FloorCatalog(Map<String, FloorDefinition> floors, FloorConfig config, Function<MobId, GridSize> mobSizes) {
        this.floors = Collections.unmodifiableMap(new LinkedHashMap<>(floors));
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.mobSizes = Objects.requireNonNull(mobSizes, "Mob sizes cannot be null");
    }

    /**
     * Bundled floors with default options and every mob 1x1.
     */
    public static FloorCatalog load() {
        return load(FloorConfig.defaults(), id -> GridSize.single());
    }

    /**
     * Bundled floors with mob footprints taken from the registry.
     */
    public static FloorCatalog load(FloorConfig config, MobRegistry registry) {
        return load(config, id -> registry.spec(id).size());
    }

    private static FloorCatalog load(FloorConfig config, Function<MobId, GridSize> mobSizes) {
        try (var in = FloorCatalog.class.getResourceAsStream(FLOORS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Floor resource not found: " + FLOORS_RESOURCE);
            }
            var catalog = new FloorCatalog(parse(in), config, mobSizes);
            log.info("Loaded {} floor types", catalog.names().size());
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + FLOORS_RESOURCE, e);
        }
    }

    /**
     * Parse a JSON object of floor name to definition.
     *
     * @throws IllegalArgumentException on malformed content, including unknown mob ids
     */
    public static Map<String, FloorDefinition> parse(InputStream in) {
        try {
            return new ObjectMapper().readValue(in, new TypeReference<LinkedHashMap<String, FloorDefinition>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed floor content: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Spawn table for a floor type. The final floor of a dungeon gets no stairs.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public SpawnTable spawnTable(String name, boolean isFinal) {
        var definition = floors.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown floor type: " + name);
        }
        return definition.toSpawnTable(config, mobSizes, isFinal);
    }

    public Optional<FloorDefinition> definition(String name) {
        return Optional.ofNullable(floors.get(name));
    }

    public Set<String> names() {
        return floors.keySet();
    }
}
