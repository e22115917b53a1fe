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
package com.hellblazer.delve.combat.mob;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Immutable map from mob id to spec, populated once from content JSON.
 *
 * @author hal.hildebrand
 */
public final class MobRegistry {
    private static final Logger log           = LoggerFactory.getLogger(MobRegistry.class);
    private static final String MOBS_RESOURCE = "/mobs.json";

    private final Map<MobId, MobSpec> specs;

    public MobRegistry(Collection<MobSpec> specs) {
        var map = new EnumMap<MobId, MobSpec>(MobId.class);
        for (var spec : specs) {
            if (map.put(spec.id(), spec) != null) {
                throw new IllegalArgumentException("Duplicate mob spec: " + spec.id());
            }
        }
        this.specs = Collections.unmodifiableMap(map);
    }

    /**
     * Load the bundled {@code mobs.json}.
     */
    public static MobRegistry load() {
        try (var in = MobRegistry.class.getResourceAsStream(MOBS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Mob resource not found: " + MOBS_RESOURCE);
            }
            var registry = fromJson(in);
            log.info("Loaded {} mob specs", registry.size());
            return registry;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + MOBS_RESOURCE, e);
        }
    }

    /**
     * Parse a JSON array of mob specs.
     *
     * @throws IllegalArgumentException on malformed content, including unknown mob ids
     */
    public static MobRegistry fromJson(InputStream in) {
        try {
            List<MobSpec> specs = new ObjectMapper().readValue(in, new TypeReference<>() {
            });
            return new MobRegistry(specs);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed mob content: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @throws IllegalArgumentException if the registry has no spec for the id
     */
    public MobSpec spec(MobId id) {
        var spec = specs.get(id);
        if (spec == null) {
            throw new IllegalArgumentException("No spec registered for " + id);
        }
        return spec;
    }

    public Optional<MobSpec> find(MobId id) {
        return Optional.ofNullable(specs.get(id));
    }

    public Set<MobId> ids() {
        return specs.keySet();
    }

    public int size() {
        return specs.size();
    }
}
