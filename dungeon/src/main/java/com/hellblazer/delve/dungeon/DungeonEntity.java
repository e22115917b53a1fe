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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.hellblazer.delve.combat.mob.MobId;
import com.hellblazer.delve.geometry.GridSize;

import java.util.Objects;

/**
 * Everything that can be placed on a floor other than the player. Each variant carries only its kind-specific data;
 * callers dispatch with {@code instanceof} patterns.
 *
 * @author hal.hildebrand
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({ @JsonSubTypes.Type(value = DungeonEntity.Door.class, name = "door"),
                @JsonSubTypes.Type(value = DungeonEntity.Chest.class, name = "chest"),
                @JsonSubTypes.Type(value = DungeonEntity.Stairs.class, name = "stairs"),
                @JsonSubTypes.Type(value = DungeonEntity.Rock.class, name = "rock"),
                @JsonSubTypes.Type(value = DungeonEntity.CraftingStation.class, name = "station"),
                @JsonSubTypes.Type(value = DungeonEntity.Npc.class, name = "npc"),
                @JsonSubTypes.Type(value = DungeonEntity.Mob.class, name = "mob") })
public sealed interface DungeonEntity {

    /**
     * Cells covered, 1x1 unless the variant says otherwise.
     */
    default GridSize footprintSize() {
        return GridSize.single();
    }

    /**
     * True if stepping into the entity starts a fight.
     */
    @JsonIgnore
    default boolean isHostile() {
        return false;
    }

    /**
     * Placed on door tiles straight from terrain metadata.
     */
    record Door() implements DungeonEntity {
    }

    record Chest(int variant) implements DungeonEntity {
        public Chest {
            if (variant < 0) {
                throw new IllegalArgumentException("Chest variant must be non-negative: " + variant);
            }
        }
    }

    /**
     * Leads to the next floor.
     */
    record Stairs() implements DungeonEntity {
    }

    record Rock(RockType type, int spriteVariant) implements DungeonEntity {
        public Rock {
            Objects.requireNonNull(type, "Rock type cannot be null");
        }
    }

    record CraftingStation(StationType type) implements DungeonEntity {
        public CraftingStation {
            Objects.requireNonNull(type, "Station type cannot be null");
        }
    }

    /**
     * Non-combat character; blocks movement and can be talked to.
     */
    record Npc(MobId mobId, GridSize size) implements DungeonEntity {
        public Npc {
            Objects.requireNonNull(mobId, "Mob id cannot be null");
            size = size == null ? GridSize.single() : size;
        }

        @Override
        public GridSize footprintSize() {
            return size;
        }
    }

    record Mob(MobId mobId, GridSize size) implements DungeonEntity {
        public Mob {
            Objects.requireNonNull(mobId, "Mob id cannot be null");
            size = size == null ? GridSize.single() : size;
        }

        @Override
        public GridSize footprintSize() {
            return size;
        }

        @JsonIgnore
        @Override
        public boolean isHostile() {
            return true;
        }
    }
}
