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

/**
 * Per-floor generation options. Setters validate and return {@code this}.
 *
 * @author hal.hildebrand
 */
public class FloorConfig {
    private boolean placePlayer        = true;
    private boolean spawnDoors         = true;
    private int     chestVariants      = 4;
    private int     rockSpriteVariants = 2;

    public static FloorConfig defaults() {
        return new FloorConfig();
    }

    /**
     * Spawning only: no player, no doors. Useful for previewing a spawn table.
     */
    public static FloorConfig spawnOnly() {
        return new FloorConfig().withPlacePlayer(false).withSpawnDoors(false);
    }

    /**
     * Whether the player is put on the terrain entrance before anything spawns.
     */
    public boolean isPlacePlayer() {
        return placePlayer;
    }

    /**
     * Whether door tiles receive door entities.
     */
    public boolean isSpawnDoors() {
        return spawnDoors;
    }

    public int getChestVariants() {
        return chestVariants;
    }

    public int getRockSpriteVariants() {
        return rockSpriteVariants;
    }

    public FloorConfig withPlacePlayer(boolean place) {
        this.placePlayer = place;
        return this;
    }

    public FloorConfig withSpawnDoors(boolean spawn) {
        this.spawnDoors = spawn;
        return this;
    }

    public FloorConfig withChestVariants(int variants) {
        if (variants <= 0) {
            throw new IllegalArgumentException("Chest variants must be positive");
        }
        this.chestVariants = variants;
        return this;
    }

    public FloorConfig withRockSpriteVariants(int variants) {
        if (variants <= 0) {
            throw new IllegalArgumentException("Rock sprite variants must be positive");
        }
        this.rockSpriteVariants = variants;
        return this;
    }
}
