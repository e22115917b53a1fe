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

import com.hellblazer.delve.dungeon.spawn.Placement;
import com.hellblazer.delve.geometry.Footprint;
import com.hellblazer.delve.grid.entity.LongEntityID;

import java.util.List;

/**
 * Serializable state of a floor: grid size, placements in placement order, the player, the random source state and
 * the next id to hand out. Terrain is not part of the snapshot.
 *
 * @param player          null if the floor has no player
 * @param playerFootprint null if the floor has no player
 * @author hal.hildebrand
 */
public record FloorSnapshot(int width, int height, List<Placement> placements, LongEntityID player,
                            Footprint playerFootprint, long rngState, long nextId) {

    public FloorSnapshot {
        placements = placements == null ? List.of() : List.copyOf(placements);
        if ((player == null) != (playerFootprint == null)) {
            throw new IllegalArgumentException("Player and player footprint must both be present or both absent");
        }
    }
}
