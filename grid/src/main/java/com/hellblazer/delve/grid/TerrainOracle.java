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
package com.hellblazer.delve.grid;

import com.hellblazer.delve.geometry.GridPosition;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a floor's terrain. Cells outside {@code [0, width) x [0, height)} must report not walkable and not
 * spawn eligible.
 *
 * @author hal.hildebrand
 */
public interface TerrainOracle {

    int width();

    int height();

    boolean isWalkable(int x, int y);

    /**
     * True if the spawn resolver may place an entity on this cell.
     */
    boolean canSpawnEntity(int x, int y);

    /**
     * True if the cell is a door. Doors are placed from terrain metadata, not from the free-cell pool.
     */
    default boolean isDoor(int x, int y) {
        return false;
    }

    /**
     * Door cells in row-major order.
     */
    default List<GridPosition> doors() {
        return List.of();
    }

    /**
     * Where the player enters the floor, if the terrain defines one.
     */
    default Optional<GridPosition> entrance() {
        return Optional.empty();
    }
}
