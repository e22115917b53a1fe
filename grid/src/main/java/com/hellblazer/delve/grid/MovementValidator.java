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

import com.hellblazer.delve.geometry.Footprint;
import com.hellblazer.delve.geometry.GridPosition;
import com.hellblazer.delve.geometry.GridSize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a footprint may sit at a position given terrain and current occupancy. The same rules define the
 * candidate cells the spawn resolver draws from, with the extra requirement that candidate cells be spawn eligible.
 *
 * @param <E> entity reference type of the occupancy
 * @author hal.hildebrand
 */
public class MovementValidator<E> {
    private final TerrainOracle    terrain;
    private final GridOccupancy<E> occupancy;

    public MovementValidator(TerrainOracle terrain, GridOccupancy<E> occupancy) {
        this.terrain = Objects.requireNonNull(terrain, "Terrain cannot be null");
        this.occupancy = Objects.requireNonNull(occupancy, "Occupancy cannot be null");
        if (terrain.width() != occupancy.getWidth() || terrain.height() != occupancy.getHeight()) {
            throw new IllegalArgumentException(
            String.format("Terrain %dx%d does not match occupancy %dx%d", terrain.width(), terrain.height(),
                          occupancy.getWidth(), occupancy.getHeight()));
        }
    }

    /**
     * Valid iff every covered cell is inside the grid, walkable, and not occupied by any entity other than the mover.
     *
     * @param mover entity whose own current cells are treated as free; null for a new placement
     */
    public boolean canOccupy(Footprint footprint, E mover) {
        if (!footprint.within(terrain.width(), terrain.height())) {
            return false;
        }
        for (var cell : footprint.cells()) {
            if (!terrain.isWalkable(cell.x(), cell.y())) {
                return false;
            }
        }
        return occupancy.isFree(footprint, mover);
    }

    public boolean canOccupy(GridPosition position, GridSize size, E mover) {
        return canOccupy(new Footprint(position, size), mover);
    }

    /**
     * Walkable, spawn eligible and unoccupied.
     */
    public boolean isCandidateCell(int x, int y) {
        return occupancy.inBounds(x, y) && terrain.isWalkable(x, y) && terrain.canSpawnEntity(x, y)
        && !occupancy.isOccupied(x, y);
    }

    /**
     * True if every cell of the footprint is a candidate cell.
     */
    public boolean isCandidate(Footprint footprint) {
        if (!footprint.within(terrain.width(), terrain.height())) {
            return false;
        }
        for (var cell : footprint.cells()) {
            if (!isCandidateCell(cell.x(), cell.y())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Origins, in row-major order, at which a footprint of the given size covers only candidate cells.
     */
    public List<GridPosition> candidateCells(GridSize size) {
        var origins = new ArrayList<GridPosition>();
        for (int y = 0; y + size.height() <= terrain.height(); y++) {
            for (int x = 0; x + size.width() <= terrain.width(); x++) {
                if (isCandidate(new Footprint(new GridPosition(x, y), size))) {
                    origins.add(new GridPosition(x, y));
                }
            }
        }
        return origins;
    }

    public TerrainOracle getTerrain() {
        return terrain;
    }

    public GridOccupancy<E> getOccupancy() {
        return occupancy;
    }
}
