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

/**
 * Thrown when a footprint extends outside the grid bounds.
 *
 * @author hal.hildebrand
 */
public final class InvalidFootprintException extends OccupancyException {
    private final Footprint footprint;
    private final int gridWidth;
    private final int gridHeight;

    public InvalidFootprintException(Footprint footprint, int gridWidth, int gridHeight) {
        super(String.format("%s extends outside the %dx%d grid", footprint, gridWidth, gridHeight));
        this.footprint = footprint;
        this.gridWidth = gridWidth;
        this.gridHeight = gridHeight;
    }

    public Footprint getFootprint() {
        return footprint;
    }

    public int getGridWidth() {
        return gridWidth;
    }

    public int getGridHeight() {
        return gridHeight;
    }
}
