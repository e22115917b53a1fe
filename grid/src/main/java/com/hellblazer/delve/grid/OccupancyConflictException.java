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

/**
 * Thrown when an occupy or move targets a cell that already belongs to another entity. No cell is modified when this
 * is thrown.
 *
 * @author hal.hildebrand
 */
public final class OccupancyConflictException extends OccupancyException {
    private final Footprint requested;
    private final GridPosition cell;
    private final transient Object occupant;

    public OccupancyConflictException(Footprint requested, GridPosition cell, Object occupant) {
        super(String.format("Cell %s of %s is already occupied by %s", cell, requested, occupant));
        this.requested = requested;
        this.cell = cell;
        this.occupant = occupant;
    }

    public Footprint getRequested() {
        return requested;
    }

    /**
     * The first covered cell found occupied.
     */
    public GridPosition getCell() {
        return cell;
    }

    public Object getOccupant() {
        return occupant;
    }
}
