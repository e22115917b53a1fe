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

import java.util.List;

/**
 * Immutable capture of a {@link GridOccupancy}: grid dimensions plus every placed entity and its footprint, in
 * placement order.
 *
 * @param width   grid width
 * @param height  grid height
 * @param entries placements
 * @param <E>     entity reference type
 * @author hal.hildebrand
 */
public record OccupancySnapshot<E>(int width, int height, List<Entry<E>> entries) {

    public OccupancySnapshot {
        entries = List.copyOf(entries);
    }

    /**
     * One placed entity.
     */
    public record Entry<E>(E entity, Footprint footprint) {
    }
}
