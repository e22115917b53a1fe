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
package com.hellblazer.delve.geometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The set of cells an entity covers: an origin (top-left cell) plus a size. A WxH footprint covers exactly W*H cells,
 * [origin.x, origin.x + W) x [origin.y, origin.y + H).
 *
 * @param origin top-left cell
 * @param size   cells covered in each dimension
 * @author hal.hildebrand
 */
public record Footprint(GridPosition origin, GridSize size) {

    public Footprint {
        Objects.requireNonNull(origin, "Origin cannot be null");
        Objects.requireNonNull(size, "Size cannot be null");
    }

    public static Footprint of(int x, int y, int width, int height) {
        return new Footprint(new GridPosition(x, y), new GridSize(width, height));
    }

    public static Footprint single(GridPosition origin) {
        return new Footprint(origin, GridSize.single());
    }

    public int minX() {
        return origin.x();
    }

    public int minY() {
        return origin.y();
    }

    /** Exclusive */
    public int maxX() {
        return origin.x() + size.width();
    }

    /** Exclusive */
    public int maxY() {
        return origin.y() + size.height();
    }

    /**
     * All covered cells in row-major order.
     */
    public List<GridPosition> cells() {
        var cells = new ArrayList<GridPosition>(size.area());
        for (int y = minY(); y < maxY(); y++) {
            for (int x = minX(); x < maxX(); x++) {
                cells.add(new GridPosition(x, y));
            }
        }
        return cells;
    }

    public boolean contains(int x, int y) {
        return x >= minX() && x < maxX() && y >= minY() && y < maxY();
    }

    public boolean contains(GridPosition position) {
        return contains(position.x(), position.y());
    }

    /**
     * Axis-aligned rectangle intersection; footprints that merely touch along an edge do not overlap.
     */
    public boolean overlaps(Footprint other) {
        return minX() < other.maxX() && maxX() > other.minX() && minY() < other.maxY() && maxY() > other.minY();
    }

    /**
     * Check that every covered cell lies inside a grid of the given dimensions.
     */
    public boolean within(int width, int height) {
        return minX() >= 0 && minY() >= 0 && maxX() <= width && maxY() <= height;
    }

    /**
     * Cells orthogonally adjacent to this footprint and outside it: the row above, the column to the east, the row
     * below and the column to the west, in that order. Corner cells are not included and nothing is clipped to grid
     * bounds.
     */
    public List<GridPosition> perimeterNeighbors() {
        var neighbors = new ArrayList<GridPosition>(2 * (size.width() + size.height()));
        for (int x = minX(); x < maxX(); x++) {
            neighbors.add(new GridPosition(x, minY() - 1));
        }
        for (int y = minY(); y < maxY(); y++) {
            neighbors.add(new GridPosition(maxX(), y));
        }
        for (int x = minX(); x < maxX(); x++) {
            neighbors.add(new GridPosition(x, maxY()));
        }
        for (int y = minY(); y < maxY(); y++) {
            neighbors.add(new GridPosition(minX() - 1, y));
        }
        return neighbors;
    }

    /**
     * Same size, new origin.
     */
    public Footprint moveTo(GridPosition newOrigin) {
        return new Footprint(newOrigin, size);
    }

    /**
     * Same size, origin shifted one step in the given direction.
     */
    public Footprint step(Direction direction) {
        return moveTo(origin.offset(direction));
    }

    @Override
    public String toString() {
        return "Footprint[" + origin + " " + size + "]";
    }
}
