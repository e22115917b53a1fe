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

/**
 * Immutable 2D cell coordinate on a dungeon grid. The origin is the top-left cell; x grows to the east and y grows to
 * the south.
 *
 * @param x column
 * @param y row
 * @author hal.hildebrand
 */
public record GridPosition(int x, int y) {

    /**
     * Create a position at the origin (0, 0).
     *
     * @return Position at origin
     */
    public static GridPosition origin() {
        return new GridPosition(0, 0);
    }

    /**
     * Translate this position by the given deltas.
     *
     * @param dx column delta
     * @param dy row delta
     * @return New translated position
     */
    public GridPosition translate(int dx, int dy) {
        return new GridPosition(x + dx, y + dy);
    }

    /**
     * The neighbouring position one step in the given direction.
     *
     * @param direction Step direction
     * @return Neighbouring position
     */
    public GridPosition offset(Direction direction) {
        return translate(direction.dx(), direction.dy());
    }

    /**
     * Calculate Manhattan distance to another position.
     *
     * @param other Other position
     * @return Manhattan distance (|dx| + |dy|)
     */
    public int manhattanDistance(GridPosition other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    /**
     * Check if this position lies inside a grid of the given dimensions.
     *
     * @param width  Grid width (exclusive bound)
     * @param height Grid height (exclusive bound)
     * @return True if 0 <= x < width and 0 <= y < height
     */
    public boolean isWithinBounds(int width, int height) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    @Override
    public String toString() {
        return String.format("(%d, %d)", x, y);
    }
}
