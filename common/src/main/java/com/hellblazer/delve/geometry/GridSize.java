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
 * Width and height of an entity footprint, in cells. Both dimensions are at least one.
 *
 * @param width  columns covered
 * @param height rows covered
 * @author hal.hildebrand
 */
public record GridSize(int width, int height) {

    private static final GridSize SINGLE = new GridSize(1, 1);

    public GridSize {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Grid size must be at least 1x1, got " + width + "x" + height);
        }
    }

    /**
     * The 1x1 footprint used by every entity in the current content set.
     */
    public static GridSize single() {
        return SINGLE;
    }

    /**
     * Number of cells covered.
     */
    public int area() {
        return width * height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
