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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Array-backed {@link TerrainOracle}. Layouts are usually written as ASCII rows:
 *
 * <pre>
 * var layout = TileLayout.fromRows(
 *     "#####",
 *     "#S..#",
 *     "#.,.D",
 *     "#####");
 * </pre>
 * <p>
 * Symbols are listed on {@link TileType}. Rows shorter than the widest row are padded with {@link TileType#EMPTY}.
 *
 * @author hal.hildebrand
 */
public final class TileLayout implements TerrainOracle {
    private final int        width;
    private final int        height;
    private final TileType[] tiles;

    public TileLayout(int width, int height, TileType fill) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Layout must be at least 1x1, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.tiles = new TileType[width * height];
        Arrays.fill(tiles, fill);
    }

    /**
     * Every cell plain floor.
     */
    public static TileLayout open(int width, int height) {
        return new TileLayout(width, height, TileType.FLOOR);
    }

    /**
     * Parse ASCII rows, top row first.
     *
     * @throws IllegalArgumentException on an unknown symbol, no rows, or more than one spawn point
     */
    public static TileLayout fromRows(String... rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Layout needs at least one row");
        }
        int width = Arrays.stream(rows).mapToInt(String::length).max().orElse(0);
        if (width == 0) {
            throw new IllegalArgumentException("Layout rows are all empty");
        }
        var layout = new TileLayout(width, rows.length, TileType.EMPTY);
        boolean sawSpawnPoint = false;
        for (int y = 0; y < rows.length; y++) {
            var row = rows[y];
            for (int x = 0; x < row.length(); x++) {
                var type = TileType.fromSymbol(row.charAt(x));
                if (type == TileType.SPAWN_POINT) {
                    if (sawSpawnPoint) {
                        throw new IllegalArgumentException("Layout has more than one spawn point");
                    }
                    sawSpawnPoint = true;
                }
                layout.set(x, y, type);
            }
        }
        return layout;
    }

    public TileType get(int x, int y) {
        if (!inBounds(x, y)) {
            return TileType.EMPTY;
        }
        return tiles[y * width + x];
    }

    public void set(int x, int y, TileType type) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        tiles[y * width + x] = type;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public boolean isWalkable(int x, int y) {
        return get(x, y).isWalkable();
    }

    @Override
    public boolean canSpawnEntity(int x, int y) {
        return get(x, y).isSpawnable();
    }

    @Override
    public boolean isDoor(int x, int y) {
        return get(x, y) == TileType.DOOR;
    }

    @Override
    public List<GridPosition> doors() {
        var doors = new ArrayList<GridPosition>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (tiles[y * width + x] == TileType.DOOR) {
                    doors.add(new GridPosition(x, y));
                }
            }
        }
        return doors;
    }

    @Override
    public Optional<GridPosition> entrance() {
        for (int i = 0; i < tiles.length; i++) {
            if (tiles[i] == TileType.SPAWN_POINT) {
                return Optional.of(new GridPosition(i % width, i / width));
            }
        }
        return Optional.empty();
    }

    private boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Render back to ASCII rows, the inverse of {@link #fromRows}.
     */
    public List<String> toRows() {
        var rows = new ArrayList<String>(height);
        for (int y = 0; y < height; y++) {
            var row = new StringBuilder(width);
            for (int x = 0; x < width; x++) {
                row.append(tiles[y * width + x].symbol());
            }
            rows.add(row.toString());
        }
        return rows;
    }
}
