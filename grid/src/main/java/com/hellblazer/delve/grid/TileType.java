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

/**
 * Terrain kind of a single cell.
 *
 * @author hal.hildebrand
 */
public enum TileType {
    EMPTY(' ', false, false),
    WALL('#', false, false),
    FLOOR('.', true, true),
    /** Walkable floor that never holds a spawned entity, e.g. corridors */
    PATH(',', true, false),
    /** Walkable; the door entity itself is placed here from terrain metadata */
    DOOR('D', true, false),
    /** Player entrance; walkable but kept clear of spawns */
    SPAWN_POINT('S', true, false);

    private final char    symbol;
    private final boolean walkable;
    private final boolean spawnable;

    TileType(char symbol, boolean walkable, boolean spawnable) {
        this.symbol = symbol;
        this.walkable = walkable;
        this.spawnable = spawnable;
    }

    public static TileType fromSymbol(char symbol) {
        for (var type : values()) {
            if (type.symbol == symbol) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown tile symbol: '" + symbol + "'");
    }

    public char symbol() {
        return symbol;
    }

    public boolean isWalkable() {
        return walkable;
    }

    public boolean isSpawnable() {
        return spawnable;
    }
}
