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
package com.hellblazer.delve.dungeon.spawn;

/**
 * Resolution order of spawn rules. Earlier categories claim cells first, so a later category can never take a cell
 * an earlier one placed on.
 *
 * @author hal.hildebrand
 */
public enum SpawnCategory {
    /** Derived from terrain door tiles, not from the free-cell pool */
    DOOR,
    /** Chests, stairs, rocks, crafting stations, fixed-position placements */
    OBSTACLE,
    NPC,
    GUARANTEED_MOB,
    WEIGHTED_MOB
}
