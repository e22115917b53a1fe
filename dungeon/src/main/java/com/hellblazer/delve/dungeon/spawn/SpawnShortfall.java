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
 * A rule that placed fewer entities than it asked for because the candidate pool ran out. Expected and non-fatal.
 *
 * @param rule      the under-filled rule
 * @param requested target count after sampling
 * @param placed    entities actually placed
 * @author hal.hildebrand
 */
public record SpawnShortfall(SpawnRule rule, int requested, int placed) {

    public int missing() {
        return requested - placed;
    }
}
