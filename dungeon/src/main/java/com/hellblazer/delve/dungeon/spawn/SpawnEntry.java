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

import java.util.Objects;

/**
 * One weighted choice of a {@link WeightedPoolRule}.
 *
 * @author hal.hildebrand
 */
public record SpawnEntry(EntityTemplate template, int weight) {

    public SpawnEntry {
        Objects.requireNonNull(template, "Template cannot be null");
        if (weight < 0) {
            throw new IllegalArgumentException("Weight must be non-negative for " + template + ": " + weight);
        }
    }
}
