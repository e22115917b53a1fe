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

import com.hellblazer.delve.geometry.Footprint;
import com.hellblazer.delve.geometry.GridPosition;

import java.util.Objects;

/**
 * Place one entity at an exact position. Rejected, not fatal, if the footprint is out of bounds, unwalkable or taken.
 * Spawn eligibility is not checked.
 *
 * @author hal.hildebrand
 */
public record FixedPositionRule(SpawnCategory category, EntityTemplate template, GridPosition position)
implements SpawnRule {

    public FixedPositionRule {
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(template, "Template cannot be null");
        Objects.requireNonNull(position, "Position cannot be null");
    }

    public Footprint footprint() {
        return new Footprint(position, template.size());
    }

    @Override
    public String describe() {
        return template + " at " + position;
    }
}
