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
 * A single Bernoulli trial decides whether one instance is attempted.
 *
 * @author hal.hildebrand
 */
public record ChanceRule(SpawnCategory category, EntityTemplate template, double probability) implements SpawnRule {

    public ChanceRule {
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(template, "Template cannot be null");
        if (probability < 0.0 || probability > 1.0 || Double.isNaN(probability)) {
            throw new IllegalArgumentException("Probability must be in [0, 1] for " + template + ": " + probability);
        }
    }

    @Override
    public String describe() {
        return template + " @" + probability;
    }
}
