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
package com.hellblazer.delve.combat.loot;

import com.hellblazer.delve.common.IntRange;

import java.util.Objects;

/**
 * One independently rolled line of a loot table. The entry drops with probability {@code numerator / denominator}.
 *
 * @param item        dropped item kind
 * @param numerator   successful outcomes, in [0, denominator]
 * @param denominator total outcomes, positive
 * @param quantity    inclusive quantity range rolled on a drop
 * @author hal.hildebrand
 */
public record LootEntry(ItemId item, int numerator, int denominator, IntRange quantity) {

    public LootEntry {
        Objects.requireNonNull(item, "Item cannot be null");
        Objects.requireNonNull(quantity, "Quantity range cannot be null");
        if (denominator <= 0) {
            throw new IllegalArgumentException("Denominator must be positive for " + item + ": " + denominator);
        }
        if (numerator < 0 || numerator > denominator) {
            throw new IllegalArgumentException(
            "Numerator must be in [0, " + denominator + "] for " + item + ": " + numerator);
        }
    }

    public double dropChancePercent() {
        return (double) numerator / denominator * 100.0;
    }
}
