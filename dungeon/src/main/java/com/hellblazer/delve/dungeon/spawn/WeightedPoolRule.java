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

import com.hellblazer.delve.common.IntRange;
import com.hellblazer.delve.common.RandomSource;

import java.util.List;
import java.util.Objects;

/**
 * Sample a slot count uniformly from {@code count}, then fill each slot with an entry chosen with probability
 * proportional to its weight. A single-entry pool is a plain count-ranged rule.
 *
 * @author hal.hildebrand
 */
public record WeightedPoolRule(SpawnCategory category, List<SpawnEntry> entries, IntRange count)
implements SpawnRule {

    public WeightedPoolRule {
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(count, "Count range cannot be null");
        entries = List.copyOf(entries);
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("Weighted pool needs at least one entry");
        }
        long total = 0;
        for (var entry : entries) {
            total += entry.weight();
        }
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Total pool weight exceeds " + Integer.MAX_VALUE + ": " + total);
        }
    }

    public static WeightedPoolRule single(SpawnCategory category, EntityTemplate template, IntRange count) {
        return new WeightedPoolRule(category, List.of(new SpawnEntry(template, 1)), count);
    }

    public int totalWeight() {
        return entries.stream().mapToInt(SpawnEntry::weight).sum();
    }

    /**
     * Cumulative walk: roll in [0, total) and take the first entry whose running weight exceeds the roll. Zero-weight
     * entries are never chosen.
     *
     * @throws IllegalStateException if every weight is zero
     */
    public SpawnEntry select(RandomSource rng) {
        int total = totalWeight();
        if (total <= 0) {
            throw new IllegalStateException("Pool has no weight: " + describe());
        }
        int roll = rng.nextInt(total);
        int cumulative = 0;
        for (var entry : entries) {
            cumulative += entry.weight();
            if (roll < cumulative) {
                return entry;
            }
        }
        throw new IllegalStateException("Roll " + roll + " outside total weight " + total);
    }

    @Override
    public String describe() {
        if (entries.size() == 1) {
            return entries.get(0).template() + " x" + count;
        }
        var sb = new StringBuilder("pool[");
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(entries.get(i).template()).append(':').append(entries.get(i).weight());
        }
        return sb.append("] x").append(count).toString();
    }
}
