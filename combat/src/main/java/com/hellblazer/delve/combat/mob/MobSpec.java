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
package com.hellblazer.delve.combat.mob;

import com.hellblazer.delve.combat.loot.LootTable;
import com.hellblazer.delve.common.IntRange;
import com.hellblazer.delve.geometry.GridSize;

import java.util.Objects;

/**
 * Static description of a mob kind. Stats are ranges; {@link MobFactory} rolls a concrete mob from them.
 *
 * @param id           mob kind
 * @param name         display name
 * @param quality      normal or boss
 * @param maxHealth    max health roll range
 * @param attack       flat attack roll range
 * @param defense      defense roll range
 * @param droppedGold  base gold roll range
 * @param droppedXp    base xp roll range
 * @param loot         drops on death, empty if absent
 * @param size         grid footprint, 1x1 if absent
 * @author hal.hildebrand
 */
public record MobSpec(MobId id, String name, MobQuality quality, IntRange maxHealth, IntRange attack,
                      IntRange defense, IntRange droppedGold, IntRange droppedXp, LootTable loot, GridSize size) {

    public MobSpec {
        Objects.requireNonNull(id, "Mob id cannot be null");
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(maxHealth, "Max health range cannot be null");
        Objects.requireNonNull(attack, "Attack range cannot be null");
        Objects.requireNonNull(defense, "Defense range cannot be null");
        Objects.requireNonNull(droppedGold, "Gold range cannot be null");
        Objects.requireNonNull(droppedXp, "Xp range cannot be null");
        if (maxHealth.min() < 1) {
            throw new IllegalArgumentException(id + " max health must be at least 1: " + maxHealth);
        }
        quality = quality == null ? MobQuality.NORMAL : quality;
        loot = loot == null ? LootTable.empty() : loot;
        size = size == null ? GridSize.single() : size;
    }

    /**
     * Every stat range scaled, rounding to the nearest integer. Used for deeper floors.
     */
    public MobSpec withMultiplier(double multiplier) {
        var health = maxHealth.scale(multiplier);
        if (health.min() < 1) {
            health = IntRange.of(1, Math.max(1, health.max()));
        }
        return new MobSpec(id, name, quality, health, attack.scale(multiplier), defense.scale(multiplier),
                           droppedGold.scale(multiplier), droppedXp.scale(multiplier), loot, size);
    }

    public MobSpec withName(String newName) {
        return new MobSpec(id, newName, quality, maxHealth, attack, defense, droppedGold, droppedXp, loot, size);
    }

    public MobSpec withQuality(MobQuality newQuality) {
        return new MobSpec(id, name, newQuality, maxHealth, attack, defense, droppedGold, droppedXp, loot, size);
    }
}
