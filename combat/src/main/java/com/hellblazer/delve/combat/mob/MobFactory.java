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

import com.hellblazer.delve.combat.CombatantStats;
import com.hellblazer.delve.combat.DamageFormula;
import com.hellblazer.delve.common.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rolls concrete mobs from specs.
 * <p>
 * Rolls happen in a fixed order (max health, attack, defense, gold, xp) so a seeded generator always yields the same
 * mob. A health roll above the middle of its range is rewarded: gold and xp are multiplied by
 * {@code 1 + 0.5 * excess}, where {@code excess} is how far the roll sits between the median and the maximum, in
 * [0, 1].
 *
 * @author hal.hildebrand
 */
public class MobFactory {
    private static final Logger log = LoggerFactory.getLogger(MobFactory.class);

    private static final double HEALTH_BONUS_WEIGHT = 0.5;

    private final DamageFormula formula;

    public MobFactory(DamageFormula formula) {
        this.formula = formula;
    }

    /**
     * Multiplier applied to gold and xp for a given health roll.
     */
    static double healthBonusMultiplier(int rolledHealth, int minHealth, int maxHealth) {
        double median = (minHealth + maxHealth) / 2.0;
        if (rolledHealth <= median || maxHealth <= median) {
            return 1.0;
        }
        double excess = (rolledHealth - median) / (maxHealth - median);
        return 1.0 + excess * HEALTH_BONUS_WEIGHT;
    }

    public Mob instantiate(MobSpec spec, RandomSource rng) {
        int maxHealth = rng.nextInt(spec.maxHealth());
        int attack = rng.nextInt(spec.attack());
        int defense = rng.nextInt(spec.defense());
        int baseGold = rng.nextInt(spec.droppedGold());
        int baseXp = rng.nextInt(spec.droppedXp());

        double multiplier = healthBonusMultiplier(maxHealth, spec.maxHealth().min(), spec.maxHealth().max());
        int gold = (int) Math.round(baseGold * multiplier);
        int xp = (int) Math.round(baseXp * multiplier);

        var stats = new CombatantStats(spec.name(), maxHealth, formula.attackRange(attack), defense);
        var mob = new Mob(spec.id(), stats, gold, xp, spec.loot());
        log.debug("Instantiated {}", mob);
        return mob;
    }
}
