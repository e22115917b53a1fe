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
package com.hellblazer.delve.combat;

import com.hellblazer.delve.common.IntRange;

/**
 * Pure damage and reward arithmetic.
 * <p>
 * Defense uses diminishing returns: {@code mitigation = defense / (defense + K)}. With K = 50, 50 defense halves damage
 * and 100 defense removes two thirds; mitigation approaches 1 but never reaches it. Negative defense counts as 0.
 *
 * @author hal.hildebrand
 */
public final class DamageFormula {

    private final CombatConfig config;

    public DamageFormula(CombatConfig config) {
        this.config = config;
    }

    public static DamageFormula standard() {
        return new DamageFormula(CombatConfig.defaults());
    }

    /**
     * Fraction of raw damage removed by the given defense, in [0, 1).
     */
    public double mitigation(int defense) {
        double def = Math.max(defense, 0);
        return def / (def + config.getDefenseConstant());
    }

    /**
     * Damage actually dealt: {@code round(raw * (1 - mitigation))}, never more than {@code raw}. Non-positive raw
     * damage deals nothing.
     */
    public int finalDamage(int rawDamage, int defense) {
        if (rawDamage <= 0) {
            return 0;
        }
        int damage = (int) Math.round(rawDamage * (1.0 - mitigation(defense)));
        if (damage == 0 && config.getMinimumDamage() == CombatConfig.MinimumDamage.ONE_IF_RAW_POSITIVE) {
            return 1;
        }
        return damage;
    }

    /**
     * {@code round(base * (1 + goldFind / 100))}; 100 gold find doubles the gold. Never negative.
     */
    public int applyGoldFind(int baseGold, int goldFind) {
        double multiplier = 1.0 + goldFind / 100.0;
        return (int) Math.max(0L, Math.round(baseGold * multiplier));
    }

    /**
     * Gold lost on defeat, rounded down.
     */
    public int defeatGoldPenalty(int gold) {
        if (gold <= 0) {
            return 0;
        }
        return (int) ((long) gold * config.getDefeatPenaltyPercent() / 100);
    }

    /**
     * Attack range around a flat attack value: {@code [max(1, a - v), a + v]} where {@code v = round(a * variance)}.
     * A non-positive attack cannot hurt anything and yields 0..=0.
     */
    public IntRange attackRange(int attack) {
        if (attack <= 0) {
            return IntRange.zero();
        }
        int variance = (int) Math.round(attack * config.getAttackVariance());
        return IntRange.of(Math.max(1, attack - variance), attack + variance);
    }

    public CombatConfig getConfig() {
        return config;
    }
}
