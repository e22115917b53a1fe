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

/**
 * Tunable constants for combat resolution.
 * <p>
 * Setters validate and return {@code this}, so configurations read as a chain:
 * <pre>
 * var config = new CombatConfig().withDefenseConstant(75).withMinimumDamage(MinimumDamage.ONE_IF_RAW_POSITIVE);
 * </pre>
 *
 * @author hal.hildebrand
 */
public class CombatConfig {

    /**
     * What happens when mitigation rounds a positive raw hit down to zero.
     */
    public enum MinimumDamage {
        /** A fully mitigated hit deals 0 */
        NONE,
        /** Any positive raw hit deals at least 1 */
        ONE_IF_RAW_POSITIVE
    }

    private double        defenseConstant      = 50.0;
    private int           defeatPenaltyPercent = 5;
    private MinimumDamage minimumDamage        = MinimumDamage.NONE;
    private double        attackVariance       = 0.25;

    /**
     * The standard rules: K = 50, 5% defeat penalty, no damage floor, 25% attack variance.
     */
    public static CombatConfig defaults() {
        return new CombatConfig();
    }

    /**
     * Standard rules with the one-damage floor switched on.
     */
    public static CombatConfig withDamageFloor() {
        return new CombatConfig().withMinimumDamage(MinimumDamage.ONE_IF_RAW_POSITIVE);
    }

    /**
     * Defense at which mitigation reaches exactly 50%. Larger values make defense less effective.
     */
    public double getDefenseConstant() {
        return defenseConstant;
    }

    /**
     * Percentage of carried gold lost when the player is defeated.
     */
    public int getDefeatPenaltyPercent() {
        return defeatPenaltyPercent;
    }

    public MinimumDamage getMinimumDamage() {
        return minimumDamage;
    }

    /**
     * Fraction of a flat attack value added and subtracted to form an attack range.
     */
    public double getAttackVariance() {
        return attackVariance;
    }

    public CombatConfig withDefenseConstant(double constant) {
        if (!(constant > 0.0) || Double.isInfinite(constant)) {
            throw new IllegalArgumentException("Defense constant must be positive and finite: " + constant);
        }
        this.defenseConstant = constant;
        return this;
    }

    public CombatConfig withDefeatPenaltyPercent(int percent) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("Defeat penalty must be in [0, 100]: " + percent);
        }
        this.defeatPenaltyPercent = percent;
        return this;
    }

    public CombatConfig withMinimumDamage(MinimumDamage policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Minimum damage policy cannot be null");
        }
        this.minimumDamage = policy;
        return this;
    }

    public CombatConfig withAttackVariance(double variance) {
        if (variance < 0.0 || variance >= 1.0 || Double.isNaN(variance)) {
            throw new IllegalArgumentException("Attack variance must be in [0, 1): " + variance);
        }
        this.attackVariance = variance;
        return this;
    }

    @Override
    public String toString() {
        return String.format("CombatConfig[K=%.1f, defeatPenalty=%d%%, minimumDamage=%s, variance=%.2f]",
                             defenseConstant, defeatPenaltyPercent, minimumDamage, attackVariance);
    }
}
