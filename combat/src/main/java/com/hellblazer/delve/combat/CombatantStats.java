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

import java.util.Objects;

/**
 * Combat-relevant numbers for the player or a mob. Health is the only field that changes during a fight.
 *
 * @author hal.hildebrand
 */
public class CombatantStats {
    private final String   name;
    private final int      maxHealth;
    private final IntRange attack;
    private final int      defense;
    private       int      health;
    private       int      goldFind;
    private       int      magicFind;

    public CombatantStats(String name, int maxHealth, IntRange attack, int defense) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        if (maxHealth < 1) {
            throw new IllegalArgumentException("Max health must be positive: " + maxHealth);
        }
        this.maxHealth = maxHealth;
        this.health = maxHealth;
        this.attack = Objects.requireNonNull(attack, "Attack range cannot be null");
        this.defense = defense;
    }

    public CombatantStats withGoldFind(int goldFind) {
        this.goldFind = goldFind;
        return this;
    }

    public CombatantStats withMagicFind(int magicFind) {
        this.magicFind = magicFind;
        return this;
    }

    /**
     * Start below full health, e.g. when restoring a saved fight.
     */
    public CombatantStats withHealth(int health) {
        if (health < 0 || health > maxHealth) {
            throw new IllegalArgumentException("Health must be in [0, " + maxHealth + "]: " + health);
        }
        this.health = health;
        return this;
    }

    /**
     * Reduce health, flooring at 0.
     *
     * @return health actually removed
     */
    public int takeDamage(int amount) {
        if (amount <= 0) {
            return 0;
        }
        int removed = Math.min(amount, health);
        health -= removed;
        return removed;
    }

    public void restoreFullHealth() {
        health = maxHealth;
    }

    public boolean isAlive() {
        return health > 0;
    }

    public String getName() {
        return name;
    }

    public int getHealth() {
        return health;
    }

    public int getMaxHealth() {
        return maxHealth;
    }

    public IntRange getAttack() {
        return attack;
    }

    public int getDefense() {
        return defense;
    }

    public int getGoldFind() {
        return goldFind;
    }

    public int getMagicFind() {
        return magicFind;
    }

    @Override
    public String toString() {
        return String.format("%s[hp=%d/%d, atk=%s, def=%d]", name, health, maxHealth, attack, defense);
    }
}
