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

import java.util.Objects;

/**
 * The player's combat stats plus the purse and experience that combat changes. Owned by the hosting game, not by a
 * floor.
 *
 * @author hal.hildebrand
 */
public class PlayerState {
    private final CombatantStats stats;
    private       int            gold;
    private       long           xp;

    public PlayerState(CombatantStats stats) {
        this(stats, 0, 0L);
    }

    public PlayerState(CombatantStats stats, int gold, long xp) {
        this.stats = Objects.requireNonNull(stats, "Stats cannot be null");
        if (gold < 0 || xp < 0) {
            throw new IllegalArgumentException("Gold and xp must be non-negative");
        }
        this.gold = gold;
        this.xp = xp;
    }

    public void addGold(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Use subtractGold to remove gold: " + amount);
        }
        gold = (int) Math.min(Integer.MAX_VALUE, (long) gold + amount);
    }

    /**
     * Remove gold, flooring at 0.
     *
     * @return gold actually removed
     */
    public int subtractGold(int amount) {
        int removed = Math.max(0, Math.min(amount, gold));
        gold -= removed;
        return removed;
    }

    public void addXp(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Xp cannot decrease: " + amount);
        }
        xp += amount;
    }

    public CombatantStats getStats() {
        return stats;
    }

    public String getName() {
        return stats.getName();
    }

    public int getGold() {
        return gold;
    }

    public long getXp() {
        return xp;
    }

    @Override
    public String toString() {
        return String.format("Player[%s, gold=%d, xp=%d]", stats, gold, xp);
    }
}
