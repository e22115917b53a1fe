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
import com.hellblazer.delve.combat.loot.LootTable;

/**
 * A rolled mob instance: live combat stats plus its rewards.
 *
 * @author hal.hildebrand
 */
public class Mob {
    private final MobId          id;
    private final CombatantStats stats;
    private final int            goldReward;
    private final int            xpReward;
    private final LootTable      loot;

    public Mob(MobId id, CombatantStats stats, int goldReward, int xpReward, LootTable loot) {
        this.id = id;
        this.stats = stats;
        this.goldReward = goldReward;
        this.xpReward = xpReward;
        this.loot = loot;
    }

    public MobId getId() {
        return id;
    }

    public CombatantStats getStats() {
        return stats;
    }

    public String getName() {
        return stats.getName();
    }

    /**
     * Gold before the killer's gold find.
     */
    public int getGoldReward() {
        return goldReward;
    }

    public int getXpReward() {
        return xpReward;
    }

    public LootTable getLoot() {
        return loot;
    }

    public boolean isAlive() {
        return stats.isAlive();
    }

    @Override
    public String toString() {
        return String.format("Mob[%s %s, gold=%d, xp=%d]", id, stats, goldReward, xpReward);
    }
}
