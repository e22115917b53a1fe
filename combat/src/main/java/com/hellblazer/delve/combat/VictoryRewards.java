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

import com.hellblazer.delve.combat.loot.LootDrop;

import java.util.List;

/**
 * What the player earns for a kill.
 *
 * @param gold  gold after gold find
 * @param xp    experience
 * @param drops rolled loot, possibly empty
 * @author hal.hildebrand
 */
public record VictoryRewards(int gold, int xp, List<LootDrop> drops) {

    public VictoryRewards {
        drops = List.copyOf(drops);
    }
}
