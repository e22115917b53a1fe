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
package com.hellblazer.delve.dungeon;

import com.hellblazer.delve.combat.mob.MobId;
import com.hellblazer.delve.common.IntRange;
import com.hellblazer.delve.dungeon.spawn.SpawnTable;
import com.hellblazer.delve.geometry.GridSize;

import java.util.Map;
import java.util.function.Function;

/**
 * Content description of a floor type as it appears in {@code floors.json}. Absent ranges add no rule, absent maps are
 * empty and absent chances are 0.
 *
 * @param mobs           weighted mob pool, in declaration order
 * @param mobCount       slot count of the weighted pool
 * @param guaranteedMobs mobs always attempted, with their counts
 * @param stairs         stairs count, dropped on the final floor
 * @author hal.hildebrand
 */
public record FloorDefinition(Map<MobId, Integer> mobs, IntRange mobCount, Map<MobId, Integer> guaranteedMobs,
                              IntRange chests, IntRange rocks, IntRange forges, IntRange anvils, double forgeChance,
                              double anvilChance, Map<MobId, IntRange> npcs, Map<MobId, Double> npcChances,
                              IntRange stairs) {

    public FloorDefinition {
        mobs = mobs == null ? Map.of() : mobs;
        guaranteedMobs = guaranteedMobs == null ? Map.of() : guaranteedMobs;
        npcs = npcs == null ? Map.of() : npcs;
        npcChances = npcChances == null ? Map.of() : npcChances;
    }

    public SpawnTable toSpawnTable(FloorConfig config, Function<MobId, GridSize> mobSizes, boolean isFinal) {
        var builder = SpawnTable.builder(config, mobSizes);
        if (chests != null) {
            builder.chest(chests);
        }
        if (rocks != null) {
            builder.rock(rocks);
        }
        if (forges != null) {
            builder.forge(forges);
        }
        if (anvils != null) {
            builder.anvil(anvils);
        }
        if (forgeChance > 0.0) {
            builder.forgeChance(forgeChance);
        }
        if (anvilChance > 0.0) {
            builder.anvilChance(anvilChance);
        }
        if (stairs != null && !isFinal) {
            builder.stairs(stairs);
        }
        npcs.forEach(builder::npc);
        npcChances.forEach(builder::npcChance);
        guaranteedMobs.forEach(builder::guaranteedMob);
        mobs.forEach(builder::mob);
        if (mobCount != null) {
            builder.mobCount(mobCount);
        }
        return builder.build();
    }
}
