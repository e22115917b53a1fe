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

import com.hellblazer.delve.combat.mob.MobId;
import com.hellblazer.delve.combat.mob.MobRegistry;
import com.hellblazer.delve.common.IntRange;
import com.hellblazer.delve.dungeon.FloorConfig;
import com.hellblazer.delve.dungeon.StationType;
import com.hellblazer.delve.geometry.GridPosition;
import com.hellblazer.delve.geometry.GridSize;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Ordered list of spawn rules for one floor.
 * <p>
 * Content is usually declared through the builder:
 * <pre>
 * var table = SpawnTable.builder()
 *                       .mob(MobId.GOBLIN, 5)
 *                       .mob(MobId.SLIME, 3)
 *                       .mobCount(IntRange.of(3, 4))
 *                       .guaranteedMob(MobId.DWARF_KING, 1)
 *                       .rock(IntRange.of(0, 4))
 *                       .forgeChance(0.33)
 *                       .build();
 * </pre>
 * All weighted {@code mob(...)} entries form one pool whose slot count is set by {@code mobCount}. {@link #rules()}
 * returns the rules sorted by {@link SpawnCategory}; the sort is stable, so declaration order is kept within a
 * category.
 *
 * @author hal.hildebrand
 */
public final class SpawnTable {

    private static final Comparator<SpawnRule> BY_CATEGORY = Comparator.comparing(SpawnRule::category);

    private final List<SpawnRule> rules;

    private SpawnTable(List<SpawnRule> declared) {
        var sorted = new ArrayList<>(declared);
        sorted.sort(BY_CATEGORY);
        this.rules = List.copyOf(sorted);
    }

    public static SpawnTable of(List<SpawnRule> rules) {
        return new SpawnTable(rules);
    }

    public static SpawnTable empty() {
        return new SpawnTable(List.of());
    }

    /**
     * Builder with default floor options and every mob 1x1.
     */
    public static Builder builder() {
        return new Builder(FloorConfig.defaults(), id -> GridSize.single());
    }

    /**
     * Builder taking mob footprints from the registry.
     */
    public static Builder builder(FloorConfig config, MobRegistry registry) {
        return new Builder(config, id -> registry.spec(id).size());
    }

    public static Builder builder(FloorConfig config, Function<MobId, GridSize> mobSizes) {
        return new Builder(config, mobSizes);
    }

    /**
     * Rules in resolution order.
     */
    public List<SpawnRule> rules() {
        return rules;
    }

    public List<SpawnRule> rules(SpawnCategory category) {
        return rules.stream().filter(r -> r.category() == category).toList();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("SpawnTable[");
        for (int i = 0; i < rules.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(rules.get(i).category()).append(' ').append(rules.get(i).describe());
        }
        return sb.append(']').toString();
    }

    public static final class Builder {
        private final FloorConfig                config;
        private final Function<MobId, GridSize> mobSizes;
        private final List<SpawnRule>            rules     = new ArrayList<>();
        private final List<SpawnEntry>           mobPool   = new ArrayList<>();
        private       IntRange                   mobCount  = IntRange.zero();

        private Builder(FloorConfig config, Function<MobId, GridSize> mobSizes) {
            this.config = Objects.requireNonNull(config, "Config cannot be null");
            this.mobSizes = Objects.requireNonNull(mobSizes, "Mob sizes cannot be null");
        }

        public Builder chest(IntRange count) {
            return rule(WeightedPoolRule.single(SpawnCategory.OBSTACLE, EntityTemplate.chest(config.getChestVariants()),
                                                count));
        }

        public Builder stairs(IntRange count) {
            return rule(WeightedPoolRule.single(SpawnCategory.OBSTACLE, EntityTemplate.stairs(), count));
        }

        public Builder rock(IntRange count) {
            return rule(WeightedPoolRule.single(SpawnCategory.OBSTACLE,
                                                EntityTemplate.rock(config.getRockSpriteVariants()), count));
        }

        public Builder forge(IntRange count) {
            return rule(WeightedPoolRule.single(SpawnCategory.OBSTACLE, EntityTemplate.station(StationType.FORGE),
                                                count));
        }

        public Builder anvil(IntRange count) {
            return rule(WeightedPoolRule.single(SpawnCategory.OBSTACLE, EntityTemplate.station(StationType.ANVIL),
                                                count));
        }

        public Builder forgeChance(double probability) {
            return rule(new ChanceRule(SpawnCategory.OBSTACLE, EntityTemplate.station(StationType.FORGE),
                                       probability));
        }

        public Builder anvilChance(double probability) {
            return rule(new ChanceRule(SpawnCategory.OBSTACLE, EntityTemplate.station(StationType.ANVIL),
                                       probability));
        }

        public Builder npc(MobId id, IntRange count) {
            return rule(WeightedPoolRule.single(SpawnCategory.NPC, EntityTemplate.npc(id, mobSizes.apply(id)), count));
        }

        public Builder npcChance(MobId id, double probability) {
            return rule(new ChanceRule(SpawnCategory.NPC, EntityTemplate.npc(id, mobSizes.apply(id)), probability));
        }

        public Builder guaranteedMob(MobId id, int count) {
            return rule(new GuaranteedRule(SpawnCategory.GUARANTEED_MOB, EntityTemplate.mob(id, mobSizes.apply(id)),
                                           count));
        }

        /**
         * Add an entry to the weighted mob pool.
         */
        public Builder mob(MobId id, int weight) {
            mobPool.add(new SpawnEntry(EntityTemplate.mob(id, mobSizes.apply(id)), weight));
            return this;
        }

        /**
         * Slot count of the weighted mob pool; 0..=0 unless set.
         */
        public Builder mobCount(IntRange count) {
            this.mobCount = Objects.requireNonNull(count, "Mob count cannot be null");
            return this;
        }

        public Builder fixed(EntityTemplate template, GridPosition position) {
            return rule(new FixedPositionRule(SpawnCategory.OBSTACLE, template, position));
        }

        public Builder rule(SpawnRule rule) {
            rules.add(Objects.requireNonNull(rule, "Rule cannot be null"));
            return this;
        }

        public SpawnTable build() {
            var all = new ArrayList<>(rules);
            if (!mobPool.isEmpty()) {
                all.add(new WeightedPoolRule(SpawnCategory.WEIGHTED_MOB, mobPool, mobCount));
            }
            return new SpawnTable(all);
        }
    }
}
