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
import com.hellblazer.delve.common.RandomSource;
import com.hellblazer.delve.dungeon.DungeonEntity;
import com.hellblazer.delve.dungeon.RockType;
import com.hellblazer.delve.dungeon.StationType;
import com.hellblazer.delve.geometry.GridSize;

import java.util.Objects;
import java.util.function.Function;

/**
 * Recipe for one kind of spawned entity: its footprint plus how to roll its per-instance variant data. The resolver
 * picks the cell first and then calls {@link #create}, so variant rolls follow the position roll.
 *
 * @param name    label used in logs and shortfall reports
 * @param size    footprint of every created entity
 * @param factory rolls a concrete entity
 * @author hal.hildebrand
 */
public record EntityTemplate(String name, GridSize size, Function<RandomSource, DungeonEntity> factory) {

    private static final RockType[] ROCK_TYPES = RockType.values();

    public EntityTemplate {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(size, "Size cannot be null");
        Objects.requireNonNull(factory, "Factory cannot be null");
    }

    public static EntityTemplate chest(int variants) {
        return new EntityTemplate("chest", GridSize.single(), rng -> new DungeonEntity.Chest(rng.nextInt(variants)));
    }

    public static EntityTemplate stairs() {
        return new EntityTemplate("stairs", GridSize.single(), rng -> new DungeonEntity.Stairs());
    }

    /**
     * Rock of a uniformly chosen type with a uniformly chosen sprite variant.
     */
    public static EntityTemplate rock(int spriteVariants) {
        return new EntityTemplate("rock", GridSize.single(), rng -> {
            var type = ROCK_TYPES[rng.nextInt(ROCK_TYPES.length)];
            return new DungeonEntity.Rock(type, rng.nextInt(spriteVariants));
        });
    }

    public static EntityTemplate station(StationType type) {
        return new EntityTemplate(type.name().toLowerCase(), GridSize.single(),
                                  rng -> new DungeonEntity.CraftingStation(type));
    }

    public static EntityTemplate npc(MobId mobId, GridSize size) {
        return new EntityTemplate("npc:" + mobId, size, rng -> new DungeonEntity.Npc(mobId, size));
    }

    public static EntityTemplate mob(MobId mobId, GridSize size) {
        return new EntityTemplate("mob:" + mobId, size, rng -> new DungeonEntity.Mob(mobId, size));
    }

    /**
     * Always the same entity.
     */
    public static EntityTemplate fixed(DungeonEntity entity) {
        return new EntityTemplate(entity.getClass().getSimpleName().toLowerCase(), entity.footprintSize(),
                                  rng -> entity);
    }

    public DungeonEntity create(RandomSource rng) {
        return factory.apply(rng);
    }

    @Override
    public String toString() {
        return name;
    }
}
