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
import com.hellblazer.delve.geometry.GridPosition;
import com.hellblazer.delve.grid.entity.LongEntityID;

/**
 * What happened when the player tried to step in a direction. Only {@link Moved} changes the player's position.
 *
 * @author hal.hildebrand
 */
public sealed interface MoveResult {

    record Moved(GridPosition position) implements MoveResult {
    }

    /**
     * Wall, empty tile or grid edge.
     */
    record Blocked() implements MoveResult {
    }

    record TriggeredCombat(LongEntityID entity, MobId mobId) implements MoveResult {
    }

    record EnterDoor(LongEntityID entity) implements MoveResult {
    }

    /**
     * Stepped onto stairs.
     */
    record AdvanceFloor(LongEntityID entity) implements MoveResult {
    }

    /**
     * Bumped into a chest, rock, crafting station or npc.
     */
    record Interact(LongEntityID entity, DungeonEntity target) implements MoveResult {
    }
}
