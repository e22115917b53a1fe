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

import com.hellblazer.delve.dungeon.DungeonEntity;

import java.util.List;

/**
 * Outcome of resolving a spawn table: placements in commit order plus any rules that under-filled.
 *
 * @author hal.hildebrand
 */
public record SpawnReport(List<Placement> placements, List<SpawnShortfall> shortfalls) {

    public SpawnReport {
        placements = List.copyOf(placements);
        shortfalls = List.copyOf(shortfalls);
    }

    public int placedCount() {
        return placements.size();
    }

    public boolean isComplete() {
        return shortfalls.isEmpty();
    }

    public <T extends DungeonEntity> List<Placement> placementsOf(Class<T> kind) {
        return placements.stream().filter(p -> kind.isInstance(p.entity())).toList();
    }

    public long count(Class<? extends DungeonEntity> kind) {
        return placements.stream().filter(p -> kind.isInstance(p.entity())).count();
    }
}
