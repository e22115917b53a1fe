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
 * Plain-data record of something that happened in a fight, for the UI and combat log to consume.
 *
 * @author hal.hildebrand
 */
public sealed interface CombatEvent {

    record DamageDealt(String attacker, String defender, int damage, int healthRemaining) implements CombatEvent {
    }

    record EntityDied(String name) implements CombatEvent {
    }

    record GoldGained(int amount) implements CombatEvent {
    }

    record XpGained(int amount) implements CombatEvent {
    }

    record LootDropped(List<LootDrop> drops) implements CombatEvent {
        public LootDropped {
            drops = List.copyOf(drops);
        }
    }

    record GoldLost(int amount) implements CombatEvent {
    }

    record Fled(String name) implements CombatEvent {
    }
}
