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

/**
 * Outcome of one swing.
 *
 * @param attacker     attacker name
 * @param defender     defender name
 * @param rawDamage    damage rolled from the attack range
 * @param damage       damage after mitigation
 * @param healthBefore defender health before the hit
 * @param healthAfter  defender health after the hit
 * @param targetDied   the hit took the defender to 0
 * @param ignored      the defender was already dead and nothing happened
 * @author hal.hildebrand
 */
public record AttackResult(String attacker, String defender, int rawDamage, int damage, int healthBefore,
                           int healthAfter, boolean targetDied, boolean ignored) {

    static AttackResult ignored(String attacker, String defender) {
        return new AttackResult(attacker, defender, 0, 0, 0, 0, false, true);
    }
}
