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

import com.hellblazer.delve.combat.mob.Mob;
import com.hellblazer.delve.common.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless combat arithmetic between two combatants. All randomness comes from the supplied generator.
 *
 * @author hal.hildebrand
 */
public class CombatResolver {
    private static final Logger log = LoggerFactory.getLogger(CombatResolver.class);

    private final DamageFormula formula;

    public CombatResolver() {
        this(DamageFormula.standard());
    }

    public CombatResolver(DamageFormula formula) {
        this.formula = formula;
    }

    /**
     * One swing: roll raw damage from the attacker's range, mitigate by the defender's defense, and apply it. A
     * dead attacker cannot swing and a dead defender is left untouched; either way the result is flagged ignored.
     */
    public AttackResult attack(CombatantStats attacker, CombatantStats defender, RandomSource rng) {
        if (!attacker.isAlive()) {
            log.debug("{} is dead and cannot attack {}; ignoring", attacker.getName(), defender.getName());
            return AttackResult.ignored(attacker.getName(), defender.getName());
        }
        if (!defender.isAlive()) {
            log.debug("{} attacked {} who is already dead; ignoring", attacker.getName(), defender.getName());
            return AttackResult.ignored(attacker.getName(), defender.getName());
        }
        int before = defender.getHealth();
        int raw = rng.nextInt(attacker.getAttack());
        int damage = formula.finalDamage(raw, defender.getDefense());
        defender.takeDamage(damage);
        var result = new AttackResult(attacker.getName(), defender.getName(), raw, damage, before,
                                      defender.getHealth(), !defender.isAlive(), false);
        log.debug("{} hits {} for {} ({} raw), {} -> {}", result.attacker(), result.defender(), damage, raw, before,
                  result.healthAfter());
        return result;
    }

    /**
     * Rewards for killing a mob: gold scaled by the player's gold find, unscaled xp, and a loot roll using the
     * player's magic find.
     */
    public VictoryRewards victoryRewards(Mob mob, PlayerState player, RandomSource rng) {
        var stats = player.getStats();
        int gold = formula.applyGoldFind(mob.getGoldReward(), stats.getGoldFind());
        var drops = mob.getLoot().roll(stats.getMagicFind(), rng);
        return new VictoryRewards(gold, mob.getXpReward(), drops);
    }

    public void applyVictory(PlayerState player, VictoryRewards rewards) {
        player.addGold(rewards.gold());
        player.addXp(rewards.xp());
        log.info("{} gained {} gold, {} xp and {} drops", player.getName(), rewards.gold(), rewards.xp(),
                 rewards.drops().size());
    }

    /**
     * Player defeat: lose a fixed percentage of gold, rounded down, and come back at full health.
     */
    public DefeatPenalty applyDefeat(PlayerState player) {
        int lost = player.subtractGold(formula.defeatGoldPenalty(player.getGold()));
        player.getStats().restoreFullHealth();
        log.info("{} was defeated, lost {} gold", player.getName(), lost);
        return new DefeatPenalty(lost, player.getGold(), player.getStats().getHealth());
    }

    public DamageFormula getFormula() {
        return formula;
    }
}
