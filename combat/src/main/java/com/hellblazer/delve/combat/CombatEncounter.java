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

import com.hellblazer.delve.combat.CombatEvent.*;
import com.hellblazer.delve.combat.mob.Mob;
import com.hellblazer.delve.common.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One fight between the player and a mob.
 *
 * <pre>
 * IDLE -begin-> PLAYER_TURN_PENDING -attack-> RESOLVING -> PLAYER_TURN_PENDING (both alive)
 *                                                       -> VICTORY_PENDING    (mob died)
 *                                                       -> DEFEAT_PENDING     (player died)
 * PLAYER_TURN_PENDING -flee-> CANCELLED
 * </pre>
 * An attack, the counter-attack, and any death, reward or penalty they cause are applied inside a single
 * {@link #attack()} call; nothing outside can observe {@code RESOLVING}. Attacking after the fight is decided is a
 * no-op returning no events.
 *
 * @author hal.hildebrand
 */
public class CombatEncounter {
    private static final Logger log = LoggerFactory.getLogger(CombatEncounter.class);

    private final PlayerState       player;
    private final Mob               mob;
    private final CombatResolver    resolver;
    private final RandomSource      rng;
    private final List<CombatEvent> events = new ArrayList<>();

    private EncounterState state = EncounterState.IDLE;
    private VictoryRewards rewards;
    private DefeatPenalty  penalty;

    public CombatEncounter(PlayerState player, Mob mob, CombatResolver resolver, RandomSource rng) {
        this.player = player;
        this.mob = mob;
        this.resolver = resolver;
        this.rng = rng;
    }

    public void begin() {
        if (state != EncounterState.IDLE) {
            throw new IllegalStateException("Encounter already begun: " + state);
        }
        state = EncounterState.PLAYER_TURN_PENDING;
        log.info("{} engages {}", player.getName(), mob.getName());
    }

    /**
     * Player attacks, then the mob counter-attacks if it survived. A player already at 0 health goes straight to
     * defeat; a mob already dead ends the fight without rewards.
     *
     * @return events of this round, empty if the fight was already decided
     * @throws IllegalStateException before {@link #begin()} or after fleeing
     */
    public List<CombatEvent> attack() {
        switch (state) {
            case IDLE -> throw new IllegalStateException("Encounter has not begun");
            case CANCELLED -> throw new IllegalStateException("Encounter was cancelled");
            case VICTORY_PENDING, DEFEAT_PENDING -> {
                log.debug("Attack after the fight was decided ({}); ignoring", state);
                return List.of();
            }
            default -> {
            }
        }

        state = EncounterState.RESOLVING;
        var round = new ArrayList<CombatEvent>();

        var hit = resolver.attack(player.getStats(), mob.getStats(), rng);
        if (hit.ignored()) {
            if (!player.getStats().isAlive()) {
                defeat(round);
            } else {
                log.debug("{} was already dead, no rewards", mob.getName());
                state = EncounterState.VICTORY_PENDING;
            }
        } else {
            round.add(new DamageDealt(hit.attacker(), hit.defender(), hit.damage(), hit.healthAfter()));
            if (hit.targetDied()) {
                victory(round);
            } else {
                var counter = resolver.attack(mob.getStats(), player.getStats(), rng);
                round.add(new DamageDealt(counter.attacker(), counter.defender(), counter.damage(),
                                          counter.healthAfter()));
                if (counter.targetDied()) {
                    defeat(round);
                } else {
                    state = EncounterState.PLAYER_TURN_PENDING;
                }
            }
        }

        events.addAll(round);
        if (state.isTerminal()) {
            log.info("Encounter {} vs {} resolved: {}", player.getName(), mob.getName(), state);
        }
        return round;
    }

    private void victory(List<CombatEvent> round) {
        round.add(new EntityDied(mob.getName()));
        rewards = resolver.victoryRewards(mob, player, rng);
        resolver.applyVictory(player, rewards);
        round.add(new GoldGained(rewards.gold()));
        round.add(new XpGained(rewards.xp()));
        if (!rewards.drops().isEmpty()) {
            round.add(new LootDropped(rewards.drops()));
        }
        state = EncounterState.VICTORY_PENDING;
    }

    private void defeat(List<CombatEvent> round) {
        round.add(new EntityDied(player.getName()));
        penalty = resolver.applyDefeat(player);
        round.add(new GoldLost(penalty.goldLost()));
        state = EncounterState.DEFEAT_PENDING;
    }

    /**
     * Disengage before committing an attack.
     *
     * @throws IllegalStateException unless it is the player's turn
     */
    public CombatEvent flee() {
        if (state != EncounterState.PLAYER_TURN_PENDING) {
            throw new IllegalStateException("Cannot flee in state " + state);
        }
        state = EncounterState.CANCELLED;
        var fled = new Fled(player.getName());
        events.add(fled);
        log.info("{} fled from {}", player.getName(), mob.getName());
        return fled;
    }

    public EncounterState state() {
        return state;
    }

    /**
     * Rewards, once the mob is dead.
     */
    public Optional<VictoryRewards> rewards() {
        return Optional.ofNullable(rewards);
    }

    /**
     * Penalty, once the player is defeated.
     */
    public Optional<DefeatPenalty> penalty() {
        return Optional.ofNullable(penalty);
    }

    /**
     * Every event so far, oldest first.
     */
    public List<CombatEvent> log() {
        return Collections.unmodifiableList(events);
    }

    public Mob getMob() {
        return mob;
    }

    public PlayerState getPlayer() {
        return player;
    }
}
