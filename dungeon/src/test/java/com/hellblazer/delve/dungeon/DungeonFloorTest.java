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

import com.hellblazer.delve.combat.CombatResolver;
import com.hellblazer.delve.combat.CombatantStats;
import com.hellblazer.delve.combat.DamageFormula;
import com.hellblazer.delve.combat.EncounterState;
import com.hellblazer.delve.combat.PlayerState;
import com.hellblazer.delve.combat.mob.MobFactory;
import com.hellblazer.delve.combat.mob.MobId;
import com.hellblazer.delve.combat.mob.MobRegistry;
import com.hellblazer.delve.common.IntRange;
import com.hellblazer.delve.common.SplitMixRandom;
import com.hellblazer.delve.dungeon.spawn.EntityTemplate;
import com.hellblazer.delve.dungeon.spawn.Placement;
import com.hellblazer.delve.dungeon.spawn.SpawnTable;
import com.hellblazer.delve.geometry.Direction;
import com.hellblazer.delve.geometry.GridPosition;
import com.hellblazer.delve.grid.TileLayout;
import com.hellblazer.delve.grid.entity.LongEntityID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Player movement, bumping and combat hand-off on a small hand-built floor.
 *
 * @author hal.hildebrand
 */
class DungeonFloorTest {

    private static final String[] ROOM = { "#######",
                                           "#.....#",
                                           "#..S..D",
                                           "#.....#",
                                           "#######" };

    private TileLayout   layout;
    private DungeonFloor floor;

    private static LongEntityID idAt(DungeonFloor floor, int x, int y) {
        return floor.getOccupancy().entityAt(x, y).orElseThrow();
    }

    @BeforeEach
    void setUp() {
        layout = TileLayout.fromRows(ROOM);
        var table = SpawnTable.builder()
                              .fixed(EntityTemplate.fixed(new DungeonEntity.Chest(1)), new GridPosition(2, 2))
                              .fixed(EntityTemplate.mob(MobId.GOBLIN, null), new GridPosition(3, 1))
                              .fixed(EntityTemplate.stairs(), new GridPosition(3, 3))
                              .build();
        floor = DungeonFloor.enter(layout, table, FloorConfig.defaults(), new SplitMixRandom(17L));
    }

    @Test
    void testEntryPlacesPlayerThenDoorsThenRules() {
        assertEquals(new GridPosition(3, 2), floor.playerPosition().orElseThrow());
        assertEquals(new LongEntityID(1L), floor.playerId().orElseThrow());

        var placements = floor.placements();
        assertEquals(4, placements.size());
        assertEquals(new DungeonEntity.Door(), placements.get(0).entity());
        assertEquals(new GridPosition(6, 2), placements.get(0).footprint().origin());
        assertEquals(new DungeonEntity.Chest(1), floor.entityAt(new GridPosition(2, 2)).orElseThrow());
        assertTrue(floor.entityAt(new GridPosition(1, 1)).isEmpty());
        assertTrue(floor.getReport().isComplete());
    }

    @Test
    void testBumpingEntitiesReportsWhatWasHit() {
        var west = floor.movePlayer(Direction.WEST);
        assertEquals(new MoveResult.Interact(idAt(floor, 2, 2), new DungeonEntity.Chest(1)), west);

        var north = floor.movePlayer(Direction.NORTH);
        assertEquals(new MoveResult.TriggeredCombat(idAt(floor, 3, 1), MobId.GOBLIN), north);

        var south = floor.movePlayer(Direction.SOUTH);
        assertEquals(new MoveResult.AdvanceFloor(idAt(floor, 3, 3)), south);

        assertEquals(new GridPosition(3, 2), floor.playerPosition().orElseThrow());
    }

    @Test
    void testWalkingToTheDoor() {
        assertEquals(new MoveResult.Moved(new GridPosition(4, 2)), floor.movePlayer(Direction.EAST));
        assertEquals(new MoveResult.Moved(new GridPosition(5, 2)), floor.movePlayer(Direction.EAST));
        assertEquals(new MoveResult.EnterDoor(idAt(floor, 6, 2)), floor.movePlayer(Direction.EAST));

        assertEquals(new MoveResult.Moved(new GridPosition(5, 1)), floor.movePlayer(Direction.NORTH));
        assertEquals(new MoveResult.Blocked(), floor.movePlayer(Direction.NORTH));
        assertEquals(new GridPosition(5, 1), floor.playerPosition().orElseThrow());
    }

    @Test
    void testAdjacentEntitiesInCardinalOrder() {
        var kinds = floor.adjacentEntities().stream().map(Placement::entity).toList();

        assertEquals(List.of(new DungeonEntity.Mob(MobId.GOBLIN, null), new DungeonEntity.Stairs(),
                             new DungeonEntity.Chest(1)), kinds);

        floor.movePlayer(Direction.EAST);
        assertTrue(floor.adjacentEntities().isEmpty());
    }

    @Test
    void testRemoveFreesCells() {
        var mob = idAt(floor, 3, 1);

        var removed = floor.remove(mob).orElseThrow();

        assertEquals(new GridPosition(3, 1), removed.footprint().origin());
        assertTrue(floor.entity(mob).isEmpty());
        assertTrue(floor.remove(mob).isEmpty());
        assertEquals(new MoveResult.Moved(new GridPosition(3, 1)), floor.movePlayer(Direction.NORTH));
        assertThrows(IllegalArgumentException.class, () -> floor.remove(floor.playerId().orElseThrow()));
    }

    @Test
    void testVictoryDespawnsMob() {
        var registry = MobRegistry.load();
        var factory = new MobFactory(DamageFormula.standard());
        var resolver = new CombatResolver();
        var hero = new PlayerState(new CombatantStats("Hero", 1000, IntRange.single(1000), 10));
        var mob = idAt(floor, 3, 1);

        var encounter = floor.engage(mob, hero, registry, factory, resolver);
        assertEquals(EncounterState.PLAYER_TURN_PENDING, encounter.state());
        assertFalse(floor.conclude(mob, encounter));

        encounter.attack();

        assertEquals(EncounterState.VICTORY_PENDING, encounter.state());
        assertTrue(floor.conclude(mob, encounter));
        assertTrue(floor.entityAt(new GridPosition(3, 1)).isEmpty());
        assertTrue(hero.getGold() > 0);
    }

    @Test
    void testOnlyMobsCanBeEngaged() {
        var chest = idAt(floor, 2, 2);
        assertThrows(IllegalArgumentException.class,
                     () -> floor.engage(chest, new PlayerState(new CombatantStats("Hero", 10, IntRange.single(1), 0)),
                                        MobRegistry.load(), new MobFactory(DamageFormula.standard()),
                                        new CombatResolver()));
    }

    @Test
    void testPlayerPlacementNeedsEntrance() {
        assertThrows(IllegalArgumentException.class,
                     () -> DungeonFloor.enter(TileLayout.open(3, 3), SpawnTable.empty(), FloorConfig.defaults(),
                                              new SplitMixRandom(1L)));

        var noPlayer = DungeonFloor.enter(TileLayout.open(3, 3), SpawnTable.empty(), FloorConfig.spawnOnly(),
                                          new SplitMixRandom(1L));
        assertTrue(noPlayer.playerPosition().isEmpty());
        assertThrows(IllegalStateException.class, () -> noPlayer.movePlayer(Direction.EAST));
    }

    @Test
    void testStandardFloorRespectsTerrain() {
        var cave = TileLayout.fromRows("##########",
                                       "#........#",
                                       "#.,,,,,..#",
                                       "#....S...D",
                                       "#........#",
                                       "##########");
        var catalog = FloorCatalog.load(FloorConfig.defaults(), MobRegistry.load());

        var standard = DungeonFloor.enter(cave, catalog.spawnTable("standard", false), FloorConfig.defaults(),
                                          new SplitMixRandom(2025L));

        var report = standard.getReport();
        assertEquals(4, report.count(DungeonEntity.Mob.class) - countWeighted(report.placements()));
        assertEquals(1, report.count(DungeonEntity.Stairs.class));
        for (var placement : standard.placements()) {
            var origin = placement.footprint().origin();
            if (placement.entity() instanceof DungeonEntity.Door) {
                assertTrue(cave.isDoor(origin.x(), origin.y()));
            } else {
                assertTrue(cave.canSpawnEntity(origin.x(), origin.y()), placement.toString());
            }
        }
    }

    private static long countWeighted(List<Placement> placements) {
        return placements.stream()
                         .filter(p -> p.entity() instanceof DungeonEntity.Mob mob && (mob.mobId() == MobId.GOBLIN
                                                                                      || mob.mobId() == MobId.SLIME))
                         .count();
    }
}
