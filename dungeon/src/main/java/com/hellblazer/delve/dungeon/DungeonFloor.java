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

import com.hellblazer.delve.combat.CombatEncounter;
import com.hellblazer.delve.combat.CombatResolver;
import com.hellblazer.delve.combat.EncounterState;
import com.hellblazer.delve.combat.PlayerState;
import com.hellblazer.delve.combat.mob.MobFactory;
import com.hellblazer.delve.combat.mob.MobRegistry;
import com.hellblazer.delve.common.RandomSource;
import com.hellblazer.delve.common.SplitMixRandom;
import com.hellblazer.delve.dungeon.persistence.FloorSnapshot;
import com.hellblazer.delve.dungeon.spawn.Placement;
import com.hellblazer.delve.dungeon.spawn.SpawnReport;
import com.hellblazer.delve.dungeon.spawn.SpawnResolver;
import com.hellblazer.delve.dungeon.spawn.SpawnTable;
import com.hellblazer.delve.geometry.Direction;
import com.hellblazer.delve.geometry.Footprint;
import com.hellblazer.delve.geometry.GridPosition;
import com.hellblazer.delve.grid.GridOccupancy;
import com.hellblazer.delve.grid.MovementValidator;
import com.hellblazer.delve.grid.TerrainOracle;
import com.hellblazer.delve.grid.entity.LongEntityID;
import com.hellblazer.delve.grid.entity.SequentialLongIDGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The state of the floor the player is on: terrain, occupancy, what every placed id is, the player, the floor's random
 * source and id counter. One instance is created on entry, owns every mutation of its occupancy grid, and is dropped
 * when the player leaves. Not thread safe.
 *
 * @author hal.hildebrand
 */
public class DungeonFloor {
    private static final Logger log = LoggerFactory.getLogger(DungeonFloor.class);

    private final TerrainOracle                         terrain;
    private final FloorConfig                           config;
    private final SplitMixRandom                        rng;
    private final SequentialLongIDGenerator             ids;
    private final GridOccupancy<LongEntityID>           occupancy;
    private final MovementValidator<LongEntityID>       validator;
    private final Map<LongEntityID, DungeonEntity>      entities = new LinkedHashMap<>();
    private       LongEntityID                          player;
    private       SpawnReport                           report   = new SpawnReport(List.of(), List.of());

    private DungeonFloor(TerrainOracle terrain, FloorConfig config, SplitMixRandom rng,
                         SequentialLongIDGenerator ids) {
        this.terrain = Objects.requireNonNull(terrain, "Terrain cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.rng = Objects.requireNonNull(rng, "Random source cannot be null");
        this.ids = ids;
        this.occupancy = new GridOccupancy<>(terrain.width(), terrain.height());
        this.validator = new MovementValidator<>(terrain, occupancy);
    }

    /**
     * Build a fresh floor: place the player on the terrain entrance (if the config asks for it), then resolve the
     * spawn table.
     *
     * @throws IllegalArgumentException if the player is to be placed and the terrain has no usable entrance
     */
    public static DungeonFloor enter(TerrainOracle terrain, SpawnTable table, FloorConfig config,
                                     SplitMixRandom rng) {
        var floor = new DungeonFloor(terrain, config, rng, new SequentialLongIDGenerator(1L));
        if (config.isPlacePlayer()) {
            var entrance = terrain.entrance()
                                  .orElseThrow(() -> new IllegalArgumentException("Terrain has no entrance"));
            var footprint = Footprint.single(entrance);
            if (!floor.validator.canOccupy(footprint, null)) {
                throw new IllegalArgumentException("Entrance " + entrance + " is not walkable");
            }
            floor.player = floor.ids.generateID();
            floor.occupancy.occupy(footprint, floor.player);
        }
        floor.report = new SpawnResolver(rng, floor.ids, config).resolve(table, floor.validator);
        for (var placement : floor.report.placements()) {
            floor.entities.put(placement.id(), placement.entity());
        }
        log.info("Entered {}x{} floor, player at {}, {} entities", terrain.width(), terrain.height(),
                 floor.playerPosition().map(GridPosition::toString).orElse("none"), floor.entities.size());
        return floor;
    }

    /**
     * Rebuild a floor from a snapshot. The random source and id counter resume exactly where the snapshot left off.
     *
     * @throws IllegalArgumentException if the snapshot does not fit the terrain
     */
    public static DungeonFloor restore(FloorSnapshot snapshot, TerrainOracle terrain, FloorConfig config) {
        if (snapshot.width() != terrain.width() || snapshot.height() != terrain.height()) {
            throw new IllegalArgumentException(
            String.format("Snapshot %dx%d does not match terrain %dx%d", snapshot.width(), snapshot.height(),
                          terrain.width(), terrain.height()));
        }
        var floor = new DungeonFloor(terrain, config, SplitMixRandom.restore(snapshot.rngState()),
                                     new SequentialLongIDGenerator(snapshot.nextId()));
        if (snapshot.player() != null) {
            floor.player = snapshot.player();
            floor.occupancy.occupy(snapshot.playerFootprint(), floor.player);
        }
        for (var placement : snapshot.placements()) {
            floor.occupancy.occupy(placement.footprint(), placement.id());
            floor.entities.put(placement.id(), placement.entity());
        }
        floor.report = new SpawnReport(snapshot.placements(), List.of());
        log.info("Restored {}x{} floor with {} entities", terrain.width(), terrain.height(), floor.entities.size());
        return floor;
    }

    /**
     * Capture everything needed to rebuild an equivalent floor on the same terrain.
     */
    public FloorSnapshot snapshot() {
        var playerFootprint = player == null ? null : occupancy.footprintOf(player).orElseThrow();
        return new FloorSnapshot(terrain.width(), terrain.height(), placements(), player, playerFootprint,
                                 rng.state(), ids.getCurrentValue());
    }

    /**
     * Non-player entities currently on the floor, in placement order.
     */
    public List<Placement> placements() {
        var result = new ArrayList<Placement>(entities.size());
        entities.forEach((id, entity) -> result.add(new Placement(id, entity, occupancy.footprintOf(id).orElseThrow())));
        return result;
    }

    public Optional<DungeonEntity> entityAt(GridPosition position) {
        return occupancy.entityAt(position).map(entities::get);
    }

    public Optional<DungeonEntity> entity(LongEntityID id) {
        return Optional.ofNullable(entities.get(id));
    }

    public Optional<LongEntityID> playerId() {
        return Optional.ofNullable(player);
    }

    public Optional<GridPosition> playerPosition() {
        return player == null ? Optional.empty() : occupancy.footprintOf(player).map(Footprint::origin);
    }

    /**
     * Try to step the player one cell. Stepping into an entity never moves the player; it reports what was hit.
     *
     * @throws IllegalStateException if the floor has no player
     */
    public MoveResult movePlayer(Direction direction) {
        var current = occupancy.footprintOf(requirePlayer()).orElseThrow();
        var target = current.step(direction);
        if (!target.within(terrain.width(), terrain.height())) {
            return new MoveResult.Blocked();
        }
        for (var cell : target.cells()) {
            var occupant = occupancy.entityAt(cell).filter(id -> !id.equals(player));
            if (occupant.isPresent()) {
                return bump(occupant.get());
            }
        }
        if (!validator.canOccupy(target, player)) {
            return new MoveResult.Blocked();
        }
        var moved = occupancy.move(player, target.origin());
        return new MoveResult.Moved(moved.origin());
    }

    /**
     * Entities in the four cardinal cells around the player, distinct, in north, east, south, west order.
     */
    public List<Placement> adjacentEntities() {
        var result = new ArrayList<Placement>();
        for (var id : occupancy.adjacentOccupants(requirePlayer())) {
            var entity = entities.get(id);
            if (entity != null) {
                result.add(new Placement(id, entity, occupancy.footprintOf(id).orElseThrow()));
            }
        }
        return result;
    }

    /**
     * Despawn an entity, freeing its cells.
     *
     * @throws IllegalArgumentException for the player
     */
    public Optional<Placement> remove(LongEntityID id) {
        if (id.equals(player)) {
            throw new IllegalArgumentException("Cannot remove the player");
        }
        var entity = entities.remove(id);
        if (entity == null) {
            return Optional.empty();
        }
        var footprint = occupancy.remove(id).orElseThrow();
        log.debug("Removed {} {} from {}", id, entity, footprint);
        return Optional.of(new Placement(id, entity, footprint));
    }

    /**
     * Start a fight with a mob on this floor. The mob's stats are rolled from the registry using the floor's random
     * source, so a restored floor replays the same fight.
     *
     * @return an encounter already in its first player turn
     * @throws IllegalArgumentException if the id is not a mob on this floor
     */
    public CombatEncounter engage(LongEntityID id, PlayerState playerState, MobRegistry registry, MobFactory factory,
                                  CombatResolver resolver) {
        if (!(entities.get(id) instanceof DungeonEntity.Mob mob)) {
            throw new IllegalArgumentException("Not a mob on this floor: " + id);
        }
        var encounter = new CombatEncounter(playerState, factory.instantiate(registry.spec(mob.mobId()), rng),
                                            resolver, rng);
        encounter.begin();
        return encounter;
    }

    /**
     * Apply the floor side of a finished fight: a defeated mob is despawned.
     *
     * @return true if the mob was removed
     */
    public boolean conclude(LongEntityID id, CombatEncounter encounter) {
        if (encounter.state() != EncounterState.VICTORY_PENDING) {
            return false;
        }
        return remove(id).isPresent();
    }

    public RandomSource random() {
        return rng;
    }

    public SpawnReport getReport() {
        return report;
    }

    public TerrainOracle getTerrain() {
        return terrain;
    }

    public FloorConfig getConfig() {
        return config;
    }

    public GridOccupancy<LongEntityID> getOccupancy() {
        return occupancy;
    }

    private MoveResult bump(LongEntityID id) {
        var entity = entities.get(id);
        if (entity instanceof DungeonEntity.Mob mob) {
            return new MoveResult.TriggeredCombat(id, mob.mobId());
        }
        if (entity instanceof DungeonEntity.Door) {
            return new MoveResult.EnterDoor(id);
        }
        if (entity instanceof DungeonEntity.Stairs) {
            return new MoveResult.AdvanceFloor(id);
        }
        return new MoveResult.Interact(id, entity);
    }

    private LongEntityID requirePlayer() {
        if (player == null) {
            throw new IllegalStateException("No player on this floor");
        }
        return player;
    }
}
