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

import com.hellblazer.delve.common.RandomSource;
import com.hellblazer.delve.dungeon.DungeonEntity;
import com.hellblazer.delve.dungeon.FloorConfig;
import com.hellblazer.delve.geometry.Footprint;
import com.hellblazer.delve.geometry.GridSize;
import com.hellblazer.delve.grid.GridOccupancy;
import com.hellblazer.delve.grid.MovementValidator;
import com.hellblazer.delve.grid.OccupancyException;
import com.hellblazer.delve.grid.TerrainOracle;
import com.hellblazer.delve.grid.entity.EntityIDGenerator;
import com.hellblazer.delve.grid.entity.LongEntityID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a {@link SpawnTable} into concrete placements on a floor.
 * <p>
 * Doors come first, straight from terrain metadata. The table's rules follow in category order, every placement
 * drawing its origin uniformly from the current candidate cells (walkable, spawn eligible, free) and committing to the
 * occupancy grid before the next draw. A rule that runs out of candidates stops early and is reported as a
 * {@link SpawnShortfall}; each rule makes at most as many attempts as its target count.
 * <p>
 * Random draws per placement happen in a fixed order: origin, then the template's variant rolls. Weighted pools sample
 * their slot count first, then for each slot the entry, the origin and the variant.
 *
 * @author hal.hildebrand
 */
public class SpawnResolver {
    private static final Logger log = LoggerFactory.getLogger(SpawnResolver.class);

    private final RandomSource                    rng;
    private final EntityIDGenerator<LongEntityID> ids;
    private final FloorConfig                     config;

    public SpawnResolver(RandomSource rng, EntityIDGenerator<LongEntityID> ids) {
        this(rng, ids, FloorConfig.defaults());
    }

    public SpawnResolver(RandomSource rng, EntityIDGenerator<LongEntityID> ids, FloorConfig config) {
        this.rng = Objects.requireNonNull(rng, "Random source cannot be null");
        this.ids = Objects.requireNonNull(ids, "Id generator cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    public SpawnReport resolve(SpawnTable table, TerrainOracle terrain, GridOccupancy<LongEntityID> occupancy) {
        return resolve(table, new MovementValidator<>(terrain, occupancy));
    }

    /**
     * Resolve every rule of the table against the validator's terrain and occupancy. The occupancy grid is mutated as
     * placements commit.
     */
    public SpawnReport resolve(SpawnTable table, MovementValidator<LongEntityID> validator) {
        Objects.requireNonNull(table, "Spawn table cannot be null");
        var placements = new ArrayList<Placement>();
        var shortfalls = new ArrayList<SpawnShortfall>();

        if (config.isSpawnDoors()) {
            spawnDoors(validator, placements);
        }
        for (var rule : table.rules()) {
            int before = placements.size();
            int requested;
            if (rule instanceof GuaranteedRule guaranteed) {
                requested = guaranteed.count();
                resolveGuaranteed(guaranteed, validator, placements);
            } else if (rule instanceof WeightedPoolRule pool) {
                requested = resolvePool(pool, validator, placements);
            } else if (rule instanceof ChanceRule chance) {
                requested = resolveChance(chance, validator, placements);
            } else if (rule instanceof FixedPositionRule fixed) {
                requested = 1;
                resolveFixed(fixed, validator, placements);
            } else {
                throw new IllegalArgumentException("Unknown spawn rule: " + rule);
            }
            int placed = placements.size() - before;
            if (placed < requested) {
                var shortfall = new SpawnShortfall(rule, requested, placed);
                shortfalls.add(shortfall);
                log.warn("Insufficient space for {} {}: placed {} of {}", rule.category(), rule.describe(), placed,
                         requested);
            }
        }
        log.info("Spawned {} entities from {} rules, {} short", placements.size(), table.rules().size(),
                 shortfalls.size());
        return new SpawnReport(placements, shortfalls);
    }

    private void spawnDoors(MovementValidator<LongEntityID> validator, List<Placement> placements) {
        for (var door : validator.getTerrain().doors()) {
            var footprint = Footprint.single(door);
            if (!validator.getOccupancy().inBounds(door.x(), door.y())
            || !validator.getTerrain().isWalkable(door.x(), door.y())) {
                log.warn("Door cell {} is not walkable, skipping", door);
                continue;
            }
            if (!validator.getOccupancy().isFree(footprint, null)) {
                log.warn("Door cell {} already occupied, skipping", door);
                continue;
            }
            commit(new DungeonEntity.Door(), footprint, validator.getOccupancy()).ifPresent(placements::add);
        }
    }

    private void resolveGuaranteed(GuaranteedRule rule, MovementValidator<LongEntityID> validator,
                                   List<Placement> placements) {
        for (int i = 0; i < rule.count(); i++) {
            if (!placeRandom(rule.template(), validator, placements)) {
                return;
            }
        }
    }

    /**
     * Stops early once no free spawnable cell is left.
     *
     * @return target slot count, 0 for a weightless pool
     */
    private int resolvePool(WeightedPoolRule rule, MovementValidator<LongEntityID> validator,
                            List<Placement> placements) {
        if (rule.totalWeight() == 0) {
            log.debug("Pool {} has no weight, nothing to place", rule.describe());
            return 0;
        }
        int slots = rng.nextInt(rule.count());
        for (int i = 0; i < slots; i++) {
            if (validator.candidateCells(GridSize.single()).isEmpty()) {
                break;
            }
            var entry = rule.select(rng);
            placeRandom(entry.template(), validator, placements);
        }
        return slots;
    }

    private int resolveChance(ChanceRule rule, MovementValidator<LongEntityID> validator,
                              List<Placement> placements) {
        if (!rng.chance(rule.probability())) {
            return 0;
        }
        placeRandom(rule.template(), validator, placements);
        return 1;
    }

    private void resolveFixed(FixedPositionRule rule, MovementValidator<LongEntityID> validator,
                              List<Placement> placements) {
        var footprint = rule.footprint();
        if (!validator.canOccupy(footprint, null)) {
            log.warn("Rejected fixed placement {}", rule.describe());
            return;
        }
        commit(rule.template().create(rng), footprint, validator.getOccupancy()).ifPresent(placements::add);
    }

    /**
     * One attempt at a uniformly random candidate origin.
     *
     * @return false if no candidate origin was left for the template's footprint
     */
    private boolean placeRandom(EntityTemplate template, MovementValidator<LongEntityID> validator,
                                List<Placement> placements) {
        var candidates = validator.candidateCells(template.size());
        if (candidates.isEmpty()) {
            return false;
        }
        var origin = rng.pick(candidates);
        var entity = template.create(rng);
        commit(entity, new Footprint(origin, template.size()), validator.getOccupancy()).ifPresent(placements::add);
        return true;
    }

    private Optional<Placement> commit(DungeonEntity entity, Footprint footprint,
                                       GridOccupancy<LongEntityID> occupancy) {
        var id = ids.generateID();
        try {
            occupancy.occupy(footprint, id);
        } catch (OccupancyException e) {
            log.warn("Rejected {} at {}: {}", entity, footprint, e.getMessage());
            return Optional.empty();
        }
        log.debug("Placed {} {} at {}", id, entity, footprint);
        return Optional.of(new Placement(id, entity, footprint));
    }
}
