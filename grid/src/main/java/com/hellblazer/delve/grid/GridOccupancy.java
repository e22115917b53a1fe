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
package com.hellblazer.delve.grid;

import com.hellblazer.delve.geometry.Footprint;
import com.hellblazer.delve.geometry.GridPosition;
import com.hellblazer.delve.geometry.GridSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Bounded 2D map of which cells are occupied by which entity.
 * <p>
 * Storage is a flat row-major array, so {@link #isOccupied(int, int)} and {@link #entityAt(int, int)} are O(1). A
 * second map records each entity's footprint so entities can be moved or removed by reference.
 * <p>
 * Invariants maintained by every mutation:
 * <ul>
 * <li>no two entities' footprints overlap</li>
 * <li>an entity with a WxH footprint owns exactly W*H cells, all mapping to the same reference</li>
 * <li>a failed mutation leaves every cell unchanged</li>
 * </ul>
 * Occupancy is owned by a single floor and is not thread safe.
 *
 * @param <E> opaque entity reference; compared with {@link Object#equals(Object)}
 * @author hal.hildebrand
 */
public class GridOccupancy<E> {
    private static final Logger log = LoggerFactory.getLogger(GridOccupancy.class);

    private final int      width;
    private final int      height;
    private final Object[] cells;

    // Entity -> footprint, in placement order
    private final Map<E, Footprint> footprints = new LinkedHashMap<>();

    private int occupiedCells;

    public GridOccupancy(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Grid must be at least 1x1, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.cells = new Object[width * height];
    }

    /**
     * Rebuild an occupancy from a snapshot. Every recorded footprint is re-occupied in snapshot order.
     *
     * @throws OccupancyException if the snapshot contains overlapping or out-of-bounds footprints
     */
    public static <E> GridOccupancy<E> fromSnapshot(OccupancySnapshot<E> snapshot) {
        var occupancy = new GridOccupancy<E>(snapshot.width(), snapshot.height());
        for (var entry : snapshot.entries()) {
            occupancy.occupy(entry.footprint(), entry.entity());
        }
        return occupancy;
    }

    // ===== Mutation =====

    /**
     * Occupy every cell covered by the footprint with the given entity.
     *
     * @throws InvalidFootprintException  if the footprint leaves the grid
     * @throws OccupancyConflictException if any covered cell is already occupied
     * @throws IllegalArgumentException   if the entity is already placed (use {@link #move})
     */
    public void occupy(GridPosition pos, GridSize size, E entity) {
        occupy(new Footprint(pos, size), entity);
    }

    /**
     * @see #occupy(GridPosition, GridSize, Object)
     */
    public void occupy(Footprint footprint, E entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        checkBounds(footprint);
        if (footprints.containsKey(entity)) {
            throw new IllegalArgumentException(
            "Entity " + entity + " is already placed at " + footprints.get(entity) + "; move it instead");
        }
        checkFree(footprint, null);

        for (var cell : footprint.cells()) {
            cells[index(cell.x(), cell.y())] = entity;
        }
        occupiedCells += footprint.size().area();
        footprints.put(entity, footprint);
        log.debug("Occupied {} with {}", footprint, entity);
    }

    /**
     * Clear every cell covered by the footprint. Cells that are already empty are left as they are. Any entity whose
     * footprint intersects the region is released as a whole, so an entity is never left owning part of its
     * footprint.
     *
     * @return the entities released, in placement order
     * @throws InvalidFootprintException if the footprint leaves the grid
     */
    public Set<E> vacate(GridPosition pos, GridSize size) {
        return vacate(new Footprint(pos, size));
    }

    /**
     * @see #vacate(GridPosition, GridSize)
     */
    public Set<E> vacate(Footprint region) {
        checkBounds(region);
        var released = new LinkedHashSet<E>();
        for (var cell : region.cells()) {
            var occupant = occupant(cell.x(), cell.y());
            if (occupant != null) {
                released.add(occupant);
            }
        }
        for (var entity : released) {
            release(entity);
        }
        if (!released.isEmpty()) {
            log.debug("Vacated {} releasing {}", region, released);
        }
        return released;
    }

    /**
     * Remove an entity from the grid.
     *
     * @return the footprint it occupied, or empty if it was not placed
     */
    public Optional<Footprint> remove(E entity) {
        var footprint = footprints.get(entity);
        if (footprint == null) {
            return Optional.empty();
        }
        release(entity);
        log.debug("Removed {} from {}", entity, footprint);
        return Optional.of(footprint);
    }

    /**
     * Move a placed entity so its footprint starts at a new origin. The destination may overlap the entity's own
     * current cells but no other entity's.
     *
     * @return the new footprint
     * @throws IllegalArgumentException   if the entity is not placed
     * @throws InvalidFootprintException  if the destination leaves the grid
     * @throws OccupancyConflictException if another entity occupies a destination cell
     */
    public Footprint move(E entity, GridPosition newOrigin) {
        var current = footprints.get(entity);
        if (current == null) {
            throw new IllegalArgumentException("Entity " + entity + " is not placed");
        }
        var destination = current.moveTo(newOrigin);
        checkBounds(destination);
        checkFree(destination, entity);

        for (var cell : current.cells()) {
            cells[index(cell.x(), cell.y())] = null;
        }
        for (var cell : destination.cells()) {
            cells[index(cell.x(), cell.y())] = entity;
        }
        footprints.put(entity, destination);
        log.debug("Moved {} from {} to {}", entity, current, destination);
        return destination;
    }

    /**
     * Remove every entity
     */
    public void clear() {
        Arrays.fill(cells, null);
        footprints.clear();
        occupiedCells = 0;
    }

    // ===== Point queries =====

    /**
     * O(1) point lookup. Cells outside the grid are reported as unoccupied.
     */
    public boolean isOccupied(int x, int y) {
        return inBounds(x, y) && cells[index(x, y)] != null;
    }

    /**
     * O(1) point lookup of the entity covering a cell.
     */
    public Optional<E> entityAt(int x, int y) {
        if (!inBounds(x, y)) {
            return Optional.empty();
        }
        return Optional.ofNullable(occupant(x, y));
    }

    public Optional<E> entityAt(GridPosition position) {
        return entityAt(position.x(), position.y());
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * True if the footprint is inside the grid and none of its cells belongs to an entity other than
     * {@code ignoring}.
     *
     * @param ignoring entity whose own cells count as free, may be null
     */
    public boolean isFree(Footprint footprint, E ignoring) {
        if (!footprint.within(width, height)) {
            return false;
        }
        for (var cell : footprint.cells()) {
            var occupant = occupant(cell.x(), cell.y());
            if (occupant != null && !occupant.equals(ignoring)) {
                return false;
            }
        }
        return true;
    }

    // ===== Entity queries =====

    public Optional<Footprint> footprintOf(E entity) {
        return Optional.ofNullable(footprints.get(entity));
    }

    public boolean contains(E entity) {
        return footprints.containsKey(entity);
    }

    /**
     * Occupants of the cells orthogonally adjacent to the footprint, distinct and in north, east, south, west scan
     * order. Cells outside the grid are skipped.
     */
    public List<E> adjacentOccupants(Footprint footprint) {
        var result = new LinkedHashSet<E>();
        for (var neighbor : footprint.perimeterNeighbors()) {
            if (!inBounds(neighbor.x(), neighbor.y())) {
                continue;
            }
            var occupant = occupant(neighbor.x(), neighbor.y());
            if (occupant != null) {
                result.add(occupant);
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * Occupants adjacent to a placed entity, excluding the entity itself.
     */
    public List<E> adjacentOccupants(E entity) {
        var footprint = footprints.get(entity);
        if (footprint == null) {
            return List.of();
        }
        var result = adjacentOccupants(footprint);
        result.remove(entity);
        return result;
    }

    /**
     * Placed entities with their footprints, in placement order.
     */
    public Map<E, Footprint> placements() {
        return Collections.unmodifiableMap(footprints);
    }

    /**
     * Placed entities, in placement order.
     */
    public Set<E> entities() {
        return Collections.unmodifiableSet(footprints.keySet());
    }

    public int entityCount() {
        return footprints.size();
    }

    public int occupiedCellCount() {
        return occupiedCells;
    }

    public int freeCellCount() {
        return cells.length - occupiedCells;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Capture the current placements. Restoring via {@link #fromSnapshot} yields an equivalent occupancy.
     */
    public OccupancySnapshot<E> snapshot() {
        var entries = new ArrayList<OccupancySnapshot.Entry<E>>(footprints.size());
        footprints.forEach((entity, footprint) -> entries.add(new OccupancySnapshot.Entry<>(entity, footprint)));
        return new OccupancySnapshot<>(width, height, entries);
    }

    // ===== Internal =====

    private void checkBounds(Footprint footprint) {
        if (!footprint.within(width, height)) {
            throw new InvalidFootprintException(footprint, width, height);
        }
    }

    private void checkFree(Footprint footprint, E ignoring) {
        for (var cell : footprint.cells()) {
            var occupant = occupant(cell.x(), cell.y());
            if (occupant != null && !occupant.equals(ignoring)) {
                throw new OccupancyConflictException(footprint, cell, occupant);
            }
        }
    }

    private void release(E entity) {
        var footprint = footprints.remove(entity);
        for (var cell : footprint.cells()) {
            cells[index(cell.x(), cell.y())] = null;
        }
        occupiedCells -= footprint.size().area();
    }

    @SuppressWarnings("unchecked")
    private E occupant(int x, int y) {
        return (E) cells[index(x, y)];
    }

    private int index(int x, int y) {
        return y * width + x;
    }

    @Override
    public String toString() {
        return String.format("GridOccupancy[%dx%d, entities=%d, occupied=%d]", width, height, footprints.size(),
                             occupiedCells);
    }
}
