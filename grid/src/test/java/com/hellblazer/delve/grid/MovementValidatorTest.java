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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Validator against a mocked terrain oracle.
 *
 * @author hal.hildebrand
 */
class MovementValidatorTest {

    private TerrainOracle             terrain;
    private GridOccupancy<String>     occupancy;
    private MovementValidator<String>     validator;

    @BeforeEach
    void setUp() {
        terrain = mock(TerrainOracle.class);
        when(terrain.width()).thenReturn(4);
        when(terrain.height()).thenReturn(3);
        when(terrain.isWalkable(anyInt(), anyInt())).thenReturn(true);
        when(terrain.canSpawnEntity(anyInt(), anyInt())).thenReturn(true);
        occupancy = new GridOccupancy<>(4, 3);
        validator = new MovementValidator<>(terrain, occupancy);
    }

    @Test
    void testWalkableEmptyFootprintIsValid() {
        assertTrue(validator.canOccupy(Footprint.of(1, 1, 2, 2), null));
    }

    @Test
    void testWallInsideFootprintBlocks() {
        when(terrain.isWalkable(2, 2)).thenReturn(false);

        assertFalse(validator.canOccupy(Footprint.of(1, 1, 2, 2), null));
        assertTrue(validator.canOccupy(Footprint.of(0, 0, 2, 2), null));
    }

    @Test
    void testOutOfBoundsNeverConsultsTerrain() {
        assertFalse(validator.canOccupy(new GridPosition(3, 0), new GridSize(2, 1), null));
        verify(terrain, never()).isWalkable(4, 0);
    }

    @Test
    void testMoverOwnCellsCountAsFree() {
        occupancy.occupy(Footprint.of(0, 0, 2, 1), "cart");
        occupancy.occupy(Footprint.of(2, 1, 1, 1), "slime");

        assertTrue(validator.canOccupy(Footprint.of(1, 0, 2, 1), "cart"));
        assertFalse(validator.canOccupy(Footprint.of(1, 0, 2, 1), null));
        assertFalse(validator.canOccupy(Footprint.of(1, 1, 2, 1), "cart"), "Slime still blocks the cart");
    }

    @Test
    void testCandidateCellsRequireSpawnEligibility() {
        when(terrain.canSpawnEntity(0, 0)).thenReturn(false);
        when(terrain.isWalkable(3, 2)).thenReturn(false);
        occupancy.occupy(Footprint.of(1, 0, 1, 1), "chest");

        var candidates = validator.candidateCells(GridSize.single());

        assertEquals(12 - 3, candidates.size());
        assertFalse(candidates.contains(new GridPosition(0, 0)));
        assertFalse(candidates.contains(new GridPosition(1, 0)));
        assertFalse(candidates.contains(new GridPosition(3, 2)));
        assertEquals(new GridPosition(2, 0), candidates.get(0));
    }

    @Test
    void testCandidateOriginsForLargeFootprint() {
        occupancy.occupy(Footprint.of(1, 1, 1, 1), "pillar");

        var candidates = validator.candidateCells(new GridSize(2, 2));

        assertEquals(List.of(new GridPosition(2, 0), new GridPosition(2, 1)), candidates);
    }

    @Test
    void testMismatchedDimensionsRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> new MovementValidator<>(terrain, new GridOccupancy<String>(5, 5)));
    }
}
