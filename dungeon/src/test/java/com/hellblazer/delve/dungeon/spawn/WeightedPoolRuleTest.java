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

import com.hellblazer.delve.combat.mob.MobId;
import com.hellblazer.delve.common.IntRange;
import com.hellblazer.delve.common.RandomSource;
import com.hellblazer.delve.common.SplitMixRandom;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * @author hal.hildebrand
 */
class WeightedPoolRuleTest {

    private static final EntityTemplate GOBLIN = EntityTemplate.mob(MobId.GOBLIN, null);
    private static final EntityTemplate SLIME  = EntityTemplate.mob(MobId.SLIME, null);

    private static WeightedPoolRule pool(int goblinWeight, int slimeWeight) {
        return new WeightedPoolRule(SpawnCategory.WEIGHTED_MOB,
                                    List.of(new SpawnEntry(GOBLIN, goblinWeight), new SpawnEntry(SLIME, slimeWeight)),
                                    IntRange.of(3, 4));
    }

    @Test
    void testCumulativeWalkBoundaries() {
        var rule = pool(5, 3);
        var rng = mock(RandomSource.class);
        when(rng.nextInt(8)).thenReturn(0, 4, 5, 7);

        assertSame(GOBLIN, rule.select(rng).template());
        assertSame(GOBLIN, rule.select(rng).template());
        assertSame(SLIME, rule.select(rng).template());
        assertSame(SLIME, rule.select(rng).template());
    }

    @Test
    void testSelectionFollowsWeights() {
        var rule = pool(5, 3);
        var rng = new SplitMixRandom(2024L);
        int goblins = 0;
        int trials = 8000;
        for (int i = 0; i < trials; i++) {
            if (rule.select(rng).template() == GOBLIN) {
                goblins++;
            }
        }
        assertEquals(5.0 / 8.0, goblins / (double) trials, 0.03);
    }

    @Test
    void testZeroWeightEntryNeverChosen() {
        var rule = pool(0, 1);
        var rng = new SplitMixRandom(5L);
        for (int i = 0; i < 500; i++) {
            assertSame(SLIME, rule.select(rng).template());
        }
    }

    @Test
    void testWeightlessPoolCannotSelect() {
        var rule = pool(0, 0);
        assertEquals(0, rule.totalWeight());
        assertThrows(IllegalStateException.class, () -> rule.select(new SplitMixRandom(1L)));
    }

    @Test
    void testMalformedRulesRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SpawnEntry(GOBLIN, -1));
        assertThrows(IllegalArgumentException.class,
                     () -> new WeightedPoolRule(SpawnCategory.WEIGHTED_MOB, List.of(), IntRange.single(1)));
        assertThrows(IllegalArgumentException.class, () -> new ChanceRule(SpawnCategory.OBSTACLE, GOBLIN, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new GuaranteedRule(SpawnCategory.NPC, GOBLIN, -2));
        assertThrows(IllegalArgumentException.class, () -> IntRange.of(4, 3));
    }

    @Test
    void testTotalWeightMustFitAnInt() {
        assertThrows(IllegalArgumentException.class, () -> pool(Integer.MAX_VALUE, Integer.MAX_VALUE));
        assertThrows(IllegalArgumentException.class, () -> pool(Integer.MAX_VALUE, 1));

        var widest = pool(Integer.MAX_VALUE - 1, 1);
        assertEquals(Integer.MAX_VALUE, widest.totalWeight());
        assertSame(GOBLIN, widest.select(new SplitMixRandom(3L)).template());
    }
}
