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
package com.hellblazer.delve.combat.loot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.delve.common.IntRange;
import com.hellblazer.delve.common.SplitMixRandom;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class LootTableTest {

    private static final int TRIALS = 1000;

    @Test
    void testCertainEntryAlwaysDropsFixedQuantity() {
        var table = LootTable.builder().with("ore", 1, 1, IntRange.single(2)).build();
        var rng = new SplitMixRandom(5L);

        for (int i = 0; i < 100; i++) {
            assertEquals(List.of(new LootDrop(ItemId.of("ore"), 2)), table.roll(0, rng));
        }
    }

    @Test
    void testNumeratorEqualsDenominatorAlwaysDrops() {
        var table = LootTable.builder().with("gem", 7, 7, IntRange.of(1, 3)).build();
        var rng = new SplitMixRandom(11L);

        for (int i = 0; i < TRIALS; i++) {
            var drops = table.roll(0, rng);
            assertEquals(1, drops.size());
            assertTrue(IntRange.of(1, 3).contains(drops.get(0).quantity()));
        }
    }

    @Test
    void testZeroNumeratorNeverDropsEvenWithMagicFind() {
        var table = LootTable.builder().with("nothing", 0, 10, IntRange.single(1)).build();
        var rng = new SplitMixRandom(13L);

        for (int i = 0; i < TRIALS; i++) {
            assertTrue(table.roll(350, rng).isEmpty());
        }
    }

    @Test
    void testEntriesRollIndependently() {
        var table = LootTable.builder()
                             .with("common", 1, 2, IntRange.single(1))
                             .with("rare", 1, 2, IntRange.single(1))
                             .build();
        var rng = new SplitMixRandom(17L);
        int both = 0, commonOnly = 0, rareOnly = 0, none = 0;

        for (int i = 0; i < 4000; i++) {
            var drops = table.roll(0, rng);
            boolean common = drops.stream().anyMatch(d -> d.item().value().equals("common"));
            boolean rare = drops.stream().anyMatch(d -> d.item().value().equals("rare"));
            if (common && rare) {
                both++;
            } else if (common) {
                commonOnly++;
            } else if (rare) {
                rareOnly++;
            } else {
                none++;
            }
        }
        // Each outcome should be near 1000 for independent fair coins
        for (int count : new int[] { both, commonOnly, rareOnly, none }) {
            assertTrue(count > 850 && count < 1150, "Outcome count " + count);
        }
    }

    @Test
    void testMagicFindRaisesDropRate() {
        var table = LootTable.builder().with("shard", 1, 4, IntRange.single(1)).build();
        var plain = new SplitMixRandom(23L);
        var lucky = new SplitMixRandom(23L);
        int plainDrops = 0;
        int luckyDrops = 0;

        for (int i = 0; i < 4000; i++) {
            plainDrops += table.roll(0, plain).size();
            luckyDrops += table.roll(200, lucky).size();
        }
        // 1 trial: 25%; 3 trials: 1 - 0.75^3 ~ 58%
        assertTrue(plainDrops > 850 && plainDrops < 1150, "Plain drops " + plainDrops);
        assertTrue(luckyDrops > 2150 && luckyDrops < 2500, "Lucky drops " + luckyDrops);
    }

    @Test
    void testTrialCount() {
        var rng = new SplitMixRandom(29L);
        assertEquals(1, LootTable.trials(0, rng));
        assertEquals(1, LootTable.trials(-50, rng));
        assertEquals(2, LootTable.trials(100, rng));
        assertEquals(4, LootTable.trials(300, rng));
        for (int i = 0; i < 100; i++) {
            int trials = LootTable.trials(150, rng);
            assertTrue(trials == 2 || trials == 3);
        }
    }

    @Test
    void testMagicFindKeepsLargestQuantity() {
        var table = LootTable.builder().with("coin", 1, 1, IntRange.of(1, 10)).build();
        var rng = new SplitMixRandom(31L);
        int singleTotal = 0;
        int boostedTotal = 0;

        for (int i = 0; i < 2000; i++) {
            singleTotal += table.roll(0, rng).get(0).quantity();
            boostedTotal += table.roll(400, rng).get(0).quantity();
        }
        assertTrue(boostedTotal > singleTotal, "Best-of-five should beat a single roll on average");
    }

    @Test
    void testMalformedEntriesRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LootEntry(ItemId.of("x"), 1, 0, IntRange.single(1)));
        assertThrows(IllegalArgumentException.class, () -> new LootEntry(ItemId.of("x"), 3, 2, IntRange.single(1)));
        assertThrows(IllegalArgumentException.class, () -> new LootEntry(ItemId.of("x"), -1, 2, IntRange.single(1)));
        assertThrows(IllegalArgumentException.class, () -> LootTable.builder()
                                                                    .with("dup", 1, 2, IntRange.single(1))
                                                                    .with("dup", 1, 3, IntRange.single(1)));
    }

    @Test
    void testLookupAndDropChance() {
        var table = LootTable.builder()
                             .with("coal", 1, 4, IntRange.of(1, 3))
                             .with("gold", 1, 20, IntRange.single(1))
                             .build();

        assertEquals(25.0, table.entryFor(ItemId.of("coal")).orElseThrow().dropChancePercent(), 1e-9);
        assertEquals(5.0, table.entryFor(ItemId.of("gold")).orElseThrow().dropChancePercent(), 1e-9);
        assertTrue(table.entryFor(ItemId.of("iron")).isEmpty());
        assertFalse(table.isEmpty());
        assertTrue(LootTable.empty().roll(500, new SplitMixRandom(1L)).isEmpty());
    }

    @Test
    void testJsonShape() throws Exception {
        var json = "[{\"item\":\"coal\",\"numerator\":1,\"denominator\":2,\"quantity\":{\"min\":1,\"max\":4}}]";
        var mapper = new ObjectMapper();

        var table = mapper.readValue(json, LootTable.class);

        assertEquals(LootTable.builder().with("coal", 1, 2, IntRange.of(1, 4)).build(), table);
        assertEquals(table, mapper.readValue(mapper.writeValueAsString(table), LootTable.class));
    }
}
