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

import com.hellblazer.delve.combat.mob.MobId;
import com.hellblazer.delve.common.IntRange;
import com.hellblazer.delve.dungeon.spawn.ChanceRule;
import com.hellblazer.delve.dungeon.spawn.SpawnCategory;
import com.hellblazer.delve.dungeon.spawn.WeightedPoolRule;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class FloorCatalogTest {

    private final FloorCatalog catalog = FloorCatalog.load();

    @Test
    void testStandardFloor() {
        var table = catalog.spawnTable("standard", false);

        assertEquals(4, table.rules(SpawnCategory.OBSTACLE).size());
        assertEquals(4, table.rules(SpawnCategory.GUARANTEED_MOB).size());

        var merchant = (ChanceRule) table.rules(SpawnCategory.NPC).get(0);
        assertEquals(0.33, merchant.probability());
        assertEquals("npc:" + MobId.MERCHANT, merchant.template().name());

        var pool = (WeightedPoolRule) table.rules(SpawnCategory.WEIGHTED_MOB).get(0);
        assertEquals(IntRange.of(3, 4), pool.count());
        assertEquals(5, pool.entries().get(0).weight());
        assertEquals(3, pool.entries().get(1).weight());
    }

    @Test
    void testFinalFloorHasNoStairs() {
        var table = catalog.spawnTable("standard", true);

        assertEquals(3, table.rules(SpawnCategory.OBSTACLE).size());
        assertTrue(table.rules().stream().noneMatch(r -> r.describe().startsWith("stairs")));
        assertTrue(catalog.spawnTable("plain", false).rules().stream().anyMatch(r -> r.describe().startsWith("stairs")));
    }

    @Test
    void testUnknownFloorRejected() {
        assertTrue(catalog.names().contains("plain"));
        assertThrows(IllegalArgumentException.class, () -> catalog.spawnTable("volcano", false));
    }

    @Test
    void testUnknownMobIdIsMalformedContent() {
        var json = "{\"lair\": {\"mobs\": {\"DRAGON\": 1}}}";
        assertThrows(IllegalArgumentException.class,
                     () -> FloorCatalog.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void testInvertedRangeIsMalformedContent() {
        var json = "{\"lair\": {\"rocks\": {\"min\": 4, \"max\": 1}}}";
        assertThrows(IllegalArgumentException.class,
                     () -> FloorCatalog.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    }
}
