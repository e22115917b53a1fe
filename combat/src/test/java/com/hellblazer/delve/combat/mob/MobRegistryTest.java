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
package com.hellblazer.delve.combat.mob;

import com.hellblazer.delve.common.IntRange;
import com.hellblazer.delve.geometry.GridSize;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class MobRegistryTest {

    @Test
    void testBundledContentCoversEveryMob() {
        var registry = MobRegistry.load();

        assertEquals(EnumSet.allOf(MobId.class), EnumSet.copyOf(registry.ids()));
        assertEquals("Goblin", registry.spec(MobId.GOBLIN).name());
        assertEquals(MobQuality.BOSS, registry.spec(MobId.DWARF_KING).quality());
        assertEquals(GridSize.single(), registry.spec(MobId.SLIME).size());
    }

    @Test
    void testMerchantIsHarmless() {
        var merchant = MobRegistry.load().spec(MobId.MERCHANT);

        assertEquals(IntRange.zero(), merchant.attack());
        assertEquals(IntRange.zero(), merchant.defense());
        assertEquals(IntRange.zero(), merchant.droppedGold());
        assertTrue(merchant.loot().isEmpty());
    }

    @Test
    void testUnknownMobIdRejected() {
        var json = """
                   [{"id":"DRAGON","name":"Dragon","maxHealth":{"min":1,"max":2},"attack":{"min":1,"max":2},
                     "defense":{"min":1,"max":2},"droppedGold":{"min":1,"max":2},"droppedXp":{"min":1,"max":2}}]
                   """;
        var in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalArgumentException.class, () -> MobRegistry.fromJson(in));
    }

    @Test
    void testInvertedRangeRejected() {
        var json = """
                   [{"id":"SLIME","name":"Slime","maxHealth":{"min":5,"max":2},"attack":{"min":1,"max":2},
                     "defense":{"min":1,"max":2},"droppedGold":{"min":1,"max":2},"droppedXp":{"min":1,"max":2}}]
                   """;
        var in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalArgumentException.class, () -> MobRegistry.fromJson(in));
    }

    @Test
    void testMissingSpecRejected() {
        var registry = new MobRegistry(java.util.List.of());
        assertThrows(IllegalArgumentException.class, () -> registry.spec(MobId.SLIME));
        assertTrue(registry.find(MobId.SLIME).isEmpty());
    }

    @Test
    void testMultiplierScalesStats() {
        var goblin = MobRegistry.load().spec(MobId.GOBLIN);
        var scaled = goblin.withMultiplier(2.0);

        assertEquals(goblin.maxHealth().min() * 2, scaled.maxHealth().min());
        assertEquals(goblin.attack().max() * 2, scaled.attack().max());
        assertEquals(goblin.name(), scaled.name());
        assertEquals(MobQuality.BOSS, goblin.withQuality(MobQuality.BOSS).quality());
        assertEquals("Elite Goblin", goblin.withName("Elite Goblin").name());
    }
}
