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

import com.hellblazer.delve.common.IntRange;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class DamageFormulaTest {

    private final DamageFormula formula = DamageFormula.standard();

    @Test
    void testMitigationAnchors() {
        assertEquals(0.0, formula.mitigation(0));
        assertEquals(0.5, formula.mitigation(50));
        assertEquals(2.0 / 3.0, formula.mitigation(100), 1e-12);
        assertEquals(0.0, formula.mitigation(-20), "Negative defense counts as none");
    }

    @Test
    void testFinalDamageRounds() {
        assertEquals(5, formula.finalDamage(10, 50));
        assertEquals(3, formula.finalDamage(10, 100));
        assertEquals(10, formula.finalDamage(10, 0));
        assertEquals(0, formula.finalDamage(0, 10));
        assertEquals(0, formula.finalDamage(-4, 10));
    }

    @Test
    void testNoDamageFloorByDefault() {
        // 1 * (1 - 200/250) = 0.2 rounds to 0
        assertEquals(0, formula.finalDamage(1, 200));
    }

    @Test
    void testOptInDamageFloor() {
        var floored = new DamageFormula(CombatConfig.withDamageFloor());
        assertEquals(1, floored.finalDamage(1, 200));
        assertEquals(0, floored.finalDamage(0, 200), "Zero raw damage stays zero");
        assertEquals(5, floored.finalDamage(10, 50));
    }

    @Test
    void testGoldFind() {
        assertEquals(100, formula.applyGoldFind(100, 0));
        assertEquals(200, formula.applyGoldFind(100, 100));
        assertEquals(13, formula.applyGoldFind(10, 25));
        assertEquals(0, formula.applyGoldFind(10, -200));
    }

    @Test
    void testDefeatPenaltyRoundsDown() {
        assertEquals(5, formula.defeatGoldPenalty(100));
        assertEquals(0, formula.defeatGoldPenalty(19));
        assertEquals(1, formula.defeatGoldPenalty(39));
        assertEquals(0, formula.defeatGoldPenalty(0));
    }

    @Test
    void testAttackRange() {
        assertEquals(IntRange.of(15, 25), formula.attackRange(20));
        assertEquals(IntRange.of(1, 3), formula.attackRange(2));
        assertEquals(IntRange.zero(), formula.attackRange(0));
    }

    @Test
    void testCustomDefenseConstant() {
        var tough = new DamageFormula(new CombatConfig().withDefenseConstant(100));
        assertEquals(0.5, tough.mitigation(100));
        assertThrows(IllegalArgumentException.class, () -> new CombatConfig().withDefenseConstant(0));
        assertThrows(IllegalArgumentException.class, () -> new CombatConfig().withDefeatPenaltyPercent(101));
        assertThrows(IllegalArgumentException.class, () -> new CombatConfig().withAttackVariance(1.0));
    }

    @Property
    @Label("Mitigation stays in [0, 1)")
    void mitigationBounded(@ForAll int defense) {
        double m = formula.mitigation(defense);
        assertTrue(m >= 0.0);
        assertTrue(m < 1.0);
    }

    @Property
    @Label("Mitigation never decreases as defense grows")
    void mitigationMonotonic(@ForAll @net.jqwik.api.constraints.IntRange(min = 0, max = 1_000_000) int defense) {
        assertTrue(formula.mitigation(defense + 1) >= formula.mitigation(defense));
    }

    @Property
    @Label("Final damage never exceeds raw damage")
    void finalDamageAtMostRaw(@ForAll @net.jqwik.api.constraints.IntRange(min = 0, max = 100_000) int raw,
                              @ForAll @net.jqwik.api.constraints.IntRange(min = 0, max = 100_000) int defense) {
        int damage = formula.finalDamage(raw, defense);
        assertTrue(damage <= raw);
        assertTrue(damage >= 0);
    }
}
