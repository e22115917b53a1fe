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
package com.hellblazer.delve.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IntRangeTest {

    @Test
    void testInclusiveBounds() {
        var range = IntRange.of(2, 5);

        assertTrue(range.contains(2));
        assertTrue(range.contains(5));
        assertFalse(range.contains(6));
        assertEquals(4, range.span());
    }

    @Test
    void testMalformedRangesRejected() {
        assertThrows(IllegalArgumentException.class, () -> IntRange.of(5, 2), "Inverted range");
        assertThrows(IllegalArgumentException.class, () -> IntRange.of(-1, 2), "Negative range");
    }

    @Test
    void testScaleRounds() {
        assertEquals(IntRange.of(3, 8), IntRange.of(2, 5).scale(1.5));
        assertEquals(IntRange.zero(), IntRange.of(0, 0).scale(3.0));
    }
}
