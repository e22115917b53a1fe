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

/**
 * Inclusive, non-negative integer range used for spawn counts, stat rolls and loot quantities.
 *
 * @param min lower bound (inclusive)
 * @param max upper bound (inclusive)
 * @author hal.hildebrand
 */
public record IntRange(int min, int max) {

    private static final IntRange ZERO = new IntRange(0, 0);

    public IntRange {
        if (min < 0) {
            throw new IllegalArgumentException("Range lower bound must be non-negative: " + min);
        }
        if (min > max) {
            throw new IllegalArgumentException("Inverted range: " + min + "..=" + max);
        }
    }

    public static IntRange of(int min, int max) {
        return new IntRange(min, max);
    }

    public static IntRange single(int value) {
        return new IntRange(value, value);
    }

    /**
     * The empty spawn range 0..=0.
     */
    public static IntRange zero() {
        return ZERO;
    }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }

    /**
     * Number of distinct values in the range.
     */
    public long span() {
        return (long) max - min + 1;
    }

    /**
     * Scale both bounds, rounding to the nearest integer.
     */
    public IntRange scale(double multiplier) {
        if (multiplier < 0) {
            throw new IllegalArgumentException("Multiplier must be non-negative: " + multiplier);
        }
        return new IntRange((int) Math.round(min * multiplier), (int) Math.round(max * multiplier));
    }

    @Override
    public String toString() {
        return min + "..=" + max;
    }
}
