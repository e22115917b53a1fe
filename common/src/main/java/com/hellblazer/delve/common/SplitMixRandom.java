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
 * SplitMix64 generator with a fully exposed 64-bit state.
 * <p>
 * Unlike {@link java.util.Random}, the complete state is a single long, so a floor snapshot can record it and a restored
 * floor continues the identical sequence:
 * <pre>
 * var rng = new SplitMixRandom(42);
 * rng.nextInt(10);
 * long saved = rng.state();
 * var resumed = SplitMixRandom.restore(saved);   // same next values as rng
 * </pre>
 * Not thread safe; a generator belongs to exactly one floor.
 *
 * @author hal.hildebrand
 */
public final class SplitMixRandom implements RandomSource {
    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;
    private static final double DOUBLE_UNIT = 0x1.0p-53;

    private long state;

    public SplitMixRandom(long seed) {
        this.state = seed;
    }

    /**
     * Resume a generator from a value previously returned by {@link #state()}.
     */
    public static SplitMixRandom restore(long state) {
        return new SplitMixRandom(state);
    }

    @Override
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("Bound must be positive: " + bound);
        }
        // Lemire's multiply-shift with rejection for an unbiased result
        long random = Integer.toUnsignedLong(nextInt32());
        long product = random * bound;
        long low = product & 0xFFFFFFFFL;
        if (low < bound) {
            long threshold = (0x1_0000_0000L - bound) % bound;
            while (low < threshold) {
                random = Integer.toUnsignedLong(nextInt32());
                product = random * bound;
                low = product & 0xFFFFFFFFL;
            }
        }
        return (int) (product >>> 32);
    }

    @Override
    public double nextDouble() {
        return (nextLong() >>> 11) * DOUBLE_UNIT;
    }

    @Override
    public long state() {
        return state;
    }

    public long nextLong() {
        long z = (state += GOLDEN_GAMMA);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    private int nextInt32() {
        return (int) (nextLong() >>> 32);
    }

    @Override
    public String toString() {
        return "SplitMixRandom[state=" + Long.toHexString(state) + "]";
    }
}
