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

import java.util.List;

/**
 * Injected source of randomness for placement and combat. Implementations must be deterministic for a given starting
 * state so that a fixed seed plus a fixed sequence of calls reproduces the same floor and the same fight.
 *
 * @author hal.hildebrand
 */
public interface RandomSource {

    /**
     * Uniform integer in [0, bound).
     *
     * @param bound exclusive upper bound, must be positive
     */
    int nextInt(int bound);

    /**
     * Uniform double in [0.0, 1.0).
     */
    double nextDouble();

    /**
     * Opaque generator state; feeding it back to the implementation resumes the exact same sequence.
     */
    long state();

    /**
     * Uniform integer in the inclusive range.
     */
    default int nextInt(IntRange range) {
        return nextInt(range.min(), range.max());
    }

    /**
     * Uniform integer in [min, max], both inclusive.
     */
    default int nextInt(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("Inverted bounds: " + min + ".." + max);
        }
        long span = (long) max - min + 1;
        if (span <= Integer.MAX_VALUE) {
            return min + nextInt((int) span);
        }
        // wider than an int bound: draw 32 bits from two 16 bit halves and reject values past the span
        long draw;
        do {
            draw = ((long) nextInt(1 << 16) << 16) | nextInt(1 << 16);
        } while (draw >= span);
        return (int) (min + draw);
    }

    /**
     * Bernoulli trial that succeeds with the given probability.
     *
     * @param probability in [0.0, 1.0]
     */
    default boolean chance(double probability) {
        if (probability < 0.0 || probability > 1.0 || Double.isNaN(probability)) {
            throw new IllegalArgumentException("Probability must be in [0, 1]: " + probability);
        }
        if (probability == 0.0) {
            return false;
        }
        if (probability == 1.0) {
            return true;
        }
        return nextDouble() < probability;
    }

    /**
     * Uniformly chosen element of a non-empty list.
     */
    default <T> T pick(List<T> choices) {
        if (choices.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return choices.get(nextInt(choices.size()));
    }
}
