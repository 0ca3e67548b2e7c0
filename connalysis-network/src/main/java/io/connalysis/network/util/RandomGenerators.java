/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.connalysis.network.util;

import org.apache.commons.rng.JumpableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeded random sources for shuffles, null-model trials and subsampling.
 * Based on Apache Commons RNG; there is no process-wide generator, every
 * randomized operation receives its provider explicitly.
 */
public final class RandomGenerators {

    /**
     * Jumpable PRNG algorithms. Jumping lets one seed fan out into
     * non-overlapping streams for parallel trials.
     */
    public enum Algorithm {
        /**
         * XorShiro256++ algorithm - 256-bit state, period 2^256 - 1, jump size 2^128.
         * Recommendation: general purpose and the default.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * XorShiro128++ algorithm - 128-bit state, period 2^128 - 1, jump size 2^64.
         * Recommendation: when memory footprint is a concern.
         */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a new random number generator with the specified algorithm and seed.
     *
     * @param algorithm the PRNG algorithm to use
     * @param seed the seed for deterministic random generation
     * @return a jumpable uniform random provider
     */
    public static JumpableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (JumpableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /**
     * Creates a new random number generator with the default algorithm
     * (XO_SHI_RO_256_PP) and the specified seed.
     *
     * @param seed the seed for deterministic random generation
     * @return a jumpable uniform random provider
     */
    public static JumpableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Derives independent streams from one seed by repeated jumps. The same
     * seed and count always yield the same streams, in the same order.
     *
     * @param seed the seed of the parent generator
     * @param count number of streams
     * @return {@code count} non-overlapping providers
     */
    public static List<UniformRandomProvider> independentStreams(long seed, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        JumpableUniformRandomProvider parent = create(seed);
        List<UniformRandomProvider> streams = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            streams.add(parent.jump());
        }
        return streams;
    }

    /**
     * Shuffles an int array in-place using the Fisher-Yates algorithm.
     *
     * @param values the array to shuffle
     * @param rng the random number generator
     */
    public static void shuffle(int[] values, UniformRandomProvider rng) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            int temp = values[i];
            values[i] = values[j];
            values[j] = temp;
        }
    }
}
