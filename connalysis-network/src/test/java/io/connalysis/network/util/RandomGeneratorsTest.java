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

import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RandomGeneratorsTest {

    @Test
    public void testSameSeedSameSequence() {
        UniformRandomProvider a = RandomGenerators.create(42L);
        UniformRandomProvider b = RandomGenerators.create(42L);
        for (int i = 0; i < 100; i++) {
            assertEquals(a.nextLong(), b.nextLong());
        }
    }

    @Test
    public void testAlgorithmsDiffer() {
        UniformRandomProvider a = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, 42L);
        UniformRandomProvider b = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_128_PP, 42L);
        assertNotEquals(a.nextLong(), b.nextLong());
    }

    @Test
    public void testIndependentStreamsAreReproducibleAndDistinct() {
        List<UniformRandomProvider> first = RandomGenerators.independentStreams(7L, 3);
        List<UniformRandomProvider> second = RandomGenerators.independentStreams(7L, 3);
        assertEquals(3, first.size());
        long[] heads = new long[3];
        for (int i = 0; i < 3; i++) {
            heads[i] = first.get(i).nextLong();
            assertEquals(heads[i], second.get(i).nextLong());
        }
        assertNotEquals(heads[0], heads[1]);
        assertNotEquals(heads[1], heads[2]);
        assertThrows(IllegalArgumentException.class, () -> RandomGenerators.independentStreams(7L, -1));
    }

    @Test
    public void testShuffleIsPermutation() {
        int[] values = new int[50];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        RandomGenerators.shuffle(values, RandomGenerators.create(3L));
        int[] sorted = values.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < sorted.length; i++) {
            assertEquals(i, sorted[i]);
        }
        assertFalse(Arrays.equals(sorted, values));
    }
}
