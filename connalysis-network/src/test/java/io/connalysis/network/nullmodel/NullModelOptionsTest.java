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

package io.connalysis.network.nullmodel;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class NullModelOptionsTest {

    @Test
    public void testNormalizationNames() {
        assertEquals(Normalization.MEAN, Normalization.fromName("mean"));
        assertEquals(Normalization.STD, Normalization.fromName("STD"));
        assertThrows(IllegalArgumentException.class, () -> Normalization.fromName("zscore"));
        assertThrows(IllegalArgumentException.class, () -> Normalization.fromName(null));
    }

    @Test
    public void testNullModelNames() {
        assertEquals(NullModelType.ANALYTICAL, NullModelType.fromName("analytical"));
        assertEquals(NullModelType.SHUFFLED, NullModelType.fromName("shuffled"));
        assertThrows(IllegalArgumentException.class, () -> NullModelType.fromName("permuted"));
    }
}
