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

package io.connalysis.network;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CurveTest {

    @Test
    public void testRejectsDecreasingX() {
        assertThrows(IllegalArgumentException.class, () -> new Curve(new double[]{1, 0}, new double[]{0, 0}));
        assertThrows(IllegalArgumentException.class, () -> new Curve(new double[]{0, 1}, new double[]{0}));
    }

    @Test
    public void testIntegrate() {
        Curve c = new Curve(new double[]{0, 1, 2}, new double[]{0, 1, 1});
        assertEquals(1.5, c.integrate(), 1e-12);
    }

    @Test
    public void testValueAtAndTruncate() {
        Curve c = new Curve(new double[]{1, 2, 3}, new double[]{0.5, Double.NaN, 0.25});
        assertEquals(0.5, c.valueAt(1));
        assertTrue(Double.isNaN(c.valueAt(2)));
        assertTrue(Double.isNaN(c.valueAt(4)));
        Curve t = c.truncate(2);
        assertEquals(2, t.length());
        assertEquals(c.truncate(5), c);
    }

    @Test
    public void testNanMean() {
        Curve c = new Curve(new double[]{1, 2, 3}, new double[]{1.0, Double.NaN, 3.0});
        assertEquals(2.0, c.nanMean(), 1e-12);
        Curve infinite = new Curve(new double[]{1, 2, 3},
            new double[]{1.0, Double.NaN, Double.POSITIVE_INFINITY});
        assertEquals(Double.POSITIVE_INFINITY, infinite.nanMean());
        Curve none = new Curve(new double[]{1}, new double[]{Double.NaN});
        assertTrue(Double.isNaN(none.nanMean()));
    }

    @Test
    public void testNullModelCurveFromSamples() {
        NullModelCurve n = NullModelCurve.fromSamples(new double[]{1, 2, 3}, List.of(
            new double[]{1.0, 2.0, Double.NaN},
            new double[]{3.0, Double.NaN, Double.NaN}));
        assertArrayEquals(new double[]{2.0, 2.0, Double.NaN}, n.mean(), 1e-12);
        assertArrayEquals(new double[]{1.0, 0.0, Double.NaN}, n.std(), 1e-12);
        assertThrows(IllegalArgumentException.class,
            () -> NullModelCurve.fromSamples(new double[]{1, 2}, List.of(new double[]{1.0})));
    }
}
