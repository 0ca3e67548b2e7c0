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

package io.connalysis.network.measures;

import io.connalysis.network.AdjacencyMatrix;
import io.connalysis.network.Direction;
import io.connalysis.network.TestMatrices;
import io.connalysis.network.nullmodel.NullModelType;
import io.connalysis.network.nullmodel.RichClubNullModel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class MeasuresTest {

    @Test
    public void testDegreeMeasure() {
        DegreeMeasure measure = new DegreeMeasure();
        assertEquals("Degree", measure.getMnemonic());
        assertEquals(0, measure.getDependencies().length);

        DegreeMeasure.DegreeResult result = measure.compute(TestMatrices.fourNodeExample(), new HashMap<>());
        assertEquals(4, result.getNodeCount());
        assertArrayEquals(new double[]{2, 1, 1, 0}, result.degrees(Direction.EFFERENT));
        assertArrayEquals(new double[]{0, 1, 2, 1}, result.degrees(Direction.AFFERENT));
        assertEquals(1.0, result.efferentStats.getMean(), 1e-12);
        assertEquals(2.0, result.afferentStats.getMax(), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> result.degrees(Direction.BOTH));
    }

    @Test
    public void testGiniMeasureUsesDegreeDependency() {
        GiniMeasure measure = new GiniMeasure();
        assertArrayEquals(new String[]{"Degree"}, measure.getDependencies());

        AdjacencyMatrix ring = TestMatrices.ring(10);
        Map<String, Object> dependencies = new HashMap<>();
        dependencies.put(DegreeMeasure.MNEMONIC, new DegreeMeasure().compute(ring, dependencies));
        GiniMeasure.GiniResult result = measure.compute(ring, dependencies);
        assertEquals(0.0, result.gini(Direction.EFFERENT), 1e-12);
        assertEquals(0.0, result.gini(Direction.AFFERENT), 1e-12);
        assertTrue(result.normalizedGini(Direction.EFFERENT) < 0.0,
            "a regular graph is more equal than a random one");
    }

    @Test
    public void testGiniMeasureWithoutDependencyResult() {
        GiniMeasure.GiniResult result = new GiniMeasure().compute(TestMatrices.outStar(10), new HashMap<>());
        assertEquals(0.9, result.efferentGini, 1e-9);
    }

    @Test
    public void testRichClubMeasurePicksNullModel() {
        RichClubMeasure measure = new RichClubMeasure();
        RichClubMeasure.RichClubResult booleanResult = measure.compute(TestMatrices.random(40, 0.15, 1L), new HashMap<>());
        assertEquals(NullModelType.ANALYTICAL, booleanResult.nullModel);
        assertEquals(Direction.EFFERENT, booleanResult.direction);

        RichClubMeasure shuffled = new RichClubMeasure(Direction.AFFERENT, null,
            RichClubNullModel.builder().trials(2).seed(5L).parallelism(1).build());
        RichClubMeasure.RichClubResult weightedResult =
            shuffled.compute(TestMatrices.randomWeighted(20, 0.2, 2L), new HashMap<>());
        assertEquals(NullModelType.SHUFFLED, weightedResult.nullModel);
        assertEquals(weightedResult.observed.length(), weightedResult.normalized.length());
    }

    @Test
    public void testRichClubMeasureRejectsBoth() {
        assertThrows(IllegalArgumentException.class,
            () -> new RichClubMeasure(Direction.BOTH, null, RichClubNullModel.defaults()));
    }
}
