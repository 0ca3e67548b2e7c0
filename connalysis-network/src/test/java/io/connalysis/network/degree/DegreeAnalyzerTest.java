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

package io.connalysis.network.degree;

import io.connalysis.network.AdjacencyMatrix;
import io.connalysis.network.Curve;
import io.connalysis.network.Direction;
import io.connalysis.network.TestMatrices;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DegreeAnalyzerTest {

    /// Out-degrees [3, 1, 1, 1].
    private static AdjacencyMatrix oneHubThreeLeaves() {
        return AdjacencyMatrix.fromEdges(4, new int[]{0, 0, 0, 1, 2, 3}, new int[]{1, 2, 3, 0, 0, 0});
    }

    @Test
    public void testDegreeVectors() {
        AdjacencyMatrix m = TestMatrices.fourNodeExample();
        assertArrayEquals(new double[]{2, 1, 1, 0}, DegreeAnalyzer.degreeVector(m, Direction.EFFERENT));
        assertArrayEquals(new double[]{0, 1, 2, 1}, DegreeAnalyzer.degreeVector(m, Direction.AFFERENT));
        assertThrows(IllegalArgumentException.class, () -> DegreeAnalyzer.degreeVector(m, Direction.BOTH));
    }

    @Test
    public void testGiniCurveOfExampleDegrees() {
        Curve curve = DegreeAnalyzer.giniCurve(oneHubThreeLeaves(), Direction.EFFERENT);
        assertArrayEquals(new double[]{0.25, 0.5, 0.75, 1.0}, curve.x(), 1e-12);
        assertArrayEquals(new double[]{3.0 / 6, 4.0 / 6, 5.0 / 6, 1.0}, curve.y(), 1e-12);
        assertEquals(0.25, DegreeAnalyzer.giniCoefficient(curve), 1e-12);
    }

    @Test
    public void testRegularGraphHasZeroGini() {
        assertEquals(0.0, DegreeAnalyzer.giniCoefficient(TestMatrices.ring(25), Direction.EFFERENT), 1e-12);
        assertEquals(0.0, DegreeAnalyzer.giniCoefficient(TestMatrices.ring(25), Direction.AFFERENT), 1e-12);
    }

    @Test
    public void testSingleHubApproachesOne() {
        double previous = 0.0;
        for (int n : new int[]{5, 50, 500}) {
            double gini = DegreeAnalyzer.giniCoefficient(TestMatrices.outStar(n), Direction.EFFERENT);
            assertEquals(1.0 - 1.0 / n, gini, 1e-9);
            assertTrue(gini > previous);
            previous = gini;
        }
    }

    @Test
    public void testEmptyMatrixGiniIsZero() {
        AdjacencyMatrix empty = AdjacencyMatrix.fromEdges(3, new int[0], new int[0]);
        Curve curve = DegreeAnalyzer.giniCurve(empty, Direction.EFFERENT);
        assertArrayEquals(new double[]{0, 0, 0}, curve.y());
        assertEquals(0.0, DegreeAnalyzer.giniCoefficient(curve));
    }

    @Test
    public void testAnalyticalExpectedCurveEndsAtOne() {
        AdjacencyMatrix m = TestMatrices.random(60, 0.1, 3L);
        Curve expected = DegreeAnalyzer.analyticalExpectedGiniCurve(m, Direction.EFFERENT);
        assertEquals(m.size(), expected.length());
        assertEquals(1.0, expected.x(expected.length() - 1), 1e-9);
        assertEquals(1.0, expected.y(expected.length() - 1), 1e-9);
        for (int i = 1; i < expected.length(); i++) {
            assertTrue(expected.y(i) >= expected.y(i - 1) - 1e-12);
        }
    }

    @Test
    public void testNormalizedGiniSeparatesHubFromRandom() {
        double random = DegreeAnalyzer.normalizedGiniCoefficient(TestMatrices.random(200, 0.05, 5L), Direction.EFFERENT);
        double hub = DegreeAnalyzer.normalizedGiniCoefficient(TestMatrices.outStar(200), Direction.EFFERENT);
        assertTrue(Math.abs(random) < 0.1, "random graph normalized Gini should be near zero: " + random);
        assertTrue(hub > 0.3, "single hub should exceed the random expectation: " + hub);
    }

    @Test
    public void testNormalizedGiniMatchesCoefficientDifference() {
        AdjacencyMatrix m = TestMatrices.random(40, 0.15, 9L);
        Curve observed = DegreeAnalyzer.giniCurve(m, Direction.AFFERENT);
        Curve expected = DegreeAnalyzer.analyticalExpectedGiniCurve(m, Direction.AFFERENT);
        double difference = 2.0 * (DegreeAnalyzer.lorenzArea(observed) - DegreeAnalyzer.lorenzArea(expected));
        assertEquals(difference, DegreeAnalyzer.normalizedGiniCoefficient(m, Direction.AFFERENT), 1e-12);
    }
}
