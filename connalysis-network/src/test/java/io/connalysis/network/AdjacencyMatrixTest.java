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

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class AdjacencyMatrixTest {

    @Test
    public void testFromEdges() {
        AdjacencyMatrix m = TestMatrices.fourNodeExample();
        assertEquals(4, m.size());
        assertEquals(4, m.nonZeroCount());
        assertTrue(m.isBoolean());
        assertTrue(m.hasEdge(0, 2));
        assertFalse(m.hasEdge(2, 0));
        assertEquals(1.0, m.value(1, 2));
        assertEquals(0.0, m.value(3, 0));
        assertArrayEquals(new double[]{2, 1, 1, 0}, m.rowSums());
        assertArrayEquals(new double[]{0, 1, 2, 1}, m.columnSums());
        assertArrayEquals(new int[]{1, 2}, m.rowIndices(0));
        assertArrayEquals(new int[]{0, 1}, m.columnIndices(2));
        assertEquals(4.0 / 16.0, m.density(), 1e-12);
    }

    @Test
    public void testDuplicateEdgeRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> AdjacencyMatrix.fromEdges(3, new int[]{0, 0}, new int[]{1, 1}));
    }

    @Test
    public void testOutOfBoundsEdgeRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> AdjacencyMatrix.fromEdges(2, new int[]{0}, new int[]{2}));
    }

    @Test
    public void testWeightedDuplicatesSummedAndZerosDropped() {
        AdjacencyMatrix m = AdjacencyMatrix.fromWeightedEdges(3,
            new int[]{0, 0, 1, 2},
            new int[]{1, 1, 2, 0},
            new double[]{1.5, 2.0, 0.0, 3.0});
        assertFalse(m.isBoolean());
        assertEquals(2, m.nonZeroCount());
        assertEquals(3.5, m.value(0, 1));
        assertFalse(m.hasEdge(1, 2));
        assertArrayEquals(new double[]{3.5, 0.0, 3.0}, m.rowSums());
        assertArrayEquals(new int[]{1, 0, 1}, m.rowNonZeroCounts());
    }

    @Test
    public void testNegativeWeightRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> AdjacencyMatrix.fromWeightedEdges(2, new int[]{0}, new int[]{1}, new double[]{-1.0}));
        assertThrows(IllegalArgumentException.class,
            () -> AdjacencyMatrix.fromWeightedEdges(2, new int[]{0}, new int[]{1}, new double[]{Double.NaN}));
    }

    @Test
    public void testFromDenseMatchesEdges() {
        boolean[][] dense = {
            {false, true, true, false},
            {false, false, true, false},
            {false, false, false, true},
            {false, false, false, false}
        };
        assertEquals(TestMatrices.fourNodeExample(), AdjacencyMatrix.fromDense(dense));
    }

    @Test
    public void testNonSquareDenseRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> AdjacencyMatrix.fromDense(new double[][]{{0.0, 1.0}}));
    }

    @Test
    public void testInducedSum() {
        AdjacencyMatrix m = TestMatrices.fourNodeExample();
        assertEquals(3.0, m.inducedSum(new boolean[]{true, true, true, false}));
        assertEquals(0.0, m.inducedSum(new boolean[]{true, false, false, true}));
    }

    @Test
    public void testSubMatrix() {
        AdjacencyMatrix sub = TestMatrices.fourNodeExample().subMatrix(new int[]{2, 3, 0});
        assertEquals(3, sub.size());
        assertEquals(2, sub.nonZeroCount());
        assertTrue(sub.hasEdge(0, 1));
        assertTrue(sub.hasEdge(2, 0));
        assertThrows(IllegalArgumentException.class,
            () -> TestMatrices.fourNodeExample().subMatrix(new int[]{1, 1}));
    }

    @Test
    public void testColumnLayoutConsistentWithRows() {
        AdjacencyMatrix m = TestMatrices.random(30, 0.2, 11L);
        int[] columnCounts = new int[m.size()];
        m.forEachEdge((source, target, value) -> {
            columnCounts[target]++;
            assertTrue(m.hasEdge(source, target));
        });
        assertArrayEquals(columnCounts, m.columnNonZeroCounts());
        for (int c = 0; c < m.size(); c++) {
            for (int source : m.columnIndices(c)) {
                assertTrue(m.hasEdge(source, c));
            }
        }
    }
}
