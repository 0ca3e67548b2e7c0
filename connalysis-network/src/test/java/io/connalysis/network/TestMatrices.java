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

import io.connalysis.network.util.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.List;

/// Small connectomes shared by the tests.
public final class TestMatrices {

    private TestMatrices() {
    }

    /// Edges 0→1, 0→2, 1→2, 2→3; out-degrees [2, 1, 1, 0].
    public static AdjacencyMatrix fourNodeExample() {
        return AdjacencyMatrix.fromEdges(4, new int[]{0, 0, 1, 2}, new int[]{1, 2, 2, 3});
    }

    /// Directed ring: every node has in- and out-degree 1.
    public static AdjacencyMatrix ring(int n) {
        int[] sources = new int[n];
        int[] targets = new int[n];
        for (int i = 0; i < n; i++) {
            sources[i] = i;
            targets[i] = (i + 1) % n;
        }
        return AdjacencyMatrix.fromEdges(n, sources, targets);
    }

    /// Node 0 connects to every other node, nothing else.
    public static AdjacencyMatrix outStar(int n) {
        int[] sources = new int[n - 1];
        int[] targets = new int[n - 1];
        for (int i = 1; i < n; i++) {
            sources[i - 1] = 0;
            targets[i - 1] = i;
        }
        return AdjacencyMatrix.fromEdges(n, sources, targets);
    }

    /// Erdős–Rényi graph without self-loops.
    public static AdjacencyMatrix random(int n, double p, long seed) {
        UniformRandomProvider rng = RandomGenerators.create(seed);
        List<int[]> edges = new ArrayList<>();
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                if (r != c && rng.nextDouble() < p) {
                    edges.add(new int[]{r, c});
                }
            }
        }
        int[] sources = new int[edges.size()];
        int[] targets = new int[edges.size()];
        for (int k = 0; k < edges.size(); k++) {
            sources[k] = edges.get(k)[0];
            targets[k] = edges.get(k)[1];
        }
        return AdjacencyMatrix.fromEdges(n, sources, targets);
    }

    /// Erdős–Rényi graph without self-loops and with weights in [1, 5).
    public static AdjacencyMatrix randomWeighted(int n, double p, long seed) {
        UniformRandomProvider rng = RandomGenerators.create(seed);
        double[][] dense = new double[n][n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                if (r != c && rng.nextDouble() < p) {
                    dense[r][c] = 1.0 + 4.0 * rng.nextDouble();
                }
            }
        }
        return AdjacencyMatrix.fromDense(dense);
    }
}
