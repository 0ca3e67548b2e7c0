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

import io.connalysis.network.AdjacencyMatrix;
import io.connalysis.network.Direction;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Arrays;
import java.util.Objects;

/// # DegreePreservingShuffle
///
/// Randomized control matrices that keep one degree sequence exactly and the
/// other in expectation.
///
/// ## Efferent
///
/// ```
///  for every column c (target):
///      k  = stored entries of column c
///      w_r = out-degree(r) for r != c, w_c = 0
///      new sources of c = k rows drawn without replacement, P(r) ∝ w_r
/// ```
///
/// Every column keeps its in-degree; a row is drawn in proportion to its
/// out-degree, so out-degrees match only on average. [Direction#AFFERENT]
/// swaps the roles of rows and columns.
///
/// ## Sampling
///
/// Weighted sampling without replacement uses exponential keys
/// (Efraimidis–Spirakis): each candidate gets `log(u) / w` and the `k`
/// largest keys win, which has the same distribution as drawing one item
/// at a time and renormalizing the remaining weights.
///
/// The input matrix is never modified. Stored values of a resampled column
/// (row) are reassigned to the new indices in ascending index order.
public final class DegreePreservingShuffle {

    private DegreePreservingShuffle() {
    }

    /// Generates one shuffled control matrix.
    ///
    /// @param matrix the observed adjacency matrix
    /// @param direction [Direction#EFFERENT] to preserve column counts,
    ///                  [Direction#AFFERENT] to preserve row counts
    /// @param rng seeded random source; the same seed yields the same matrix
    /// @return a new shuffled matrix with the same number of stored entries
    /// @throws IllegalArgumentException for any other direction
    /// @throws IllegalStateException if a line needs more distinct partners
    ///         than there are nodes with positive weight
    public static AdjacencyMatrix generateDegreeBasedControl(AdjacencyMatrix matrix, Direction direction,
                                                             UniformRandomProvider rng) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        Objects.requireNonNull(rng, "rng cannot be null");
        Direction.requireSingleAxis(direction);
        boolean byColumn = direction == Direction.EFFERENT;

        int n = matrix.size();
        int[] weights = byColumn ? matrix.rowNonZeroCounts() : matrix.columnNonZeroCounts();
        int nnz = matrix.nonZeroCount();
        int[] sources = new int[nnz];
        int[] targets = new int[nnz];
        double[] values = matrix.isBoolean() ? null : new double[nnz];

        KeyHeap heap = new KeyHeap(n);
        int write = 0;
        for (int line = 0; line < n; line++) {
            int k = byColumn ? matrix.columnNonZeroCount(line) : matrix.rowNonZeroCount(line);
            if (k == 0) {
                continue;
            }
            int[] partners = sampleWithoutReplacement(weights, line, k, rng, heap);
            double[] lineValues = values == null ? null
                : (byColumn ? matrix.columnValues(line) : matrix.rowValues(line));
            for (int j = 0; j < k; j++) {
                sources[write] = byColumn ? partners[j] : line;
                targets[write] = byColumn ? line : partners[j];
                if (values != null) {
                    values[write] = lineValues[j];
                }
                write++;
            }
        }
        return values == null ? AdjacencyMatrix.fromEdges(n, sources, targets)
            : AdjacencyMatrix.fromWeightedEdges(n, sources, targets, values);
    }

    /// Draws `k` distinct indices with probability proportional to `weights`,
    /// never returning `excluded`.
    ///
    /// @return the drawn indices in ascending order
    static int[] sampleWithoutReplacement(int[] weights, int excluded, int k,
                                          UniformRandomProvider rng, KeyHeap heap) {
        heap.reset(k);
        for (int i = 0; i < weights.length; i++) {
            if (i == excluded || weights[i] <= 0) {
                continue;
            }
            // 1 - nextDouble() lies in (0, 1], keeping the log finite
            double key = Math.log(1.0 - rng.nextDouble()) / weights[i];
            heap.offer(key, i);
        }
        if (heap.size() < k) {
            throw new IllegalStateException("Cannot draw " + k + " distinct partners for node " + excluded
                + ": only " + heap.size() + " candidates have a positive degree");
        }
        int[] drawn = heap.indices();
        Arrays.sort(drawn);
        return drawn;
    }

    /// Bounded min-heap keeping the `capacity` largest keys.
    static final class KeyHeap {
        private final double[] keys;
        private final int[] ids;
        private int capacity;
        private int size;

        KeyHeap(int maxCapacity) {
            this.keys = new double[maxCapacity];
            this.ids = new int[maxCapacity];
        }

        void reset(int capacity) {
            this.capacity = capacity;
            this.size = 0;
        }

        int size() {
            return size;
        }

        void offer(double key, int id) {
            if (size < capacity) {
                keys[size] = key;
                ids[size] = id;
                siftUp(size++);
            } else if (key > keys[0]) {
                keys[0] = key;
                ids[0] = id;
                siftDown(0);
            }
        }

        int[] indices() {
            return Arrays.copyOf(ids, size);
        }

        private void siftUp(int i) {
            while (i > 0) {
                int parent = (i - 1) >>> 1;
                if (keys[parent] <= keys[i]) {
                    return;
                }
                swap(i, parent);
                i = parent;
            }
        }

        private void siftDown(int i) {
            while (true) {
                int left = 2 * i + 1;
                if (left >= size) {
                    return;
                }
                int smallest = left;
                int right = left + 1;
                if (right < size && keys[right] < keys[left]) {
                    smallest = right;
                }
                if (keys[i] <= keys[smallest]) {
                    return;
                }
                swap(i, smallest);
                i = smallest;
            }
        }

        private void swap(int a, int b) {
            double k = keys[a];
            keys[a] = keys[b];
            keys[b] = k;
            int id = ids[a];
            ids[a] = ids[b];
            ids[b] = id;
        }
    }
}
