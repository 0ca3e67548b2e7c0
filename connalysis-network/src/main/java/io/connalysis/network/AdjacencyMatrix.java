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

import java.util.Arrays;
import java.util.Objects;

/// # AdjacencyMatrix
///
/// Immutable sparse square adjacency matrix of a directed graph.
///
/// ## Layout
///
/// Rows are sources and columns are targets. The matrix keeps both a
/// compressed-row and a compressed-column index over the same entries:
///
/// ```
///   row layout                     column layout
///   rowPointers[N+1]               columnPointers[N+1]
///   rowTargets[nnz]  (sorted)      columnSources[nnz]  (sorted)
///   rowValues[nnz]   (weighted)    columnValues[nnz]   (weighted)
/// ```
///
/// Row slices (efferent neighbourhoods) and column slices (afferent
/// neighbourhoods) are therefore both O(1) to locate, and each operation picks
/// the layout it needs instead of converting formats on the fly.
///
/// ## Boolean vs. weighted
///
/// A boolean matrix stores no values; every stored entry counts as 1. A
/// weighted matrix stores a strictly positive value per entry. Explicit
/// zeros are dropped on construction.
///
/// ## Usage
/// ```java
/// AdjacencyMatrix m = AdjacencyMatrix.fromEdges(4,
///     new int[]{0, 0, 1, 2},
///     new int[]{1, 2, 2, 3});
/// int[] outDegrees = m.rowNonZeroCounts();   // [2, 1, 1, 0]
/// ```
public final class AdjacencyMatrix {

    /// Visitor for stored matrix entries.
    @FunctionalInterface
    public interface EntryVisitor {
        /// @param source row index
        /// @param target column index
        /// @param value stored value, 1.0 for boolean matrices
        void visit(int source, int target, double value);
    }

    private final int size;
    private final boolean booleanValued;

    private final int[] rowPointers;
    private final int[] rowTargets;
    private final double[] rowValues;

    private final int[] columnPointers;
    private final int[] columnSources;
    private final double[] columnValues;

    private AdjacencyMatrix(int size, int[] rowPointers, int[] rowTargets, double[] rowValues) {
        this.size = size;
        this.booleanValued = rowValues == null;
        this.rowPointers = rowPointers;
        this.rowTargets = rowTargets;
        this.rowValues = rowValues;

        int nnz = rowTargets.length;
        this.columnPointers = new int[size + 1];
        for (int k = 0; k < nnz; k++) {
            columnPointers[rowTargets[k] + 1]++;
        }
        for (int c = 0; c < size; c++) {
            columnPointers[c + 1] += columnPointers[c];
        }
        this.columnSources = new int[nnz];
        this.columnValues = booleanValued ? null : new double[nnz];
        int[] cursor = Arrays.copyOf(columnPointers, size);
        // scanning rows in order keeps sources sorted within each column
        for (int r = 0; r < size; r++) {
            for (int k = rowPointers[r]; k < rowPointers[r + 1]; k++) {
                int slot = cursor[rowTargets[k]]++;
                columnSources[slot] = r;
                if (!booleanValued) {
                    columnValues[slot] = rowValues[k];
                }
            }
        }
    }

    /// Creates a boolean matrix from an edge list.
    ///
    /// @param size number of nodes
    /// @param sources source node of every edge
    /// @param targets target node of every edge
    /// @return the boolean adjacency matrix
    /// @throws IllegalArgumentException on mismatched arrays, out-of-range
    ///         indices or duplicate edges
    public static AdjacencyMatrix fromEdges(int size, int[] sources, int[] targets) {
        return build(size, sources, targets, null);
    }

    /// Creates a weighted matrix from an edge list. Duplicate coordinates are
    /// summed and zero weights are dropped.
    ///
    /// @param size number of nodes
    /// @param sources source node of every edge
    /// @param targets target node of every edge
    /// @param weights non-negative weight of every edge
    /// @return the weighted adjacency matrix
    /// @throws IllegalArgumentException on mismatched arrays, out-of-range
    ///         indices or negative/non-finite weights
    public static AdjacencyMatrix fromWeightedEdges(int size, int[] sources, int[] targets, double[] weights) {
        Objects.requireNonNull(weights, "weights cannot be null");
        return build(size, sources, targets, weights);
    }

    /// Creates a boolean matrix from a dense square array.
    ///
    /// @param dense `dense[source][target]`
    /// @return the boolean adjacency matrix
    public static AdjacencyMatrix fromDense(boolean[][] dense) {
        int n = requireSquare(dense.length, r -> dense[r].length);
        int nnz = 0;
        for (boolean[] row : dense) {
            for (boolean b : row) {
                if (b) nnz++;
            }
        }
        int[] sources = new int[nnz];
        int[] targets = new int[nnz];
        int k = 0;
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                if (dense[r][c]) {
                    sources[k] = r;
                    targets[k++] = c;
                }
            }
        }
        return fromEdges(n, sources, targets);
    }

    /// Creates a weighted matrix from a dense square array; zeros are not stored.
    ///
    /// @param dense `dense[source][target]`
    /// @return the weighted adjacency matrix
    public static AdjacencyMatrix fromDense(double[][] dense) {
        int n = requireSquare(dense.length, r -> dense[r].length);
        int nnz = 0;
        for (double[] row : dense) {
            for (double v : row) {
                if (v != 0.0) nnz++;
            }
        }
        int[] sources = new int[nnz];
        int[] targets = new int[nnz];
        double[] weights = new double[nnz];
        int k = 0;
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                if (dense[r][c] != 0.0) {
                    sources[k] = r;
                    targets[k] = c;
                    weights[k++] = dense[r][c];
                }
            }
        }
        return fromWeightedEdges(n, sources, targets, weights);
    }

    private interface RowLength {
        int of(int row);
    }

    private static int requireSquare(int rows, RowLength rowLength) {
        for (int r = 0; r < rows; r++) {
            if (rowLength.of(r) != rows) {
                throw new IllegalArgumentException("Adjacency matrix must be square, row " + r
                    + " has " + rowLength.of(r) + " columns but there are " + rows + " rows");
            }
        }
        return rows;
    }

    private static AdjacencyMatrix build(int size, int[] sources, int[] targets, double[] weights) {
        Objects.requireNonNull(sources, "sources cannot be null");
        Objects.requireNonNull(targets, "targets cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative: " + size);
        }
        if (sources.length != targets.length || (weights != null && weights.length != sources.length)) {
            throw new IllegalArgumentException("Edge arrays differ in length: sources=" + sources.length
                + ", targets=" + targets.length + (weights != null ? ", weights=" + weights.length : ""));
        }
        int m = sources.length;
        for (int k = 0; k < m; k++) {
            if (sources[k] < 0 || sources[k] >= size || targets[k] < 0 || targets[k] >= size) {
                throw new IllegalArgumentException("Edge (" + sources[k] + ", " + targets[k]
                    + ") out of bounds for size " + size);
            }
            if (weights != null && (!(weights[k] >= 0.0) || Double.isInfinite(weights[k]))) {
                throw new IllegalArgumentException("Edge weights must be finite and non-negative: " + weights[k]);
            }
        }

        // bucket by target, then by source: a stable two-pass counting sort
        int[] byTargetPointers = countingPointers(size, targets);
        int[] byTarget = new int[m];
        int[] cursor = Arrays.copyOf(byTargetPointers, size);
        for (int k = 0; k < m; k++) {
            byTarget[cursor[targets[k]]++] = k;
        }
        int[] rowPointers = countingPointers(size, sources);
        int[] order = new int[m];
        cursor = Arrays.copyOf(rowPointers, size);
        for (int k : byTarget) {
            order[cursor[sources[k]]++] = k;
        }

        int[] rowTargets = new int[m];
        double[] rowValues = weights == null ? null : new double[m];
        int[] compactPointers = new int[size + 1];
        int write = 0;
        for (int r = 0; r < size; r++) {
            int lastTarget = -1;
            for (int p = rowPointers[r]; p < rowPointers[r + 1]; p++) {
                int k = order[p];
                int target = targets[k];
                if (target == lastTarget) {
                    if (weights == null) {
                        throw new IllegalArgumentException("Duplicate edge (" + r + ", " + target + ")");
                    }
                    rowValues[write - 1] += weights[k];
                    continue;
                }
                rowTargets[write] = target;
                if (weights != null) {
                    rowValues[write] = weights[k];
                }
                write++;
                lastTarget = target;
            }
            compactPointers[r + 1] = write;
        }

        if (weights != null) {
            // drop explicit zeros left after summation
            int kept = 0;
            int start = 0;
            for (int r = 0; r < size; r++) {
                int end = compactPointers[r + 1];
                for (int p = start; p < end; p++) {
                    if (rowValues[p] != 0.0) {
                        rowTargets[kept] = rowTargets[p];
                        rowValues[kept++] = rowValues[p];
                    }
                }
                start = end;
                compactPointers[r + 1] = kept;
            }
            write = kept;
        }

        return new AdjacencyMatrix(size, compactPointers,
            Arrays.copyOf(rowTargets, write),
            rowValues == null ? null : Arrays.copyOf(rowValues, write));
    }

    private static int[] countingPointers(int size, int[] keys) {
        int[] pointers = new int[size + 1];
        for (int key : keys) {
            pointers[key + 1]++;
        }
        for (int i = 0; i < size; i++) {
            pointers[i + 1] += pointers[i];
        }
        return pointers;
    }

    /// @return number of nodes (rows and columns)
    public int size() {
        return size;
    }

    /// @return number of stored entries
    public int nonZeroCount() {
        return rowTargets.length;
    }

    /// @return true if this matrix stores no values (all entries are 1)
    public boolean isBoolean() {
        return booleanValued;
    }

    /// Fraction of stored entries among the `N * (N - 1)` off-diagonal pairs.
    ///
    /// @return the edge density, 0 for matrices with fewer than two nodes
    public double density() {
        long pairs = (long) size * (size - 1);
        return pairs == 0 ? 0.0 : (double) nonZeroCount() / pairs;
    }

    /// @param row source node
    /// @return number of stored entries in the row
    public int rowNonZeroCount(int row) {
        return rowPointers[row + 1] - rowPointers[row];
    }

    /// @param column target node
    /// @return number of stored entries in the column
    public int columnNonZeroCount(int column) {
        return columnPointers[column + 1] - columnPointers[column];
    }

    /// @param row source node
    /// @return sorted targets of the row (a copy)
    public int[] rowIndices(int row) {
        return Arrays.copyOfRange(rowTargets, rowPointers[row], rowPointers[row + 1]);
    }

    /// @param column target node
    /// @return sorted sources of the column (a copy)
    public int[] columnIndices(int column) {
        return Arrays.copyOfRange(columnSources, columnPointers[column], columnPointers[column + 1]);
    }

    /// @param row source node
    /// @return values of the row aligned with [#rowIndices(int)]
    public double[] rowValues(int row) {
        if (booleanValued) {
            double[] ones = new double[rowNonZeroCount(row)];
            Arrays.fill(ones, 1.0);
            return ones;
        }
        return Arrays.copyOfRange(rowValues, rowPointers[row], rowPointers[row + 1]);
    }

    /// @param column target node
    /// @return values of the column aligned with [#columnIndices(int)]
    public double[] columnValues(int column) {
        if (booleanValued) {
            double[] ones = new double[columnNonZeroCount(column)];
            Arrays.fill(ones, 1.0);
            return ones;
        }
        return Arrays.copyOfRange(columnValues, columnPointers[column], columnPointers[column + 1]);
    }

    /// Looks up a single entry by binary search in the row.
    ///
    /// @param source row index
    /// @param target column index
    /// @return the stored value, or 0.0 if there is no entry
    public double value(int source, int target) {
        Objects.checkIndex(source, size);
        Objects.checkIndex(target, size);
        int p = Arrays.binarySearch(rowTargets, rowPointers[source], rowPointers[source + 1], target);
        if (p < 0) {
            return 0.0;
        }
        return booleanValued ? 1.0 : rowValues[p];
    }

    /// @param source row index
    /// @param target column index
    /// @return true if an entry is stored at (source, target)
    public boolean hasEdge(int source, int target) {
        Objects.checkIndex(source, size);
        Objects.checkIndex(target, size);
        return Arrays.binarySearch(rowTargets, rowPointers[source], rowPointers[source + 1], target) >= 0;
    }

    /// Visits all entries of one row in target order.
    ///
    /// @param row source node
    /// @param visitor entry visitor
    public void forEachInRow(int row, EntryVisitor visitor) {
        for (int k = rowPointers[row]; k < rowPointers[row + 1]; k++) {
            visitor.visit(row, rowTargets[k], booleanValued ? 1.0 : rowValues[k]);
        }
    }

    /// Visits all entries in row-major order.
    ///
    /// @param visitor entry visitor
    public void forEachEdge(EntryVisitor visitor) {
        for (int r = 0; r < size; r++) {
            forEachInRow(r, visitor);
        }
    }

    /// @return stored entries per row (out-degree)
    public int[] rowNonZeroCounts() {
        int[] counts = new int[size];
        for (int r = 0; r < size; r++) {
            counts[r] = rowPointers[r + 1] - rowPointers[r];
        }
        return counts;
    }

    /// @return stored entries per column (in-degree)
    public int[] columnNonZeroCounts() {
        int[] counts = new int[size];
        for (int c = 0; c < size; c++) {
            counts[c] = columnPointers[c + 1] - columnPointers[c];
        }
        return counts;
    }

    /// @return sum of values per row
    public double[] rowSums() {
        double[] sums = new double[size];
        for (int r = 0; r < size; r++) {
            if (booleanValued) {
                sums[r] = rowPointers[r + 1] - rowPointers[r];
            } else {
                for (int k = rowPointers[r]; k < rowPointers[r + 1]; k++) {
                    sums[r] += rowValues[k];
                }
            }
        }
        return sums;
    }

    /// @return sum of values per column
    public double[] columnSums() {
        double[] sums = new double[size];
        for (int c = 0; c < size; c++) {
            if (booleanValued) {
                sums[c] = columnPointers[c + 1] - columnPointers[c];
            } else {
                for (int k = columnPointers[c]; k < columnPointers[c + 1]; k++) {
                    sums[c] += columnValues[k];
                }
            }
        }
        return sums;
    }

    /// Sums the submatrix induced by a node mask without materializing it.
    ///
    /// @param mask `mask[i]` selects node i as both source and target
    /// @return sum of values of entries whose endpoints are both selected
    public double inducedSum(boolean[] mask) {
        if (mask.length != size) {
            throw new IllegalArgumentException("Mask length " + mask.length + " does not match size " + size);
        }
        double sum = 0.0;
        for (int r = 0; r < size; r++) {
            if (!mask[r]) {
                continue;
            }
            for (int k = rowPointers[r]; k < rowPointers[r + 1]; k++) {
                if (mask[rowTargets[k]]) {
                    sum += booleanValued ? 1.0 : rowValues[k];
                }
            }
        }
        return sum;
    }

    /// Restricts the matrix to a subset of nodes, renumbered in the given order.
    ///
    /// @param nodes distinct node indices to keep
    /// @return the induced submatrix
    public AdjacencyMatrix subMatrix(int[] nodes) {
        int[] newIndex = new int[size];
        Arrays.fill(newIndex, -1);
        for (int i = 0; i < nodes.length; i++) {
            Objects.checkIndex(nodes[i], size);
            if (newIndex[nodes[i]] >= 0) {
                throw new IllegalArgumentException("Duplicate node in selection: " + nodes[i]);
            }
            newIndex[nodes[i]] = i;
        }
        int count = 0;
        for (int node : nodes) {
            for (int k = rowPointers[node]; k < rowPointers[node + 1]; k++) {
                if (newIndex[rowTargets[k]] >= 0) count++;
            }
        }
        int[] sources = new int[count];
        int[] targets = new int[count];
        double[] weights = booleanValued ? null : new double[count];
        int w = 0;
        for (int node : nodes) {
            for (int k = rowPointers[node]; k < rowPointers[node + 1]; k++) {
                int target = newIndex[rowTargets[k]];
                if (target >= 0) {
                    sources[w] = newIndex[node];
                    targets[w] = target;
                    if (weights != null) {
                        weights[w] = rowValues[k];
                    }
                    w++;
                }
            }
        }
        return booleanValued ? fromEdges(nodes.length, sources, targets)
            : fromWeightedEdges(nodes.length, sources, targets, weights);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AdjacencyMatrix)) return false;
        AdjacencyMatrix that = (AdjacencyMatrix) o;
        return size == that.size
            && booleanValued == that.booleanValued
            && Arrays.equals(rowPointers, that.rowPointers)
            && Arrays.equals(rowTargets, that.rowTargets)
            && Arrays.equals(rowValues, that.rowValues);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(size, booleanValued);
        result = 31 * result + Arrays.hashCode(rowPointers);
        result = 31 * result + Arrays.hashCode(rowTargets);
        result = 31 * result + Arrays.hashCode(rowValues);
        return result;
    }

    @Override
    public String toString() {
        return String.format("AdjacencyMatrix{size=%d, nnz=%d, %s}",
            size, nonZeroCount(), booleanValued ? "boolean" : "weighted");
    }
}
