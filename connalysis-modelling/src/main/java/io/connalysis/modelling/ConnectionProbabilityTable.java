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

package io.connalysis.modelling;

import java.util.Arrays;
import java.util.List;

/// # ConnectionProbabilityTable
///
/// Connected and total pair counts over a D-dimensional grid of covariate
/// bins, with the resulting connection probabilities.
///
/// ## Layout
///
/// Cells are stored row-major: the last dimension varies fastest. For a
/// distance x bipolar table with shape `[numDistBins, 3]`, cell
/// `(i, j)` sits at flat index `i * 3 + j`.
///
/// ## Empty bins
///
/// A cell without any pair has probability exactly 0.
public final class ConnectionProbabilityTable {

    private final List<BinEdges> bins;
    private final int[] shape;
    private final long[] connected;
    private final long[] total;
    private final double[] probability;

    /// Creates a table from flat row-major counts.
    ///
    /// @param bins bin edges per dimension
    /// @param connected connected pair count per cell
    /// @param total pair count per cell
    public ConnectionProbabilityTable(List<BinEdges> bins, long[] connected, long[] total) {
        this.bins = List.copyOf(bins);
        this.shape = new int[bins.size()];
        int cells = 1;
        for (int d = 0; d < shape.length; d++) {
            shape[d] = bins.get(d).binCount();
            cells = Math.multiplyExact(cells, shape[d]);
        }
        if (connected.length != cells || total.length != cells) {
            throw new IllegalArgumentException("Expected " + cells + " cells, got " + connected.length
                + " connected and " + total.length + " total counts");
        }
        this.connected = connected.clone();
        this.total = total.clone();
        this.probability = new double[cells];
        for (int i = 0; i < cells; i++) {
            if (this.connected[i] > this.total[i]) {
                throw new IllegalArgumentException("Cell " + i + " has more connected (" + this.connected[i]
                    + ") than total (" + this.total[i] + ") pairs");
            }
            probability[i] = this.total[i] == 0 ? 0.0 : (double) this.connected[i] / this.total[i];
        }
    }

    /// @return number of covariate dimensions
    public int dimensions() {
        return shape.length;
    }

    /// @return bin count per dimension
    public int[] shape() {
        return shape.clone();
    }

    /// @param dimension covariate dimension
    /// @return bin edges of that dimension
    public BinEdges bins(int dimension) {
        return bins.get(dimension);
    }

    /// @param dimension covariate dimension
    /// @return bin midpoints of that dimension
    public double[] binCentres(int dimension) {
        return bins.get(dimension).centres();
    }

    /// @return number of cells
    public int cellCount() {
        return probability.length;
    }

    /// @param index one bin index per dimension
    /// @return connection probability of the cell
    public double probability(int... index) {
        return probability[flatIndex(index)];
    }

    /// @param index one bin index per dimension
    /// @return connected pairs in the cell
    public long connectedCount(int... index) {
        return connected[flatIndex(index)];
    }

    /// @param index one bin index per dimension
    /// @return all pairs in the cell
    public long totalCount(int... index) {
        return total[flatIndex(index)];
    }

    /// @return row-major probabilities
    public double[] probabilities() {
        return probability.clone();
    }

    /// @return row-major connected counts
    public long[] connectedCounts() {
        return connected.clone();
    }

    /// @return row-major total counts
    public long[] totalCounts() {
        return total.clone();
    }

    /// Probabilities along the first dimension with every other index fixed.
    ///
    /// @param fixed bin indices of dimensions 1 to D-1
    /// @return one probability per bin of dimension 0
    public double[] probabilitiesAlongFirst(int... fixed) {
        if (fixed.length != shape.length - 1) {
            throw new IllegalArgumentException("Expected " + (shape.length - 1) + " fixed indices, got " + fixed.length);
        }
        int[] index = new int[shape.length];
        System.arraycopy(fixed, 0, index, 1, fixed.length);
        double[] values = new double[shape[0]];
        for (int i = 0; i < values.length; i++) {
            index[0] = i;
            values[i] = probability[flatIndex(index)];
        }
        return values;
    }

    int flatIndex(int... index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " indices, got " + index.length);
        }
        int flat = 0;
        for (int d = 0; d < shape.length; d++) {
            if (index[d] < 0 || index[d] >= shape[d]) {
                throw new IndexOutOfBoundsException("Bin index " + index[d] + " out of range for dimension "
                    + d + " with " + shape[d] + " bins");
            }
            flat = flat * shape[d] + index[d];
        }
        return flat;
    }

    @Override
    public String toString() {
        return "ConnectionProbabilityTable{shape=" + Arrays.toString(shape)
            + ", pairs=" + Arrays.stream(total).sum()
            + ", connected=" + Arrays.stream(connected).sum() + "}";
    }
}
