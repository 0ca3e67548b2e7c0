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

/// Strictly increasing bin boundaries for one covariate.
///
/// Bin `i` covers `edges[i] <= v < edges[i + 1]`; the last bin also
/// includes its upper edge so the maximum value is always captured:
///
/// ```
///   edges   0      100     200     300
///           [───────)[──────)[──────]
///   bin        0        1       2
/// ```
public final class BinEdges {

    private final double[] edges;

    private BinEdges(double[] edges) {
        if (edges.length < 2) {
            throw new IllegalArgumentException("At least two bin edges required, got " + edges.length);
        }
        for (int i = 0; i < edges.length; i++) {
            if (!Double.isFinite(edges[i])) {
                throw new IllegalArgumentException("Bin edge " + i + " is not finite: " + edges[i]);
            }
            if (i > 0 && edges[i] <= edges[i - 1]) {
                throw new IllegalArgumentException("Bin edges must be strictly increasing: "
                    + edges[i - 1] + " then " + edges[i]);
            }
        }
        this.edges = edges;
    }

    /// @param edges boundaries in strictly increasing order
    /// @return bin edges over the given boundaries
    public static BinEdges of(double... edges) {
        return new BinEdges(edges.clone());
    }

    /// Equal-width bins `0, binSize, ..., numBins * binSize`.
    ///
    /// @param binSize width of each bin
    /// @param numBins number of bins
    /// @return bin edges starting at zero
    public static BinEdges uniform(double binSize, int numBins) {
        if (!(binSize > 0) || Double.isInfinite(binSize)) {
            throw new IllegalArgumentException("Bin size must be positive and finite: " + binSize);
        }
        if (numBins < 1) {
            throw new IllegalArgumentException("At least one bin required, got " + numBins);
        }
        double[] edges = new double[numBins + 1];
        for (int i = 0; i <= numBins; i++) {
            edges[i] = i * binSize;
        }
        return new BinEdges(edges);
    }

    /// @return number of bins, one less than the number of edges
    public int binCount() {
        return edges.length - 1;
    }

    /// @return copy of the boundaries
    public double[] edges() {
        return edges.clone();
    }

    /// @param i edge index
    /// @return the boundary at `i`
    public double edge(int i) {
        return edges[i];
    }

    /// @return lowest boundary
    public double lower() {
        return edges[0];
    }

    /// @return highest boundary
    public double upper() {
        return edges[edges.length - 1];
    }

    /// Index of the bin holding `value`.
    ///
    /// @param value covariate value
    /// @return bin index, or -1 for NaN and values outside `[lower, upper]`
    public int binOf(double value) {
        if (Double.isNaN(value) || value < edges[0] || value > edges[edges.length - 1]) {
            return -1;
        }
        int pos = Arrays.binarySearch(edges, value);
        if (pos >= 0) {
            return Math.min(pos, edges.length - 2);
        }
        return -pos - 2;
    }

    /// @return midpoint of each bin
    public double[] centres() {
        double[] centres = new double[binCount()];
        for (int i = 0; i < centres.length; i++) {
            centres[i] = 0.5 * (edges[i] + edges[i + 1]);
        }
        return centres;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinEdges)) return false;
        return Arrays.equals(edges, ((BinEdges) o).edges);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(edges);
    }

    @Override
    public String toString() {
        return "BinEdges" + Arrays.toString(edges);
    }
}
