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

package io.connalysis.network.richclub;

import io.connalysis.network.AdjacencyMatrix;
import io.connalysis.network.Curve;
import io.connalysis.network.Direction;
import io.connalysis.network.NullModelCurve;
import io.connalysis.network.degree.DegreeAnalyzer;
import org.apache.commons.math3.distribution.HypergeometricDistribution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/// # RichClubAnalyzer
///
/// Rich-club curves: for a degree threshold `k`, the edge density of the
/// subgraph induced by the nodes whose degree is at least `k`,
///
/// ```
///   rc(k) = E(S_k) / (|S_k| * (|S_k| - 1)),   S_k = { v : deg(v) >= k }
/// ```
///
/// Thresholds with fewer than two rich nodes have no valid denominator and
/// carry `NaN`.
///
/// ## Algorithms
///
/// | Method | Cost | Use |
/// |--------|------|-----|
/// | [#richClubCurve] | O(thresholds x nnz) | reference; weighted degree binning |
/// | [#efficientRichClubCurve] | O(nnz + N + max degree) | large graphs |
///
/// The efficient form gives every edge an effective rank
/// `min(deg(source), deg(target))`: the edge lies inside `S_k` exactly when its
/// rank is at least `k`. Histogramming edges and nodes by rank and summing
/// both histograms from the top yields all numerators and denominators in
/// one pass.
public final class RichClubAnalyzer {

    private static final Logger logger = LogManager.getLogger(RichClubAnalyzer.class);

    /// Minimum number of degree bins for weighted matrices.
    public static final int MIN_WEIGHTED_BINS = 30;

    /// Fraction of the node count used as bin count when larger than [#MIN_WEIGHTED_BINS].
    public static final double WEIGHTED_BIN_FRACTION = 0.1;

    private RichClubAnalyzer() {
    }

    /// Rich-club curve computed directly from induced subgraph sums.
    ///
    /// Boolean matrices use every integer threshold `1..max degree`.
    /// Weighted matrices bin their (weighted) degrees into equal-width bins and
    /// use the bin index as threshold; x is then the bin centre.
    ///
    /// @param matrix adjacency matrix
    /// @param direction [Direction#EFFERENT] or [Direction#AFFERENT]
    /// @return the rich-club curve
    public static Curve richClubCurve(AdjacencyMatrix matrix, Direction direction) {
        double[] degrees = DegreeAnalyzer.degreeVector(matrix, direction);
        int n = degrees.length;

        double[] x;
        int[] level = new int[n];
        int thresholds;
        if (matrix.isBoolean()) {
            int max = 0;
            for (int i = 0; i < n; i++) {
                level[i] = (int) degrees[i];
                max = Math.max(max, level[i]);
            }
            thresholds = max;
            x = new double[thresholds];
            for (int t = 0; t < thresholds; t++) {
                x[t] = t + 1;
            }
        } else {
            DegreeBins bins = DegreeBins.of(degrees);
            thresholds = bins.count();
            x = bins.centres();
            for (int i = 0; i < n; i++) {
                // bin index shifted so that threshold t covers level >= t + 1
                level[i] = bins.indexOf(degrees[i]) + 1;
            }
        }

        double[] y = new double[thresholds];
        boolean[] mask = new boolean[n];
        for (int t = 0; t < thresholds; t++) {
            int members = 0;
            for (int i = 0; i < n; i++) {
                mask[i] = level[i] >= t + 1;
                if (mask[i]) members++;
            }
            long potential = (long) members * (members - 1);
            y[t] = potential == 0 ? Double.NaN : matrix.inducedSum(mask) / potential;
        }
        return new Curve(x, y);
    }

    /// Edge-linear rich-club curve using node degrees counted as stored
    /// entries along the direction.
    ///
    /// @param matrix adjacency matrix
    /// @param direction degree direction, including [Direction#BOTH]
    /// @return curve over thresholds `0..max degree`
    public static Curve efficientRichClubCurve(AdjacencyMatrix matrix, Direction direction) {
        return efficientRichClubCurve(matrix, direction, null, false);
    }

    /// Edge-linear rich-club curve.
    ///
    /// Weighted entries count as single edges. Nodes of degree zero are
    /// counted at threshold 0 in every direction.
    ///
    /// @param matrix adjacency matrix
    /// @param direction degree direction, ignored when `degrees` is given
    /// @param degrees optional pre-computed degree per node, or null
    /// @param sparseBins if true, thresholds are only the observed degree
    ///                   values plus 0 instead of every integer up to the maximum
    /// @return curve over ascending thresholds
    /// @throws IllegalArgumentException for a null direction without degrees,
    ///         or a degree vector of the wrong length or with negative entries
    public static Curve efficientRichClubCurve(AdjacencyMatrix matrix, Direction direction,
                                               int[] degrees, boolean sparseBins) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        int n = matrix.size();
        int[] degree = degrees != null ? validatedDegrees(degrees, n) : countDegrees(matrix, direction);

        int[] thresholds = thresholds(degree, sparseBins);
        int bins = thresholds.length;

        long[] nodesAtLevel = new long[bins];
        for (int d : degree) {
            nodesAtLevel[levelOf(thresholds, d)]++;
        }
        long[] edgesAtLevel = new long[bins];
        matrix.forEachEdge((source, target, value) ->
            edgesAtLevel[levelOf(thresholds, Math.min(degree[source], degree[target]))]++);

        double[] x = new double[bins];
        double[] y = new double[bins];
        long nodes = 0;
        long edges = 0;
        for (int b = bins - 1; b >= 0; b--) {
            nodes += nodesAtLevel[b];
            edges += edgesAtLevel[b];
            long pairs = nodes * (nodes - 1);
            x[b] = thresholds[b];
            y[b] = pairs == 0 ? Double.NaN : (double) edges / pairs;
        }
        return new Curve(x, y);
    }

    /// Mean and standard deviation of the rich-club curve under a
    /// configuration-style null model.
    ///
    /// For every threshold `k` and rich node `v`, the number of connections
    /// from `v` into the rich club is modelled as hypergeometric: `out(v)`
    /// draws from the in-degree stubs of all other nodes, of which those of
    /// the other rich nodes are successes. Means and variances are summed over
    /// rich nodes and divided by the number of rich pairs.
    ///
    /// Summing variances treats nodes as independent, which overlapping
    /// neighbourhoods violate; the result is a known approximation and is kept
    /// as published.
    ///
    /// @param matrix boolean adjacency matrix
    /// @param direction [Direction#EFFERENT] or [Direction#AFFERENT]
    /// @return expected curve over thresholds `1..max degree`
    /// @throws IllegalStateException if the matrix is not boolean
    public static NullModelCurve analyticalExpectedRichClubCurve(AdjacencyMatrix matrix, Direction direction) {
        Direction.requireSingleAxis(direction);
        requireBoolean(matrix);
        int[] inDegree = matrix.columnNonZeroCounts();
        int[] outDegree = matrix.rowNonZeroCounts();
        int[] degree = direction == Direction.EFFERENT ? outDegree : inDegree;
        int n = degree.length;
        int max = Arrays.stream(degree).max().orElse(0);
        long totalIn = matrix.nonZeroCount();

        double[] x = new double[max];
        double[] mean = new double[max];
        double[] std = new double[max];
        for (int k = 1; k <= max; k++) {
            long members = 0;
            long richIn = 0;
            for (int v = 0; v < n; v++) {
                if (degree[v] >= k) {
                    members++;
                    richIn += inDegree[v];
                }
            }
            double meanSum = 0.0;
            double varianceSum = 0.0;
            for (int v = 0; v < n; v++) {
                if (degree[v] < k) {
                    continue;
                }
                long population = totalIn - inDegree[v];
                long successes = richIn - inDegree[v];
                long draws = Math.min(outDegree[v], population);
                if (population <= 0 || draws <= 0) {
                    continue;
                }
                if (population == 1) {
                    meanSum += successes;
                    continue;
                }
                HypergeometricDistribution stubs = new HypergeometricDistribution(
                    null, Math.toIntExact(population), Math.toIntExact(successes), Math.toIntExact(draws));
                meanSum += stubs.getNumericalMean();
                varianceSum += stubs.getNumericalVariance();
            }
            long pairs = members * (members - 1);
            x[k - 1] = k;
            mean[k - 1] = pairs == 0 ? Double.NaN : meanSum / pairs;
            std[k - 1] = pairs == 0 ? Double.NaN : Math.sqrt(varianceSum) / pairs;
        }
        return new NullModelCurve(x, mean, std);
    }

    /// @throws IllegalStateException if the matrix is weighted
    static void requireBoolean(AdjacencyMatrix matrix) {
        if (!matrix.isBoolean()) {
            throw new IllegalStateException("The analytical rich-club null model only supports boolean matrices");
        }
    }

    private static int[] countDegrees(AdjacencyMatrix matrix, Direction direction) {
        if (direction == null) {
            throw new IllegalArgumentException("Unknown value for argument direction: null");
        }
        switch (direction) {
            case EFFERENT:
                return matrix.rowNonZeroCounts();
            case AFFERENT:
                return matrix.columnNonZeroCounts();
            case BOTH:
                int[] out = matrix.rowNonZeroCounts();
                int[] in = matrix.columnNonZeroCounts();
                for (int i = 0; i < out.length; i++) {
                    out[i] += in[i];
                }
                return out;
            default:
                throw new IllegalArgumentException("Unknown value for argument direction: " + direction);
        }
    }

    private static int[] validatedDegrees(int[] degrees, int n) {
        if (degrees.length != n) {
            throw new IllegalArgumentException("Degree vector has " + degrees.length
                + " entries but the matrix has " + n + " nodes");
        }
        for (int d : degrees) {
            if (d < 0) {
                throw new IllegalArgumentException("Degrees must be non-negative: " + d);
            }
        }
        return degrees;
    }

    private static int[] thresholds(int[] degree, boolean sparseBins) {
        int max = 0;
        for (int d : degree) {
            max = Math.max(max, d);
        }
        if (!sparseBins) {
            int[] all = new int[max + 1];
            for (int t = 0; t <= max; t++) {
                all[t] = t;
            }
            return all;
        }
        int[] observed = Arrays.copyOf(degree, degree.length + 1);
        observed[degree.length] = 0;
        return Arrays.stream(observed).distinct().sorted().toArray();
    }

    /// Index of the largest threshold not above `value`.
    private static int levelOf(int[] thresholds, int value) {
        int i = Arrays.binarySearch(thresholds, value);
        return i >= 0 ? i : -i - 2;
    }

    /// Equal-width bins over a weighted degree range.
    static final class DegreeBins {
        private final double[] edges;

        private DegreeBins(double[] edges) {
            this.edges = edges;
        }

        static DegreeBins of(double[] degrees) {
            int n = degrees.length;
            int count = Math.max((int) (n * WEIGHTED_BIN_FRACTION), Math.min(n, MIN_WEIGHTED_BINS));
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double d : degrees) {
                min = Math.min(min, d);
                max = Math.max(max, d);
            }
            if (n == 0) {
                return new DegreeBins(new double[]{0.0});
            }
            if (max == min) {
                logger.warn("All {} nodes share degree {}; every threshold selects the whole graph", n, min);
            }
            double upper = max + 1e-6 * (max - min);
            double[] edges = new double[count + 1];
            for (int i = 0; i <= count; i++) {
                edges[i] = count == 0 ? min : min + (upper - min) * i / count;
            }
            return new DegreeBins(edges);
        }

        int count() {
            return edges.length - 1;
        }

        /// Zero-based bin of a value: the number of edges not above it, minus one.
        int indexOf(double value) {
            int below = 0;
            for (double edge : edges) {
                if (edge <= value) below++;
            }
            return below - 1;
        }

        double[] centres() {
            double[] centres = new double[count()];
            for (int i = 0; i < centres.length; i++) {
                centres[i] = 0.5 * (edges[i] + edges[i + 1]);
            }
            return centres;
        }
    }
}
