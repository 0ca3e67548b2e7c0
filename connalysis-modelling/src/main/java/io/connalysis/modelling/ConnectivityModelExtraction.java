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

import io.connalysis.modelling.covariate.BipolarMatrix;
import io.connalysis.modelling.covariate.CovariateMatrix;
import io.connalysis.modelling.covariate.PairwiseDistanceMatrix;
import io.connalysis.network.AdjacencyMatrix;
import io.connalysis.network.util.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;

/// # ConnectivityModelExtraction
///
/// Typical covariate setups for [DependentConnectionProbability].
///
/// | Extraction | Covariates | Bins |
/// |------------|------------|------|
/// | [#extractDistanceDependent] | pairwise distance | `0, binSize, ..., ceil(maxRange / binSize) * binSize` |
/// | [#extractBipolarDistanceDependent] | distance, sign of target minus source depth | distance bins x {-1, 0, +1} |
///
/// When `maxRange` is null the largest pairwise distance is used; it must
/// be given when counting in more than one chunk.
public final class ConnectivityModelExtraction {

    private static final Logger logger = LogManager.getLogger(ConnectivityModelExtraction.class);

    /// Edges of the three bipolar bins, centred on -1, 0 and +1.
    public static final BinEdges BIPOLAR_BINS = BinEdges.of(-1.5, -0.5, 0.5, 1.5);

    private ConnectivityModelExtraction() {
    }

    /// Distance-dependent connection probability.
    ///
    /// @param adjacency adjacency matrix
    /// @param positions coordinates per node, aligned with the matrix
    /// @param binSize width of the distance bins
    /// @param maxRange upper end of the binned range, or null for the largest distance
    /// @param chunks number of row blocks, at least 1
    /// @return one-dimensional table over distance
    public static ConnectionProbabilityTable extractDistanceDependent(AdjacencyMatrix adjacency, double[][] positions,
                                                                      double binSize, Double maxRange, int chunks) {
        requireAligned(adjacency, positions.length, "positions");
        PairwiseDistanceMatrix distances = PairwiseDistanceMatrix.of(positions);
        BinEdges distanceBins = distanceBins(distances, binSize, maxRange, chunks);
        return extractor(chunks).extract(adjacency, List.of(distances), List.of(distanceBins));
    }

    /// Bipolar distance-dependent connection probability.
    ///
    /// @param adjacency adjacency matrix
    /// @param positions coordinates per node, aligned with the matrix
    /// @param depths depth per node, aligned with the matrix
    /// @param binSize width of the distance bins
    /// @param maxRange upper end of the binned range, or null for the largest distance
    /// @param chunks number of row blocks, at least 1
    /// @return two-dimensional table over distance and depth sign
    public static ConnectionProbabilityTable extractBipolarDistanceDependent(AdjacencyMatrix adjacency,
                                                                             double[][] positions, double[] depths,
                                                                             double binSize, Double maxRange,
                                                                             int chunks) {
        requireAligned(adjacency, positions.length, "positions");
        requireAligned(adjacency, depths.length, "depths");
        PairwiseDistanceMatrix distances = PairwiseDistanceMatrix.of(positions);
        BinEdges distanceBins = distanceBins(distances, binSize, maxRange, chunks);
        List<CovariateMatrix> covariates = List.of(distances, BipolarMatrix.of(depths));
        return extractor(chunks).extract(adjacency, covariates, List.of(distanceBins, BIPOLAR_BINS));
    }

    /// Uniformly samples `size` nodes and restricts the matrix to them.
    ///
    /// A `size` that is not positive or not smaller than the node count
    /// keeps every node.
    ///
    /// @param adjacency adjacency matrix
    /// @param size number of nodes to keep
    /// @param seed sampling seed
    /// @return selected nodes, ascending, with the induced matrix
    public static Subsample subsample(AdjacencyMatrix adjacency, int size, long seed) {
        int n = adjacency.size();
        int[] nodes = new int[n];
        for (int i = 0; i < n; i++) {
            nodes[i] = i;
        }
        if (size <= 0 || size >= n) {
            return new Subsample(nodes, adjacency);
        }
        logger.info("Subsampling to {} of {} nodes", size, n);
        UniformRandomProvider rng = RandomGenerators.create(seed);
        RandomGenerators.shuffle(nodes, rng);
        int[] selected = Arrays.copyOf(nodes, size);
        Arrays.sort(selected);
        return new Subsample(selected, adjacency.subMatrix(selected));
    }

    static BinEdges distanceBins(PairwiseDistanceMatrix distances, double binSize, Double maxRange, int chunks) {
        if (!(binSize > 0) || Double.isInfinite(binSize)) {
            throw new IllegalArgumentException("Bin size must be positive and finite: " + binSize);
        }
        if (chunks <= 0) {
            throw new IllegalArgumentException("Number of chunks must be positive: " + chunks);
        }
        double range;
        if (maxRange != null) {
            range = maxRange;
        } else if (chunks > 1) {
            throw new IllegalArgumentException("Maximum range must be specified when splitting into "
                + chunks + " chunks");
        } else {
            range = distances.maxDistance();
            if (Double.isNaN(range)) {
                range = 0.0;
            }
        }
        if (!(range >= 0) || Double.isInfinite(range)) {
            throw new IllegalArgumentException("Maximum range must be non-negative and finite: " + range);
        }
        int numBins = Math.max(1, (int) Math.ceil(range / binSize));
        return BinEdges.uniform(binSize, numBins);
    }

    private static DependentConnectionProbability extractor(int chunks) {
        return DependentConnectionProbability.builder().chunks(chunks).build();
    }

    private static void requireAligned(AdjacencyMatrix adjacency, int length, String what) {
        if (length != adjacency.size()) {
            throw new IllegalArgumentException("Got " + length + " " + what + " for "
                + adjacency.size() + " nodes");
        }
    }

    /// Nodes kept by [#subsample] and the matrix restricted to them.
    ///
    /// @param nodes original indices of the kept nodes, ascending
    /// @param adjacency induced matrix, node `i` is original node `nodes[i]`
    public record Subsample(int[] nodes, AdjacencyMatrix adjacency) {

        /// Selects the rows of a per-node table.
        ///
        /// @param values one row per original node
        /// @return rows of the kept nodes
        public double[][] select(double[][] values) {
            double[][] selected = new double[nodes.length][];
            for (int i = 0; i < nodes.length; i++) {
                selected[i] = values[nodes[i]];
            }
            return selected;
        }

        /// Selects the entries of a per-node vector.
        ///
        /// @param values one value per original node
        /// @return values of the kept nodes
        public double[] select(double[] values) {
            double[] selected = new double[nodes.length];
            for (int i = 0; i < nodes.length; i++) {
                selected[i] = values[nodes[i]];
            }
            return selected;
        }
    }
}
