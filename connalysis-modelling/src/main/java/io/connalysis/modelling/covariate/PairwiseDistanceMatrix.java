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

package io.connalysis.modelling.covariate;

/// Euclidean distance between source and target positions, computed on access.
///
/// Coinciding positions, including every self-pair, yield `NaN` so that
/// they are never binned.
public final class PairwiseDistanceMatrix implements CovariateMatrix {

    private final double[][] sourcePositions;
    private final double[][] targetPositions;

    /// @param sourcePositions one coordinate vector per source node
    /// @param targetPositions one coordinate vector per target node, same dimensionality
    public PairwiseDistanceMatrix(double[][] sourcePositions, double[][] targetPositions) {
        int dims = -1;
        for (double[][] positions : new double[][][]{sourcePositions, targetPositions}) {
            for (double[] p : positions) {
                if (dims < 0) {
                    dims = p.length;
                } else if (p.length != dims) {
                    throw new IllegalArgumentException("Positions have mixed dimensionality: "
                        + dims + " and " + p.length);
                }
            }
        }
        this.sourcePositions = sourcePositions;
        this.targetPositions = targetPositions;
    }

    /// Distances among a single set of nodes.
    ///
    /// @param positions one coordinate vector per node
    /// @return the square distance matrix
    public static PairwiseDistanceMatrix of(double[][] positions) {
        return new PairwiseDistanceMatrix(positions, positions);
    }

    @Override
    public int rows() {
        return sourcePositions.length;
    }

    @Override
    public int columns() {
        return targetPositions.length;
    }

    @Override
    public double get(int row, int column) {
        double[] a = sourcePositions[row];
        double[] b = targetPositions[column];
        double sum = 0.0;
        for (int d = 0; d < a.length; d++) {
            double diff = a[d] - b[d];
            sum += diff * diff;
        }
        return sum == 0.0 ? Double.NaN : Math.sqrt(sum);
    }

    /// Largest finite distance over all pairs.
    ///
    /// @return the maximum distance, or `NaN` if no pair has a finite non-zero distance
    public double maxDistance() {
        double max = Double.NaN;
        for (int r = 0; r < rows(); r++) {
            for (int c = 0; c < columns(); c++) {
                double d = get(r, c);
                if (!Double.isNaN(d) && (Double.isNaN(max) || d > max)) {
                    max = d;
                }
            }
        }
        return max;
    }
}
