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
import org.apache.commons.math3.distribution.BinomialDistribution;

import java.util.Arrays;

/// # DegreeAnalyzer
///
/// Degree vectors and Lorenz-curve inequality statistics of a connectome.
///
/// ## Gini curve
///
/// Degrees are sorted from highest to lowest and accumulated, so point `i`
/// of the curve is the share of all connections held by the `i + 1` most
/// connected nodes, placed at rank `(i + 1) / N`:
///
/// ```
///  share
///   1.0 ┤            ●───●
///       │       ●───╯
///   0.5 ●──────╯            degrees [3, 1, 1, 1]
///       │
///   0.0 ┼────┬────┬────┬────┤ rank
///       0   .25  .50  .75  1.0
/// ```
///
/// ## Gini coefficient
///
/// With `A` the area under the curve (including the origin), the
/// coefficient is `2A - 1`: 0 for a regular graph, `1 - 1/N` when a single
/// node holds every connection.
///
/// ## Null model
///
/// [#analyticalExpectedGiniCurve] evaluates the same construction for an
/// Erdős–Rényi graph of equal density, where every degree is
/// `Binomial(N - 1, p)`, without sampling.
public final class DegreeAnalyzer {

    private DegreeAnalyzer() {
    }

    /// Per-node sum of the matrix along the given axis.
    ///
    /// @param matrix adjacency matrix
    /// @param direction [Direction#EFFERENT] for row sums, [Direction#AFFERENT] for column sums
    /// @return the degree vector, one entry per node
    /// @throws IllegalArgumentException for any other direction
    public static double[] degreeVector(AdjacencyMatrix matrix, Direction direction) {
        Direction.requireSingleAxis(direction);
        return direction == Direction.EFFERENT ? matrix.rowSums() : matrix.columnSums();
    }

    /// Cumulative degree share by rank, starting from the highest degree.
    ///
    /// @param matrix adjacency matrix
    /// @param direction degree direction
    /// @return curve with x = `(i + 1) / N` and y = cumulative share; all zeros
    ///         when the matrix has no entries
    public static Curve giniCurve(AdjacencyMatrix matrix, Direction direction) {
        return giniCurve(degreeVector(matrix, direction));
    }

    /// Cumulative degree share by rank for an already computed degree vector.
    ///
    /// @param degreeVector one non-negative degree per node
    /// @return curve with x = `(i + 1) / N` and y = cumulative share
    public static Curve giniCurve(double[] degreeVector) {
        double[] degrees = degreeVector.clone();
        int n = degrees.length;
        Arrays.sort(degrees);
        double total = 0.0;
        for (double d : degrees) {
            total += d;
        }

        double[] rank = new double[n];
        double[] share = new double[n];
        double cumulative = 0.0;
        for (int i = 0; i < n; i++) {
            cumulative += degrees[n - 1 - i];
            rank[i] = (double) (i + 1) / n;
            share[i] = total > 0 ? cumulative / total : 0.0;
        }
        return new Curve(rank, share);
    }

    /// Gini coefficient of the degree distribution.
    ///
    /// @param matrix adjacency matrix
    /// @param direction degree direction
    /// @return value in [0, 1), 0 for perfectly regular (or empty) graphs
    public static double giniCoefficient(AdjacencyMatrix matrix, Direction direction) {
        return giniCoefficient(giniCurve(matrix, direction));
    }

    /// Gini coefficient of a curve produced by [#giniCurve(double[])].
    ///
    /// @param curve cumulative degree share curve
    /// @return value in [0, 1)
    public static double giniCoefficient(Curve curve) {
        if (curve.length() == 0 || curve.y(curve.length() - 1) == 0.0) {
            return 0.0;
        }
        return 2.0 * lorenzArea(curve) - 1.0;
    }

    /// Expected Gini curve of an Erdős–Rényi graph with the same node count
    /// and number of stored entries.
    ///
    /// Only the number of stored entries is used, not their weights.
    ///
    /// @param matrix adjacency matrix
    /// @param direction degree direction
    /// @return curve with x = cumulative probability mass from the highest
    ///         degree down and y = the matching cumulative degree share
    public static Curve analyticalExpectedGiniCurve(AdjacencyMatrix matrix, Direction direction) {
        Direction.requireSingleAxis(direction);
        int n = matrix.size();
        int trials = Math.max(n - 1, 0);
        long pairs = (long) n * trials;
        double p = pairs == 0 ? 0.0 : Math.min(1.0, (double) matrix.nonZeroCount() / pairs);

        BinomialDistribution binomial = new BinomialDistribution(null, trials, p);
        double[] pmf = new double[trials + 1];
        double mass = 0.0;
        double weightedMass = 0.0;
        for (int i = 0; i <= trials; i++) {
            int degree = trials - i;
            pmf[i] = binomial.probability(degree);
            mass += pmf[i];
            weightedMass += pmf[i] * degree;
        }

        double[] x = new double[trials + 1];
        double[] y = new double[trials + 1];
        double cumulativeMass = 0.0;
        double cumulativeDegree = 0.0;
        for (int i = 0; i <= trials; i++) {
            cumulativeMass += pmf[i];
            cumulativeDegree += pmf[i] * (trials - i);
            x[i] = mass > 0 ? cumulativeMass / mass : 0.0;
            y[i] = weightedMass > 0 ? cumulativeDegree / weightedMass : 0.0;
        }
        // rounding can leave the running sums a few ulps out of order
        for (int i = 1; i <= trials; i++) {
            x[i] = Math.max(x[i], x[i - 1]);
        }
        return new Curve(x, y);
    }

    /// Excess inequality over the Erdős–Rényi expectation:
    /// `2 * (area(observed) - area(expected))`, which equals the difference
    /// of the two Gini coefficients.
    ///
    /// @param matrix adjacency matrix
    /// @param direction degree direction
    /// @return signed excess inequality, about 0 for random graphs
    public static double normalizedGiniCoefficient(AdjacencyMatrix matrix, Direction direction) {
        Curve observed = giniCurve(matrix, direction);
        Curve expected = analyticalExpectedGiniCurve(matrix, direction);
        return 2.0 * (lorenzArea(observed) - lorenzArea(expected));
    }

    /// Trapezoid area of a cumulative-share curve with the origin prepended.
    static double lorenzArea(Curve curve) {
        int n = curve.length();
        double[] x = new double[n + 1];
        double[] y = new double[n + 1];
        for (int i = 0; i < n; i++) {
            x[i + 1] = curve.x(i);
            y[i + 1] = curve.y(i);
        }
        return Curve.trapezoid(x, y);
    }
}
