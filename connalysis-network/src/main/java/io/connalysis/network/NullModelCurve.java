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

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Expected curve under a null model: a mean and a standard deviation per x.
public final class NullModelCurve {

    private final double[] x;
    private final double[] mean;
    private final double[] std;

    /// @param x sample positions, non-decreasing
    /// @param mean expected value per position
    /// @param std standard deviation per position
    public NullModelCurve(double[] x, double[] mean, double[] std) {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(mean, "mean cannot be null");
        Objects.requireNonNull(std, "std cannot be null");
        if (x.length != mean.length || x.length != std.length) {
            throw new IllegalArgumentException("x, mean and std differ in length: "
                + x.length + ", " + mean.length + ", " + std.length);
        }
        this.x = x.clone();
        this.mean = mean.clone();
        this.std = std.clone();
    }

    /// Aggregates sampled curves that share the same x grid.
    ///
    /// `NaN` samples are ignored per point; the standard deviation is the
    /// population standard deviation of the remaining samples. A point with
    /// only `NaN` samples yields `NaN` for both statistics.
    ///
    /// @param x the shared grid
    /// @param samples one y array per sampled curve, each aligned with x
    /// @return the aggregated null-model curve
    public static NullModelCurve fromSamples(double[] x, List<double[]> samples) {
        for (double[] sample : samples) {
            if (sample.length != x.length) {
                throw new IllegalArgumentException("Sample length " + sample.length
                    + " does not match grid length " + x.length);
            }
        }
        double[] mean = new double[x.length];
        double[] std = new double[x.length];
        SummaryStatistics stats = new SummaryStatistics();
        for (int i = 0; i < x.length; i++) {
            stats.clear();
            for (double[] sample : samples) {
                if (!Double.isNaN(sample[i])) {
                    stats.addValue(sample[i]);
                }
            }
            mean[i] = stats.getMean();
            std[i] = Math.sqrt(stats.getPopulationVariance());
        }
        return new NullModelCurve(x, mean, std);
    }

    /// @return number of points
    public int length() {
        return x.length;
    }

    /// @return copy of the x values
    public double[] x() {
        return x.clone();
    }

    /// @return copy of the expected values
    public double[] mean() {
        return mean.clone();
    }

    /// @return copy of the standard deviations
    public double[] std() {
        return std.clone();
    }

    /// @return the expected values as a curve
    public Curve meanCurve() {
        return new Curve(x, mean);
    }

    @Override
    public String toString() {
        return "NullModelCurve{x=" + Arrays.toString(x) + ", mean=" + Arrays.toString(mean)
            + ", std=" + Arrays.toString(std) + "}";
    }
}
