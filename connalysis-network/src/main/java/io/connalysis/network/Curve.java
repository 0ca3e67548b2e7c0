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

/// Finite sequence of (x, y) points with non-decreasing x.
///
/// Curves are produced by cumulative sums (Gini curves) or by sorted degree
/// thresholds (rich-club curves). Points whose statistic has no valid
/// denominator carry `NaN` in y.
public final class Curve {

    private final double[] x;
    private final double[] y;

    /// @param x sample positions, non-decreasing
    /// @param y values aligned with x
    /// @throws IllegalArgumentException if lengths differ or x decreases
    public Curve(double[] x, double[] y) {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y differ in length: " + x.length + " vs " + y.length);
        }
        for (int i = 1; i < x.length; i++) {
            if (x[i] < x[i - 1]) {
                throw new IllegalArgumentException("x must be non-decreasing, x[" + i + "]=" + x[i]
                    + " < x[" + (i - 1) + "]=" + x[i - 1]);
            }
        }
        this.x = x.clone();
        this.y = y.clone();
    }

    /// @return number of points
    public int length() {
        return x.length;
    }

    /// @return copy of the x values
    public double[] x() {
        return x.clone();
    }

    /// @return copy of the y values
    public double[] y() {
        return y.clone();
    }

    /// @param i point index
    /// @return x of point i
    public double x(int i) {
        return x[i];
    }

    /// @param i point index
    /// @return y of point i
    public double y(int i) {
        return y[i];
    }

    /// Looks up the y value at an exact x position.
    ///
    /// @param position x value to find
    /// @return y at that position, or `NaN` if the curve has no such point
    public double valueAt(double position) {
        int i = Arrays.binarySearch(x, position);
        return i >= 0 ? y[i] : Double.NaN;
    }

    /// Integrates the curve with the trapezoid rule over its x axis.
    ///
    /// @return the area under the curve, 0 for fewer than two points
    public double integrate() {
        return trapezoid(x, y);
    }

    /// Trapezoid rule over paired sample arrays.
    ///
    /// @param x sample positions
    /// @param y sample values
    /// @return the integral
    public static double trapezoid(double[] x, double[] y) {
        double area = 0.0;
        for (int i = 1; i < x.length; i++) {
            area += (x[i] - x[i - 1]) * (y[i - 1] + y[i]) / 2.0;
        }
        return area;
    }

    /// @param length number of leading points to keep
    /// @return a curve with at most `length` points
    public Curve truncate(int length) {
        int n = Math.min(length, x.length);
        return new Curve(Arrays.copyOf(x, n), Arrays.copyOf(y, n));
    }

    /// Mean of the y values that are not `NaN`. Infinite values take part,
    /// so a single infinite point makes the mean infinite.
    ///
    /// @return the mean, or `NaN` if every y value is `NaN`
    public double nanMean() {
        double sum = 0.0;
        int count = 0;
        for (double v : y) {
            if (!Double.isNaN(v)) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Curve)) return false;
        Curve curve = (Curve) o;
        return Arrays.equals(x, curve.x) && Arrays.equals(y, curve.y);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(x) + Arrays.hashCode(y);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Curve{");
        for (int i = 0; i < x.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%.4g:%.4g", x[i], y[i]));
        }
        return sb.append('}').toString();
    }
}
