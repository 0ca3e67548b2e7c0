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

package io.connalysis.modelling.fit;

import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.SimpleCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;

/// [CurveFitter] backed by the Levenberg-Marquardt optimizer of
/// Commons Math's [SimpleCurveFitter].
public final class LeastSquaresCurveFitter implements CurveFitter {

    /// Default iteration cap of the optimizer.
    public static final int DEFAULT_MAX_ITERATIONS = 10_000;

    private final int maxIterations;

    /// Creates a fitter with [#DEFAULT_MAX_ITERATIONS].
    public LeastSquaresCurveFitter() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    /// @param maxIterations iteration cap, at least 1
    public LeastSquaresCurveFitter(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    @Override
    public double[] fit(ParametricUnivariateFunction function, double[] x, double[] y, double[] initialGuess) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Sample length mismatch: " + x.length + " x, " + y.length + " y");
        }
        WeightedObservedPoints points = new WeightedObservedPoints();
        for (int i = 0; i < x.length; i++) {
            if (Double.isFinite(x[i]) && Double.isFinite(y[i])) {
                points.add(x[i], y[i]);
            }
        }
        if (points.toList().size() < initialGuess.length) {
            throw new IllegalArgumentException("At least " + initialGuess.length
                + " finite samples required, got " + points.toList().size());
        }
        SimpleCurveFitter fitter = SimpleCurveFitter.create(function, initialGuess.clone())
            .withMaxIterations(maxIterations);
        try {
            return fitter.fit(points.toList());
        } catch (MathIllegalStateException e) {
            throw new IllegalStateException("Curve fit did not converge: " + e.getMessage(), e);
        }
    }
}
