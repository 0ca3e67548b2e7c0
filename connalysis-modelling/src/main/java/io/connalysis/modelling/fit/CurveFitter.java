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

/// Nonlinear least-squares fitting of a parametric function to samples.
///
/// ## Contract
///
/// ```
/// (x[], y[], initialGuess[]) ──► fit ──► parameters[]
/// ```
///
/// Samples whose `x` or `y` is not finite are ignored. Implementations throw
/// [IllegalArgumentException] when fewer usable samples remain than there are
/// parameters, and [IllegalStateException] when the solver does not converge.
///
/// @see LeastSquaresCurveFitter
public interface CurveFitter {

    /// Fits `function` to the samples.
    ///
    /// @param function model with its parameter gradient
    /// @param x sample positions
    /// @param y sample values, aligned with `x`
    /// @param initialGuess starting parameters
    /// @return fitted parameters, same length as `initialGuess`
    double[] fit(ParametricUnivariateFunction function, double[] x, double[] y, double[] initialGuess);
}
