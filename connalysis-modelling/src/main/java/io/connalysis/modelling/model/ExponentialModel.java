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

package io.connalysis.modelling.model;

import org.apache.commons.math3.analysis.ParametricUnivariateFunction;

/// Distance-dependent model `p(d) = a * exp(-b d)`.
///
/// @param a probability at zero distance
/// @param b decay rate per unit distance
public record ExponentialModel(double a, double b) implements ConnectionModel {

    /// Model type identifier.
    public static final String MODEL_TYPE = "exponential";

    /// `a * exp(-b x)` with its gradient in `(a, b)`, for curve fitting.
    public static final ParametricUnivariateFunction FUNCTION = new ParametricUnivariateFunction() {
        @Override
        public double value(double x, double... parameters) {
            return parameters[0] * Math.exp(-parameters[1] * x);
        }

        @Override
        public double[] gradient(double x, double... parameters) {
            double e = Math.exp(-parameters[1] * x);
            return new double[]{e, -parameters[0] * x * e};
        }
    };

    /// Validates the parameters.
    public ExponentialModel {
        if (!Double.isFinite(a) || !Double.isFinite(b)) {
            throw new IllegalArgumentException("Model parameters must be finite: a=" + a + ", b=" + b);
        }
    }

    /// @param distance pair distance
    /// @return connection probability at that distance
    public double probability(double distance) {
        return a * Math.exp(-b * distance);
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    @Override
    public String[] getInputs() {
        return new String[]{"d"};
    }

    @Override
    public double evaluate(double... inputs) {
        if (inputs.length != 1) {
            throw new IllegalArgumentException("Expected 1 input (d), got " + inputs.length);
        }
        return probability(inputs[0]);
    }

    @Override
    public String toString() {
        return String.format("f(d) = %.3f * exp(-%.3f * d)", a, b);
    }
}
