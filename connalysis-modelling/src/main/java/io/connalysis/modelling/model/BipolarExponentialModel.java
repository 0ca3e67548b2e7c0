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

/// Bipolar distance-dependent model: separate exponentials for targets
/// below (`dz < 0`) and above (`dz > 0`) the source, and their average at
/// equal depth.
///
/// @param negative branch for `dz < 0`
/// @param positive branch for `dz > 0`
public record BipolarExponentialModel(ExponentialModel negative, ExponentialModel positive)
    implements ConnectionModel {

    /// Model type identifier.
    public static final String MODEL_TYPE = "bipolar-exponential";

    /// Validates the branches.
    public BipolarExponentialModel {
        if (negative == null || positive == null) {
            throw new IllegalArgumentException("Both model branches are required");
        }
    }

    /// @param aN negative-branch amplitude
    /// @param bN negative-branch decay rate
    /// @param aP positive-branch amplitude
    /// @param bP positive-branch decay rate
    /// @return the model
    public static BipolarExponentialModel of(double aN, double bN, double aP, double bP) {
        return new BipolarExponentialModel(new ExponentialModel(aN, bN), new ExponentialModel(aP, bP));
    }

    /// @param distance pair distance
    /// @param depthSign sign (or any value with the sign) of `target depth - source depth`
    /// @return connection probability
    public double probability(double distance, double depthSign) {
        if (depthSign < 0) {
            return negative.probability(distance);
        }
        if (depthSign > 0) {
            return positive.probability(distance);
        }
        return 0.5 * (negative.probability(distance) + positive.probability(distance));
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    @Override
    public String[] getInputs() {
        return new String[]{"d", "dz"};
    }

    @Override
    public double evaluate(double... inputs) {
        if (inputs.length != 2) {
            throw new IllegalArgumentException("Expected 2 inputs (d, dz), got " + inputs.length);
        }
        return probability(inputs[0], inputs[1]);
    }

    @Override
    public String toString() {
        return "f(d, dz) = " + negative.toString().substring("f(d) = ".length()) + " if dz < 0; "
            + positive.toString().substring("f(d) = ".length()) + " if dz > 0; average of both if dz == 0";
    }
}
