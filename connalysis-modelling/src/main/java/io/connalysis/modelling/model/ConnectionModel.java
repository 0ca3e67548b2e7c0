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

/// Fitted connection-probability model, one of a closed set of functional forms.
///
/// ## Implementations
///
/// | Model type | Inputs | Form |
/// |------------|--------|------|
/// | [ExponentialModel] `exponential` | `d` | `a * exp(-b d)` |
/// | [BipolarExponentialModel] `bipolar-exponential` | `d, dz` | exponential per sign of `dz`, averaged at `dz == 0` |
public sealed interface ConnectionModel permits ExponentialModel, BipolarExponentialModel {

    /// @return the model type identifier
    String getModelType();

    /// @return names of the inputs accepted by [#evaluate(double...)], in order
    String[] getInputs();

    /// Connection probability for the given inputs.
    ///
    /// @param inputs one value per entry of [#getInputs()]
    /// @return model value
    double evaluate(double... inputs);
}
