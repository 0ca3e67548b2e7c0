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

import java.util.Map;

/// # ConnectomeMeasure Interface
///
/// Base interface for structural statistics computed over an [AdjacencyMatrix].
///
/// ## Lifecycle
/// 1. **Check Dependencies**: required measures are computed first by [ConnectomeAnalyzer]
/// 2. **Compute**: the measure runs with the dependency results keyed by mnemonic
///
/// ## Implementation Guide
/// ```java
/// public class MyMeasure implements ConnectomeMeasure<MyResult> {
///     @Override
///     public String getMnemonic() { return "My"; }
///
///     @Override
///     public String[] getDependencies() { return new String[]{"Degree"}; }
///
///     @Override
///     public MyResult compute(AdjacencyMatrix matrix, Map<String, Object> dependencies) {
///         DegreeMeasure.DegreeResult degrees = (DegreeMeasure.DegreeResult) dependencies.get("Degree");
///         return new MyResult(...);
///     }
/// }
/// ```
///
/// @param <T> the type of result produced by this measure
public interface ConnectomeMeasure<T> {

    /// Gets the mnemonic identifier for this measure.
    /// Must be unique among the measures registered with one analyzer.
    ///
    /// @return a short, unique identifier (e.g., "Degree", "Gini", "RichClub")
    String getMnemonic();

    /// Gets the dependencies required for this measure.
    ///
    /// @return array of measure mnemonics this depends on (empty array if none)
    String[] getDependencies();

    /// Computes this measure for the given matrix.
    ///
    /// @param matrix the connectome to analyze
    /// @param dependencyResults results from dependency measures (keyed by mnemonic)
    /// @return the computed measure result
    T compute(AdjacencyMatrix matrix, Map<String, Object> dependencyResults);
}
