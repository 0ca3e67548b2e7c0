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

/// A real-valued property of every source-target pair of a connectome,
/// aligned index for index with its adjacency matrix.
///
/// `NaN` marks pairs the property does not apply to; such pairs fall in no bin.
public interface CovariateMatrix {

    /// @return number of source nodes
    int rows();

    /// @return number of target nodes
    int columns();

    /// @param row source index
    /// @param column target index
    /// @return covariate value of the pair, or `NaN` if not applicable
    double get(int row, int column);

    /// Fills `buffer` with the values of one source row.
    ///
    /// @param row source index
    /// @param buffer destination of length [#columns()]
    default void rowSlice(int row, double[] buffer) {
        if (buffer.length != columns()) {
            throw new IllegalArgumentException("Row buffer length " + buffer.length
                + " does not match column count " + columns());
        }
        for (int c = 0; c < buffer.length; c++) {
            buffer[c] = get(row, c);
        }
    }
}
