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

/// Covariate values held in a row-major array.
public final class DenseCovariateMatrix implements CovariateMatrix {

    private final int rows;
    private final int columns;
    private final double[] values;

    /// Copies a rectangular array.
    ///
    /// @param values `values[row][column]`, all rows of equal length
    public DenseCovariateMatrix(double[][] values) {
        this.rows = values.length;
        this.columns = rows == 0 ? 0 : values[0].length;
        this.values = new double[rows * columns];
        for (int r = 0; r < rows; r++) {
            if (values[r].length != columns) {
                throw new IllegalArgumentException("Row " + r + " has " + values[r].length
                    + " columns, expected " + columns);
            }
            System.arraycopy(values[r], 0, this.values, r * columns, columns);
        }
    }

    @Override
    public int rows() {
        return rows;
    }

    @Override
    public int columns() {
        return columns;
    }

    @Override
    public double get(int row, int column) {
        return values[row * columns + column];
    }

    @Override
    public void rowSlice(int row, double[] buffer) {
        if (buffer.length != columns) {
            throw new IllegalArgumentException("Row buffer length " + buffer.length
                + " does not match column count " + columns);
        }
        System.arraycopy(values, row * columns, buffer, 0, columns);
    }
}
