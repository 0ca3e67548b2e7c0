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

/// Sign of the depth difference `target - source` for every pair:
/// -1 when the target lies below the source, +1 above, 0 at equal depth.
///
/// The square form built by [#of(double[])] has `NaN` on its diagonal, so a
/// node is never paired with itself.
public final class BipolarMatrix implements CovariateMatrix {

    private final double[] sourceDepths;
    private final double[] targetDepths;
    private final boolean selfPairs;

    /// @param sourceDepths depth per source node
    /// @param targetDepths depth per target node
    public BipolarMatrix(double[] sourceDepths, double[] targetDepths) {
        this(sourceDepths, targetDepths, false);
    }

    private BipolarMatrix(double[] sourceDepths, double[] targetDepths, boolean selfPairs) {
        this.sourceDepths = sourceDepths;
        this.targetDepths = targetDepths;
        this.selfPairs = selfPairs;
    }

    /// @param depths depth per node
    /// @return the square bipolar matrix, `NaN` on the diagonal
    public static BipolarMatrix of(double[] depths) {
        return new BipolarMatrix(depths, depths, true);
    }

    @Override
    public int rows() {
        return sourceDepths.length;
    }

    @Override
    public int columns() {
        return targetDepths.length;
    }

    @Override
    public double get(int row, int column) {
        if (selfPairs && row == column) {
            return Double.NaN;
        }
        return Math.signum(targetDepths[column] - sourceDepths[row]);
    }
}
