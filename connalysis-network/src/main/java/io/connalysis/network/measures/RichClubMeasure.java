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

package io.connalysis.network.measures;

import io.connalysis.network.AdjacencyMatrix;
import io.connalysis.network.ConnectomeMeasure;
import io.connalysis.network.Curve;
import io.connalysis.network.Direction;
import io.connalysis.network.nullmodel.Normalization;
import io.connalysis.network.nullmodel.NullModelType;
import io.connalysis.network.nullmodel.RichClubNullModel;

import java.util.Map;

/**
 * Rich-club effect of a connectome against a null model.
 *
 * Boolean matrices are normalized with the analytical model unless a null
 * model type is forced; weighted matrices always use shuffled controls.
 */
public class RichClubMeasure implements ConnectomeMeasure<RichClubMeasure.RichClubResult> {

    /// Mnemonic under which results are registered.
    public static final String MNEMONIC = "RichClub";

    private final Direction direction;
    private final NullModelType forcedNullModel;
    private final RichClubNullModel nullModel;

    /// Creates a RichClubMeasure for efferent degrees with default null-model settings.
    public RichClubMeasure() {
        this(Direction.EFFERENT, null, RichClubNullModel.defaults());
    }

    /// Creates a RichClubMeasure.
    ///
    /// @param direction degree direction
    /// @param forcedNullModel null model to use, or null to pick by matrix type
    /// @param nullModel shuffle configuration
    public RichClubMeasure(Direction direction, NullModelType forcedNullModel, RichClubNullModel nullModel) {
        this.direction = Direction.requireSingleAxis(direction);
        this.forcedNullModel = forcedNullModel;
        this.nullModel = nullModel;
    }

    @Override
    public String getMnemonic() {
        return MNEMONIC;
    }

    @Override
    public String[] getDependencies() {
        return new String[0];
    }

    @Override
    public RichClubResult compute(AdjacencyMatrix matrix, Map<String, Object> dependencyResults) {
        NullModelType type = forcedNullModel != null ? forcedNullModel
            : (matrix.isBoolean() ? NullModelType.ANALYTICAL : NullModelType.SHUFFLED);
        Curve observed = RichClubNullModel.observedRichClubCurve(matrix, direction);
        Curve normalized = nullModel.normalizedRichClubCurve(matrix, direction, Normalization.STD, type);
        return new RichClubResult(direction, type, observed, normalized, normalized.nanMean());
    }

    /**
     * Result container for rich-club analysis.
     */
    public static class RichClubResult {
        /// Degree direction of the thresholds
        public final Direction direction;
        /// Null model the curve was normalized with
        public final NullModelType nullModel;
        /// Observed rich-club curve
        public final Curve observed;
        /// Z-scored rich-club curve
        public final Curve normalized;
        /// Mean of the z-scores, ignoring NaN
        public final double coefficient;

        /// Creates a rich-club result.
        ///
        /// @param direction degree direction
        /// @param nullModel null model type
        /// @param observed observed curve
        /// @param normalized std-normalized curve
        /// @param coefficient rich-club coefficient
        public RichClubResult(Direction direction, NullModelType nullModel, Curve observed,
                              Curve normalized, double coefficient) {
            this.direction = direction;
            this.nullModel = nullModel;
            this.observed = observed;
            this.normalized = normalized;
            this.coefficient = coefficient;
        }

        @Override
        public String toString() {
            return String.format("RichClubResult{direction=%s, nullModel=%s, thresholds=%d, coefficient=%.4f}",
                direction, nullModel.label(), normalized.length(), coefficient);
        }
    }
}
