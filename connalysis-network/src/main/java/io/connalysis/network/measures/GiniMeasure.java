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
import io.connalysis.network.degree.DegreeAnalyzer;

import java.util.Map;

/**
 * Degree inequality of a connectome in both directions.
 *
 * Reports the Gini coefficient of the in- and out-degree distributions and
 * their excess over the Erdős–Rényi expectation of equal density. Reuses the
 * degree vectors of {@link DegreeMeasure}.
 */
public class GiniMeasure implements ConnectomeMeasure<GiniMeasure.GiniResult> {

    /// Mnemonic under which results are registered.
    public static final String MNEMONIC = "Gini";

    @Override
    public String getMnemonic() {
        return MNEMONIC;
    }

    @Override
    public String[] getDependencies() {
        return new String[]{DegreeMeasure.MNEMONIC};
    }

    @Override
    public GiniResult compute(AdjacencyMatrix matrix, Map<String, Object> dependencyResults) {
        DegreeMeasure.DegreeResult degrees = (DegreeMeasure.DegreeResult) dependencyResults.get(DegreeMeasure.MNEMONIC);
        if (degrees == null) {
            degrees = new DegreeMeasure().compute(matrix, dependencyResults);
        }
        Curve efferentCurve = DegreeAnalyzer.giniCurve(degrees.efferent);
        Curve afferentCurve = DegreeAnalyzer.giniCurve(degrees.afferent);
        return new GiniResult(
            efferentCurve,
            afferentCurve,
            DegreeAnalyzer.giniCoefficient(efferentCurve),
            DegreeAnalyzer.giniCoefficient(afferentCurve),
            DegreeAnalyzer.normalizedGiniCoefficient(matrix, Direction.EFFERENT),
            DegreeAnalyzer.normalizedGiniCoefficient(matrix, Direction.AFFERENT));
    }

    /**
     * Result container for Gini analysis.
     */
    public static class GiniResult {
        /// Cumulative out-degree share curve
        public final Curve efferentCurve;
        /// Cumulative in-degree share curve
        public final Curve afferentCurve;
        /// Gini coefficient of the out-degrees
        public final double efferentGini;
        /// Gini coefficient of the in-degrees
        public final double afferentGini;
        /// Out-degree Gini coefficient in excess of the random-graph expectation
        public final double normalizedEfferentGini;
        /// In-degree Gini coefficient in excess of the random-graph expectation
        public final double normalizedAfferentGini;

        /// Creates a Gini result.
        ///
        /// @param efferentCurve out-degree share curve
        /// @param afferentCurve in-degree share curve
        /// @param efferentGini out-degree Gini coefficient
        /// @param afferentGini in-degree Gini coefficient
        /// @param normalizedEfferentGini normalized out-degree Gini coefficient
        /// @param normalizedAfferentGini normalized in-degree Gini coefficient
        public GiniResult(Curve efferentCurve, Curve afferentCurve,
                          double efferentGini, double afferentGini,
                          double normalizedEfferentGini, double normalizedAfferentGini) {
            this.efferentCurve = efferentCurve;
            this.afferentCurve = afferentCurve;
            this.efferentGini = efferentGini;
            this.afferentGini = afferentGini;
            this.normalizedEfferentGini = normalizedEfferentGini;
            this.normalizedAfferentGini = normalizedAfferentGini;
        }

        /**
         * Gets the Gini coefficient for one direction.
         * @param direction efferent or afferent
         * @return the Gini coefficient
         */
        public double gini(Direction direction) {
            return Direction.requireSingleAxis(direction) == Direction.EFFERENT ? efferentGini : afferentGini;
        }

        /**
         * Gets the normalized Gini coefficient for one direction.
         * @param direction efferent or afferent
         * @return the normalized Gini coefficient
         */
        public double normalizedGini(Direction direction) {
            return Direction.requireSingleAxis(direction) == Direction.EFFERENT
                ? normalizedEfferentGini : normalizedAfferentGini;
        }

        @Override
        public String toString() {
            return String.format("GiniResult{efferent=%.4f (normalized %.4f), afferent=%.4f (normalized %.4f)}",
                efferentGini, normalizedEfferentGini, afferentGini, normalizedAfferentGini);
        }
    }
}
